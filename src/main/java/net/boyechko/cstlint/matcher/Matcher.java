/*
 * CST-Lint - Lint Engine over a Lossless Concrete Syntax Tree
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.cstlint.matcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import net.boyechko.cstlint.matcher.Pattern.AllOf;
import net.boyechko.cstlint.matcher.Pattern.Absent;
import net.boyechko.cstlint.matcher.Pattern.AnyValue;
import net.boyechko.cstlint.matcher.Pattern.Capture;
import net.boyechko.cstlint.matcher.Pattern.NodePattern;
import net.boyechko.cstlint.matcher.Pattern.Not;
import net.boyechko.cstlint.matcher.Pattern.OneOf;
import net.boyechko.cstlint.matcher.Pattern.Regex;
import net.boyechko.cstlint.matcher.Pattern.Repeat;
import net.boyechko.cstlint.matcher.Pattern.Sequence;
import net.boyechko.cstlint.matcher.Pattern.Text;
import net.boyechko.cstlint.syntax.Token;
import net.boyechko.cstlint.tree.MaybeToken;
import net.boyechko.cstlint.tree.Node;
import net.boyechko.cstlint.tree.NodeShape;
import net.boyechko.cstlint.tree.Nodes;

/**
 * Evaluates {@link Pattern}s against nodes, tokens and child lists. Matching looks at node kinds,
 * component values and token text only; positions and trivia never take part.
 *
 * <p>Sequence patterns backtrack like a regular expression over the child list. An unbounded
 * {@link Repeat} takes its minimum first and grows only when the rest of the sequence fails; a
 * bounded one takes as many as it can and shrinks on failure.
 */
public final class Matcher {
    private Matcher() {}

    public static boolean matches(Object value, Pattern pattern) {
        return match(value, pattern, Captures.empty()) != null;
    }

    public static Optional<Captures> extract(Object value, Pattern pattern) {
        return Optional.ofNullable(match(value, pattern, Captures.empty()));
    }

    /** Every node under {@code root}, itself included, that matches, in pre-order. */
    public static List<Node> findAll(Node root, Pattern pattern) {
        List<Node> found = new ArrayList<>();
        for (Node node : Nodes.preorder(root)) {
            if (matches(node, pattern)) {
                found.add(node);
            }
        }
        return found;
    }

    /** Returns the extended captures on success, {@code null} on failure. */
    private static Captures match(Object value, Pattern pattern, Captures caps) {
        if (pattern instanceof AnyValue) {
            return caps;
        } else if (pattern instanceof Absent) {
            boolean absent =
                    value == null || (value instanceof MaybeToken m && !m.isPresent());
            return absent ? caps : null;
        } else if (pattern instanceof NodePattern p) {
            return matchNode(value, p, caps);
        } else if (pattern instanceof Text t) {
            String text = textOf(value);
            return text != null && text.equals(t.text()) ? caps : null;
        } else if (pattern instanceof Regex r) {
            String text = textOf(value);
            return text != null && r.regex().matcher(text).matches() ? caps : null;
        } else if (pattern instanceof OneOf o) {
            for (Pattern option : o.options()) {
                Captures result = match(value, option, caps);
                if (result != null) {
                    return result;
                }
            }
            return null;
        } else if (pattern instanceof AllOf a) {
            Captures result = caps;
            for (Pattern each : a.patterns()) {
                result = match(value, each, result);
                if (result == null) {
                    return null;
                }
            }
            return result;
        } else if (pattern instanceof Not n) {
            return match(value, n.pattern(), caps) == null ? caps : null;
        } else if (pattern instanceof Capture c) {
            Captures result = match(value, c.pattern(), caps);
            return result != null ? result.plus(c.name(), value) : null;
        } else if (pattern instanceof Sequence s) {
            if (!(value instanceof List<?> items)) {
                return null;
            }
            return matchSequence(items, 0, s.elements(), 0, caps);
        } else if (pattern instanceof Repeat) {
            throw new IllegalArgumentException("A repeat can only appear inside a sequence");
        }
        throw new IllegalStateException("Unknown pattern " + pattern);
    }

    private static Captures matchNode(Object value, NodePattern p, Captures caps) {
        if (!(value instanceof Node node) || !p.kind().isInstance(node)) {
            return null;
        }
        NodeShape shape = node.shape();
        Captures result = caps;
        for (Map.Entry<String, Pattern> field : p.fields().entrySet()) {
            result = match(shape.get(node, field.getKey()), field.getValue(), result);
            if (result == null) {
                return null;
            }
        }
        return result;
    }

    private static Captures matchSequence(
            List<?> items, int i, List<Pattern> elements, int j, Captures caps) {
        if (j == elements.size()) {
            return i == items.size() ? caps : null;
        }
        Pattern element = elements.get(j);
        if (!(element instanceof Repeat repeat)) {
            if (i >= items.size()) {
                return null;
            }
            Captures one = match(items.get(i), element, caps);
            return one != null ? matchSequence(items, i + 1, elements, j + 1, one) : null;
        }
        return repeat.isBounded()
                ? matchGreedy(items, i, elements, j, repeat, caps)
                : matchLazy(items, i, elements, j, repeat, caps);
    }

    private static Captures matchLazy(
            List<?> items, int i, List<Pattern> elements, int j, Repeat repeat, Captures caps) {
        Captures current = caps;
        int count = 0;
        while (count < repeat.min()) {
            if (i + count >= items.size()) {
                return null;
            }
            current = match(items.get(i + count), repeat.pattern(), current);
            if (current == null) {
                return null;
            }
            count++;
        }
        while (true) {
            Captures rest = matchSequence(items, i + count, elements, j + 1, current);
            if (rest != null) {
                return rest;
            }
            if (i + count >= items.size()) {
                return null;
            }
            current = match(items.get(i + count), repeat.pattern(), current);
            if (current == null) {
                return null;
            }
            count++;
        }
    }

    private static Captures matchGreedy(
            List<?> items, int i, List<Pattern> elements, int j, Repeat repeat, Captures caps) {
        // runs.get(k) holds the captures after consuming k children
        List<Captures> runs = new ArrayList<>();
        runs.add(caps);
        Captures current = caps;
        while (runs.size() - 1 < repeat.max() && i + runs.size() - 1 < items.size()) {
            current = match(items.get(i + runs.size() - 1), repeat.pattern(), current);
            if (current == null) {
                break;
            }
            runs.add(current);
        }
        for (int k = runs.size() - 1; k >= repeat.min(); k--) {
            Captures rest = matchSequence(items, i + k, elements, j + 1, runs.get(k));
            if (rest != null) {
                return rest;
            }
        }
        return null;
    }

    private static String textOf(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Token t) {
            return t.text();
        }
        if (value instanceof MaybeToken m) {
            return m.text();
        }
        if (value instanceof List<?> list
                && !list.isEmpty()
                && list.stream().allMatch(Token.class::isInstance)) {
            return list.stream().map(t -> ((Token) t).text()).collect(Collectors.joining(" "));
        }
        return null;
    }
}
