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
package net.boyechko.cstlint.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.cstlint.syntax.CodePosition;
import net.boyechko.cstlint.syntax.CodeRange;
import net.boyechko.cstlint.syntax.Token;
import net.boyechko.cstlint.tree.NodeShape.Component;

/**
 * Renders a tree back to source text by walking each node's components in declaration order.
 * Optionally records the source range and parent of every node while doing so.
 */
public final class CodeGenerator {

    private final StringBuilder out = new StringBuilder();
    private final boolean tracking;

    // Position tracking state
    private int line = 1;
    private int column;
    private CodePosition lastTextEnd = new CodePosition(1, 0);
    private final Deque<Frame> open = new ArrayDeque<>();
    private final Map<Node, CodeRange> ranges = new IdentityHashMap<>();
    private final Map<Node, Node> parents = new IdentityHashMap<>();

    private static final class Frame {
        CodePosition start;
    }

    private CodeGenerator(boolean tracking) {
        this.tracking = tracking;
    }

    public static String render(Node node) {
        CodeGenerator gen = new CodeGenerator(false);
        gen.emitNode(node, SequencePosition.standalone(null));
        return gen.out.toString();
    }

    /** Renders {@code root} and records where every node of it landed. */
    public static PositionIndex index(Node root) {
        CodeGenerator gen = new CodeGenerator(true);
        gen.emitNode(root, SequencePosition.standalone(null));
        return new PositionIndex(root, gen.out.toString(), gen.ranges, gen.parents);
    }

    private void emitNode(Node node, SequencePosition position) {
        if (tracking) {
            open.push(new Frame());
            if (position.parent() != null) {
                parents.put(node, position.parent());
            }
        }

        NodeShape shape = node.shape();
        for (Component c : shape.components()) {
            Object value = shape.get(node, c);
            switch (c.kind()) {
                case NODE -> {
                    if (value != null) {
                        emitNode((Node) value, SequencePosition.standalone(node));
                    }
                }
                case NODE_LIST -> {
                    List<?> items = (List<?>) value;
                    for (int i = 0; i < items.size(); i++) {
                        emitNode((Node) items.get(i), new SequencePosition(node, i, items.size()));
                    }
                }
                case TOKEN -> emitToken((Token) value);
                case TOKEN_LIST -> {
                    for (Object t : (List<?>) value) {
                        emitToken((Token) t);
                    }
                }
                case MAYBE_TOKEN -> emitMaybe(node, shape, c, (MaybeToken) value, position);
            }
        }

        if (tracking) {
            Frame frame = open.pop();
            CodePosition start = frame.start != null ? frame.start : here();
            CodePosition end = frame.start != null ? lastTextEnd : start;
            ranges.put(node, new CodeRange(start, end));
        }
    }

    private void emitMaybe(
            Node node, NodeShape shape, Component c, MaybeToken value, SequencePosition position) {
        switch (value.state()) {
            case PRESENT -> emitToken(value.token());
            case ABSENT -> {}
            case AUTO -> {
                Auto auto = c.auto();
                if (auto == null) {
                    throw new IllegalStateException(
                            c.name()
                                    + " of "
                                    + shape.kindName()
                                    + " is AUTO but declares no @Auto");
                }
                if (isAutoPresent(node, shape, c.name(), auto, position)) {
                    emitText(auto.leading(), false);
                    emitText(auto.text(), true);
                    // spacing only goes between elements, never before a closing bracket
                    if (!position.isLast()) {
                        emitText(auto.trailing(), false);
                    }
                }
            }
        }
    }

    static boolean isAutoPresent(
            Node node, NodeShape shape, String component, Auto auto, SequencePosition position) {
        if (!auto.ifNonEmpty().isEmpty()) {
            return !((List<?>) shape.get(node, shape.slot(auto.ifNonEmpty()))).isEmpty();
        }
        if (auto.unlessLast()) {
            return !position.isLast();
        }
        return node.autoPresent(component, position);
    }

    private void emitToken(Token token) {
        emitText(token.leading(), false);
        emitText(token.text(), token.kind().hasText());
        emitText(token.trailing(), false);
    }

    private void emitText(String s, boolean significant) {
        if (s.isEmpty()) {
            return;
        }
        out.append(s);
        if (!tracking) {
            return;
        }
        if (significant) {
            CodePosition start = here();
            for (Frame f : open) {
                if (f.start != null) {
                    break;
                }
                f.start = start;
            }
        }
        advance(s);
        if (significant) {
            lastTextEnd = here();
        }
    }

    private void advance(String s) {
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == '\n' || (ch == '\r' && (i + 1 >= s.length() || s.charAt(i + 1) != '\n'))) {
                line++;
                column = 0;
            } else if (ch != '\r') {
                column++;
            }
        }
    }

    private CodePosition here() {
        return new CodePosition(line, column);
    }
}
