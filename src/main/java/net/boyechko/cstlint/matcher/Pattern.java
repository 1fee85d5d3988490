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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.boyechko.cstlint.tree.Node;
import net.boyechko.cstlint.tree.NodeShape;

/**
 * A declarative description of a tree shape. Patterns are plain immutable data; {@link Matcher}
 * evaluates them. Build them with {@link Patterns}.
 */
public sealed interface Pattern
        permits Pattern.AnyValue,
                Pattern.NodePattern,
                Pattern.Text,
                Pattern.Regex,
                Pattern.Absent,
                Pattern.OneOf,
                Pattern.AllOf,
                Pattern.Not,
                Pattern.Capture,
                Pattern.Sequence,
                Pattern.Repeat {

    /** Matches any value, including an absent one. */
    record AnyValue() implements Pattern {}

    /**
     * Matches a node that is an instance of {@code kind} and whose named components match the
     * given patterns. Components not named are not looked at.
     */
    record NodePattern(Class<? extends Node> kind, Map<String, Pattern> fields)
            implements Pattern {

        public NodePattern {
            Objects.requireNonNull(kind, "kind");
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
            if (!fields.isEmpty()) {
                if (!kind.isRecord()) {
                    throw new IllegalArgumentException(
                            kind.getSimpleName() + " is not a concrete node kind");
                }
                NodeShape shape = NodeShape.of(kind);
                for (String name : fields.keySet()) {
                    shape.component(name);
                }
            }
        }

        /** Copy that also requires component {@code name} to match {@code pattern}. */
        public NodePattern with(String name, Pattern pattern) {
            Map<String, Pattern> more = new LinkedHashMap<>(fields);
            more.put(name, Objects.requireNonNull(pattern, "pattern"));
            return new NodePattern(kind, more);
        }
    }

    /** Matches token text exactly; trivia is never compared. */
    record Text(String text) implements Pattern {
        public Text {
            Objects.requireNonNull(text, "text");
        }
    }

    /** Matches token text against a regular expression, in full. */
    record Regex(java.util.regex.Pattern regex) implements Pattern {}

    /** Matches a missing optional child or a punctuation token that is not present. */
    record Absent() implements Pattern {}

    record OneOf(List<Pattern> options) implements Pattern {
        public OneOf {
            options = List.copyOf(options);
        }
    }

    record AllOf(List<Pattern> patterns) implements Pattern {
        public AllOf {
            patterns = List.copyOf(patterns);
        }
    }

    record Not(Pattern pattern) implements Pattern {}

    /** Binds {@code name} to the matched value when {@code pattern} matches. */
    record Capture(String name, Pattern pattern) implements Pattern {}

    /**
     * Matches a list slot element by element. A {@link Repeat} element consumes a run of
     * children; any other element consumes exactly one.
     */
    record Sequence(List<Pattern> elements) implements Pattern {
        public Sequence {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Between {@code min} and {@code max} consecutive children matching {@code pattern}. Only
     * meaningful as an element of a {@link Sequence}.
     *
     * @param max upper bound, or {@link #UNBOUNDED}
     */
    record Repeat(int min, int max, Pattern pattern) implements Pattern {
        public static final int UNBOUNDED = Integer.MAX_VALUE;

        public Repeat {
            if (min < 0 || max < min) {
                throw new IllegalArgumentException("Invalid repeat bounds " + min + ".." + max);
            }
            Objects.requireNonNull(pattern, "pattern");
        }

        public boolean isBounded() {
            return max != UNBOUNDED;
        }
    }
}
