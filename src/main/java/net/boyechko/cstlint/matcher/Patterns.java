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

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import net.boyechko.cstlint.matcher.Pattern.NodePattern;
import net.boyechko.cstlint.matcher.Pattern.Repeat;
import net.boyechko.cstlint.tree.Name;
import net.boyechko.cstlint.tree.Node;

/**
 * Builders for {@link Pattern}s, meant to be statically imported:
 *
 * <pre>{@code
 * node(ClassDef.class)
 *         .with("bases", seq(atLeast(1, node(Arg.class).with("value", name("object")))))
 * }</pre>
 */
public final class Patterns {
    private static final Pattern ANY = new Pattern.AnyValue();
    private static final Pattern ABSENT = new Pattern.Absent();

    private Patterns() {}

    public static NodePattern node(Class<? extends Node> kind) {
        return new NodePattern(kind, Map.of());
    }

    /** A {@link Name} spelled {@code id}. */
    public static NodePattern name(String id) {
        return node(Name.class).with("value", text(id));
    }

    public static Pattern any() {
        return ANY;
    }

    public static Pattern absent() {
        return ABSENT;
    }

    public static Pattern text(String text) {
        return new Pattern.Text(text);
    }

    public static Pattern regex(String regex) {
        return new Pattern.Regex(java.util.regex.Pattern.compile(regex));
    }

    public static Pattern oneOf(Pattern... options) {
        return new Pattern.OneOf(Arrays.asList(options));
    }

    /** Matches any of the given token texts. */
    public static Pattern oneOfText(String... texts) {
        return new Pattern.OneOf(Arrays.stream(texts).map(Patterns::text).toList());
    }

    public static Pattern allOf(Pattern... patterns) {
        return new Pattern.AllOf(Arrays.asList(patterns));
    }

    public static Pattern not(Pattern pattern) {
        return new Pattern.Not(pattern);
    }

    public static Pattern capture(String name, Pattern pattern) {
        return new Pattern.Capture(name, pattern);
    }

    public static Pattern seq(Pattern... elements) {
        return new Pattern.Sequence(Arrays.asList(elements));
    }

    public static Pattern seq(List<Pattern> elements) {
        return new Pattern.Sequence(elements);
    }

    public static Pattern atLeast(int n, Pattern pattern) {
        return new Repeat(n, Repeat.UNBOUNDED, pattern);
    }

    public static Pattern atMost(int n, Pattern pattern) {
        return new Repeat(0, n, pattern);
    }

    public static Pattern zeroOrMore(Pattern pattern) {
        return atLeast(0, pattern);
    }

    public static Pattern zeroOrMore() {
        return atLeast(0, ANY);
    }

    public static Pattern zeroOrOne(Pattern pattern) {
        return atMost(1, pattern);
    }
}
