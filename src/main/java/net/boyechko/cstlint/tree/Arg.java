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

/**
 * A call argument or class base: positional {@code value}, {@code keyword=value}, {@code *value}
 * or {@code **value}.
 */
public record Arg(
        MaybeToken star,
        @OptionalChild Name keyword,
        MaybeToken equal,
        Expression value,
        @Auto(text = ",", trailing = " ", unlessLast = true) MaybeToken comma)
        implements Node {

    public static Arg positional(Expression value) {
        return new Arg(MaybeToken.absent(), null, MaybeToken.absent(), value, MaybeToken.auto());
    }

    public boolean isPositional() {
        return keyword == null && !star.isPresent();
    }
}
