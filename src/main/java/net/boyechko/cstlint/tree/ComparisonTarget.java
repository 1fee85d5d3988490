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

import java.util.List;
import java.util.stream.Collectors;
import net.boyechko.cstlint.syntax.Token;

/**
 * One {@code operator comparator} link of a {@link Comparison}. Two-word operators ({@code not
 * in}, {@code is not}) keep both tokens.
 */
public record ComparisonTarget(List<Token> operator, Expression comparator) implements Node {

    public ComparisonTarget {
        operator = List.copyOf(operator);
        if (operator.isEmpty()) {
            throw new IllegalArgumentException("A comparison needs an operator");
        }
    }

    /** Operator words joined by a single space, e.g. {@code "is not"}. */
    public String operatorText() {
        return operator.stream().map(Token::text).collect(Collectors.joining(" "));
    }
}
