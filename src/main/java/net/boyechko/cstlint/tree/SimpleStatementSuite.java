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
import net.boyechko.cstlint.syntax.Token;

/** A body written on the same line as its header, as in {@code if x: return}. */
public record SimpleStatementSuite(List<SmallStatement> body, Token newline) implements Suite {

    public SimpleStatementSuite {
        body = List.copyOf(body);
    }

    @Override
    public Node whenEmptied(String slot, List<Node> removed) {
        return new SimpleStatementSuite(List.of(IndentedBlock.placeholder("")), newline);
    }
}
