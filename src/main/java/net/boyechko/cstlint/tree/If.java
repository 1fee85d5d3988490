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

import net.boyechko.cstlint.syntax.Token;

/**
 * An {@code if} statement. An {@code elif} branch is another {@code If} in {@code orElse} whose
 * keyword token reads {@code elif}.
 */
public record If(
        Token ifKeyword,
        Expression test,
        Token colon,
        Suite body,
        @OptionalChild OrElse orElse)
        implements CompoundStatement, OrElse {

    public boolean isElif() {
        return ifKeyword.text().equals("elif");
    }
}
