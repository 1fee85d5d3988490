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

/**
 * {@code from [dots][module] import names}. A star import has no names and a present {@code
 * star}.
 */
public record ImportFrom(
        Token fromKeyword,
        List<Token> relative,
        @OptionalChild Expression module,
        Token importKeyword,
        MaybeToken star,
        MaybeToken lpar,
        List<ImportAlias> names,
        MaybeToken rpar,
        @Auto(text = ";", trailing = " ", unlessLast = true) MaybeToken semicolon)
        implements SmallStatement {

    public ImportFrom {
        relative = List.copyOf(relative);
        names = List.copyOf(names);
    }
}
