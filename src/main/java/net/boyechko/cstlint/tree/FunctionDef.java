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

public record FunctionDef(
        List<Decorator> decorators,
        MaybeToken asyncKeyword,
        Token defKeyword,
        Name name,
        Token lpar,
        List<Param> params,
        Token rpar,
        @OptionalChild Annotation returns,
        Token colon,
        Suite body)
        implements CompoundStatement {

    public FunctionDef {
        decorators = List.copyOf(decorators);
        params = List.copyOf(params);
    }
}
