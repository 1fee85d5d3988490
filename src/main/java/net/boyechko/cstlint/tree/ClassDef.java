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
 * A class definition. Bases and keyword arguments such as {@code metaclass=M} share the {@code
 * bases} slot; the parentheses resolve to absent in the {@code AUTO} state once it is empty.
 */
public record ClassDef(
        List<Decorator> decorators,
        Token classKeyword,
        Name name,
        @Auto(text = "(", ifNonEmpty = "bases") MaybeToken lpar,
        List<Arg> bases,
        @Auto(text = ")", ifNonEmpty = "bases") MaybeToken rpar,
        Token colon,
        Suite body)
        implements CompoundStatement {

    public ClassDef {
        decorators = List.copyOf(decorators);
        bases = List.copyOf(bases);
    }

    /** Copy with new bases; parentheses are left to follow them. */
    public ClassDef withBases(List<Arg> newBases) {
        return new ClassDef(
                decorators,
                classKeyword,
                name,
                MaybeToken.auto(),
                newBases,
                MaybeToken.auto(),
                colon,
                body);
    }
}
