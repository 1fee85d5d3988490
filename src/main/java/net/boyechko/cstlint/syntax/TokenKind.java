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
package net.boyechko.cstlint.syntax;

/** Lexical category of a {@link Token}. Keywords are {@link #NAME} tokens. */
public enum TokenKind {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    /** Zero-width marker for an increase of indentation. */
    INDENT,
    /** Zero-width marker for a decrease of indentation. */
    DEDENT,
    /** Zero-width end of input; its leading trivia holds whatever follows the last line. */
    ENDMARKER;

    /** True for kinds whose text is code rather than line structure. */
    public boolean hasText() {
        return this != NEWLINE && this != INDENT && this != DEDENT && this != ENDMARKER;
    }
}
