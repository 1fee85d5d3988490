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

/** Half-open range between two {@link CodePosition}s. */
public record CodeRange(CodePosition start, CodePosition end) {

    public static CodeRange at(CodePosition pos) {
        return new CodeRange(pos, pos);
    }

    public boolean contains(CodePosition pos) {
        return start.compareTo(pos) <= 0 && pos.compareTo(end) < 0;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
