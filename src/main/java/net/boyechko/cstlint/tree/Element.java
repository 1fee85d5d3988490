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

/** An item of a tuple, list or set literal. */
public record Element(
        Expression value, @Auto(text = ",", trailing = " ") MaybeToken comma) implements Node {

    public static Element of(Expression value) {
        return new Element(value, MaybeToken.auto());
    }

    /** Separates from the next item; a tuple of one keeps its comma. */
    @Override
    public boolean autoPresent(String component, SequencePosition position) {
        if (!position.isLast()) {
            return true;
        }
        return position.parent() instanceof Tuple && position.size() == 1;
    }
}
