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
package net.boyechko.cstlint.fixes;

import net.boyechko.cstlint.violation.Violation;

/** Two violations propose different replacements for the very same node. */
public class ConflictingFixException extends FixException {
    private final Violation first;
    private final Violation second;

    public ConflictingFixException(Violation first, Violation second) {
        super(
                "Conflicting fixes for "
                        + first.node().kindName()
                        + " at "
                        + first.position()
                        + ": "
                        + first.rule()
                        + " wants to "
                        + first.replacement().describe()
                        + ", "
                        + second.rule()
                        + " wants to "
                        + second.replacement().describe());
        this.first = first;
        this.second = second;
    }

    public Violation first() {
        return first;
    }

    public Violation second() {
        return second;
    }
}
