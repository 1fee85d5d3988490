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
package net.boyechko.cstlint.violation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.stream.Collectors;

/** Violations found in one file. */
public class ViolationList extends ArrayList<Violation> {

    public ViolationList() {
        super();
    }

    public ViolationList(Collection<Violation> violations) {
        super(violations != null ? violations : new ArrayList<>());
    }

    public ViolationList getFixable() {
        return stream()
                .filter(Violation::hasFix)
                .collect(Collectors.toCollection(ViolationList::new));
    }

    public ViolationList getResolved() {
        return stream()
                .filter(Violation::isResolved)
                .collect(Collectors.toCollection(ViolationList::new));
    }

    public ViolationList getRemaining() {
        return stream()
                .filter(v -> !v.isResolved())
                .collect(Collectors.toCollection(ViolationList::new));
    }

    public ViolationList getFailed() {
        return stream()
                .filter(Violation::hasFailed)
                .collect(Collectors.toCollection(ViolationList::new));
    }

    /** Copy ordered by position, then rule name. */
    public ViolationList sorted() {
        return stream()
                .sorted(
                        Comparator.comparing(Violation::position)
                                .thenComparing(Violation::rule))
                .collect(Collectors.toCollection(ViolationList::new));
    }
}
