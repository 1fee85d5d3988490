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
package net.boyechko.cstlint.validation;

import java.util.List;
import net.boyechko.cstlint.violation.ViolationList;

/**
 * Outcome of running rules over one parsed file.
 *
 * @param violations violations that survived suppression comments
 * @param suppressed how many were dropped by suppression comments
 */
public record LintReport(ViolationList violations, int suppressed, List<RuleFault> faults) {

    public LintReport {
        faults = List.copyOf(faults);
    }

    public boolean hasFaults() {
        return !faults.isEmpty();
    }
}
