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

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import java.util.List;
import net.boyechko.cstlint.tree.Module;
import net.boyechko.cstlint.violation.ViolationList;

/**
 * Result of applying fixes to one file.
 *
 * @param applied violations whose replacement made it into the new tree
 * @param superseded violations whose node was replaced as part of an enclosing fix
 */
public record FixOutcome(
        Module original,
        Module fixed,
        String originalSource,
        String fixedSource,
        ViolationList applied,
        ViolationList superseded) {

    public boolean changed() {
        return !originalSource.equals(fixedSource);
    }

    /** Unified diff between the original and the fixed source, empty when nothing changed. */
    public String unifiedDiff(String fileName) {
        if (!changed()) {
            return "";
        }
        List<String> before = originalSource.lines().toList();
        List<String> after = fixedSource.lines().toList();
        Patch<String> patch = DiffUtils.diff(before, after);
        List<String> diff =
                UnifiedDiffUtils.generateUnifiedDiff(fileName, fileName, before, patch, 3);
        return String.join("\n", diff) + "\n";
    }
}
