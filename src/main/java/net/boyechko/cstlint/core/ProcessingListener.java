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
package net.boyechko.cstlint.core;

import net.boyechko.cstlint.fixes.FixException;
import net.boyechko.cstlint.fixes.FixOutcome;
import net.boyechko.cstlint.syntax.SourceException;
import net.boyechko.cstlint.validation.FileContext;
import net.boyechko.cstlint.validation.RuleFault;
import net.boyechko.cstlint.violation.Violation;

/** Interface for reporting progress and results of processing files. */
public interface ProcessingListener {

    void onViolation(FileContext file, Violation violation);

    void onSummary(ProcessingResult result);

    default void onFileStart(FileContext file) {}

    default void onSkipped(FileContext file) {}

    default void onUnparseable(FileContext file, SourceException error) {}

    default void onRuleFault(FileContext file, RuleFault fault) {}

    default void onFixApplied(FileContext file, FixOutcome outcome) {}

    default void onFixError(FileContext file, FixException error) {}

    /** A listener that ignores everything. */
    static ProcessingListener silent() {
        return new ProcessingListener() {
            @Override
            public void onViolation(FileContext file, Violation violation) {}

            @Override
            public void onSummary(ProcessingResult result) {}
        };
    }
}
