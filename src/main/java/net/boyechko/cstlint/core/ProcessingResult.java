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

import java.util.List;
import net.boyechko.cstlint.fixes.FixException;
import net.boyechko.cstlint.fixes.FixOutcome;
import net.boyechko.cstlint.syntax.SourceException;
import net.boyechko.cstlint.validation.FileContext;
import net.boyechko.cstlint.validation.RuleFault;
import net.boyechko.cstlint.violation.ViolationList;

/**
 * What happened to one file.
 *
 * @param fix applied fixes, or null when autofix was off, had nothing to do, or failed
 * @param parseError why the file could not be parsed, or null
 * @param fixError why autofix was abandoned, or null
 */
public record ProcessingResult(
        FileContext file,
        Outcome outcome,
        ViolationList violations,
        List<RuleFault> faults,
        String source,
        FixOutcome fix,
        SourceException parseError,
        FixException fixError) {

    public enum Outcome {
        /** Parsed and walked by at least one rule. */
        CHECKED,
        /** Every rule asked to skip the file; it was not parsed. */
        SKIPPED,
        /** Tokenizing or parsing failed; no rule ran. */
        UNPARSEABLE
    }

    public ProcessingResult {
        faults = List.copyOf(faults);
    }

    public static ProcessingResult skipped(
            FileContext file, String source, List<RuleFault> faults) {
        return new ProcessingResult(
                file, Outcome.SKIPPED, new ViolationList(), faults, source, null, null, null);
    }

    public static ProcessingResult unparseable(
            FileContext file, String source, List<RuleFault> faults, SourceException error) {
        return new ProcessingResult(
                file, Outcome.UNPARSEABLE, new ViolationList(), faults, source, null, error, null);
    }

    /** Source after fixes, or the original source when nothing was applied. */
    public String fixedSource() {
        return fix != null ? fix.fixedSource() : source;
    }

    public boolean changed() {
        return fix != null && fix.changed();
    }

    public int totalViolations() {
        return violations.size();
    }

    public int totalResolved() {
        return violations.getResolved().size();
    }

    public int totalRemaining() {
        return violations.getRemaining().size();
    }
}
