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

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.cstlint.CstTestBase;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for suppression comments, through the engine. */
class SuppressionIndexTest extends CstTestBase {

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            textBlock =
                    """
                    x = 1  # lint-ignore                    | 0 | 1
                    x = 1  # lint-fixme                     | 0 | 1
                    x = 1  #lint-ignore: FlagName           | 0 | 1
                    x = 1  # lint-ignore: Other, FlagName   | 0 | 1
                    x = 1  # lint-ignore: Other             | 1 | 0
                    x = 1  # unrelated                      | 1 | 0
                    x = 1                                   | 1 | 0
                    """)
    void sameLineDirectives(String line, int remaining, int suppressed) throws Exception {
        LintReport report = lint(line.strip() + "\n", () -> new FlagName("x"));
        assertEquals(remaining, report.violations().size());
        assertEquals(suppressed, report.suppressed());
    }

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            value = {
                "# lint-ignore\\nx = 1\\n | 0",
                "# lint-fixme: FlagName\\nx = 1\\n | 0",
                "# lint-ignore\\n# why it is fine\\nx = 1\\n | 0",
                "# lint-ignore\\n\\nx = 1\\n | 1",
                "y = 2  # lint-ignore\\nx = 1\\n | 1",
                "# lint-ignore: Other\\nx = 1\\n | 1"
            })
    void directivesAbove(String escaped, int remaining) throws Exception {
        String source = escaped.strip().replace("\\n", "\n");
        LintReport report = lint(source, () -> new FlagName("x"));
        assertEquals(remaining, report.violations().size(), source);
    }
}
