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
package net.boyechko.cstlint.rules;

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.cstlint.CstTestBase;
import net.boyechko.cstlint.validation.LintReport;
import net.boyechko.cstlint.violation.Violation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class NoStaticIfConditionTest extends CstTestBase {

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            quoteCharacter = '"',
            value = {
                "True           | true",
                "False          | false",
                "None           | false",
                "0              | false",
                "0.0            | false",
                "0x00           | false",
                "0j             | false",
                "1              | true",
                "0.5            | true",
                "''             | false",
                "'a'            | true",
                "(True)         | true",
                "not None       | true",
                "x or True      | true",
                "False and x    | false",
                "True and False | false"
            })
    void reportsConstantConditions(String condition, String value) throws Exception {
        LintReport report = lint("if " + condition + ":\n    pass\n", NoStaticIfCondition::new);
        assertEquals(1, report.violations().size(), condition);
        Violation v = report.violations().get(0);
        assertEquals("Condition of 'if' is always " + value, v.message());
        assertFalse(v.hasFix());
    }

    @ParameterizedTest
    @ValueSource(strings = {"x", "x or False", "True and x", "f()", "not x", "x == 0"})
    void ignoresDynamicConditions(String condition) throws Exception {
        assertTrue(
                lint("if " + condition + ":\n    pass\n", NoStaticIfCondition::new)
                        .violations()
                        .isEmpty());
    }

    @Test
    void reportsElifToo() throws Exception {
        LintReport report =
                lint("if x:\n    pass\nelif x or True:\n    pass\n", NoStaticIfCondition::new);
        assertEquals(1, report.violations().size());
        assertEquals("Condition of 'elif' is always true", report.violations().get(0).message());
        assertEquals(3, report.violations().get(0).position().line());
        assertEquals(5, report.violations().get(0).position().column());
    }

    @Test
    void conditionalExpressionsAreNotIfStatements() throws Exception {
        assertTrue(lint("y = a if True else b\n", NoStaticIfCondition::new).violations().isEmpty());
    }
}
