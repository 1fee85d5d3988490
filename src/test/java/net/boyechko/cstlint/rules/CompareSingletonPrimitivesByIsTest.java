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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class CompareSingletonPrimitivesByIsTest extends CstTestBase {

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            value = {
                "y = x == None      | y = x is None",
                "y = x != True      | y = x is not True",
                "y = None == x      | y = None is x",
                "y = x==None        | y = x is None",
                "y = x  ==  False   | y = x  is  False",
                "y = a < b == None  | y = a < b is None",
                "y = (x == None)    | y = (x is None)"
            })
    void rewritesEqualityWithSingletons(String source, String expected) throws Exception {
        assertEquals(expected + "\n", fix(source + "\n", CompareSingletonPrimitivesByIs::new));
    }

    @ParameterizedTest
    @ValueSource(strings = {"y = x == 1\n", "y = x is None\n", "y = x == none\n", "y = x < None\n"})
    void ignoresOtherComparisons(String source) throws Exception {
        assertTrue(lint(source, CompareSingletonPrimitivesByIs::new).violations().isEmpty());
    }

    @Test
    void reportsEachOperator() throws Exception {
        String source = "if x == None and y != False:\n    pass\n";
        LintReport report = lint(source, CompareSingletonPrimitivesByIs::new);
        assertEquals(2, report.violations().size());
        assertEquals(
                "Use 'is' instead of '==' to compare singletons",
                report.violations().get(0).message());
        assertEquals(
                "Use 'is not' instead of '!=' to compare singletons",
                report.violations().get(1).message());
    }
}
