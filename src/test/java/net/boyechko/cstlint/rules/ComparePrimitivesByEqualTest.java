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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ComparePrimitivesByEqualTest extends CstTestBase {

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            quoteCharacter = '"',
            value = {
                "y = x is 1          | y = x == 1",
                "y = x is not 'a'    | y = x != 'a'",
                "y = 1.5 is x        | y = 1.5 == x",
                "y = x is -1         | y = x == -1",
                "y = x is 'a' 'b'    | y = x == 'a' 'b'",
                "y = x  is  not  0   | y = x  !=  0"
            })
    void rewritesIdentityWithLiterals(String source, String expected) throws Exception {
        assertEquals(expected + "\n", fix(source + "\n", ComparePrimitivesByEqual::new));
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "y = x is None\n",
                "y = x is y\n",
                "y = x == 1\n",
                "y = x is -z\n",
                "y = x is not f(1)\n"
            })
    void ignoresOtherComparisons(String source) throws Exception {
        assertTrue(lint(source, ComparePrimitivesByEqual::new).violations().isEmpty());
    }

    @Test
    void messageNamesBothOperators() throws Exception {
        assertEquals(
                "Use '!=' instead of 'is not' to compare literals",
                lint("y = x is not 2\n", ComparePrimitivesByEqual::new)
                        .violations()
                        .get(0)
                        .message());
    }
}
