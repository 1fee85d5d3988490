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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class NoRedundantLambdaTest extends CstTestBase {

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            value = {
                "ys = sorted(xs, key=lambda x: f(x))  | ys = sorted(xs, key=f)",
                "g = lambda a, b: op(a, b)            | g = op",
                "g = lambda: make()                   | g = make",
                "g = lambda x: mod.f(x)               | g = mod.f",
                "ys = map(lambda x: f(x), xs)         | ys = map(f, xs)"
            })
    void replacesForwardingLambda(String source, String expected) throws Exception {
        assertEquals(expected + "\n", fix(source + "\n", NoRedundantLambda::new));
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "g = lambda x: x.f(x)\n",
                "g = lambda x: f(x, 1)\n",
                "g = lambda x, y: f(y, x)\n",
                "g = lambda x: f(*x)\n",
                "g = lambda x=1: f(x)\n",
                "g = lambda *a: f(*a)\n",
                "g = lambda x: f(x)(x)\n",
                "g = lambda x: f(key=x)\n",
                "g = lambda x: x\n"
            })
    void keepsLambdasThatDoMore(String source) throws Exception {
        assertTrue(lint(source, NoRedundantLambda::new).violations().isEmpty(), source);
    }
}
