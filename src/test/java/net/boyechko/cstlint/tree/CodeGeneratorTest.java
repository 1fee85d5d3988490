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
package net.boyechko.cstlint.tree;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.cstlint.CstTestBase;
import net.boyechko.cstlint.syntax.Token;
import org.junit.jupiter.api.Test;

/** Tests for rendering, in particular of AUTO punctuation. */
class CodeGeneratorTest extends CstTestBase {

    private static Call call(String func, Arg... args) {
        return new Call(Name.of(func), Token.op("("), List.of(args), Token.op(")"));
    }

    @Test
    void autoCommasSeparateArguments() {
        Call call = call("f", Arg.positional(Name.of("a")), Arg.positional(Name.of("b")));
        assertEquals("f(a, b)", call.code());
        assertEquals("f(a)", call("f", Arg.positional(Name.of("a"))).code());
        assertEquals("f()", call("f").code());
    }

    @Test
    void tupleOfOneKeepsItsComma() {
        Tuple one =
                new Tuple(
                        MaybeToken.of(Token.op("(")),
                        List.of(Element.of(Name.of("x"))),
                        MaybeToken.of(Token.op(")")));
        assertEquals("(x,)", one.code());

        Tuple two =
                new Tuple(
                        MaybeToken.of(Token.op("(")),
                        List.of(Element.of(Name.of("x")), Element.of(Name.of("y"))),
                        MaybeToken.of(Token.op(")")));
        assertEquals("(x, y)", two.code());
    }

    @Test
    void listOfOneHasNoComma() {
        ListLiteral list =
                new ListLiteral(Token.op("["), List.of(Element.of(Name.of("x"))), Token.op("]"));
        assertEquals("[x]", list.code());
    }

    @Test
    void classParenthesesFollowBases() throws Exception {
        ClassDef cls = (ClassDef) parse("class C(object):\n    pass\n").body().get(0);
        assertEquals("class C:\n    pass\n", cls.withBases(List.of()).code());
        assertEquals(
                "class C(Base):\n    pass\n",
                cls.withBases(List.of(Arg.positional(Name.of("Base")))).code());
    }

    @Test
    void presentTokensRenderVerbatim() throws Exception {
        ClassDef cls = (ClassDef) parse("class C ( object ) :\n    pass\n").body().get(0);
        assertEquals("class C ( object ) :\n    pass\n", cls.code());
    }

    @Test
    void autoWithoutDeclarationIsAnError() {
        Raise raise =
                new Raise(
                        Token.name("raise"),
                        Name.of("E"),
                        MaybeToken.auto(),
                        null,
                        MaybeToken.absent());
        assertThrows(IllegalStateException.class, raise::code);
    }

    @Test
    void placeholderPassRenders() {
        Pass pass = IndentedBlock.placeholder("    ");
        assertEquals("    pass", pass.code());
    }
}
