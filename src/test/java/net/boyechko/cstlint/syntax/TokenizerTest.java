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
package net.boyechko.cstlint.syntax;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TokenizerTest {

    private static List<TokenKind> kinds(TokenSequence seq) {
        return seq.tokens().stream().map(Token::kind).collect(Collectors.toList());
    }

    @Test
    void simpleAssignment() throws Exception {
        TokenSequence seq = Tokenizer.tokenize("x = 1\n");
        assertEquals(
                List.of(
                        TokenKind.NAME,
                        TokenKind.OP,
                        TokenKind.NUMBER,
                        TokenKind.NEWLINE,
                        TokenKind.ENDMARKER),
                kinds(seq));
        Token x = seq.get(0);
        assertEquals("x", x.text());
        assertEquals(" ", x.trailing());
        assertEquals(new CodePosition(1, 4), seq.positionOf(2));
    }

    @Test
    void indentationProducesIndentAndDedent() throws Exception {
        TokenSequence seq = Tokenizer.tokenize("if x:\n    y\nz\n");
        List<TokenKind> kinds = kinds(seq);
        assertEquals(1, kinds.stream().filter(k -> k == TokenKind.INDENT).count());
        assertEquals(1, kinds.stream().filter(k -> k == TokenKind.DEDENT).count());
        assertTrue(kinds.indexOf(TokenKind.INDENT) < kinds.indexOf(TokenKind.DEDENT));
    }

    @Test
    void unclosedBlocksAreDedentedAtEnd() throws Exception {
        TokenSequence seq = Tokenizer.tokenize("def f():\n    if x:\n        pass");
        List<TokenKind> kinds = kinds(seq);
        assertEquals(2, kinds.stream().filter(k -> k == TokenKind.DEDENT).count());
        assertEquals(TokenKind.ENDMARKER, kinds.get(kinds.size() - 1));
    }

    @Test
    void newlinesInsideBracketsAreTrivia() throws Exception {
        TokenSequence seq = Tokenizer.tokenize("f(a,\n  b)\n");
        assertEquals(
                1, kinds(seq).stream().filter(k -> k == TokenKind.NEWLINE).count());
        Token b =
                seq.tokens().stream().filter(t -> t.text().equals("b")).findFirst().orElseThrow();
        assertEquals("\n  ", b.leading());
    }

    @Test
    void commentsAreRecordedAndKeptAsTrivia() throws Exception {
        String source = "# header\nx = 1  # trailing\n";
        TokenSequence seq = Tokenizer.tokenize(source);
        assertEquals(2, seq.comments().size());
        Comment header = seq.comments().get(0);
        assertEquals(1, header.line());
        assertTrue(header.ownLine());
        Comment trailing = seq.comments().get(1);
        assertEquals(2, trailing.line());
        assertFalse(trailing.ownLine());
        assertEquals("# trailing", trailing.text());
        assertEquals(source, seq.render());
    }

    @Test
    void stringPrefixesAndTripleQuotes() throws Exception {
        TokenSequence seq = Tokenizer.tokenize("s = rb'x' + \"\"\"a\nb\"\"\"\n");
        List<String> strings =
                seq.tokens().stream()
                        .filter(t -> t.kind() == TokenKind.STRING)
                        .map(Token::text)
                        .collect(Collectors.toList());
        assertEquals(List.of("rb'x'", "\"\"\"a\nb\"\"\""), strings);
    }

    @Test
    void longestOperatorWins() throws Exception {
        TokenSequence seq = Tokenizer.tokenize("x **= y // z\n");
        assertEquals("**=", seq.get(1).text());
        assertEquals("//", seq.get(3).text());
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "",
                "x\n",
                "x",
                "x = 1\r\ny = 2\r\n",
                "\uFEFFx = 1\n",
                "#!/usr/bin/env python\nx = 1\n",
                "if x:\n\tpass\n",
                "x = [\n    1,\n    2,\n]\n",
                "x = 1 + \\\n    2\n",
                "\n\n# only comments\n\n",
                "class A:\n    def f(self):\n        return 1\n\n\n# end\n"
            })
    void renderReproducesSource(String source) throws Exception {
        assertEquals(source, Tokenizer.tokenize(source).render());
    }

    @Test
    void unterminatedStringIsLexError() {
        LexException e = assertThrows(LexException.class, () -> Tokenizer.tokenize("x = 'abc\n"));
        assertEquals(1, e.line());
        assertEquals(4, e.column());
    }

    @Test
    void inconsistentDedentIsLexError() {
        assertThrows(
                LexException.class, () -> Tokenizer.tokenize("if x:\n    y\n  z\n"));
    }

    @Test
    void unexpectedCharacterIsLexError() {
        LexException e = assertThrows(LexException.class, () -> Tokenizer.tokenize("x = $\n"));
        assertTrue(e.getMessage().contains("$"));
    }
}
