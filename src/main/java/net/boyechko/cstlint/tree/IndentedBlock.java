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

import java.util.List;
import net.boyechko.cstlint.syntax.Token;
import net.boyechko.cstlint.syntax.TokenKind;

/**
 * A body on its own indented lines. {@code newline} ends the header line and carries any comment
 * after the colon; {@code indent} and {@code dedent} are zero-width.
 */
public record IndentedBlock(Token newline, Token indent, List<Statement> body, Token dedent)
        implements Suite {

    public IndentedBlock {
        body = List.copyOf(body);
    }

    /**
     * A block may not be empty, so removing its last statement leaves {@code pass} in its place,
     * indented like the statement it replaces.
     */
    @Override
    public Node whenEmptied(String slot, List<Node> removed) {
        String leading = "";
        Token newlineToken = Token.of(TokenKind.NEWLINE, "\n");
        if (!removed.isEmpty()) {
            Token first = Nodes.firstToken(removed.get(0));
            if (first != null) {
                leading = first.leading();
            }
            if (removed.get(removed.size() - 1) instanceof SimpleStatementLine line) {
                newlineToken = line.newline();
            }
        }
        Statement pass = new SimpleStatementLine(List.of(placeholder(leading)), newlineToken);
        return new IndentedBlock(newline, indent, List.of(pass), dedent);
    }

    static Pass placeholder(String leading) {
        return new Pass(new Token(TokenKind.NAME, leading, "pass", ""), MaybeToken.auto());
    }
}
