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

import java.util.List;

/**
 * Output of the {@link Tokenizer}: tokens, the start position of each token's text, and the
 * comments found in trivia.
 */
public final class TokenSequence {
    private final List<Token> tokens;
    private final List<CodePosition> starts;
    private final List<Comment> comments;

    public TokenSequence(List<Token> tokens, List<CodePosition> starts, List<Comment> comments) {
        if (tokens.size() != starts.size()) {
            throw new IllegalArgumentException(
                    "Got " + tokens.size() + " tokens but " + starts.size() + " positions");
        }
        this.tokens = List.copyOf(tokens);
        this.starts = List.copyOf(starts);
        this.comments = List.copyOf(comments);
    }

    public List<Token> tokens() {
        return tokens;
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public int size() {
        return tokens.size();
    }

    public CodePosition positionOf(int index) {
        return starts.get(Math.min(index, starts.size() - 1));
    }

    public List<Comment> comments() {
        return comments;
    }

    /** Concatenation of every token with its trivia. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            sb.append(t.leading()).append(t.text()).append(t.trailing());
        }
        return sb.toString();
    }
}
