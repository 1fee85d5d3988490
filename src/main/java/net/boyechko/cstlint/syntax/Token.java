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

import java.util.Objects;

/**
 * A lexical unit together with the trivia around it.
 *
 * <p>{@code trailing} is the horizontal whitespace directly after the text. Everything else that
 * precedes the text (comments, blank lines, indentation, line continuations) is {@code leading}.
 * Concatenating {@link #render()} over all tokens reproduces the source.
 */
public record Token(TokenKind kind, String leading, String text, String trailing) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        leading = leading != null ? leading : "";
        text = Objects.requireNonNull(text, "text");
        trailing = trailing != null ? trailing : "";
    }

    public static Token of(TokenKind kind, String text) {
        return new Token(kind, "", text, "");
    }

    public static Token op(String text) {
        return of(TokenKind.OP, text);
    }

    public static Token name(String text) {
        return of(TokenKind.NAME, text);
    }

    public String render() {
        return leading + text + trailing;
    }

    public boolean is(TokenKind k, String t) {
        return kind == k && text.equals(t);
    }

    public Token withText(String newText) {
        return new Token(kind, leading, newText, trailing);
    }

    public Token withLeading(String newLeading) {
        return new Token(kind, newLeading, text, trailing);
    }

    public Token withTrailing(String newTrailing) {
        return new Token(kind, leading, text, newTrailing);
    }
}
