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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits source text into {@link Token}s without losing a single character.
 *
 * <p>Indentation is tracked with a stack of column widths; an increase yields a zero-width {@link
 * TokenKind#INDENT}, each level closed yields a zero-width {@link TokenKind#DEDENT}. Newlines
 * inside brackets, comments, blank lines and backslash continuations become trivia.
 */
public final class Tokenizer {
    private static final Logger logger = LoggerFactory.getLogger(Tokenizer.class);

    private static final int TAB_SIZE = 8;
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    // Longest first, so the first hit is the longest match.
    private static final String[] OPERATORS = {
        "**=", "//=", ">>=", "<<=", "...",
        "!=", "%=", "&=", "**", "*=", "+=", "-=", "->", "//", "/=", ":=", "<<", "<=", "==", ">=",
        ">>", "@=", "^=", "|=",
        "%", "&", "(", ")", "*", "+", ",", "-", ".", "/", ":", ";", "<", "=", ">", "@", "[", "]",
        "^", "{", "|", "}", "~"
    };

    private static final Set<String> STRING_PREFIXES =
            Set.of("r", "u", "b", "f", "br", "rb", "fr", "rf");

    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private final List<CodePosition> starts = new ArrayList<>();
    private final List<Comment> comments = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final StringBuilder pending = new StringBuilder();

    private int pos;
    private int line = 1;
    private int column;
    private int parenDepth;
    private boolean atLineStart = true;
    private boolean lineHasCode;

    private Tokenizer(String source) {
        this.src = source;
        this.indents.push(0);
    }

    public static TokenSequence tokenize(String source) throws LexException {
        TokenSequence seq = new Tokenizer(source).run();
        logger.debug("Tokenized {} chars into {} tokens", source.length(), seq.size());
        return seq;
    }

    private TokenSequence run() throws LexException {
        if (!src.isEmpty() && src.charAt(0) == BYTE_ORDER_MARK) {
            pending.append(take(1));
        }

        while (true) {
            if (atLineStart && parenDepth == 0) {
                if (!startLine()) {
                    break;
                }
                continue;
            }
            if (pos >= src.length()) {
                break;
            }

            char c = src.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pending.append(take(horizontalWhitespaceEnd(pos) - pos));
            } else if (c == '#') {
                readComment();
            } else if (c == '\\' && newlineLength(pos + 1) > 0) {
                pending.append(take(1 + newlineLength(pos + 1)));
            } else if (c == '\n' || c == '\r') {
                CodePosition start = here();
                String newline = take(newlineLength(pos));
                if (parenDepth > 0) {
                    pending.append(newline);
                } else {
                    emit(TokenKind.NEWLINE, newline, start);
                    atLineStart = true;
                }
                lineHasCode = false;
            } else {
                readToken(c);
            }
        }

        finish();
        return new TokenSequence(tokens, starts, comments);
    }

    /**
     * Consumes indentation, blank lines and comment-only lines at the start of a logical line.
     * Returns false at end of input.
     */
    private boolean startLine() throws LexException {
        int width = 0;
        int end = pos;
        while (end < src.length()) {
            char c = src.charAt(end);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            end++;
        }
        pending.append(take(end - pos));

        if (pos >= src.length()) {
            return false;
        }

        char c = src.charAt(pos);
        if (c == '#') {
            readComment();
            if (newlineLength(pos) > 0) {
                pending.append(take(newlineLength(pos)));
            }
            return true;
        }
        if (newlineLength(pos) > 0) {
            pending.append(take(newlineLength(pos)));
            return true;
        }

        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            emitMarker(TokenKind.INDENT);
        } else {
            while (width < indents.peek()) {
                indents.pop();
                emitMarker(TokenKind.DEDENT);
            }
            if (width != indents.peek()) {
                throw new LexException(
                        "unindent does not match any outer indentation level", here());
            }
        }
        atLineStart = false;
        return true;
    }

    private void readComment() {
        int end = pos;
        while (end < src.length() && src.charAt(end) != '\n' && src.charAt(end) != '\r') {
            end++;
        }
        int commentLine = line;
        String text = take(end - pos);
        comments.add(new Comment(commentLine, text, !lineHasCode));
        pending.append(text);
    }

    private void readToken(char c) throws LexException {
        CodePosition start = here();

        if (isIdentifierStart(c)) {
            int end = identifierEnd(pos);
            String word = src.substring(pos, end);
            if (end < src.length()
                    && isQuote(src.charAt(end))
                    && STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT))) {
                emit(TokenKind.STRING, take(stringEnd(end, start) - pos), start);
            } else {
                emit(TokenKind.NAME, take(end - pos), start);
            }
            return;
        }

        if (Character.isDigit(c)
                || (c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1)))) {
            emit(TokenKind.NUMBER, take(numberEnd(pos) - pos), start);
            return;
        }

        if (isQuote(c)) {
            emit(TokenKind.STRING, take(stringEnd(pos, start) - pos), start);
            return;
        }

        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) {
                trackBrackets(op);
                emit(TokenKind.OP, take(op.length()), start);
                return;
            }
        }

        throw new LexException("unexpected character '" + c + "'", start);
    }

    private void trackBrackets(String op) {
        switch (op) {
            case "(", "[", "{" -> parenDepth++;
            case ")", "]", "}" -> parenDepth = Math.max(0, parenDepth - 1);
            default -> {}
        }
    }

    private void finish() {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).kind() != TokenKind.NEWLINE) {
            emit(TokenKind.NEWLINE, "", here());
        }
        while (indents.size() > 1) {
            indents.pop();
            emitMarker(TokenKind.DEDENT);
        }
        emit(TokenKind.ENDMARKER, "", here());
    }

    private void emit(TokenKind kind, String text, CodePosition start) {
        String trailing = "";
        if (kind != TokenKind.NEWLINE && kind != TokenKind.ENDMARKER) {
            trailing = take(horizontalWhitespaceEnd(pos) - pos);
            lineHasCode = true;
        }
        tokens.add(new Token(kind, pending.toString(), text, trailing));
        starts.add(start);
        pending.setLength(0);
    }

    private void emitMarker(TokenKind kind) {
        tokens.add(new Token(kind, "", "", ""));
        starts.add(here());
    }

    // == Scanning helpers =============================================

    private int identifierEnd(int from) {
        int i = from;
        while (i < src.length()) {
            int cp = src.codePointAt(i);
            if (!(Character.isUnicodeIdentifierPart(cp) || cp == '_')
                    || Character.isIdentifierIgnorable(cp)) {
                break;
            }
            i += Character.charCount(cp);
        }
        return i;
    }

    private int numberEnd(int from) {
        int i = from;
        if (src.charAt(i) == '0'
                && i + 1 < src.length()
                && "xXoObB".indexOf(src.charAt(i + 1)) >= 0) {
            i += 2;
            while (i < src.length()
                    && (Character.isLetterOrDigit(src.charAt(i)) || src.charAt(i) == '_')) {
                i++;
            }
            return i;
        }
        i = digitsEnd(i);
        if (i < src.length() && src.charAt(i) == '.') {
            i = digitsEnd(i + 1);
        }
        if (i < src.length() && (src.charAt(i) == 'e' || src.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < src.length() && (src.charAt(j) == '+' || src.charAt(j) == '-')) {
                j++;
            }
            if (j < src.length() && Character.isDigit(src.charAt(j))) {
                i = digitsEnd(j);
            }
        }
        if (i < src.length() && (src.charAt(i) == 'j' || src.charAt(i) == 'J')) {
            i++;
        }
        return i;
    }

    private int digitsEnd(int from) {
        int i = from;
        while (i < src.length() && (Character.isDigit(src.charAt(i)) || src.charAt(i) == '_')) {
            i++;
        }
        return i;
    }

    /** Returns the index just past the closing quote of the string opening at {@code from}. */
    private int stringEnd(int from, CodePosition start) throws LexException {
        char quote = src.charAt(from);
        String tripleQuote = String.valueOf(quote).repeat(3);
        boolean triple = src.startsWith(tripleQuote, from);
        int i = from + (triple ? 3 : 1);

        while (true) {
            if (i >= src.length()) {
                throw new LexException("unterminated string literal", start);
            }
            char ch = src.charAt(i);
            if (ch == '\\') {
                i += 1 + Math.max(1, newlineLength(i + 1));
                continue;
            }
            if (triple) {
                if (src.startsWith(tripleQuote, i)) {
                    return i + 3;
                }
            } else if (ch == quote) {
                return i + 1;
            } else if (ch == '\n' || ch == '\r') {
                throw new LexException("unterminated string literal", start);
            }
            i++;
        }
    }

    private int horizontalWhitespaceEnd(int from) {
        int i = from;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c != ' ' && c != '\t' && c != '\f') {
                break;
            }
            i++;
        }
        return i;
    }

    private int newlineLength(int at) {
        if (at >= src.length()) {
            return 0;
        }
        char c = src.charAt(at);
        if (c == '\n') {
            return 1;
        }
        if (c == '\r') {
            return at + 1 < src.length() && src.charAt(at + 1) == '\n' ? 2 : 1;
        }
        return 0;
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isUnicodeIdentifierStart(c) || Character.isHighSurrogate(c);
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    private CodePosition here() {
        return new CodePosition(line, column);
    }

    private String take(int length) {
        String s = src.substring(pos, pos + length);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= s.length() || s.charAt(i + 1) != '\n'))) {
                line++;
                column = 0;
            } else {
                column++;
            }
        }
        pos += length;
        return s;
    }
}
