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

import java.util.Objects;
import net.boyechko.cstlint.syntax.Token;

/**
 * Optional punctuation in one of three states: present with a concrete token, absent, or
 * {@code AUTO}, resolved at render time from the owning component's {@link Auto} declaration.
 */
public record MaybeToken(State state, Token token) {

    public enum State {
        PRESENT,
        ABSENT,
        AUTO
    }

    private static final MaybeToken ABSENT = new MaybeToken(State.ABSENT, null);
    private static final MaybeToken AUTO = new MaybeToken(State.AUTO, null);

    public MaybeToken {
        Objects.requireNonNull(state, "state");
        if (state == State.PRESENT) {
            Objects.requireNonNull(token, "token");
        } else if (token != null) {
            throw new IllegalArgumentException("Only a PRESENT MaybeToken carries a token");
        }
    }

    /** Returns a present token, or {@link #absent()} when {@code token} is null. */
    public static MaybeToken of(Token token) {
        return token != null ? new MaybeToken(State.PRESENT, token) : ABSENT;
    }

    public static MaybeToken absent() {
        return ABSENT;
    }

    public static MaybeToken auto() {
        return AUTO;
    }

    public boolean isPresent() {
        return state == State.PRESENT;
    }

    public boolean isAuto() {
        return state == State.AUTO;
    }

    /** Token text when present, empty string otherwise. */
    public String text() {
        return isPresent() ? token.text() : "";
    }
}
