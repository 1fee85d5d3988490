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
package net.boyechko.cstlint.validation;

import net.boyechko.cstlint.syntax.CodePosition;

/**
 * A rule threw while the engine was calling into it.
 *
 * @param hook which callback failed, e.g. {@code enter ClassDef}
 * @param position where in the file, or null outside of a node
 */
public record RuleFault(String rule, String hook, CodePosition position, RuntimeException cause) {

    public String message() {
        String where = position != null ? " at " + position : "";
        return rule + " failed in " + hook + where + ": " + cause.getMessage();
    }
}
