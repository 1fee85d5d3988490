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

/**
 * A parameter of a function or lambda. {@code star} holds {@code *} or {@code **}; a bare
 * {@code *} or the positional-only marker {@code /} is a parameter with a {@code star} and no
 * name.
 */
public record Param(
        MaybeToken star,
        @OptionalChild Name name,
        @OptionalChild Annotation annotation,
        MaybeToken equal,
        @OptionalChild Expression defaultValue,
        @Auto(text = ",", trailing = " ", unlessLast = true) MaybeToken comma)
        implements Node {}
