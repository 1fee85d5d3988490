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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares how a {@link MaybeToken} component renders while in the {@code AUTO} state.
 *
 * <p>With {@link #ifNonEmpty()} the token is present iff that list slot has elements. With {@link
 * #unlessLast()} it is present iff the node is not the last element of its parent's list. Without
 * either, the node's {@link Node#autoPresent} decides.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface Auto {
    String text();

    String leading() default "";

    /** Spacing after the token, emitted only when the node is not the last of its list. */
    String trailing() default "";

    String ifNonEmpty() default "";

    boolean unlessLast() default false;
}
