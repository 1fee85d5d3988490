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

/**
 * A node of the concrete syntax tree. Every implementation is an immutable record whose
 * components, in declaration order, are the node's children and formatting tokens in source
 * order. Component names double as slot names for traversal hooks and patterns.
 */
public interface Node {

    default NodeShape shape() {
        return NodeShape.of(getClass());
    }

    default String kindName() {
        return getClass().getSimpleName();
    }

    /** Renders this subtree back to source text, trivia included. */
    default String code() {
        return CodeGenerator.render(this);
    }

    /**
     * Resolves an {@link MaybeToken#auto() AUTO} component whose {@link Auto} annotation declares
     * no condition of its own.
     */
    default boolean autoPresent(String component, SequencePosition position) {
        return true;
    }

    /**
     * Called by the patch applier when removals leave the list slot {@code slot} empty. Returns
     * the node to use instead, or {@code null} to remove this node from its own parent.
     */
    default Node whenEmptied(String slot, List<Node> removed) {
        return this;
    }
}
