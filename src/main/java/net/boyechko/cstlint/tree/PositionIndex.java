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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.boyechko.cstlint.syntax.CodePosition;
import net.boyechko.cstlint.syntax.CodeRange;

/**
 * Source ranges and parent links for every node of one tree, keyed by node identity. A node's
 * range runs from the first character of its first token's text to the end of its last token's
 * text; surrounding trivia is excluded.
 */
public final class PositionIndex {
    private final Node root;
    private final String source;
    private final Map<Node, CodeRange> ranges;
    private final Map<Node, Node> parents;

    PositionIndex(Node root, String source, Map<Node, CodeRange> ranges, Map<Node, Node> parents) {
        this.root = root;
        this.source = source;
        this.ranges = Collections.unmodifiableMap(ranges);
        this.parents = Collections.unmodifiableMap(parents);
    }

    public static PositionIndex of(Node root) {
        return CodeGenerator.index(root);
    }

    public Node root() {
        return root;
    }

    /** The rendered source of the indexed tree. */
    public String source() {
        return source;
    }

    public CodeRange rangeOf(Node node) {
        CodeRange range = ranges.get(node);
        if (range == null) {
            throw new IllegalArgumentException(node.kindName() + " is not part of this tree");
        }
        return range;
    }

    public CodePosition positionOf(Node node) {
        return rangeOf(node).start();
    }

    public boolean contains(Node node) {
        return ranges.containsKey(node);
    }

    public Optional<Node> parentOf(Node node) {
        return Optional.ofNullable(parents.get(node));
    }

    /** Ancestors of {@code node}, nearest first. */
    public List<Node> ancestorsOf(Node node) {
        List<Node> out = new ArrayList<>();
        Node current = parents.get(node);
        while (current != null) {
            out.add(current);
            current = parents.get(current);
        }
        return out;
    }

    /** Nearest ancestor of the given kind. */
    public <T extends Node> Optional<T> enclosing(Node node, Class<T> kind) {
        for (Node ancestor : ancestorsOf(node)) {
            if (kind.isInstance(ancestor)) {
                return Optional.of(kind.cast(ancestor));
            }
        }
        return Optional.empty();
    }
}
