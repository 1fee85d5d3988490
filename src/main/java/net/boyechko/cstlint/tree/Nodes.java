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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.cstlint.syntax.Token;
import net.boyechko.cstlint.tree.NodeShape.Component;

/** Static helpers over arbitrary nodes. */
public final class Nodes {
    private Nodes() {}

    public static List<Node> children(Node node) {
        return node.shape().children(node);
    }

    /** Copy of {@code node} with one component replaced. */
    @SuppressWarnings("unchecked")
    public static <T extends Node> T with(T node, String component, Object value) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put(component, value);
        return (T) node.shape().copyWith(node, changes);
    }

    /** Copy of {@code node} with several components replaced. */
    @SuppressWarnings("unchecked")
    public static <T extends Node> T withChanges(T node, Map<String, ?> changes) {
        return (T) node.shape().copyWith(node, changes);
    }

    /** First token in render order, or null for a node that holds no token at all. */
    public static Token firstToken(Node node) {
        NodeShape shape = node.shape();
        for (Component c : shape.components()) {
            Object value = shape.get(node, c);
            Token found =
                    switch (c.kind()) {
                        case TOKEN -> (Token) value;
                        case MAYBE_TOKEN -> ((MaybeToken) value).token();
                        case TOKEN_LIST -> ((List<?>) value).isEmpty()
                                ? null
                                : (Token) ((List<?>) value).get(0);
                        case NODE -> value != null ? firstToken((Node) value) : null;
                        case NODE_LIST -> {
                            Token t = null;
                            for (Object item : (List<?>) value) {
                                t = firstToken((Node) item);
                                if (t != null) {
                                    break;
                                }
                            }
                            yield t;
                        }
                    };
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Copy of {@code node} whose first token carries {@code leading} as its leading trivia. A
     * node without tokens is returned as is.
     */
    public static <T extends Node> T withLeading(T node, String leading) {
        NodeShape shape = node.shape();
        for (Component c : shape.components()) {
            Object value = shape.get(node, c);
            switch (c.kind()) {
                case TOKEN -> {
                    return with(node, c.name(), ((Token) value).withLeading(leading));
                }
                case MAYBE_TOKEN -> {
                    MaybeToken maybe = (MaybeToken) value;
                    if (maybe.isPresent()) {
                        Token token = maybe.token().withLeading(leading);
                        return with(node, c.name(), MaybeToken.of(token));
                    }
                }
                case TOKEN_LIST -> {
                    List<?> tokens = (List<?>) value;
                    if (!tokens.isEmpty()) {
                        List<Token> copy = new ArrayList<>();
                        for (Object t : tokens) {
                            copy.add((Token) t);
                        }
                        copy.set(0, copy.get(0).withLeading(leading));
                        return with(node, c.name(), copy);
                    }
                }
                case NODE -> {
                    if (value != null && firstToken((Node) value) != null) {
                        return with(node, c.name(), withLeading((Node) value, leading));
                    }
                }
                case NODE_LIST -> {
                    List<?> items = (List<?>) value;
                    for (int i = 0; i < items.size(); i++) {
                        Node item = (Node) items.get(i);
                        if (firstToken(item) != null) {
                            List<Object> copy = new ArrayList<>(items);
                            copy.set(i, withLeading(item, leading));
                            return with(node, c.name(), copy);
                        }
                    }
                }
            }
        }
        return node;
    }

    /** All nodes of the subtree in pre-order, {@code root} first. */
    public static List<Node> preorder(Node root) {
        List<Node> out = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            out.add(node);
            List<Node> children = children(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }
}
