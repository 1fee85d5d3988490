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
package net.boyechko.cstlint.fixes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import net.boyechko.cstlint.syntax.Token;
import net.boyechko.cstlint.tree.Auto;
import net.boyechko.cstlint.tree.MaybeToken;
import net.boyechko.cstlint.tree.Module;
import net.boyechko.cstlint.tree.Node;
import net.boyechko.cstlint.tree.NodeShape;
import net.boyechko.cstlint.tree.NodeShape.Component;
import net.boyechko.cstlint.tree.NodeShape.ComponentKind;
import net.boyechko.cstlint.tree.Nodes;
import net.boyechko.cstlint.violation.Replacement;
import net.boyechko.cstlint.violation.Violation;
import net.boyechko.cstlint.violation.ViolationList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds the replacements carried by violations into a new tree and renders it.
 *
 * <p>Nodes are matched by identity. The tree is rebuilt top-down; when a node is replaced, the
 * replacement itself is rebuilt, so edits of original descendants it still contains are applied
 * inside it. Edits whose node the replacement dropped are superseded. Unchanged subtrees are
 * shared with the original tree.
 *
 * <p>Removing list elements resets dependent punctuation to {@code AUTO}: components declared
 * {@code @Auto(ifNonEmpty = slot)} once the slot is emptied, and the separators of a new last
 * element. A new first element inherits the leading trivia of the removed first one. An emptied
 * list then gets its owner's {@link Node#whenEmptied} treatment.
 */
public final class PatchApplier {
    private static final Logger logger = LoggerFactory.getLogger(PatchApplier.class);

    private record Edit(Replacement replacement, List<Violation> sources) {}

    private final Map<Node, Edit> edits = new IdentityHashMap<>();
    private final Set<Node> applied = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Node> active = Collections.newSetFromMap(new IdentityHashMap<>());

    private PatchApplier() {}

    public static FixOutcome apply(Module module, ViolationList violations) throws FixException {
        return new PatchApplier().run(module, violations);
    }

    private FixOutcome run(Module module, ViolationList violations) throws FixException {
        collectEdits(module, violations);

        Node result = transform(module);
        if (!(result instanceof Module fixed)) {
            throw new FixException("The module cannot be removed or replaced by a non-module");
        }

        ViolationList appliedViolations = new ViolationList();
        ViolationList superseded = new ViolationList();
        for (Map.Entry<Node, Edit> entry : edits.entrySet()) {
            boolean wasApplied = applied.contains(entry.getKey());
            for (Violation v : entry.getValue().sources()) {
                if (wasApplied) {
                    v.markResolved(v.replacement().describe());
                    appliedViolations.add(v);
                } else {
                    v.markResolved("Superseded by a fix of an enclosing node");
                    superseded.add(v);
                }
            }
        }
        logger.debug(
                "Applied {} fixes, {} superseded", appliedViolations.size(), superseded.size());

        return new FixOutcome(
                module,
                fixed,
                module.code(),
                fixed.code(),
                appliedViolations.sorted(),
                superseded.sorted());
    }

    private void collectEdits(Module module, ViolationList violations) throws FixException {
        Set<Node> inTree = Collections.newSetFromMap(new IdentityHashMap<>());
        inTree.addAll(Nodes.preorder(module));

        for (Violation v : violations) {
            if (!v.hasFix()) {
                continue;
            }
            if (!inTree.contains(v.node())) {
                logger.warn(
                        "Ignoring fix from {}: its node is not part of this tree", v.rule());
                v.markFailed("Node is not part of the fixed tree");
                continue;
            }
            Edit existing = edits.get(v.node());
            if (existing == null) {
                List<Violation> sources = new ArrayList<>();
                sources.add(v);
                edits.put(v.node(), new Edit(v.replacement(), sources));
            } else if (existing.replacement().equals(v.replacement())) {
                existing.sources().add(v);
            } else {
                throw new ConflictingFixException(existing.sources().get(0), v);
            }
        }
    }

    /** Returns the rebuilt node, or null when it is removed. */
    private Node transform(Node node) throws FixException {
        Edit edit = edits.get(node);
        if (edit == null || active.contains(node)) {
            return rebuild(node);
        }
        applied.add(node);
        if (edit.replacement() instanceof Replacement.With with) {
            active.add(node);
            try {
                return transform(with.node());
            } finally {
                active.remove(node);
            }
        }
        return null;
    }

    private Node rebuild(Node node) throws FixException {
        NodeShape shape = node.shape();
        Map<String, Object> changes = new LinkedHashMap<>();
        Map<String, List<Node>> emptied = new LinkedHashMap<>();

        for (Component slot : shape.slots()) {
            Object value = shape.get(node, slot);
            if (slot.kind() == ComponentKind.NODE) {
                if (value == null) {
                    continue;
                }
                Node child = (Node) value;
                Node result = transform(child);
                if (result == null && !slot.optional()) {
                    throw new FixException(
                            "Cannot remove required "
                                    + slot.name()
                                    + " of "
                                    + shape.kindName());
                }
                if (result != child) {
                    changes.put(slot.name(), result);
                }
            } else {
                rebuildList(slot, (List<?>) value, changes, emptied);
            }
        }

        if (changes.isEmpty()) {
            return node;
        }
        for (Component c : shape.components()) {
            if (c.kind() == ComponentKind.MAYBE_TOKEN
                    && c.auto() != null
                    && emptied.containsKey(c.auto().ifNonEmpty())) {
                changes.put(c.name(), MaybeToken.auto());
            }
        }

        Node rebuilt = copy(node, changes);
        for (Map.Entry<String, List<Node>> e : emptied.entrySet()) {
            rebuilt = rebuilt.whenEmptied(e.getKey(), e.getValue());
            if (rebuilt == null) {
                logger.debug("{} removed after its {} was emptied", shape.kindName(), e.getKey());
                return null;
            }
        }
        return rebuilt;
    }

    private void rebuildList(
            Component slot,
            List<?> items,
            Map<String, Object> changes,
            Map<String, List<Node>> emptied)
            throws FixException {
        List<Node> out = new ArrayList<>(items.size());
        List<Node> removed = new ArrayList<>();
        boolean changed = false;
        boolean lastRemoved = false;
        for (Object item : items) {
            Node child = (Node) item;
            Node result = transform(child);
            lastRemoved = result == null;
            if (result == null) {
                removed.add(child);
                changed = true;
            } else {
                out.add(result);
                changed |= result != child;
            }
        }
        if (!changed) {
            return;
        }
        if (out.isEmpty() && !items.isEmpty()) {
            emptied.put(slot.name(), removed);
        } else {
            if (!removed.isEmpty() && removed.get(0) == items.get(0)) {
                out.set(0, inheritLeading(out.get(0), removed.get(0)));
            }
            if (lastRemoved) {
                int last = out.size() - 1;
                out.set(last, resetAuto(out.get(last), PatchApplier::isSeparator));
            }
        }
        changes.put(slot.name(), out);
    }

    /** A new first element takes over the indentation and header comments of the removed one. */
    private static Node inheritLeading(Node node, Node removed) throws FixException {
        Token first = Nodes.firstToken(removed);
        if (first == null) {
            return node;
        }
        try {
            return Nodes.withLeading(node, first.leading());
        } catch (IllegalArgumentException e) {
            throw new FixException("Invalid edit of " + node.kindName() + ": " + e.getMessage(), e);
        }
    }

    /** Punctuation whose presence depends on the node's place in its list. */
    private static boolean isSeparator(Auto auto) {
        return auto.unlessLast() || auto.ifNonEmpty().isEmpty();
    }

    private static Node resetAuto(Node node, Predicate<Auto> which) throws FixException {
        NodeShape shape = node.shape();
        Map<String, Object> changes = new LinkedHashMap<>();
        for (Component c : shape.components()) {
            if (c.kind() == ComponentKind.MAYBE_TOKEN
                    && c.auto() != null
                    && which.test(c.auto())
                    && !((MaybeToken) shape.get(node, c)).isAuto()) {
                changes.put(c.name(), MaybeToken.auto());
            }
        }
        return changes.isEmpty() ? node : copy(node, changes);
    }

    private static Node copy(Node node, Map<String, Object> changes) throws FixException {
        try {
            return node.shape().copyWith(node, changes);
        } catch (IllegalArgumentException e) {
            throw new FixException("Invalid edit of " + node.kindName() + ": " + e.getMessage(), e);
        }
    }
}
