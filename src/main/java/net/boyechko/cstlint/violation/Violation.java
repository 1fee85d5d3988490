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
package net.boyechko.cstlint.violation;

import java.util.Objects;
import net.boyechko.cstlint.syntax.CodePosition;
import net.boyechko.cstlint.syntax.CodeRange;
import net.boyechko.cstlint.tree.Node;

/** A finding reported by a lint rule against one node of a file. */
public final class Violation {
    private final String rule;
    private final Node node;
    private final CodeRange range;
    private final String message;
    private final Replacement replacement; // null when the rule offers no fix

    private boolean resolved;
    private boolean failed;
    private String resolution;

    public Violation(String rule, Node node, CodeRange range, String message) {
        this(rule, node, range, message, null);
    }

    public Violation(
            String rule, Node node, CodeRange range, String message, Replacement replacement) {
        this.rule = Objects.requireNonNull(rule, "rule");
        this.node = Objects.requireNonNull(node, "node");
        this.range = Objects.requireNonNull(range, "range");
        this.message = message;
        this.replacement = replacement;
    }

    public String rule() {
        return rule;
    }

    /** The node the violation is anchored at, from the tree that was linted. */
    public Node node() {
        return node;
    }

    public CodeRange range() {
        return range;
    }

    public CodePosition position() {
        return range.start();
    }

    public String message() {
        return message;
    }

    /** Returns the proposed fix, or null if there is none. */
    public Replacement replacement() {
        return replacement;
    }

    public boolean hasFix() {
        return replacement != null;
    }

    public boolean isResolved() {
        return resolved;
    }

    public boolean hasFailed() {
        return failed;
    }

    public String resolutionNote() {
        return resolution;
    }

    public void markResolved(String note) {
        this.resolved = true;
        this.resolution = note;
    }

    public void markFailed(String note) {
        this.failed = true;
        this.resolution = note;
    }

    @Override
    public String toString() {
        return position() + " " + rule + ": " + message;
    }
}
