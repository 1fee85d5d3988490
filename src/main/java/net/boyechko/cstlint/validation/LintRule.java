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

import net.boyechko.cstlint.tree.Node;
import net.boyechko.cstlint.violation.Replacement;
import net.boyechko.cstlint.violation.Violation;
import net.boyechko.cstlint.violation.ViolationList;

/**
 * Base class for lint rules. A rule registers the hooks it needs in {@link #registerHooks}, is
 * walked over one file by a {@link TreeWalker}, and reports what it finds with {@link #report}.
 *
 * <p>Instances are single-use: they may keep per-file state in fields, and callers supply a new
 * instance for each file. Rules must not mutate the tree and must not depend on other rules.
 */
public abstract class LintRule {

    private final ViolationList violations = new ViolationList();
    private LintContext context;
    private boolean stopped;

    /** Rule name used in reports, configuration and suppression comments. */
    public String name() {
        return getClass().getSimpleName();
    }

    public abstract String description();

    /** Called once per file, before traversal starts, to declare the hooks this rule wants. */
    public abstract void registerHooks(HookRegistry hooks);

    /** Returns true to keep this rule away from {@code file} entirely. */
    public boolean shouldSkipFile(FileContext file) {
        return false;
    }

    public void beforeTraversal(LintContext ctx) {}

    public void afterTraversal() {}

    public ViolationList getViolations() {
        return violations;
    }

    /** Ends this rule's part in the current traversal; other rules carry on. */
    protected void stopVisiting() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    protected LintContext context() {
        if (context == null) {
            throw new IllegalStateException(name() + " is not attached to a file");
        }
        return context;
    }

    protected Violation report(Node node, String message) {
        return report(node, message, null);
    }

    protected Violation report(Node node, String message, Replacement replacement) {
        Violation v =
                new Violation(name(), node, context().rangeOf(node), message, replacement);
        violations.add(v);
        return v;
    }

    void attach(LintContext ctx) {
        this.context = ctx;
    }
}
