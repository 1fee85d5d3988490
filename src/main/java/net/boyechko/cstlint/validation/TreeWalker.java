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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.boyechko.cstlint.syntax.CodePosition;
import net.boyechko.cstlint.tree.Module;
import net.boyechko.cstlint.tree.Node;
import net.boyechko.cstlint.tree.NodeShape;
import net.boyechko.cstlint.validation.HookRegistry.Hook;
import net.boyechko.cstlint.validation.HookRegistry.Phase;
import net.boyechko.cstlint.violation.ViolationList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a syntax tree once, depth first, calling the hooks of every added rule at each node.
 *
 * <p>At a node of kind {@code K}: each rule's enter hooks for {@code K}; then for each child slot
 * in source order, the slot's enter hooks, the children, the slot's leave hooks; then the leave
 * hooks for {@code K}. Within one event, rules are called in the order they were added.
 *
 * <p>A rule that throws is logged, recorded as a {@link RuleFault} and gets no further calls for
 * this file. Its violations reported so far are kept.
 */
public class TreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(TreeWalker.class);

    private record Key(Phase phase, Class<?> kind, String slot) {}

    private record Entry(int ruleIndex, Hook hook) {}

    private final List<LintRule> rules = new ArrayList<>();
    private final List<RuleFault> faults = new ArrayList<>();
    private final Map<Key, List<Entry>> table = new HashMap<>();

    private boolean[] disabled;
    private LintContext ctx;

    public TreeWalker addRule(LintRule rule) {
        rules.add(rule);
        return this;
    }

    public List<RuleFault> getFaults() {
        return Collections.unmodifiableList(faults);
    }

    public ViolationList walk(Module module, LintContext ctx) {
        this.ctx = ctx;
        this.disabled = new boolean[rules.size()];
        faults.clear();
        table.clear();

        for (int i = 0; i < rules.size(); i++) {
            LintRule rule = rules.get(i);
            rule.attach(ctx);
            int index = i;
            guard(index, "registerHooks", null, () -> register(index, rule));
        }
        logger.debug("Dispatch table for {}: {} entries", ctx.file(), table.size());

        for (int i = 0; i < rules.size(); i++) {
            LintRule rule = rules.get(i);
            guard(i, "beforeTraversal", null, () -> rule.beforeTraversal(ctx));
        }

        walkNode(module);

        ViolationList all = new ViolationList();
        for (int i = 0; i < rules.size(); i++) {
            LintRule rule = rules.get(i);
            guard(i, "afterTraversal", null, rule::afterTraversal);
            all.addAll(rule.getViolations());
        }
        return all;
    }

    private void register(int ruleIndex, LintRule rule) {
        HookRegistry registry = new HookRegistry();
        rule.registerHooks(registry);
        for (Hook hook : registry.hooks()) {
            table.computeIfAbsent(
                            new Key(hook.phase(), hook.kind(), hook.slot()), k -> new ArrayList<>())
                    .add(new Entry(ruleIndex, hook));
        }
    }

    private void walkNode(Node node) {
        Class<?> kind = node.getClass();
        fire(new Key(Phase.ENTER, kind, null), node);

        NodeShape shape = node.shape();
        for (NodeShape.Component slot : shape.slots()) {
            fire(new Key(Phase.ENTER_SLOT, kind, slot.name()), node);
            Object value = shape.get(node, slot);
            if (value instanceof Node child) {
                walkNode(child);
            } else if (value instanceof List<?> children) {
                for (Object child : children) {
                    walkNode((Node) child);
                }
            }
            fire(new Key(Phase.LEAVE_SLOT, kind, slot.name()), node);
        }

        fire(new Key(Phase.LEAVE, kind, null), node);
    }

    private void fire(Key key, Node node) {
        List<Entry> entries = table.get(key);
        if (entries == null) {
            return;
        }
        for (Entry entry : entries) {
            Consumer<Node> action = entry.hook().action();
            guard(entry.ruleIndex(), entry.hook().describe(), node, () -> action.accept(node));
        }
    }

    private void guard(int ruleIndex, String hook, Node node, Runnable call) {
        LintRule rule = rules.get(ruleIndex);
        if (disabled[ruleIndex] || rule.isStopped()) {
            return;
        }
        try {
            call.run();
        } catch (RuntimeException e) {
            CodePosition at = node != null ? ctx.positionOf(node) : null;
            logger.error(
                    "Error in rule {} ({}) at {}: {}",
                    rule.name(),
                    hook,
                    at != null ? at : ctx.file(),
                    e.getMessage());
            faults.add(new RuleFault(rule.name(), hook, at, e));
            disabled[ruleIndex] = true;
        }
    }
}
