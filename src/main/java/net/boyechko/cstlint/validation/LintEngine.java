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
import java.util.List;
import java.util.function.Supplier;
import net.boyechko.cstlint.violation.Violation;
import net.boyechko.cstlint.violation.ViolationList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a fixed set of rules over files. Rule definitions are held as suppliers so that each file
 * gets fresh rule instances; the engine itself keeps no per-file state and may be shared.
 */
public class LintEngine {
    private static final Logger logger = LoggerFactory.getLogger(LintEngine.class);

    private final List<Supplier<LintRule>> ruleSuppliers;

    public LintEngine(List<Supplier<LintRule>> ruleSuppliers) {
        this.ruleSuppliers = List.copyOf(ruleSuppliers);
    }

    public List<Supplier<LintRule>> getRuleSuppliers() {
        return ruleSuppliers;
    }

    public List<LintRule> instantiateRules() {
        List<LintRule> rules = new ArrayList<>(ruleSuppliers.size());
        for (Supplier<LintRule> supplier : ruleSuppliers) {
            LintRule rule = supplier.get();
            if (rule == null) {
                throw new IllegalStateException("Rule supplier returned null");
            }
            rules.add(rule);
        }
        return rules;
    }

    /**
     * Fresh instances of the rules that want to see {@code file}. A rule whose skip predicate
     * throws is left out and the fault is added to {@code faults}.
     */
    public List<LintRule> rulesFor(FileContext file, List<RuleFault> faults) {
        List<LintRule> active = new ArrayList<>();
        for (LintRule rule : instantiateRules()) {
            try {
                if (rule.shouldSkipFile(file)) {
                    logger.debug("Rule {} skips {}", rule.name(), file);
                } else {
                    active.add(rule);
                }
            } catch (RuntimeException e) {
                logger.error(
                        "Error in rule {} deciding whether to skip {}: {}",
                        rule.name(),
                        file,
                        e.getMessage());
                faults.add(new RuleFault(rule.name(), "shouldSkipFile", null, e));
            }
        }
        return active;
    }

    /** Walks {@code rules} over the parsed file and applies suppression comments. */
    public LintReport lint(LintContext ctx, List<LintRule> rules) {
        TreeWalker walker = new TreeWalker();
        for (LintRule rule : rules) {
            walker.addRule(rule);
        }
        ViolationList found = walker.walk(ctx.module(), ctx);

        SuppressionIndex suppressions = new SuppressionIndex(ctx.comments());
        ViolationList kept = new ViolationList();
        int suppressed = 0;
        for (Violation v : found) {
            if (suppressions.isSuppressed(v)) {
                logger.debug("Suppressed {} at {}", v.rule(), v.position());
                suppressed++;
            } else {
                kept.add(v);
            }
        }
        return new LintReport(kept, suppressed, walker.getFaults());
    }
}
