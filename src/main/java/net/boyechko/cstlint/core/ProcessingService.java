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
package net.boyechko.cstlint.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import net.boyechko.cstlint.fixes.ConflictingFixException;
import net.boyechko.cstlint.fixes.FixException;
import net.boyechko.cstlint.fixes.FixOutcome;
import net.boyechko.cstlint.fixes.PatchApplier;
import net.boyechko.cstlint.parse.Parser;
import net.boyechko.cstlint.syntax.SourceException;
import net.boyechko.cstlint.syntax.TokenSequence;
import net.boyechko.cstlint.syntax.Tokenizer;
import net.boyechko.cstlint.tree.Module;
import net.boyechko.cstlint.validation.FileContext;
import net.boyechko.cstlint.validation.LintContext;
import net.boyechko.cstlint.validation.LintEngine;
import net.boyechko.cstlint.validation.LintReport;
import net.boyechko.cstlint.validation.LintRule;
import net.boyechko.cstlint.validation.RuleFault;
import net.boyechko.cstlint.violation.Violation;
import net.boyechko.cstlint.violation.ViolationList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the processing of source files: skip check, tokenize, parse, lint, and optionally
 * autofix. The service holds no per-file state and may be shared between threads.
 */
public class ProcessingService {
    private static final Logger logger = LoggerFactory.getLogger(ProcessingService.class);

    private final EngineConfig config;
    private final LintEngine engine;
    private final ProcessingListener listener;
    private final boolean autofix;

    public static class ProcessingServiceBuilder {
        private List<Supplier<LintRule>> rules;
        private EngineConfig config;
        private ProcessingListener listener;
        private Boolean autofix;
        private final Set<String> skipRules = new HashSet<>();
        private final Set<String> includeOnlyRules = new HashSet<>();

        public ProcessingServiceBuilder withRules(List<Supplier<LintRule>> rules) {
            this.rules = List.copyOf(rules);
            return this;
        }

        public ProcessingServiceBuilder withConfig(EngineConfig config) {
            this.config = config;
            return this;
        }

        public ProcessingServiceBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        /** Overrides the configuration's {@code autofix} setting. */
        public ProcessingServiceBuilder withAutofix(boolean autofix) {
            this.autofix = autofix;
            return this;
        }

        public ProcessingServiceBuilder skipRules(Set<String> ruleNames) {
            skipRules.addAll(ruleNames);
            return this;
        }

        public ProcessingServiceBuilder includeOnlyRules(Set<String> ruleNames) {
            includeOnlyRules.addAll(ruleNames);
            return this;
        }

        public ProcessingService build() {
            return new ProcessingService(this);
        }
    }

    public static ProcessingServiceBuilder builder() {
        return new ProcessingServiceBuilder();
    }

    private ProcessingService(ProcessingServiceBuilder builder) {
        this.config = builder.config != null ? builder.config : EngineConfig.loadDefault();
        this.listener = builder.listener != null ? builder.listener : ProcessingListener.silent();
        this.autofix = builder.autofix != null ? builder.autofix : config.isAutofix();

        Set<String> skip = new HashSet<>(builder.skipRules);
        skip.addAll(config.getDisabledRules());
        List<Supplier<LintRule>> defaults =
                builder.rules != null ? builder.rules : ProcessingDefaults.rules();
        this.engine = new LintEngine(filterRules(defaults, skip, builder.includeOnlyRules));
    }

    /** Filters rule suppliers by rule name against the skip and includeOnly sets. */
    private static List<Supplier<LintRule>> filterRules(
            List<Supplier<LintRule>> defaults, Set<String> skip, Set<String> includeOnly) {
        if (skip.isEmpty() && includeOnly.isEmpty()) {
            return defaults;
        }
        List<Supplier<LintRule>> filtered = new ArrayList<>();
        Set<String> known = new LinkedHashSet<>();
        for (Supplier<LintRule> supplier : defaults) {
            String name = supplier.get().name();
            known.add(name);
            if (!includeOnly.isEmpty()) {
                if (includeOnly.contains(name)) {
                    filtered.add(supplier);
                }
            } else if (!skip.contains(name)) {
                filtered.add(supplier);
            }
        }
        Set<String> requested = new HashSet<>(skip);
        requested.addAll(includeOnly);
        requested.removeAll(known);
        for (String unknown : requested) {
            logger.warn("Unknown rule name '{}'; known rules are {}", unknown, known);
        }
        return filtered;
    }

    public List<Supplier<LintRule>> getRuleSuppliers() {
        return engine.getRuleSuppliers();
    }

    public boolean isAutofix() {
        return autofix;
    }

    /** Processes one file in memory; nothing is written. */
    public ProcessingResult process(SourceFile file) {
        FileContext fileContext = new FileContext(file.path(), config.isTestPath(file.path()));
        listener.onFileStart(fileContext);

        List<RuleFault> faults = new ArrayList<>();
        List<LintRule> rules = engine.rulesFor(fileContext, faults);
        reportFaults(fileContext, faults);
        if (rules.isEmpty()) {
            logger.debug("No rule wants {}, not parsing it", fileContext);
            listener.onSkipped(fileContext);
            ProcessingResult result =
                    ProcessingResult.skipped(fileContext, file.source(), faults);
            listener.onSummary(result);
            return result;
        }

        TokenSequence tokens;
        Module module;
        try {
            tokens = Tokenizer.tokenize(file.source());
            module = Parser.parse(tokens);
        } catch (SourceException e) {
            logger.warn("Cannot parse {}: {}", fileContext, e.getMessage());
            listener.onUnparseable(fileContext, e);
            ProcessingResult result =
                    ProcessingResult.unparseable(fileContext, file.source(), faults, e);
            listener.onSummary(result);
            return result;
        }

        LintContext ctx = LintContext.of(fileContext, module, tokens.comments());
        LintReport report = engine.lint(ctx, rules);
        reportFaults(fileContext, report.faults());
        faults.addAll(report.faults());

        ViolationList violations = report.violations().sorted();
        for (Violation v : violations) {
            listener.onViolation(fileContext, v);
        }

        FixOutcome fix = null;
        FixException fixError = null;
        if (autofix && !violations.getFixable().isEmpty()) {
            try {
                fix = PatchApplier.apply(module, violations);
                listener.onFixApplied(fileContext, fix);
            } catch (ConflictingFixException e) {
                logger.warn("Not fixing {}: {}", fileContext, e.getMessage());
                e.first().markFailed(e.getMessage());
                e.second().markFailed(e.getMessage());
                fixError = e;
                listener.onFixError(fileContext, e);
            } catch (FixException e) {
                logger.warn("Not fixing {}: {}", fileContext, e.getMessage());
                fixError = e;
                listener.onFixError(fileContext, e);
            }
        }

        ProcessingResult result =
                new ProcessingResult(
                        fileContext,
                        ProcessingResult.Outcome.CHECKED,
                        violations,
                        faults,
                        file.source(),
                        fix,
                        null,
                        fixError);
        listener.onSummary(result);
        return result;
    }

    /** Reads, processes and, when autofix is on and something changed, rewrites a file. */
    public ProcessingResult processFile(Path path) throws IOException {
        ProcessingResult result = process(SourceFile.read(path));
        if (autofix && result.changed()) {
            Files.writeString(path, result.fixedSource(), StandardCharsets.UTF_8);
            logger.debug("Wrote fixed source to {}", path);
        }
        return result;
    }

    private void reportFaults(FileContext file, List<RuleFault> faults) {
        for (RuleFault fault : faults) {
            listener.onRuleFault(file, fault);
        }
    }
}
