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
package net.boyechko.cstlint;

import java.util.List;
import java.util.function.Supplier;
import net.boyechko.cstlint.fixes.FixException;
import net.boyechko.cstlint.fixes.FixOutcome;
import net.boyechko.cstlint.fixes.PatchApplier;
import net.boyechko.cstlint.syntax.SourceException;
import net.boyechko.cstlint.syntax.TokenSequence;
import net.boyechko.cstlint.syntax.Tokenizer;
import net.boyechko.cstlint.parse.Parser;
import net.boyechko.cstlint.tree.Module;
import net.boyechko.cstlint.validation.FileContext;
import net.boyechko.cstlint.validation.LintContext;
import net.boyechko.cstlint.validation.LintEngine;
import net.boyechko.cstlint.validation.LintReport;
import net.boyechko.cstlint.validation.LintRule;

/** Base for tests that parse snippets and run rules over them. */
public abstract class CstTestBase {

    protected static final FileContext FILE = FileContext.of("example.py");

    protected static Module parse(String source) throws SourceException {
        return Parser.parseModule(source);
    }

    protected static LintContext contextOf(String source) throws SourceException {
        TokenSequence tokens = Tokenizer.tokenize(source);
        return LintContext.of(FILE, Parser.parse(tokens), tokens.comments());
    }

    /** Runs fresh instances of {@code rules} over {@code source}. */
    @SafeVarargs
    protected static LintReport lint(String source, Supplier<LintRule>... rules)
            throws SourceException {
        LintEngine engine = new LintEngine(List.of(rules));
        return engine.lint(contextOf(source), engine.instantiateRules());
    }

    /** Lints and applies every fix; returns the rewritten source. */
    @SafeVarargs
    protected static String fix(String source, Supplier<LintRule>... rules)
            throws SourceException, FixException {
        LintEngine engine = new LintEngine(List.of(rules));
        LintContext ctx = contextOf(source);
        LintReport report = engine.lint(ctx, engine.instantiateRules());
        FixOutcome outcome = PatchApplier.apply(ctx.module(), report.violations());
        return outcome.fixedSource();
    }
}
