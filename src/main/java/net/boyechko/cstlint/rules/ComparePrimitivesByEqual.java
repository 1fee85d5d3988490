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
package net.boyechko.cstlint.rules;

import static net.boyechko.cstlint.matcher.Patterns.node;
import static net.boyechko.cstlint.matcher.Patterns.oneOf;
import static net.boyechko.cstlint.matcher.Patterns.oneOfText;

import java.util.List;
import net.boyechko.cstlint.matcher.Matcher;
import net.boyechko.cstlint.matcher.Pattern;
import net.boyechko.cstlint.syntax.Token;
import net.boyechko.cstlint.syntax.TokenKind;
import net.boyechko.cstlint.tree.Comparison;
import net.boyechko.cstlint.tree.ComparisonTarget;
import net.boyechko.cstlint.tree.ConcatenatedString;
import net.boyechko.cstlint.tree.Expression;
import net.boyechko.cstlint.tree.Number;
import net.boyechko.cstlint.tree.SimpleString;
import net.boyechko.cstlint.tree.UnaryOperation;
import net.boyechko.cstlint.validation.HookRegistry;
import net.boyechko.cstlint.validation.LintRule;
import net.boyechko.cstlint.violation.Replacement;

/**
 * Numbers and strings are compared by value. Identity of equal literals is an interpreter detail,
 * so {@code x is 1} becomes {@code x == 1} and {@code x is not "a"} becomes {@code x != "a"}.
 */
public class ComparePrimitivesByEqual extends LintRule {

    private static final Pattern PRIMITIVE =
            oneOf(
                    node(Number.class),
                    node(SimpleString.class),
                    node(ConcatenatedString.class),
                    node(UnaryOperation.class)
                            .with("operator", oneOfText("-", "+", "~"))
                            .with("operand", node(Number.class)));

    @Override
    public String description() {
        return "Compare numbers and strings with '==' or '!='";
    }

    @Override
    public void registerHooks(HookRegistry hooks) {
        hooks.onEnter(Comparison.class, this::checkComparison);
    }

    private void checkComparison(Comparison comparison) {
        Expression left = comparison.left();
        for (ComparisonTarget target : comparison.comparisons()) {
            String op = target.operatorText();
            boolean identity = op.equals("is") || op.equals("is not");
            if (identity
                    && (Matcher.matches(left, PRIMITIVE)
                            || Matcher.matches(target.comparator(), PRIMITIVE))) {
                String replacement = op.equals("is") ? "==" : "!=";
                List<Token> words = target.operator();
                Token first = words.get(0);
                Token last = words.get(words.size() - 1);
                Token operator =
                        new Token(TokenKind.OP, first.leading(), replacement, last.trailing());
                report(
                        target,
                        "Use '" + replacement + "' instead of '" + op + "' to compare literals",
                        Replacement.with(
                                new ComparisonTarget(List.of(operator), target.comparator())));
            }
            left = target.comparator();
        }
    }
}
