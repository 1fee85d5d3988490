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

import static net.boyechko.cstlint.matcher.Patterns.oneOf;

import java.util.List;
import net.boyechko.cstlint.matcher.Matcher;
import net.boyechko.cstlint.matcher.Pattern;
import net.boyechko.cstlint.matcher.Patterns;
import net.boyechko.cstlint.syntax.Token;
import net.boyechko.cstlint.syntax.TokenKind;
import net.boyechko.cstlint.tree.Comparison;
import net.boyechko.cstlint.tree.ComparisonTarget;
import net.boyechko.cstlint.tree.Expression;
import net.boyechko.cstlint.validation.HookRegistry;
import net.boyechko.cstlint.validation.LintRule;
import net.boyechko.cstlint.violation.Replacement;

/**
 * {@code None}, {@code True} and {@code False} are singletons and are compared by identity:
 * {@code x == None} becomes {@code x is None}, {@code x != True} becomes {@code x is not True}.
 */
public class CompareSingletonPrimitivesByIs extends LintRule {

    private static final Pattern SINGLETON =
            oneOf(Patterns.name("None"), Patterns.name("True"), Patterns.name("False"));

    @Override
    public String description() {
        return "Compare None, True and False with 'is' or 'is not'";
    }

    @Override
    public void registerHooks(HookRegistry hooks) {
        hooks.onEnter(Comparison.class, this::checkComparison);
    }

    private void checkComparison(Comparison comparison) {
        Expression left = comparison.left();
        for (ComparisonTarget target : comparison.comparisons()) {
            String op = target.operatorText();
            boolean equality = op.equals("==") || op.equals("!=");
            if (equality
                    && (Matcher.matches(left, SINGLETON)
                            || Matcher.matches(target.comparator(), SINGLETON))) {
                String replacement = op.equals("==") ? "is" : "is not";
                report(
                        target,
                        "Use '" + replacement + "' instead of '" + op + "' to compare singletons",
                        Replacement.with(
                                new ComparisonTarget(
                                        identityOperator(left, target, op),
                                        target.comparator())));
            }
            left = target.comparator();
        }
    }

    /** Keyword tokens for the operator; {@code x==None} needs spaces added around them. */
    private List<Token> identityOperator(Expression left, ComparisonTarget target, String op) {
        Token original = target.operator().get(0);
        boolean touchesLeft =
                context().rangeOf(left).end().equals(context().rangeOf(target).start());
        String leading = original.leading().isEmpty() && touchesLeft ? " " : original.leading();
        String trailing = original.trailing().isEmpty() ? " " : original.trailing();
        if (op.equals("==")) {
            return List.of(new Token(TokenKind.NAME, leading, "is", trailing));
        }
        return List.of(
                new Token(TokenKind.NAME, leading, "is", " "),
                new Token(TokenKind.NAME, "", "not", trailing));
    }
}
