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

import java.util.regex.Pattern;
import net.boyechko.cstlint.tree.BooleanOperation;
import net.boyechko.cstlint.tree.ConcatenatedString;
import net.boyechko.cstlint.tree.Expression;
import net.boyechko.cstlint.tree.If;
import net.boyechko.cstlint.tree.Name;
import net.boyechko.cstlint.tree.Number;
import net.boyechko.cstlint.tree.Parenthesized;
import net.boyechko.cstlint.tree.SimpleString;
import net.boyechko.cstlint.tree.UnaryOperation;
import net.boyechko.cstlint.validation.HookRegistry;
import net.boyechko.cstlint.validation.LintRule;

/**
 * Reports {@code if} and {@code elif} tests whose truth value is fixed in the source, such as
 * {@code if True:}, {@code if 0:} or {@code if x or True:}. One branch is dead code, and which
 * one the author meant is not for a tool to decide, so there is no fix.
 */
public class NoStaticIfCondition extends LintRule {

    private static final Pattern ZERO =
            Pattern.compile(
                    "0[xob][0_]+|[0_]*\\.?[0_]*(e[+-]?[0-9_]+)?j?", Pattern.CASE_INSENSITIVE);

    @Override
    public String description() {
        return "If conditions should not be constant";
    }

    @Override
    public void registerHooks(HookRegistry hooks) {
        hooks.onEnter(If.class, this::checkIf);
    }

    private void checkIf(If node) {
        Boolean value = staticValue(node.test());
        if (value != null) {
            report(
                    node.test(),
                    "Condition of '"
                            + node.ifKeyword().text()
                            + "' is always "
                            + (value ? "true" : "false"));
        }
    }

    /** Truth value known without running the code, or null. */
    static Boolean staticValue(Expression expr) {
        if (expr instanceof Name name) {
            switch (name.id()) {
                case "True":
                    return Boolean.TRUE;
                case "False":
                case "None":
                    return Boolean.FALSE;
                default:
                    return null;
            }
        }
        if (expr instanceof Number number) {
            return !ZERO.matcher(number.value().text()).matches();
        }
        if (expr instanceof SimpleString string) {
            return !isEmptyLiteral(string.value().text());
        }
        if (expr instanceof ConcatenatedString concat) {
            for (SimpleString part : concat.parts()) {
                if (!isEmptyLiteral(part.value().text())) {
                    return Boolean.TRUE;
                }
            }
            return Boolean.FALSE;
        }
        if (expr instanceof Parenthesized paren) {
            return staticValue(paren.value());
        }
        if (expr instanceof UnaryOperation unary && unary.operator().text().equals("not")) {
            Boolean operand = staticValue(unary.operand());
            return operand != null ? !operand : null;
        }
        if (expr instanceof BooleanOperation op) {
            Boolean left = staticValue(op.left());
            Boolean right = staticValue(op.right());
            // the static side decides the outcome whatever the other side is
            Boolean decisive = op.operator().text().equals("or") ? Boolean.TRUE : Boolean.FALSE;
            if (decisive.equals(left) || decisive.equals(right)) {
                return decisive;
            }
            if (left != null && right != null) {
                return !decisive;
            }
        }
        return null;
    }

    private static boolean isEmptyLiteral(String literal) {
        String body = literal.replaceFirst("^[A-Za-z]*", "");
        return body.equals("''")
                || body.equals("\"\"")
                || body.equals("''''''")
                || body.equals("\"\"\"\"\"\"");
    }
}
