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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.cstlint.tree.Arg;
import net.boyechko.cstlint.tree.Call;
import net.boyechko.cstlint.tree.Expression;
import net.boyechko.cstlint.tree.Lambda;
import net.boyechko.cstlint.tree.Name;
import net.boyechko.cstlint.tree.Node;
import net.boyechko.cstlint.tree.Nodes;
import net.boyechko.cstlint.tree.Param;
import net.boyechko.cstlint.validation.HookRegistry;
import net.boyechko.cstlint.validation.LintRule;
import net.boyechko.cstlint.violation.Replacement;

/**
 * A lambda that only forwards its parameters, in order, to another callable is that callable:
 * {@code lambda x, y: f(x, y)} becomes {@code f}.
 */
public class NoRedundantLambda extends LintRule {

    @Override
    public String description() {
        return "Lambdas that only forward their arguments are redundant";
    }

    @Override
    public void registerHooks(HookRegistry hooks) {
        hooks.onEnter(Lambda.class, this::checkLambda);
    }

    private void checkLambda(Lambda lambda) {
        if (!(lambda.body() instanceof Call call)) {
            return;
        }
        List<String> params = simpleParamNames(lambda.params());
        if (params == null || params.size() != call.args().size()) {
            return;
        }
        for (int i = 0; i < params.size(); i++) {
            Arg arg = call.args().get(i);
            if (!arg.isPositional()
                    || !(arg.value() instanceof Name name)
                    || !name.id().equals(params.get(i))) {
                return;
            }
        }
        // lambda x: x.method(x) binds x at call time
        if (references(call.func(), new HashSet<>(params))) {
            return;
        }

        Expression func =
                Nodes.withLeading(call.func(), Nodes.firstToken(lambda).leading());
        report(
                lambda,
                "Lambda only forwards its arguments; pass the callable directly",
                Replacement.with(func));
    }

    /** Parameter names, or null when any parameter has a default, star or annotation. */
    private static List<String> simpleParamNames(List<Param> params) {
        List<String> names = new ArrayList<>();
        for (Param p : params) {
            if (p.star().isPresent()
                    || p.name() == null
                    || p.defaultValue() != null
                    || p.annotation() != null) {
                return null;
            }
            names.add(p.name().id());
        }
        return names;
    }

    private static boolean references(Expression expr, Set<String> names) {
        for (Node node : Nodes.preorder(expr)) {
            if (node instanceof Name name && names.contains(name.id())) {
                return true;
            }
        }
        return false;
    }
}
