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

import static net.boyechko.cstlint.matcher.Patterns.absent;
import static net.boyechko.cstlint.matcher.Patterns.node;

import net.boyechko.cstlint.matcher.Matcher;
import net.boyechko.cstlint.matcher.Pattern;
import net.boyechko.cstlint.matcher.Patterns;
import net.boyechko.cstlint.tree.Arg;
import net.boyechko.cstlint.tree.ClassDef;
import net.boyechko.cstlint.validation.HookRegistry;
import net.boyechko.cstlint.validation.LintRule;
import net.boyechko.cstlint.violation.Replacement;

/**
 * Every class inherits from {@code object} already. The explicit base is removed; when it was the
 * only one, the parentheses go with it.
 */
public class NoInheritFromObject extends LintRule {

    private static final Pattern OBJECT_BASE =
            node(Arg.class)
                    .with("star", absent())
                    .with("keyword", absent())
                    .with("value", Patterns.name("object"));

    @Override
    public String description() {
        return "Classes need not inherit from object explicitly";
    }

    @Override
    public void registerHooks(HookRegistry hooks) {
        hooks.onEnter(ClassDef.class, this::checkBases);
    }

    private void checkBases(ClassDef classDef) {
        for (Arg base : classDef.bases()) {
            if (Matcher.matches(base, OBJECT_BASE)) {
                report(
                        base,
                        "Class " + classDef.name().id() + " inherits from object explicitly",
                        Replacement.remove());
            }
        }
    }
}
