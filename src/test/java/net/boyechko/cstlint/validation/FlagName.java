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

import net.boyechko.cstlint.tree.Name;

/** Test rule: reports every name spelled like {@code id}. */
class FlagName extends LintRule {
    private final String id;

    FlagName(String id) {
        this.id = id;
    }

    @Override
    public String description() {
        return "Flags uses of " + id;
    }

    @Override
    public void registerHooks(HookRegistry hooks) {
        hooks.onEnter(
                Name.class,
                name -> {
                    if (name.id().equals(id)) {
                        report(name, "found " + id);
                    }
                });
    }
}
