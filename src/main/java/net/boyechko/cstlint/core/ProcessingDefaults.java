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

import java.util.List;
import java.util.function.Supplier;
import net.boyechko.cstlint.rules.ComparePrimitivesByEqual;
import net.boyechko.cstlint.rules.CompareSingletonPrimitivesByIs;
import net.boyechko.cstlint.rules.NoInheritFromObject;
import net.boyechko.cstlint.rules.NoRedundantLambda;
import net.boyechko.cstlint.rules.NoStaticIfCondition;
import net.boyechko.cstlint.validation.LintRule;

public final class ProcessingDefaults {
    private ProcessingDefaults() {}

    public static List<Supplier<LintRule>> rules() {
        return List.of(
                NoInheritFromObject::new,
                CompareSingletonPrimitivesByIs::new,
                ComparePrimitivesByEqual::new,
                NoStaticIfCondition::new,
                NoRedundantLambda::new);
    }
}
