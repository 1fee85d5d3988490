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
package net.boyechko.cstlint.violation;

import java.util.Objects;
import net.boyechko.cstlint.tree.Node;

/** A fix proposed by a violation: substitute another node, or drop the node altogether. */
public sealed interface Replacement permits Replacement.With, Replacement.Remove {

    record With(Node node) implements Replacement {
        public With {
            Objects.requireNonNull(node, "node");
        }
    }

    record Remove() implements Replacement {}

    static Replacement with(Node node) {
        return new With(node);
    }

    static Replacement remove() {
        return new Remove();
    }

    default String describe() {
        if (this instanceof With w) {
            return "replace with " + w.node().kindName();
        }
        return "remove";
    }
}
