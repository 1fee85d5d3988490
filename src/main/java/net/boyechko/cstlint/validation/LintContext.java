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

import java.util.List;
import java.util.Optional;
import net.boyechko.cstlint.syntax.CodePosition;
import net.boyechko.cstlint.syntax.CodeRange;
import net.boyechko.cstlint.syntax.Comment;
import net.boyechko.cstlint.tree.Module;
import net.boyechko.cstlint.tree.Node;
import net.boyechko.cstlint.tree.PositionIndex;

/** Everything known about the file during one traversal. */
public record LintContext(
        FileContext file, Module module, PositionIndex positions, List<Comment> comments) {

    public LintContext {
        comments = List.copyOf(comments);
    }

    public static LintContext of(FileContext file, Module module, List<Comment> comments) {
        return new LintContext(file, module, PositionIndex.of(module), comments);
    }

    public CodeRange rangeOf(Node node) {
        return positions.rangeOf(node);
    }

    public CodePosition positionOf(Node node) {
        return positions.positionOf(node);
    }

    public Optional<Node> parentOf(Node node) {
        return positions.parentOf(node);
    }
}
