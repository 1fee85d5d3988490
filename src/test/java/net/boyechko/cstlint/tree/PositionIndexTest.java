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
package net.boyechko.cstlint.tree;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.cstlint.CstTestBase;
import net.boyechko.cstlint.syntax.CodePosition;
import net.boyechko.cstlint.syntax.CodeRange;
import org.junit.jupiter.api.Test;

class PositionIndexTest extends CstTestBase {

    private static CodeRange range(int startLine, int startCol, int endLine, int endCol) {
        return new CodeRange(
                new CodePosition(startLine, startCol), new CodePosition(endLine, endCol));
    }

    @Test
    void rangesCoverTokenTextOnly() throws Exception {
        Module module = parse("x = 1\nif y:\n    z = 22\n");
        PositionIndex index = PositionIndex.of(module);

        SimpleStatementLine first = (SimpleStatementLine) module.body().get(0);
        assertEquals(range(1, 0, 1, 5), index.rangeOf(first));

        If stmt = (If) module.body().get(1);
        assertEquals(range(2, 0, 3, 10), index.rangeOf(stmt));

        IndentedBlock block = (IndentedBlock) stmt.body();
        SimpleStatementLine inner = (SimpleStatementLine) block.body().get(0);
        Assign assign = (Assign) inner.body().get(0);
        assertEquals(range(3, 4, 3, 5), index.rangeOf(assign.targets().get(0).target()));
        assertEquals(range(3, 8, 3, 10), index.rangeOf(assign.value()));
        assertEquals(new CodePosition(3, 4), index.positionOf(block));
    }

    @Test
    void equalNodesAreTrackedSeparately() throws Exception {
        Module module = parse("x\nx\n");
        Expr first = (Expr) ((SimpleStatementLine) module.body().get(0)).body().get(0);
        Expr second = (Expr) ((SimpleStatementLine) module.body().get(1)).body().get(0);
        assertEquals(first, second);
        PositionIndex index = PositionIndex.of(module);
        assertEquals(1, index.positionOf(first.value()).line());
        assertEquals(2, index.positionOf(second.value()).line());
    }

    @Test
    void crlfCountsAsOneLineBreak() throws Exception {
        Module module = parse("a = 1\r\nb = 2\r\n");
        SimpleStatementLine second = (SimpleStatementLine) module.body().get(1);
        assertEquals(new CodePosition(2, 0), PositionIndex.of(module).positionOf(second));
    }

    @Test
    void parentsAndAncestors() throws Exception {
        Module module = parse("def f():\n    return g(x)\n");
        PositionIndex index = PositionIndex.of(module);
        FunctionDef def = (FunctionDef) module.body().get(0);
        Name x =
                Nodes.preorder(module).stream()
                        .filter(n -> n instanceof Name name && name.id().equals("x"))
                        .map(Name.class::cast)
                        .findFirst()
                        .orElseThrow();

        Node parent = index.parentOf(x).orElseThrow();
        assertInstanceOf(Arg.class, parent);
        assertSame(def, index.enclosing(x, FunctionDef.class).orElseThrow());
        List<Node> ancestors = index.ancestorsOf(x);
        assertSame(module, ancestors.get(ancestors.size() - 1));
        assertTrue(index.parentOf(module).isEmpty());
        assertTrue(index.enclosing(x, ClassDef.class).isEmpty());
    }

    @Test
    void foreignNodeIsRejected() throws Exception {
        PositionIndex index = PositionIndex.of(parse("x\n"));
        Name stranger = Name.of("x");
        assertFalse(index.contains(stranger));
        assertThrows(IllegalArgumentException.class, () -> index.rangeOf(stranger));
    }

    @Test
    void indexedSourceMatchesRendering() throws Exception {
        String source = "# c\nx = [1,\n     2]\n";
        assertEquals(source, PositionIndex.of(parse(source)).source());
    }
}
