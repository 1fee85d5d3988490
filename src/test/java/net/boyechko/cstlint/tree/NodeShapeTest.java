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
import java.util.Map;
import java.util.stream.Collectors;
import net.boyechko.cstlint.CstTestBase;
import net.boyechko.cstlint.syntax.Token;
import net.boyechko.cstlint.tree.NodeShape.Component;
import net.boyechko.cstlint.tree.NodeShape.ComponentKind;
import org.junit.jupiter.api.Test;

class NodeShapeTest extends CstTestBase {

    private static List<String> names(List<Component> components) {
        return components.stream().map(Component::name).collect(Collectors.toList());
    }

    @Test
    void componentsFollowSourceOrder() {
        NodeShape shape = NodeShape.of(ClassDef.class);
        assertEquals(
                List.of(
                        "decorators",
                        "classKeyword",
                        "name",
                        "lpar",
                        "bases",
                        "rpar",
                        "colon",
                        "body"),
                names(shape.components()));
        assertEquals(List.of("decorators", "name", "bases", "body"), names(shape.slots()));
    }

    @Test
    void componentKindsAreClassified() {
        NodeShape shape = NodeShape.of(Arg.class);
        assertEquals(ComponentKind.MAYBE_TOKEN, shape.component("star").kind());
        assertEquals(ComponentKind.NODE, shape.component("keyword").kind());
        assertTrue(shape.component("keyword").optional());
        assertFalse(shape.component("value").optional());
        NodeShape comparison = NodeShape.of(ComparisonTarget.class);
        assertEquals(ComponentKind.TOKEN_LIST, comparison.component("operator").kind());
        assertEquals(ComponentKind.NODE_LIST, NodeShape.of(Call.class).component("args").kind());
        assertEquals(Arg.class, NodeShape.of(Call.class).component("args").valueType());
    }

    @Test
    void shapesAreCachedPerKind() {
        assertSame(NodeShape.of(Name.class), Name.of("a").shape());
    }

    @Test
    void unknownComponentIsRejected() {
        NodeShape shape = NodeShape.of(ClassDef.class);
        assertThrows(IllegalArgumentException.class, () -> shape.component("nope"));
        assertThrows(IllegalArgumentException.class, () -> shape.slot("colon"));
    }

    @Test
    void nonRecordKindIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> NodeShape.of(Expression.class));
    }

    @Test
    void copyWithReplacesOnlyNamedComponents() throws Exception {
        ClassDef cls = (ClassDef) parse("class C(object):\n    pass\n").body().get(0);
        ClassDef renamed = Nodes.with(cls, "name", Name.of("D"));
        assertEquals("D", renamed.name().id());
        assertEquals(cls.bases(), renamed.bases());
        assertSame(cls.body(), renamed.body());
        assertEquals("class D(object):\n    pass\n", renamed.code());
    }

    @Test
    void copyWithChecksTypes() throws Exception {
        ClassDef cls = (ClassDef) parse("class C:\n    pass\n").body().get(0);
        assertThrows(
                IllegalArgumentException.class,
                () -> Nodes.with(cls, "name", Token.name("D")));
        assertThrows(IllegalArgumentException.class, () -> Nodes.with(cls, "name", null));
        assertThrows(
                IllegalArgumentException.class,
                () -> Nodes.withChanges(cls, Map.of("bogus", Name.of("x"))));
        assertThrows(
                IllegalArgumentException.class,
                () -> Nodes.with(cls, "bases", List.of(Name.of("x"))));
    }

    @Test
    void childrenSkipAbsentOptionalSlots() throws Exception {
        Module module = parse("return\n");
        SimpleStatementLine line = (SimpleStatementLine) module.body().get(0);
        Return ret = (Return) line.body().get(0);
        assertNull(ret.value());
        assertTrue(Nodes.children(ret).isEmpty());
    }

    @Test
    void preorderVisitsParentsBeforeChildren() throws Exception {
        Module module = parse("f(a, b)\n");
        List<String> kinds =
                Nodes.preorder(module).stream()
                        .map(Node::kindName)
                        .collect(Collectors.toList());
        assertEquals(
                List.of(
                        "Module",
                        "SimpleStatementLine",
                        "Expr",
                        "Call",
                        "Name",
                        "Arg",
                        "Name",
                        "Arg",
                        "Name"),
                kinds);
    }

    @Test
    void withLeadingMovesTriviaOntoFirstToken() throws Exception {
        Module module = parse("x = a.b\n");
        Assign assign = (Assign) ((SimpleStatementLine) module.body().get(0)).body().get(0);
        Expression value = Nodes.withLeading(assign.value(), "  ");
        assertEquals("  a.b", value.code());
    }
}
