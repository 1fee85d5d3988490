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
package net.boyechko.cstlint.fixes;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.function.Predicate;
import net.boyechko.cstlint.CstTestBase;
import net.boyechko.cstlint.syntax.CodePosition;
import net.boyechko.cstlint.syntax.CodeRange;
import net.boyechko.cstlint.syntax.Token;
import net.boyechko.cstlint.tree.Call;
import net.boyechko.cstlint.tree.Element;
import net.boyechko.cstlint.tree.Expr;
import net.boyechko.cstlint.tree.ListLiteral;
import net.boyechko.cstlint.tree.MaybeToken;
import net.boyechko.cstlint.tree.Name;
import net.boyechko.cstlint.tree.Node;
import net.boyechko.cstlint.tree.Nodes;
import net.boyechko.cstlint.tree.Number;
import net.boyechko.cstlint.tree.Tuple;
import net.boyechko.cstlint.validation.LintContext;
import net.boyechko.cstlint.violation.Replacement;
import net.boyechko.cstlint.violation.Violation;
import net.boyechko.cstlint.violation.ViolationList;
import org.junit.jupiter.api.Test;

class PatchApplierTest extends CstTestBase {

    private static <T extends Node> T find(LintContext ctx, Class<T> kind, Predicate<T> test) {
        for (Node n : Nodes.preorder(ctx.module())) {
            if (kind.isInstance(n) && test.test(kind.cast(n))) {
                return kind.cast(n);
            }
        }
        throw new AssertionError("No matching " + kind.getSimpleName());
    }

    private static Name name(LintContext ctx, String id) {
        return find(ctx, Name.class, n -> n.id().equals(id));
    }

    private static Expr statement(LintContext ctx, String id) {
        return find(ctx, Expr.class, e -> e.value() instanceof Name n && n.id().equals(id));
    }

    private static boolean isNumber(Element element, String text) {
        return element.value() instanceof Number n && n.value().text().equals(text);
    }

    private static Violation violation(LintContext ctx, Node node, Replacement replacement) {
        return new Violation("TestRule", node, ctx.rangeOf(node), "test", replacement);
    }

    private static Replacement rename(Name name, String id) {
        return Replacement.with(new Name(name.value().withText(id)));
    }

    private static FixOutcome apply(LintContext ctx, Violation... violations)
            throws FixException {
        return PatchApplier.apply(ctx.module(), new ViolationList(List.of(violations)));
    }

    private static String removing(String source, String... ids) throws Exception {
        LintContext ctx = contextOf(source);
        ViolationList violations = new ViolationList();
        for (String id : ids) {
            violations.add(violation(ctx, statement(ctx, id), Replacement.remove()));
        }
        return PatchApplier.apply(ctx.module(), violations).fixedSource();
    }

    @Test
    void replacementOnlyTouchesItsNode() throws Exception {
        String source = "# header\nfoo(x)  # keep\n\n\nbar  =  x\n";
        LintContext ctx = contextOf(source);
        Name first = name(ctx, "x");
        Name second = find(ctx, Name.class, n -> n.id().equals("x") && n != first);

        FixOutcome outcome =
                apply(
                        ctx,
                        violation(ctx, first, rename(first, "y")),
                        violation(ctx, second, rename(second, "y")));

        assertEquals("# header\nfoo(y)  # keep\n\n\nbar  =  y\n", outcome.fixedSource());
        assertEquals(source, outcome.originalSource());
        assertEquals(2, outcome.applied().size());
        assertTrue(outcome.applied().get(0).isResolved());
        assertTrue(outcome.changed());
    }

    @Test
    void untouchedSubtreesAreShared() throws Exception {
        LintContext ctx = contextOf("a = 1\nb = x\n");
        Name x = name(ctx, "x");
        FixOutcome outcome = apply(ctx, violation(ctx, x, rename(x, "y")));
        assertSame(ctx.module().body().get(0), outcome.fixed().body().get(0));
        assertNotSame(ctx.module().body().get(1), outcome.fixed().body().get(1));
    }

    @Test
    void differentFixesForOneNodeConflict() throws Exception {
        LintContext ctx = contextOf("a\nb\n");
        Expr a = statement(ctx, "a");
        Violation remove = violation(ctx, a, Replacement.remove());
        Violation replace =
                violation(ctx, a, Replacement.with(new Expr(Name.of("c"), MaybeToken.auto())));

        ConflictingFixException e =
                assertThrows(ConflictingFixException.class, () -> apply(ctx, remove, replace));
        assertSame(remove, e.first());
        assertSame(replace, e.second());
        assertTrue(e.getMessage().contains("Conflicting fixes for Expr"));
    }

    @Test
    void identicalFixesForOneNodeAreMerged() throws Exception {
        LintContext ctx = contextOf("a\nb\n");
        Expr a = statement(ctx, "a");
        Violation one = violation(ctx, a, Replacement.remove());
        Violation two = violation(ctx, a, Replacement.remove());
        FixOutcome outcome = apply(ctx, one, two);
        assertEquals("b\n", outcome.fixedSource());
        assertTrue(one.isResolved());
        assertTrue(two.isResolved());
    }

    @Test
    void editsInsideAReplacementAreApplied() throws Exception {
        LintContext ctx = contextOf("y = [x]\n");
        ListLiteral list = find(ctx, ListLiteral.class, l -> true);
        Name x = name(ctx, "x");
        Tuple tuple =
                new Tuple(
                        MaybeToken.of(Token.op("(")),
                        list.elements(),
                        MaybeToken.of(Token.op(")")));
        Violation outer = violation(ctx, list, Replacement.with(tuple));
        Violation inner = violation(ctx, x, rename(x, "z"));

        FixOutcome outcome = apply(ctx, outer, inner);

        assertEquals("y = (z)\n", outcome.fixedSource());
        assertEquals(2, outcome.applied().size());
        assertTrue(outcome.superseded().isEmpty());
    }

    @Test
    void editsDroppedByAReplacementAreSuperseded() throws Exception {
        LintContext ctx = contextOf("y = f(x)\n");
        Call call = find(ctx, Call.class, c -> true);
        Name x = name(ctx, "x");
        Violation outer = violation(ctx, call, Replacement.with(Name.of("g")));
        Violation inner = violation(ctx, x, rename(x, "z"));

        FixOutcome outcome = apply(ctx, outer, inner);

        assertEquals("y = g\n", outcome.fixedSource());
        assertEquals(List.of(outer), outcome.applied());
        assertEquals(List.of(inner), outcome.superseded());
        assertTrue(inner.isResolved());
        assertTrue(inner.resolutionNote().startsWith("Superseded"));
    }

    @Test
    void editsFoldAtEveryNestingLevel() throws Exception {
        LintContext ctx = contextOf("y = f(g(h(x)))\n");
        ViolationList violations = new ViolationList();
        for (Node n : Nodes.preorder(ctx.module())) {
            if (n instanceof Call call && call.func() instanceof Name func) {
                Call renamed =
                        Nodes.with(
                                call,
                                "func",
                                new Name(func.value().withText(func.id().toUpperCase())));
                violations.add(violation(ctx, call, Replacement.with(renamed)));
            }
        }
        Name x = name(ctx, "x");
        violations.add(violation(ctx, x, rename(x, "X")));

        FixOutcome outcome = PatchApplier.apply(ctx.module(), violations);

        assertEquals("y = F(G(H(X)))\n", outcome.fixedSource());
        assertEquals(4, outcome.applied().size());
        assertTrue(outcome.superseded().isEmpty());
    }

    @Test
    void replacementContainingItsOwnNodeIsNotReapplied() throws Exception {
        LintContext ctx = contextOf("y = x\n");
        Name x = name(ctx, "x");
        ListLiteral wrapped =
                new ListLiteral(
                        Token.op("["), List.of(new Element(x, MaybeToken.absent())), Token.op("]"));
        Violation wrap = violation(ctx, x, Replacement.with(wrapped));

        FixOutcome outcome = apply(ctx, wrap);

        assertEquals("y = [x]\n", outcome.fixedSource());
        assertEquals(List.of(wrap), outcome.applied());
        assertTrue(wrap.isResolved());
    }

    @Test
    void removingAStatementRemovesItsLine() throws Exception {
        assertEquals("a\nc\n", removing("a\nb\nc\n", "b"));
    }

    @Test
    void emptiedBlockGetsPass() throws Exception {
        assertEquals("def f():\n    pass\n", removing("def f():\n    a\n", "a"));
        assertEquals(
                "if x:\n    pass\nelse:\n    c\n",
                removing("if x:\n    a\n    b\nelse:\n    c\n", "a", "b"));
    }

    @Test
    void emptiedSameLineSuiteGetsPass() throws Exception {
        assertEquals("if x: pass\n", removing("if x: a\n", "a"));
    }

    @Test
    void removingFirstStatementKeepsIndentationAndComments() throws Exception {
        assertEquals(
                "def f():\n    # note\n    b\n",
                removing("def f():\n    # note\n    a\n    b\n", "a"));
        assertEquals("# header\nb\n", removing("# header\na\nb\n", "a"));
    }

    @Test
    void semicolonsFollowRemovals() throws Exception {
        assertEquals("a\n", removing("a; b\n", "b"));
        assertEquals("b\n", removing("a; b\n", "a"));
        assertEquals("a; c\n", removing("a; b; c\n", "b"));
    }

    @Test
    void listSeparatorsFollowRemovals() throws Exception {
        LintContext ctx = contextOf("x = [1, 2]\n");
        Element last = find(ctx, Element.class, e -> isNumber(e, "2"));
        assertEquals(
                "x = [1]\n",
                apply(ctx, violation(ctx, last, Replacement.remove())).fixedSource());

        LintContext again = contextOf("x = [1, 2]\n");
        Element first = find(again, Element.class, e -> isNumber(e, "1"));
        assertEquals(
                "x = [2]\n",
                apply(again, violation(again, first, Replacement.remove())).fixedSource());
    }

    @Test
    void foreignNodeIsMarkedFailed() throws Exception {
        LintContext ctx = contextOf("a\n");
        CodeRange nowhere = new CodeRange(new CodePosition(1, 0), new CodePosition(1, 1));
        Violation stray =
                new Violation("TestRule", Name.of("a"), nowhere, "test", Replacement.remove());

        FixOutcome outcome = apply(ctx, stray);

        assertFalse(outcome.changed());
        assertTrue(stray.hasFailed());
        assertEquals("", outcome.unifiedDiff("example.py"));
    }

    @Test
    void removingARequiredChildFails() throws Exception {
        LintContext ctx = contextOf("f(x)\n");
        Name f = name(ctx, "f");
        FixException e =
                assertThrows(
                        FixException.class,
                        () -> apply(ctx, violation(ctx, f, Replacement.remove())));
        assertTrue(e.getMessage().contains("func"));
    }

    @Test
    void moduleCannotBeRemoved() throws Exception {
        LintContext ctx = contextOf("a\n");
        assertThrows(
                FixException.class,
                () -> apply(ctx, violation(ctx, ctx.module(), Replacement.remove())));
    }

    @Test
    void unifiedDiffShowsTheChange() throws Exception {
        LintContext ctx = contextOf("a = 1\ny = x\n");
        Name x = name(ctx, "x");
        String diff = apply(ctx, violation(ctx, x, rename(x, "z"))).unifiedDiff("example.py");
        assertTrue(diff.startsWith("--- example.py\n+++ example.py\n"), diff);
        assertTrue(diff.contains("\n-y = x\n"), diff);
        assertTrue(diff.contains("\n+y = z\n"), diff);
    }
}
