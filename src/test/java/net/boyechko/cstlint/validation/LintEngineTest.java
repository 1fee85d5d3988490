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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import net.boyechko.cstlint.CstTestBase;
import org.junit.jupiter.api.Test;

class LintEngineTest extends CstTestBase {

    /** Stays away from test files. */
    private static final class SkipsTests extends FlagName {
        SkipsTests() {
            super("x");
        }

        @Override
        public boolean shouldSkipFile(FileContext file) {
            return file.testFile();
        }
    }

    @Test
    void freshInstancesPerFile() {
        LintEngine engine = new LintEngine(List.of(() -> new FlagName("x")));
        LintRule first = engine.instantiateRules().get(0);
        LintRule second = engine.instantiateRules().get(0);
        assertNotSame(first, second);
    }

    @Test
    void nullSupplierResultIsRejected() {
        Supplier<LintRule> broken = () -> null;
        LintEngine engine = new LintEngine(List.of(broken));
        assertThrows(IllegalStateException.class, engine::instantiateRules);
    }

    @Test
    void skipPredicateFiltersRules() {
        LintEngine engine = new LintEngine(List.of(SkipsTests::new, () -> new FlagName("y")));
        List<RuleFault> faults = new ArrayList<>();

        List<LintRule> forTests =
                engine.rulesFor(new FileContext(Path.of("tests/test_a.py"), true), faults);
        assertEquals(1, forTests.size());
        assertInstanceOf(FlagName.class, forTests.get(0));
        assertFalse(forTests.get(0) instanceof SkipsTests);

        List<LintRule> forCode = engine.rulesFor(FileContext.of("pkg/a.py"), faults);
        assertEquals(2, forCode.size());
        assertTrue(faults.isEmpty());
    }

    @Test
    void throwingSkipPredicateIsAFault() {
        LintRule grumpy =
                new FlagName("x") {
                    @Override
                    public boolean shouldSkipFile(FileContext file) {
                        throw new UnsupportedOperationException("cannot decide");
                    }
                };
        LintEngine engine = new LintEngine(List.of(() -> grumpy));
        List<RuleFault> faults = new ArrayList<>();
        assertTrue(engine.rulesFor(FILE, faults).isEmpty());
        assertEquals(1, faults.size());
        assertEquals("shouldSkipFile", faults.get(0).hook());
        assertNull(faults.get(0).position());
    }

    @Test
    void lintReportsViolationsWithPositions() throws Exception {
        LintReport report = lint("a = x\nif x:\n    pass\n", () -> new FlagName("x"));
        assertEquals(2, report.violations().size());
        assertEquals(1, report.violations().get(0).position().line());
        assertEquals(4, report.violations().get(0).position().column());
        assertEquals(2, report.violations().get(1).position().line());
        assertEquals("FlagName", report.violations().get(0).rule());
        assertFalse(report.hasFaults());
    }

    @Test
    void rulesDoNotSeeEachOthersViolations() throws Exception {
        LintReport report =
                lint("x + y\n", () -> new FlagName("x"), () -> new FlagName("y"));
        assertEquals(
                List.of("found x", "found y"),
                report.violations().stream().map(v -> v.message()).toList());
    }
}
