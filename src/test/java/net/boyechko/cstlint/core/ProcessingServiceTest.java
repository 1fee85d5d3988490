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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import net.boyechko.cstlint.fixes.ConflictingFixException;
import net.boyechko.cstlint.fixes.FixException;
import net.boyechko.cstlint.fixes.FixOutcome;
import net.boyechko.cstlint.syntax.SourceException;
import net.boyechko.cstlint.tree.Name;
import net.boyechko.cstlint.validation.FileContext;
import net.boyechko.cstlint.validation.HookRegistry;
import net.boyechko.cstlint.validation.LintRule;
import net.boyechko.cstlint.validation.RuleFault;
import net.boyechko.cstlint.violation.Replacement;
import net.boyechko.cstlint.violation.Violation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcessingServiceTest {

    /** Renames every {@code x}. */
    private static class RenameX extends LintRule {
        private final String target;

        RenameX(String target) {
            this.target = target;
        }

        @Override
        public String name() {
            return "RenameXTo" + target.toUpperCase();
        }

        @Override
        public String description() {
            return "Renames x to " + target;
        }

        @Override
        public void registerHooks(HookRegistry hooks) {
            hooks.onEnter(
                    Name.class,
                    n -> {
                        if (n.id().equals("x")) {
                            report(
                                    n,
                                    "x should be " + target,
                                    Replacement.with(new Name(n.value().withText(target))));
                        }
                    });
        }
    }

    private static class TestFilesOnly extends RenameX {
        TestFilesOnly() {
            super("y");
        }

        @Override
        public boolean shouldSkipFile(FileContext file) {
            return !file.testFile();
        }
    }

    /** Records listener calls as short strings. */
    private static class RecordingListener implements ProcessingListener {
        final List<String> events = new ArrayList<>();

        @Override
        public void onFileStart(FileContext file) {
            events.add("start " + file);
        }

        @Override
        public void onSkipped(FileContext file) {
            events.add("skipped");
        }

        @Override
        public void onUnparseable(FileContext file, SourceException error) {
            events.add("unparseable " + error.position());
        }

        @Override
        public void onRuleFault(FileContext file, RuleFault fault) {
            events.add("fault " + fault.rule());
        }

        @Override
        public void onViolation(FileContext file, Violation violation) {
            events.add("violation " + violation.rule());
        }

        @Override
        public void onFixApplied(FileContext file, FixOutcome outcome) {
            events.add("fixed " + outcome.applied().size());
        }

        @Override
        public void onFixError(FileContext file, FixException error) {
            events.add("fix error");
        }

        @Override
        public void onSummary(ProcessingResult result) {
            events.add("summary " + result.outcome());
        }
    }

    private static ProcessingService service(boolean autofix) {
        return ProcessingService.builder()
                .withConfig(EngineConfig.loadDefault())
                .withAutofix(autofix)
                .build();
    }

    @Test
    void autofixRewritesSource() {
        ProcessingResult result =
                service(true).process(SourceFile.of("a.py", "class C(object):\n    pass\n"));

        assertEquals(ProcessingResult.Outcome.CHECKED, result.outcome());
        assertEquals(1, result.totalViolations());
        assertEquals(1, result.totalResolved());
        assertEquals(0, result.totalRemaining());
        assertTrue(result.changed());
        assertEquals("class C:\n    pass\n", result.fixedSource());
    }

    @Test
    void withoutAutofixSourceIsUntouched() {
        String source = "if x == None:\n    pass\n";
        ProcessingResult result = service(false).process(SourceFile.of("a.py", source));
        assertEquals(1, result.totalViolations());
        assertEquals(1, result.totalRemaining());
        assertNull(result.fix());
        assertEquals(source, result.fixedSource());
    }

    @Test
    void violationsAreSortedByPosition() {
        ProcessingResult result =
                service(false)
                        .process(
                                SourceFile.of(
                                        "a.py",
                                        "if True:\n    y = x is 1\nclass C(object):\n    pass\n"));
        List<Integer> lines =
                result.violations().stream()
                        .map(v -> v.position().line())
                        .collect(Collectors.toList());
        assertEquals(List.of(1, 2, 3), lines);
    }

    @Test
    void listenerSeesTheWholeRun() {
        RecordingListener listener = new RecordingListener();
        ProcessingService service =
                ProcessingService.builder()
                        .withRules(List.of(() -> new RenameX("y")))
                        .withListener(listener)
                        .withAutofix(true)
                        .build();

        service.process(SourceFile.of("pkg/a.py", "x\n"));

        assertEquals(
                List.of(
                        "start pkg/a.py",
                        "violation RenameXToY",
                        "fixed 1",
                        "summary CHECKED"),
                listener.events);
    }

    @Test
    void conflictingFixesLeaveFileUnchanged() {
        RecordingListener listener = new RecordingListener();
        ProcessingService service =
                ProcessingService.builder()
                        .withRules(List.of(() -> new RenameX("y"), () -> new RenameX("z")))
                        .withListener(listener)
                        .withAutofix(true)
                        .build();

        ProcessingResult result = service.process(SourceFile.of("a.py", "a = x\n"));

        assertFalse(result.changed());
        assertEquals("a = x\n", result.fixedSource());
        assertInstanceOf(ConflictingFixException.class, result.fixError());
        assertEquals(2, result.violations().getFailed().size());
        assertEquals(2, result.totalRemaining());
        assertTrue(listener.events.contains("fix error"));
    }

    @Test
    void fileSkippedByEveryRuleIsNotParsed() {
        RecordingListener listener = new RecordingListener();
        ProcessingService service =
                ProcessingService.builder()
                        .withRules(List.of(TestFilesOnly::new))
                        .withListener(listener)
                        .build();

        ProcessingResult skipped = service.process(SourceFile.of("pkg/a.py", "x = (\n"));
        assertEquals(ProcessingResult.Outcome.SKIPPED, skipped.outcome());
        assertEquals(0, skipped.totalViolations());
        assertEquals(List.of("start pkg/a.py", "skipped", "summary SKIPPED"), listener.events);

        ProcessingResult checked = service.process(SourceFile.of("tests/test_a.py", "x\n"));
        assertEquals(ProcessingResult.Outcome.CHECKED, checked.outcome());
        assertEquals(1, checked.totalViolations());
    }

    @Test
    void unparseableFileIsReported() {
        RecordingListener listener = new RecordingListener();
        ProcessingService service =
                ProcessingService.builder().withListener(listener).withAutofix(true).build();

        ProcessingResult result = service.process(SourceFile.of("a.py", "x = class\n"));

        assertEquals(ProcessingResult.Outcome.UNPARSEABLE, result.outcome());
        assertNotNull(result.parseError());
        assertEquals(1, result.parseError().position().line());
        assertFalse(result.changed());
        assertTrue(listener.events.contains("unparseable 1:4"), listener.events.toString());
    }

    @Test
    void faultyRuleDoesNotStopOthers() {
        Supplier<LintRule> broken =
                () ->
                        new LintRule() {
                            @Override
                            public String name() {
                                return "Broken";
                            }

                            @Override
                            public String description() {
                                return "always fails";
                            }

                            @Override
                            public void registerHooks(HookRegistry hooks) {
                                hooks.onEnter(
                                        Name.class,
                                        n -> {
                                            throw new IllegalStateException("broken");
                                        });
                            }
                        };
        ProcessingService service =
                ProcessingService.builder()
                        .withRules(List.of(broken, () -> new RenameX("y")))
                        .withAutofix(true)
                        .build();

        ProcessingResult result = service.process(SourceFile.of("a.py", "x\n"));

        assertEquals(1, result.faults().size());
        assertEquals("Broken", result.faults().get(0).rule());
        assertEquals("y\n", result.fixedSource());
    }

    @Test
    void processFileWritesFixes(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("a.py");
        Files.writeString(file, "if y == None:\n    pass\n", StandardCharsets.UTF_8);

        ProcessingResult result = service(true).processFile(file);

        assertTrue(result.changed());
        assertEquals("if y is None:\n    pass\n", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void processFileLeavesFileAloneWithoutAutofix(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("a.py");
        Files.writeString(file, "if y == None:\n    pass\n", StandardCharsets.UTF_8);
        service(false).processFile(file);
        assertEquals("if y == None:\n    pass\n", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void ruleSelection() {
        assertEquals(5, service(false).getRuleSuppliers().size());

        ProcessingService only =
                ProcessingService.builder()
                        .includeOnlyRules(Set.of("NoStaticIfCondition"))
                        .build();
        assertEquals(1, only.getRuleSuppliers().size());
        assertEquals("NoStaticIfCondition", only.getRuleSuppliers().get(0).get().name());

        ProcessingService skipping =
                ProcessingService.builder()
                        .skipRules(Set.of("NoStaticIfCondition", "NoSuchRule"))
                        .build();
        assertEquals(4, skipping.getRuleSuppliers().size());

        EngineConfig config = new EngineConfig();
        config.disabled_rules = Set.of("NoRedundantLambda");
        ProcessingService disabled = ProcessingService.builder().withConfig(config).build();
        assertEquals(4, disabled.getRuleSuppliers().size());
        assertFalse(disabled.isAutofix());
    }

    @Test
    void parallelRunsMatchSequentialOnes() {
        ProcessingService service = service(true);
        List<SourceFile> files =
                IntStream.range(0, 40)
                        .mapToObj(
                                i ->
                                        SourceFile.of(
                                                "f" + i + ".py",
                                                "class C"
                                                        + i
                                                        + "(object):\n    if v == None: pass\n"
                                                        + "xs = map(lambda a: g(a), ys)\n"))
                        .collect(Collectors.toList());

        List<String> sequential =
                files.stream()
                        .map(f -> service.process(f).fixedSource())
                        .collect(Collectors.toList());
        List<String> parallel =
                files.parallelStream()
                        .map(f -> service.process(f).fixedSource())
                        .collect(Collectors.toList());

        assertEquals(sequential, parallel);
        assertEquals(
                "class C0:\n    if v is None: pass\nxs = map(g, ys)\n", sequential.get(0));
    }
}
