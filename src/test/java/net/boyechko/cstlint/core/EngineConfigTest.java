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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EngineConfigTest {

    @Test
    void defaultsLoadFromClasspath() {
        EngineConfig config = EngineConfig.loadDefault();
        assertFalse(config.isAutofix());
        assertTrue(config.getDisabledRules().isEmpty());
        assertFalse(config.getTestPaths().isEmpty());
        assertTrue(config.validateConsistency().isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
        "tests/test_a.py, true",
        "tests/helpers/util.py, true",
        "pkg/tests/conftest.py, true",
        "test_a.py, true",
        "pkg/test_a.py, true",
        "pkg/a_test.py, true",
        "pkg/a.py, false",
        "a.py, false",
        "pkg/testing.py, false"
    })
    void recognizesTestFiles(String path, boolean expected) {
        assertEquals(expected, EngineConfig.loadDefault().isTestPath(Path.of(path)));
    }

    @Test
    void readsYamlFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("cstlint.yaml");
        Files.writeString(
                file,
                "test_paths:\n  - \"qa/**\"\ndisabled_rules: [NoStaticIfCondition]\n"
                        + "autofix: true\n");

        EngineConfig config = EngineConfig.fromPath(file);

        assertTrue(config.isAutofix());
        assertEquals(Set.of("NoStaticIfCondition"), config.getDisabledRules());
        assertEquals(List.of("qa/**"), config.getTestPaths());
        assertTrue(config.isTestPath(Path.of("qa/a.py")));
        assertFalse(config.isTestPath(Path.of("tests/a.py")));
    }

    @Test
    void emptyFileFallsBackToBuiltInValues(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("empty.yaml");
        Files.writeString(file, "");
        EngineConfig config = EngineConfig.fromPath(file);
        assertFalse(config.isAutofix());
        assertTrue(config.getTestPaths().isEmpty());
        assertFalse(config.isTestPath(Path.of("tests/a.py")));
    }

    @Test
    void unknownKeyIsRejected(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("bad.yaml");
        Files.writeString(file, "autofx: true\n");
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromPath(file));
    }

    @Test
    void missingResourceFails() {
        assertThrows(RuntimeException.class, () -> EngineConfig.fromResource("/nope.yaml"));
    }

    @Test
    void testPathsFollowLaterChanges() {
        EngineConfig config = EngineConfig.loadDefault();
        assertTrue(config.isTestPath(Path.of("tests/test_a.py")));

        config.test_paths = List.of("qa/**");
        assertFalse(config.isTestPath(Path.of("tests/test_a.py")));
        assertTrue(config.isTestPath(Path.of("qa/a.py")));

        EngineConfig mutable = new EngineConfig();
        assertFalse(mutable.isTestPath(Path.of("qa/a.py")));
        mutable.test_paths.add("qa/**");
        assertTrue(mutable.isTestPath(Path.of("qa/a.py")));
    }

    @Test
    void consistencyWarnings() {
        EngineConfig config = new EngineConfig();
        config.test_paths = List.of("tests/**", "tests/**", " ");
        config.disabled_rules = Set.of("");
        List<String> warnings = config.validateConsistency();
        assertEquals(3, warnings.size(), warnings.toString());
        assertTrue(warnings.contains("test_paths lists 'tests/**' more than once"));
    }
}
