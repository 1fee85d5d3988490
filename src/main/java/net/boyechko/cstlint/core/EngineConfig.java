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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Engine settings, read from YAML. Keys mirror the public fields:
 *
 * <pre>
 * test_paths: ["tests/**", "**&#47;test_*.py"]
 * disabled_rules: [NoStaticIfCondition]
 * autofix: false
 * </pre>
 */
public final class EngineConfig {
    private static final String DEFAULT_CONFIG_RESOURCE = "/cstlint-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    /** Glob patterns, relative to the working directory, of files that hold tests. */
    public List<String> test_paths;

    public Set<String> disabled_rules;

    public Boolean autofix;

    /** Matchers compiled from a snapshot of {@link #test_paths}. */
    private record CompiledGlobs(List<String> patterns, List<PathMatcher> matchers) {}

    private volatile CompiledGlobs testMatchers;

    public EngineConfig() {
        this.test_paths = new ArrayList<>();
        this.disabled_rules = new HashSet<>();
        this.autofix = Boolean.FALSE;
    }

    public List<String> getTestPaths() {
        return test_paths != null ? test_paths : List.of();
    }

    public Set<String> getDisabledRules() {
        return disabled_rules != null ? disabled_rules : Set.of();
    }

    public boolean isAutofix() {
        return Boolean.TRUE.equals(autofix);
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resourcePath path starting with "/" for an absolute resource path
     */
    public static EngineConfig fromResource(String resourcePath) {
        try (InputStream inputStream = EngineConfig.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            return load(inputStream, resourcePath);
        } catch (Exception e) {
            logger.error(
                    "Failed to load configuration from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new RuntimeException(
                    "Failed to load configuration from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /** Load configuration from a YAML file. */
    public static EngineConfig fromPath(Path path) throws IOException {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return load(inputStream, path.toString());
        } catch (YAMLException e) {
            throw new IllegalArgumentException(
                    "Invalid configuration in " + path + ": " + e.getMessage(), e);
        }
    }

    /** Load the bundled defaults. */
    public static EngineConfig loadDefault() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    private static EngineConfig load(InputStream in, String origin) {
        Yaml yaml = new Yaml(new Constructor(EngineConfig.class, new LoaderOptions()));
        EngineConfig config = yaml.load(in);
        if (config == null) {
            logger.debug("Configuration {} is empty, using built-in values", origin);
            config = new EngineConfig();
        }
        logger.debug(
                "Loaded configuration from {}: {} test path patterns, {} disabled rules",
                origin,
                config.getTestPaths().size(),
                config.getDisabledRules().size());

        List<String> warnings = config.validateConsistency();
        if (!warnings.isEmpty()) {
            logger.warn(
                    "Configuration loaded from {} has {} consistency warnings:",
                    origin,
                    warnings.size());
            for (String warning : warnings) {
                logger.warn("  - {}", warning);
            }
        }
        return config;
    }

    /** Returns warnings about blank, duplicate or malformed entries; empty when consistent. */
    public List<String> validateConsistency() {
        List<String> warnings = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        FileSystem fs = FileSystems.getDefault();
        for (String pattern : getTestPaths()) {
            if (pattern == null || pattern.isBlank()) {
                warnings.add("test_paths contains a blank pattern");
                continue;
            }
            if (!seen.add(pattern)) {
                warnings.add("test_paths lists '" + pattern + "' more than once");
            }
            try {
                fs.getPathMatcher("glob:" + pattern);
            } catch (IllegalArgumentException e) {
                warnings.add("test_paths pattern '" + pattern + "' is invalid: " + e.getMessage());
            }
        }
        for (String rule : getDisabledRules()) {
            if (rule == null || rule.isBlank()) {
                warnings.add("disabled_rules contains a blank rule name");
            }
        }
        return warnings;
    }

    /** True when {@code path} matches one of the test path patterns. */
    public boolean isTestPath(Path path) {
        Path normalized = path.normalize();
        for (PathMatcher matcher : testMatchers()) {
            if (matcher.matches(normalized)) {
                return true;
            }
        }
        return false;
    }

    /** Recompiled whenever {@code test_paths} no longer equals the compiled snapshot. */
    private List<PathMatcher> testMatchers() {
        List<String> patterns = getTestPaths();
        CompiledGlobs compiled = testMatchers;
        if (compiled != null && compiled.patterns().equals(patterns)) {
            return compiled.matchers();
        }
        FileSystem fs = FileSystems.getDefault();
        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            try {
                matchers.add(fs.getPathMatcher("glob:" + pattern));
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring invalid test path pattern '{}'", pattern);
            }
        }
        compiled =
                new CompiledGlobs(
                        Collections.unmodifiableList(new ArrayList<>(patterns)),
                        List.copyOf(matchers));
        testMatchers = compiled;
        return compiled.matchers();
    }
}
