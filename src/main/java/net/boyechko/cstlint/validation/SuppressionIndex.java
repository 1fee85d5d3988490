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

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import net.boyechko.cstlint.syntax.Comment;
import net.boyechko.cstlint.violation.Violation;

/**
 * Suppression comments of one file: {@code # lint-ignore} or {@code # lint-fixme}, optionally
 * followed by {@code : RuleA, RuleB}. A directive covers the line it is on and, when written on
 * its own line, the code line below the run of comment lines it belongs to.
 */
public final class SuppressionIndex {
    private static final Pattern DIRECTIVE =
            Pattern.compile("#\\s*lint-(?:ignore|fixme)\\b(?:\\s*:\\s*([\\w\\s,]*))?");

    /** Rule names per line; an empty set stands for every rule. */
    private final Map<Integer, Set<String>> directives = new HashMap<>();

    private final Set<Integer> commentOnlyLines = new HashSet<>();

    public SuppressionIndex(List<Comment> comments) {
        for (Comment c : comments) {
            if (c.ownLine()) {
                commentOnlyLines.add(c.line());
            }
            Matcher m = DIRECTIVE.matcher(c.text());
            if (m.find()) {
                directives.put(c.line(), parseRules(m.group(1)));
            }
        }
    }

    public boolean isEmpty() {
        return directives.isEmpty();
    }

    public boolean isSuppressed(Violation v) {
        int line = v.position().line();
        if (covers(line, v.rule())) {
            return true;
        }
        for (int above = line - 1; commentOnlyLines.contains(above); above--) {
            if (covers(above, v.rule())) {
                return true;
            }
        }
        return false;
    }

    private boolean covers(int line, String rule) {
        Set<String> rules = directives.get(line);
        return rules != null && (rules.isEmpty() || rules.contains(rule));
    }

    private static Set<String> parseRules(String list) {
        if (list == null || list.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(list.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}
