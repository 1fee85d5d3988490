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
package net.boyechko.cstlint.matcher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.boyechko.cstlint.tree.Node;

/** Values bound by {@link Pattern.Capture} during one successful match. */
public final class Captures {
    private static final Captures EMPTY = new Captures(Map.of());

    private final Map<String, Object> values;

    private Captures(Map<String, Object> values) {
        this.values = values;
    }

    static Captures empty() {
        return EMPTY;
    }

    Captures plus(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return new Captures(Collections.unmodifiableMap(copy));
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("Nothing captured as '" + name + "'");
        }
        return values.get(name);
    }

    public <T> T get(String name, Class<T> type) {
        return type.cast(get(name));
    }

    public Node node(String name) {
        return get(name, Node.class);
    }

    public Set<String> names() {
        return values.keySet();
    }

    @Override
    public String toString() {
        return "Captures" + values.keySet();
    }
}
