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

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.cstlint.syntax.Token;

/**
 * Per-kind metadata derived once from a node record: its components in source order, which of
 * them are child slots, and the canonical constructor used for copies.
 *
 * <p>Shapes are cached per class and immutable, so they can be shared between threads.
 */
public final class NodeShape {

    private static final ClassValue<NodeShape> SHAPES =
            new ClassValue<>() {
                @Override
                protected NodeShape computeValue(Class<?> type) {
                    return new NodeShape(type);
                }
            };

    public enum ComponentKind {
        NODE,
        NODE_LIST,
        TOKEN,
        TOKEN_LIST,
        MAYBE_TOKEN;

        public boolean isSlot() {
            return this == NODE || this == NODE_LIST;
        }
    }

    /**
     * One record component.
     *
     * @param valueType declared type, or the element type for list components
     */
    public record Component(
            String name,
            int index,
            ComponentKind kind,
            Class<?> valueType,
            boolean optional,
            Auto auto,
            Method accessor) {

        public boolean isSlot() {
            return kind.isSlot();
        }
    }

    private final Class<?> type;
    private final List<Component> components;
    private final List<Component> slots;
    private final Map<String, Component> byName;
    private final Constructor<?> constructor;

    private NodeShape(Class<?> type) {
        if (!type.isRecord() || !Node.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException(type.getName() + " is not a node record");
        }
        this.type = type;

        RecordComponent[] recordComponents = type.getRecordComponents();
        Class<?>[] parameterTypes = new Class<?>[recordComponents.length];
        List<Component> all = new ArrayList<>();
        Map<String, Component> names = new LinkedHashMap<>();
        for (int i = 0; i < recordComponents.length; i++) {
            parameterTypes[i] = recordComponents[i].getType();
            Component c = describe(recordComponents[i], i);
            all.add(c);
            names.put(c.name(), c);
        }
        this.components = List.copyOf(all);
        this.slots = all.stream().filter(Component::isSlot).toList();
        this.byName = Collections.unmodifiableMap(names);

        try {
            this.constructor = type.getDeclaredConstructor(parameterTypes);
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("No canonical constructor on " + type.getName(), e);
        }
    }

    public static NodeShape of(Class<?> type) {
        return SHAPES.get(type);
    }

    public Class<?> type() {
        return type;
    }

    public String kindName() {
        return type.getSimpleName();
    }

    /** All components in source order. */
    public List<Component> components() {
        return components;
    }

    /** Child slots (node and node-list components) in source order. */
    public List<Component> slots() {
        return slots;
    }

    public boolean hasComponent(String name) {
        return byName.containsKey(name);
    }

    public Component component(String name) {
        Component c = byName.get(name);
        if (c == null) {
            throw new IllegalArgumentException(
                    kindName() + " has no component '" + name + "'; known: " + byName.keySet());
        }
        return c;
    }

    public Component slot(String name) {
        Component c = component(name);
        if (!c.isSlot()) {
            throw new IllegalArgumentException(
                    "'" + name + "' of " + kindName() + " is a " + c.kind() + ", not a child slot");
        }
        return c;
    }

    public Object get(Node node, Component c) {
        try {
            return c.accessor().invoke(node);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException(
                    "Cannot read " + c.name() + " of " + kindName() + ": " + e.getMessage(), e);
        }
    }

    public Object get(Node node, String name) {
        return get(node, component(name));
    }

    /** Direct children in source order; absent optional children are skipped. */
    public List<Node> children(Node node) {
        List<Node> out = new ArrayList<>();
        for (Component c : slots) {
            Object value = get(node, c);
            if (value instanceof Node child) {
                out.add(child);
            } else if (value instanceof List<?> items) {
                for (Object item : items) {
                    out.add((Node) item);
                }
            }
        }
        return out;
    }

    /**
     * Returns a copy of {@code node} with the named components replaced. Components not named
     * are shared with the original.
     */
    public Node copyWith(Node node, Map<String, ?> changes) {
        for (String name : changes.keySet()) {
            component(name);
        }
        Object[] args = new Object[components.size()];
        for (Component c : components) {
            args[c.index()] =
                    changes.containsKey(c.name())
                            ? checked(c, changes.get(c.name()))
                            : get(node, c);
        }
        return construct(args);
    }

    private Node construct(Object[] args) {
        try {
            return (Node) constructor.newInstance(args);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Cannot construct " + kindName(), e.getCause());
        } catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException("Cannot construct " + kindName(), e);
        }
    }

    private Object checked(Component c, Object value) {
        if (value == null) {
            if (c.kind() == ComponentKind.NODE && c.optional()) {
                return null;
            }
            throw new IllegalArgumentException(
                    "'" + c.name() + "' of " + kindName() + " cannot be null");
        }
        switch (c.kind()) {
            case NODE_LIST, TOKEN_LIST -> {
                if (!(value instanceof List<?> items)) {
                    throw wrongType(c, value);
                }
                for (Object item : items) {
                    if (!c.valueType().isInstance(item)) {
                        throw wrongType(c, item);
                    }
                }
                return List.copyOf(items);
            }
            default -> {
                if (!c.valueType().isInstance(value)) {
                    throw wrongType(c, value);
                }
                return value;
            }
        }
    }

    private IllegalArgumentException wrongType(Component c, Object value) {
        return new IllegalArgumentException(
                "'"
                        + c.name()
                        + "' of "
                        + kindName()
                        + " expects "
                        + c.valueType().getSimpleName()
                        + " but got "
                        + value.getClass().getSimpleName());
    }

    private static Component describe(RecordComponent rc, int index) {
        Class<?> raw = rc.getType();
        Class<?> valueType = raw;
        ComponentKind kind;
        if (Token.class.equals(raw)) {
            kind = ComponentKind.TOKEN;
        } else if (MaybeToken.class.equals(raw)) {
            kind = ComponentKind.MAYBE_TOKEN;
        } else if (Node.class.isAssignableFrom(raw)) {
            kind = ComponentKind.NODE;
        } else if (List.class.equals(raw)) {
            valueType = elementType(rc);
            if (Token.class.equals(valueType)) {
                kind = ComponentKind.TOKEN_LIST;
            } else if (Node.class.isAssignableFrom(valueType)) {
                kind = ComponentKind.NODE_LIST;
            } else {
                throw new IllegalArgumentException(
                        "Unsupported list element " + valueType + " in " + rc.getName());
            }
        } else {
            throw new IllegalArgumentException(
                    "Unsupported component type " + raw + " in " + rc.getName());
        }
        return new Component(
                rc.getName(),
                index,
                kind,
                valueType,
                rc.isAnnotationPresent(OptionalChild.class),
                rc.getAnnotation(Auto.class),
                rc.getAccessor());
    }

    private static Class<?> elementType(RecordComponent rc) {
        Type generic = rc.getGenericType();
        if (generic instanceof ParameterizedType p
                && p.getActualTypeArguments()[0] instanceof Class<?> element) {
            return element;
        }
        throw new IllegalArgumentException("Cannot determine element type of " + rc.getName());
    }
}
