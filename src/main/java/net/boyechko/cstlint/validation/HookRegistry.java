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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;
import net.boyechko.cstlint.tree.Node;
import net.boyechko.cstlint.tree.NodeShape;

/**
 * Collects the callbacks one rule wants for particular node kinds and slots. Kinds must be
 * concrete node records and slots must be child slots of that kind.
 */
public final class HookRegistry {

    public enum Phase {
        ENTER,
        LEAVE,
        ENTER_SLOT,
        LEAVE_SLOT
    }

    /** One registered callback; {@code slot} is null for node-level hooks. */
    public record Hook(
            Phase phase, Class<? extends Node> kind, String slot, Consumer<Node> action) {

        public String describe() {
            String base =
                    phase.name().toLowerCase(Locale.ROOT).replace('_', ' ')
                            + " "
                            + kind.getSimpleName();
            return slot != null ? base + "." + slot : base;
        }
    }

    private final List<Hook> hooks = new ArrayList<>();

    public <T extends Node> HookRegistry onEnter(Class<T> kind, Consumer<? super T> action) {
        return add(Phase.ENTER, kind, null, action);
    }

    public <T extends Node> HookRegistry onLeave(Class<T> kind, Consumer<? super T> action) {
        return add(Phase.LEAVE, kind, null, action);
    }

    public <T extends Node> HookRegistry onEnterSlot(
            Class<T> kind, String slot, Consumer<? super T> action) {
        return add(Phase.ENTER_SLOT, kind, Objects.requireNonNull(slot, "slot"), action);
    }

    public <T extends Node> HookRegistry onLeaveSlot(
            Class<T> kind, String slot, Consumer<? super T> action) {
        return add(Phase.LEAVE_SLOT, kind, Objects.requireNonNull(slot, "slot"), action);
    }

    public List<Hook> hooks() {
        return Collections.unmodifiableList(hooks);
    }

    private <T extends Node> HookRegistry add(
            Phase phase, Class<T> kind, String slot, Consumer<? super T> action) {
        Objects.requireNonNull(action, "action");
        if (!kind.isRecord()) {
            throw new IllegalArgumentException(
                    kind.getSimpleName() + " is not a concrete node kind");
        }
        if (slot != null) {
            NodeShape.of(kind).slot(slot);
        }
        hooks.add(new Hook(phase, kind, slot, node -> action.accept(kind.cast(node))));
        return this;
    }
}
