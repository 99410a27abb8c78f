package org.neuralchilli.acms.core;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static table of allowed state transitions keyed by an enum.
 * Both queries are pure functions of the table.
 *
 * @param <S> state type
 */
public final class TransitionTable<S extends Enum<S>> {

    public static final String ALLOWED_TRANSITIONS_KEY = "allowed_transitions";

    private final Class<S> stateType;
    private final Map<S, Set<S>> allowed;

    private TransitionTable(Class<S> stateType, Map<S, Set<S>> allowed) {
        this.stateType = stateType;
        Map<S, Set<S>> copy = new EnumMap<>(stateType);
        for (S state : stateType.getEnumConstants()) {
            Set<S> targets = allowed.get(state);
            copy.put(state, targets == null || targets.isEmpty()
                    ? Collections.unmodifiableSet(EnumSet.noneOf(stateType))
                    : Collections.unmodifiableSet(EnumSet.copyOf(targets)));
        }
        this.allowed = Collections.unmodifiableMap(copy);
    }

    public static <S extends Enum<S>> Builder<S> builder(Class<S> stateType) {
        return new Builder<>(stateType);
    }

    /**
     * Build a table from a contract definition of the form
     * {@code STATE -> {allowed_transitions: [STATE, ...]}}.
     *
     * @throws IllegalArgumentException on unknown state names or malformed entries
     */
    public static <S extends Enum<S>> TransitionTable<S> fromDefinition(
            Class<S> stateType,
            Map<String, ?> definition
    ) {
        if (definition == null) {
            throw new IllegalArgumentException("State definition cannot be null");
        }

        Builder<S> builder = builder(stateType);
        for (Map.Entry<String, ?> entry : definition.entrySet()) {
            S from = parseState(stateType, entry.getKey());
            Object body = entry.getValue();
            if (body == null) {
                continue;
            }
            if (!(body instanceof Map<?, ?> stateBody)) {
                throw new IllegalArgumentException(
                        "State '" + entry.getKey() + "' must be a mapping, got: " + body.getClass().getSimpleName()
                );
            }
            Object targets = stateBody.get(ALLOWED_TRANSITIONS_KEY);
            if (targets == null) {
                continue;
            }
            if (!(targets instanceof Collection<?> targetList)) {
                throw new IllegalArgumentException(
                        "State '" + entry.getKey() + "' " + ALLOWED_TRANSITIONS_KEY + " must be a list"
                );
            }
            for (Object target : targetList) {
                builder.allow(from, parseState(stateType, String.valueOf(target)));
            }
        }
        return builder.build();
    }

    private static <S extends Enum<S>> S parseState(Class<S> stateType, String name) {
        try {
            return Enum.valueOf(stateType, name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown state '" + name + "' for " + stateType.getSimpleName(), e
            );
        }
    }

    /**
     * Check whether moving from {@code current} to {@code target} is allowed.
     */
    public boolean canTransition(S current, S target) {
        if (current == null || target == null) {
            return false;
        }
        return allowed.get(current).contains(target);
    }

    /**
     * Validate a move and return the new state.
     *
     * @throws IllegalTransitionException if the table forbids the move
     */
    public S transition(S current, S target) {
        if (!canTransition(current, target)) {
            throw new IllegalTransitionException(current, target);
        }
        return target;
    }

    public Set<S> allowedFrom(S state) {
        return allowed.get(state);
    }

    /**
     * States with no outgoing transitions.
     */
    public Set<S> terminalStates() {
        Set<S> terminal = EnumSet.noneOf(stateType);
        allowed.forEach((state, targets) -> {
            if (targets.isEmpty()) {
                terminal.add(state);
            }
        });
        return Collections.unmodifiableSet(terminal);
    }

    public Class<S> stateType() {
        return stateType;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof TransitionTable<?> that)) return false;
        return stateType.equals(that.stateType) && allowed.equals(that.allowed);
    }

    @Override
    public int hashCode() {
        return allowed.hashCode();
    }

    @Override
    public String toString() {
        return "TransitionTable[" + stateType.getSimpleName() + ": " + allowed + ']';
    }

    public static final class Builder<S extends Enum<S>> {
        private final Class<S> stateType;
        private final Map<S, Set<S>> allowed;

        private Builder(Class<S> stateType) {
            this.stateType = stateType;
            this.allowed = new EnumMap<>(stateType);
        }

        @SafeVarargs
        public final Builder<S> allow(S from, S... targets) {
            return allow(from, List.of(targets));
        }

        public Builder<S> allow(S from, Collection<S> targets) {
            Set<S> existing = allowed.computeIfAbsent(from, key -> EnumSet.noneOf(stateType));
            existing.addAll(targets);
            return this;
        }

        public TransitionTable<S> build() {
            return new TransitionTable<>(stateType, allowed);
        }
    }
}
