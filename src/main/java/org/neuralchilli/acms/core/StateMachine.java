package org.neuralchilli.acms.core;

/**
 * Generic finite-state machine over a {@link TransitionTable}.
 * Holds the current state and refuses any move the table does not allow.
 *
 * @param <S> state type
 */
public final class StateMachine<S extends Enum<S>> {

    private final TransitionTable<S> table;
    private S state;

    public StateMachine(TransitionTable<S> table, S initialState) {
        if (table == null) {
            throw new IllegalArgumentException("Transition table cannot be null");
        }
        if (initialState == null) {
            throw new IllegalArgumentException("Initial state cannot be null");
        }
        this.table = table;
        this.state = initialState;
    }

    public S state() {
        return state;
    }

    public TransitionTable<S> table() {
        return table;
    }

    public boolean canTransition(S target) {
        return table.canTransition(state, target);
    }

    /**
     * Move to {@code target}.
     *
     * @return the new state
     * @throws IllegalTransitionException if the table forbids the move; the state is unchanged
     */
    public S transition(S target) {
        state = table.transition(state, target);
        return state;
    }

    public boolean isTerminal() {
        return table.allowedFrom(state).isEmpty();
    }

    @Override
    public String toString() {
        return "StateMachine[state=" + state + ']';
    }
}
