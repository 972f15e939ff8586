package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.ints.Int2IntAVLTreeMap;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

import static software.amazon.ahocorasick.Automaton.NO_STATE;

/**
 * Represents a state in the automaton. A state maps byte values to the indices of other states in the automaton's
 * state list, carries the identifiers of the patterns recognized when the state is entered, and links to its failure
 * state. States are only mutated while the automaton is being built.
 */
class State {

    /*
     * Keyed by the unsigned byte value (0-255). The AVL tree keeps keys in ascending order so that the breadth-first
     * propagation visits children in a deterministic order. Missing keys return NO_STATE.
     */
    private final Int2IntAVLTreeMap transitions = new Int2IntAVLTreeMap();

    private final IntLinkedOpenHashSet output = new IntLinkedOpenHashSet();

    private int fail = NO_STATE;

    State() {
        transitions.defaultReturnValue(NO_STATE);
    }

    /**
     * Returns the index of the state to which the given byte value leads, or {@link Automaton#NO_STATE} if this state
     * has no explicit transition for it.
     *
     * @param utf8byte the byte value
     * @return the target state index, or {@link Automaton#NO_STATE}
     */
    int getTransition(byte utf8byte) {
        return transitions.get(utf8byte & 0xFF);
    }

    boolean hasTransition(byte utf8byte) {
        return transitions.containsKey(utf8byte & 0xFF);
    }

    /**
     * Associates the given byte value with the given state index, replacing any previous target.
     *
     * @param utf8byte the byte value
     * @param target   index of the target state, never {@link Automaton#NO_STATE}
     */
    void putTransition(byte utf8byte, int target) {
        if (target < 0) {
            throw new IllegalArgumentException("Transition target must be a valid state index, got " + target);
        }
        transitions.put(utf8byte & 0xFF, target);
    }

    /**
     * Hands every explicit transition to the given consumer, in ascending byte order.
     */
    void forEachTransition(TransitionConsumer consumer) {
        for (Int2IntMap.Entry entry : transitions.int2IntEntrySet()) {
            consumer.accept((byte) entry.getIntKey(), entry.getIntValue());
        }
    }

    int numberOfTransitions() {
        return transitions.size();
    }

    void addOutput(int patternId) {
        output.add(patternId);
    }

    void addOutputs(IntCollection patternIds) {
        output.addAll(patternIds);
    }

    /**
     * The live output set of this state. Callers outside of construction must copy it before handing it out.
     */
    IntSet getOutput() {
        return output;
    }

    boolean hasOutput() {
        return !output.isEmpty();
    }

    int getFail() {
        return fail;
    }

    /**
     * Sets the failure link. A failure link is assigned exactly once while the automaton is built.
     *
     * @param fail index of the failure state
     */
    void setFail(int fail) {
        if (this.fail != NO_STATE) {
            throw new IllegalStateException("Failure link already set to " + this.fail);
        }
        if (fail < 0) {
            throw new IllegalArgumentException("Failure link must be a valid state index, got " + fail);
        }
        this.fail = fail;
    }

    @FunctionalInterface
    interface TransitionConsumer {
        void accept(byte utf8byte, int target);
    }

    @Override
    public String toString() {
        return "State{" +
                "out=" + output +
                ", fail=" + fail +
                ", transitions=" + transitions.size() +
                '}';
    }
}
