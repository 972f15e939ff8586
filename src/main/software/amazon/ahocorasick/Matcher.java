package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

import java.util.List;

import static software.amazon.ahocorasick.Automaton.NO_STATE;
import static software.amazon.ahocorasick.Automaton.ROOT_STATE;

/**
 * Runs text through a completed automaton.
 */
class Matcher {

    private Matcher() { }

    /**
     * Scan the text from the root, one byte at a time, and stop at the first state entered whose output is not empty.
     * Only that output is reported: every pattern ending at that position, but nothing that completes later in the
     * text.
     *
     * @param states the states of a completed automaton
     * @param text the bytes to scan
     * @return the pattern identifiers recognized at the first match position, or the empty set if nothing matched.
     * Never null.
     */
    static IntSet firstMatch(final List<State> states, final byte[] text) {
        int current = ROOT_STATE;
        for (byte utf8byte : text) {
            int next;
            // terminates at the latest at the root, which has a transition for every byte
            while ((next = states.get(current).getTransition(utf8byte)) == NO_STATE) {
                current = states.get(current).getFail();
            }
            current = next;

            final State state = states.get(current);
            if (state.hasOutput()) {
                return IntSets.unmodifiable(new IntLinkedOpenHashSet(state.getOutput()));
            }
        }
        return IntSets.EMPTY_SET;
    }
}
