package software.amazon.ahocorasick;

import java.util.ArrayList;
import java.util.List;

import static software.amazon.ahocorasick.Automaton.NO_STATE;
import static software.amazon.ahocorasick.Automaton.ROOT_STATE;

/**
 * Builds the raw trie of an automaton: one path of states per pattern, starting at the root. States are appended to a
 * single list and refer to each other by their position in that list.
 */
class TrieBuilder {

    private TrieBuilder() { }

    /**
     * Insert every pattern into a fresh trie. The identifier of a pattern is its position in {@code patterns}; it ends
     * up in the output of the state at the end of the pattern's path. Identical patterns share that state, each
     * contributing its own identifier, and an empty pattern ends at the root.
     *
     * Once all patterns are in, every byte value the root has no explicit transition for is pointed back at the root,
     * so the root's transition function is total.
     *
     * @param patterns the encoded patterns, in identifier order
     * @param initialCapacity initial capacity of the state list
     * @return the states of the trie, root first
     */
    static List<State> build(final List<byte[]> patterns, final int initialCapacity) {
        final List<State> states = new ArrayList<>(initialCapacity);
        final State root = new State();
        states.add(root);
        root.setFail(ROOT_STATE);

        for (int patternId = 0; patternId < patterns.size(); patternId++) {
            int current = ROOT_STATE;
            for (byte utf8byte : patterns.get(patternId)) {
                final State state = states.get(current);
                final int next = state.getTransition(utf8byte);
                if (next != NO_STATE) {
                    current = next;
                } else {
                    current = addState(states);
                    state.putTransition(utf8byte, current);
                }
            }
            states.get(current).addOutput(patternId);
        }

        closeRoot(root);
        return states;
    }

    private static int addState(final List<State> states) {
        states.add(new State());
        return states.size() - 1;
    }

    private static void closeRoot(final State root) {
        for (int i = 0; i < 256; i++) {
            final byte utf8byte = (byte) i;
            if (!root.hasTransition(utf8byte)) {
                root.putTransition(utf8byte, ROOT_STATE);
            }
        }
    }
}
