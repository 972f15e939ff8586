package software.amazon.ahocorasick;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;

import static software.amazon.ahocorasick.Automaton.NO_STATE;
import static software.amazon.ahocorasick.Automaton.ROOT_STATE;

/**
 * Completes a raw trie into an automaton by computing every non-root state's failure link and merging the output of
 * the failure state into the state's own output.
 */
class FailureLinkPropagator {

    private FailureLinkPropagator() { }

    /**
     * Walk the trie breadth-first. A state's failure link always points at a shallower state, and computing it needs
     * the failure chain of its parent, so visiting states by increasing depth means every state used as a failure
     * target already has its final link and output when it is read. Each state is dequeued exactly once.
     *
     * Order dependent: the root must already be total (see {@link TrieBuilder}), which is what makes the walk up the
     * failure chain terminate.
     *
     * @param states the trie produced by {@link TrieBuilder}; modified in place
     */
    static void propagate(final List<State> states) {
        final Queue<Integer> queue = new ArrayDeque<>();
        final State root = states.get(ROOT_STATE);

        // Depth one: a single byte has no proper non-empty suffix, so these fail to the root.
        root.forEachTransition((utf8byte, target) -> {
            if (target != ROOT_STATE) {
                states.get(target).setFail(ROOT_STATE);
                queue.add(target);
            }
        });

        while (!queue.isEmpty()) {
            final State current = states.get(queue.remove());

            current.forEachTransition((utf8byte, target) -> {
                int failState = current.getFail();
                int failTarget;
                while ((failTarget = states.get(failState).getTransition(utf8byte)) == NO_STATE) {
                    failState = states.get(failState).getFail();
                }

                final State next = states.get(target);
                next.setFail(failTarget);
                next.addOutputs(states.get(failTarget).getOutput());
                queue.add(target);
            });
        }
    }
}
