package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class StateTest {

    private State state;

    @Before
    public void setUp() {
        state = new State();
    }

    @Test
    public void getTransitionShouldReturnNoStateWhenThisStateHasNoTransitions() {
        assertEquals(Automaton.NO_STATE, state.getTransition((byte) 'a'));
        assertFalse(state.hasTransition((byte) 'a'));
        assertEquals(0, state.numberOfTransitions());
    }

    @Test
    public void getTransitionShouldReturnTargetPutForThatByte() {
        state.putTransition((byte) 'a', 3);

        assertEquals(3, state.getTransition((byte) 'a'));
        assertTrue(state.hasTransition((byte) 'a'));
        assertEquals(Automaton.NO_STATE, state.getTransition((byte) 'b'));
    }

    @Test
    public void putTransitionShouldReplacePreviousTarget() {
        state.putTransition((byte) 'a', 3);
        state.putTransition((byte) 'a', 4);

        assertEquals(4, state.getTransition((byte) 'a'));
        assertEquals(1, state.numberOfTransitions());
    }

    @Test
    public void putTransitionShouldAcceptTheRootAsTarget() {
        state.putTransition((byte) 'a', Automaton.ROOT_STATE);
        assertEquals(Automaton.ROOT_STATE, state.getTransition((byte) 'a'));
    }

    @Test(expected = IllegalArgumentException.class)
    public void putTransitionShouldRejectNoState() {
        state.putTransition((byte) 'a', Automaton.NO_STATE);
    }

    @Test
    public void highBytesShouldBeTreatedAsUnsigned() {
        state.putTransition((byte) 0xC3, 7);
        state.putTransition((byte) 0x7F, 8);

        assertEquals(7, state.getTransition((byte) 0xC3));
        assertEquals(8, state.getTransition((byte) 0x7F));
        assertEquals(Automaton.NO_STATE, state.getTransition((byte) 0x43));
    }

    @Test
    public void forEachTransitionShouldVisitBytesInAscendingUnsignedOrder() {
        state.putTransition((byte) 0xFF, 1);
        state.putTransition((byte) 'z', 2);
        state.putTransition((byte) 0x00, 3);
        state.putTransition((byte) 'a', 4);

        List<Integer> bytes = new ArrayList<>();
        List<Integer> targets = new ArrayList<>();
        state.forEachTransition((utf8byte, target) -> {
            bytes.add(utf8byte & 0xFF);
            targets.add(target);
        });

        assertEquals(Arrays.asList(0x00, (int) 'a', (int) 'z', 0xFF), bytes);
        assertEquals(Arrays.asList(3, 4, 2, 1), targets);
    }

    @Test
    public void outputShouldKeepInsertionOrderAndIgnoreDuplicates() {
        assertFalse(state.hasOutput());

        state.addOutput(5);
        state.addOutputs(IntArrayList.wrap(new int[] { 2, 5, 9 }));

        assertTrue(state.hasOutput());
        assertArrayEquals(new int[] { 5, 2, 9 }, state.getOutput().toIntArray());
    }

    @Test
    public void failShouldBeUnsetUntilAssigned() {
        assertEquals(Automaton.NO_STATE, state.getFail());
        state.setFail(2);
        assertEquals(2, state.getFail());
    }

    @Test
    public void setFailShouldOnlyBeAllowedOnce() {
        state.setFail(Automaton.ROOT_STATE);
        try {
            state.setFail(1);
            fail("expected IllegalStateException");
        } catch (IllegalStateException ex) {
            assertEquals(Automaton.ROOT_STATE, state.getFail());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void setFailShouldRejectNoState() {
        state.setFail(Automaton.NO_STATE);
    }
}
