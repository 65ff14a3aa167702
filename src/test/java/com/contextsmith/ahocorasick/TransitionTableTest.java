package com.contextsmith.ahocorasick;

import org.junit.Test;

import static com.contextsmith.ahocorasick.TransitionTable.NO_STATE;
import static com.contextsmith.ahocorasick.TransitionTable.ROOT;
import static org.junit.Assert.*;

public class TransitionTableTest {

    @Test
    public void testGetOrCreateAllocatesIncreasingIds() {
        TransitionTable<Character> table = new TransitionTable<>();
        assertEquals(1, table.getStateCount());

        int h = table.getOrCreate(ROOT, 'h');
        int he = table.getOrCreate(h, 'e');
        int s = table.getOrCreate(ROOT, 's');
        assertEquals(1, h);
        assertEquals(2, he);
        assertEquals(3, s);
        assertEquals(h, table.getOrCreate(ROOT, 'h'));
        assertEquals(4, table.getStateCount());
        assertEquals(3, table.getTransitionCount());

        assertEquals(0, table.getDepth(ROOT));
        assertEquals(1, table.getDepth(h));
        assertEquals(2, table.getDepth(he));
    }

    @Test
    public void testMissingTransitions() {
        TransitionTable<Character> table = new TransitionTable<>();
        int a = table.getOrCreate(ROOT, 'a');
        assertEquals(NO_STATE, table.get(ROOT, 'b'));
        assertEquals(NO_STATE, table.get(a, 'a'));
        assertFalse(table.contains(a, 'a'));
        assertTrue(table.contains(ROOT, 'a'));
    }

    @Test
    public void testPutCountsNewTransitionsOnly() {
        TransitionTable<Character> table = new TransitionTable<>();
        int a = table.getOrCreate(ROOT, 'a');
        table.put(a, 'a', a);
        table.put(a, 'a', a);
        assertEquals(2, table.getTransitionCount());
        assertEquals(a, table.get(a, 'a'));
        assertEquals(2, table.getStateCount());
    }

    @Test
    public void testDeepPattern() {
        TransitionTable<Integer> table = new TransitionTable<>();
        int state = ROOT;
        for (int i = 0; i < 1000; ++i) {
            state = table.getOrCreate(state, i);
        }
        assertEquals(1000, state);
        assertEquals(1000, table.getDepth(state));
    }
}
