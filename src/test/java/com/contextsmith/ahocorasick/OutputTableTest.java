package com.contextsmith.ahocorasick;

import org.junit.Test;

import static org.junit.Assert.*;

public class OutputTableTest {

    @Test
    public void testAddKeepsInsertionOrderWithoutDuplicates() {
        OutputTable table = new OutputTable();
        table.add(3, 7);
        assertArrayEquals(new int[] {7}, table.get(3));
        table.add(3, 7);
        table.add(3, 1);
        table.addAll(3, new int[] {1, 4, 7, 2});
        assertArrayEquals(new int[] {7, 1, 4, 2}, table.get(3));
    }

    @Test
    public void testUnknownStatesAreEmpty() {
        OutputTable table = new OutputTable();
        table.add(1, 0);
        assertEquals(0, table.get(0).length);
        assertEquals(0, table.get(2).length);
        assertEquals(0, table.get(1000).length);
    }

    @Test
    public void testGrowsPastInitialCapacity() {
        OutputTable table = new OutputTable();
        for (int state = 0; state < 100; ++state) {
            table.add(state, state * 2);
        }
        assertArrayEquals(new int[] {198}, table.get(99));
        assertArrayEquals(new int[] {0}, table.get(0));
    }

    @Test
    public void testFreeze() {
        OutputTable table = new OutputTable();
        table.add(1, 5);
        table.freeze();
        assertTrue(table.isFrozen());
        // Lookups return the same array once frozen.
        assertSame(table.get(1), table.get(1));
        assertArrayEquals(new int[] {5}, table.get(1));
        try {
            table.add(1, 6);
            fail("Frozen table accepted an output");
        } catch (IllegalStateException e) {
            assertEquals("Output table is frozen.", e.getMessage());
        }
    }
}
