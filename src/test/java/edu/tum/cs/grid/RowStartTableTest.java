package edu.tum.cs.grid;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class RowStartTableTest {

	// rows of length 3, 2, 1, 4 in a buffer of 10 elements
	private static RowStartTable createTable() {
		RowStartTable table = new RowStartTable();
		table.addRow(0);
		table.addRow(3);
		table.addRow(5);
		table.addRow(6);
		return table;
	}

	@Test
	public void testSizes() {
		RowStartTable table = createTable();
		assertEquals(4, table.getNumRows());
		assertEquals(3, table.size(0, 10));
		assertEquals(2, table.size(1, 10));
		assertEquals(1, table.size(2, 10));
		assertEquals(4, table.size(3, 10));
		assertEquals(6, table.end(2, 10));
		assertEquals(10, table.end(3, 10));
		assertTrue(table.isConsistent(10));
	}

	@Test
	public void testShiftAfterMovesEveryLaterRow() {
		RowStartTable table = createTable();
		table.shiftAfter(0, 1);
		assertArrayEquals(new int[] { 0, 4, 6, 7 }, table.toArray());
		table.shiftAfter(2, -1);
		assertArrayEquals(new int[] { 0, 4, 6, 6 }, table.toArray());
		table.shiftAfter(3, 5);
		assertArrayEquals(new int[] { 0, 4, 6, 6 }, table.toArray());
	}

	@Test
	public void testRemoveRow() {
		RowStartTable table = createTable();
		table.shiftAfter(1, -2);
		table.removeRow(1);
		assertArrayEquals(new int[] { 0, 3, 4 }, table.toArray());
		assertTrue(table.isConsistent(8));
	}

	@Test
	public void testConsistency() {
		assertTrue(new RowStartTable().isConsistent(0));
		assertFalse(new RowStartTable().isConsistent(1));
		assertFalse(createTable().isConsistent(5));

		RowStartTable table = createTable();
		table.shiftAfter(-1, 1);
		assertFalse(table.isConsistent(11));

		table = createTable();
		table.shiftAfter(2, -3);
		assertFalse(table.isConsistent(10));
	}

	@Test
	public void testCopyAndEquality() {
		RowStartTable table = createTable();
		RowStartTable copy = new RowStartTable(table);
		assertEquals(table, copy);
		assertEquals(table.hashCode(), copy.hashCode());
		copy.shiftAfter(2, 1);
		assertNotEquals(table, copy);
		assertArrayEquals(new int[] { 0, 3, 5, 6 }, table.toArray());
	}

}
