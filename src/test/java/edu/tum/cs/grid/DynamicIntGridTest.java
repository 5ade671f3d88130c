package edu.tum.cs.grid;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.OptionalInt;

import org.junit.Test;

import com.google.common.collect.Lists;

public class DynamicIntGridTest {

	private static final int[][] data = { { 10, 5, 4 }, { 3, 9 }, { 1 }, { 7, 6, 2, 8 } };

	@Test
	public void testFromRows() {
		DynamicIntGrid g = DynamicIntGrid.fromRows(data);
		assertEquals(4, g.getNumRows());
		for (int i = 0; i < data.length; i++) {
			assertEquals(OptionalInt.of(data[i].length), g.rowSize(i));
			assertArrayEquals(data[i], g.rowToArray(i));
		}
		assertArrayEquals(new int[] { 10, 5, 4, 3, 9, 1, 7, 6, 2, 8 }, g.toArray());
		assertTrue(Arrays.deepEquals(data, g.toArray2D()));
	}

	@Test
	public void testFilled() {
		DynamicIntGrid g = DynamicIntGrid.filled(2, 3, 7);
		assertArrayEquals(new int[] { 0, 3 }, g.rowStarts.toArray());
		assertArrayEquals(new int[] { 7, 7, 7, 7, 7, 7 }, g.toArray());
		assertEquals("7,7,7\n7,7,7\n", g.toString());
	}

	@Test
	public void testGetAndReplace() {
		DynamicIntGrid g = DynamicIntGrid.fromRows(data);
		assertEquals(OptionalInt.of(9), g.get(1, 1));
		assertEquals(OptionalInt.empty(), g.get(1, 2));
		assertEquals(OptionalInt.empty(), g.get(4, 0));
		assertEquals(OptionalInt.of(9), g.replace(1, 1, 90));
		assertEquals(OptionalInt.of(90), g.get(1, 1));
		assertEquals(OptionalInt.empty(), g.replace(2, 1, 1));
	}

	@Test
	public void testInsertAndSwap() {
		DynamicIntGrid g = DynamicIntGrid.fromRows(data);
		g.insert(2, 1, 99);
		assertArrayEquals(new int[] { 1, 99 }, g.rowToArray(2));
		assertArrayEquals(new int[] { 7, 6, 2, 8 }, g.rowToArray(3));
		assertArrayEquals(new int[] { 0, 3, 5, 7 }, g.rowStarts.toArray());

		g.swap(GridPosition.of(0, 1), GridPosition.of(3, 2));
		assertEquals(OptionalInt.of(2), g.get(0, 1));
		assertEquals(OptionalInt.of(5), g.get(3, 2));
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void testInsertOutOfBounds() {
		DynamicIntGrid.fromRows(data).insert(2, 2, 0);
	}

	@Test
	public void testPushAndRemove() {
		DynamicIntGrid g = DynamicIntGrid.fromRows(data);
		assertEquals(GridPosition.of(3, 4), g.push(11));
		assertEquals(OptionalInt.of(11), g.get(3, 4));
		assertEquals(GridPosition.of(1, 2), g.pushAtRow(1, 12));
		assertEquals(GridPosition.of(4, 0), g.pushNewRow(13));

		assertEquals(OptionalInt.of(13), g.remove());
		assertEquals(5, g.getNumRows());
		assertEquals(OptionalInt.empty(), g.remove());

		assertArrayEquals(new int[] { 10, 5, 4 }, g.removeRow(0));
		assertArrayEquals(new int[] { 3, 9, 12 }, g.rowToArray(0));
		assertTrue(g.isConsistent());
	}

	@Test
	public void testIterators() {
		DynamicIntGrid g = DynamicIntGrid.fromRows(data);
		assertEquals(Arrays.asList(3, 9), Lists.newArrayList(g.iterateRow(1)));

		GridIterator<Integer> it = g.gridIterator();
		int n = 0;
		while (it.hasNext()) {
			it.advance();
			assertEquals(data[it.getRow()][it.getColumn()], it.getValue().intValue());
			it.setValue(-it.getValue());
			n++;
		}
		assertEquals(10, n);
		assertArrayEquals(new int[] { -7, -6, -2, -8 }, g.rowToArray(3));
	}

	@Test
	public void testIteratorRejectsNull() {
		DynamicIntGrid g = DynamicIntGrid.fromRows(data);
		GridIterator<Integer> it = g.rowIterator(1);
		it.advance();
		try {
			it.setValue(null);
			fail("null value accepted");
		} catch (NullPointerException ex) {
			assertEquals("value", ex.getMessage());
		}
		assertArrayEquals(new int[] { 3, 9 }, g.rowToArray(1));
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void testRowIteratorOutOfBounds() {
		DynamicIntGrid.fromRows(data).rowIterator(4);
	}

	@Test
	public void testCopyAndEquality() {
		DynamicIntGrid g = DynamicIntGrid.fromRows(data);
		DynamicIntGrid copy = g.copy();
		assertEquals(g, copy);
		assertEquals(g.hashCode(), copy.hashCode());
		copy.replace(0, 0, 0);
		assertNotEquals(g, copy);
		assertEquals(OptionalInt.of(10), g.get(0, 0));
	}

	@Test
	public void testToString() {
		assertEquals("10,5,4\n3,9\n1\n7,6,2,8\n", DynamicIntGrid.fromRows(data).toString());
	}

}
