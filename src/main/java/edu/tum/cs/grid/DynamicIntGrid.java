package edu.tum.cs.grid;

import java.util.Arrays;
import java.util.Iterator;
import java.util.OptionalInt;

import com.carrotsearch.hppc.IntArrayList;
import com.google.common.base.Preconditions;
import com.google.common.math.IntMath;

/**
 * Jagged grid of primitive ints, backed by a single {@link IntArrayList}.
 */
public class DynamicIntGrid extends AbstractDynamicGrid {

	private static final GridConfiguration config = new GridConfiguration(DynamicIntGrid.class);
	private static final int defaultInitialCapacity = readInitialCapacity(config);
	private static final EmptyRowPolicy defaultEmptyRowPolicy = readEmptyRowPolicy(config);

	private final IntArrayList elements;

	public DynamicIntGrid() {
		this(defaultInitialCapacity, defaultEmptyRowPolicy);
	}

	public DynamicIntGrid(int initialCapacity) {
		this(initialCapacity, defaultEmptyRowPolicy);
	}

	public DynamicIntGrid(int initialCapacity, EmptyRowPolicy emptyRowPolicy) {
		super(emptyRowPolicy);
		Preconditions.checkArgument(initialCapacity >= 0, "negative initial capacity %s", initialCapacity);
		this.elements = new IntArrayList(initialCapacity);
	}

	protected DynamicIntGrid(DynamicIntGrid other) {
		super(other);
		this.elements = new IntArrayList(other.elements.size());
		for (int i = 0; i < other.elements.size(); i++)
			elements.add(other.elements.get(i));
	}

	public static DynamicIntGrid filled(int numRows, int numColumns, int value) {
		Preconditions.checkArgument(numRows >= 0, "negative number of rows %s", numRows);
		Preconditions.checkArgument(numColumns >= 0, "negative number of columns %s", numColumns);
		int[] row = new int[numColumns];
		Arrays.fill(row, value);
		DynamicIntGrid grid = new DynamicIntGrid(IntMath.checkedMultiply(numRows, numColumns),
				defaultEmptyRowPolicy);
		for (int i = 0; i < numRows; i++)
			grid.pushRow(row);
		return grid;
	}

	public static DynamicIntGrid fromRows(int[][] rows) {
		DynamicIntGrid grid = new DynamicIntGrid();
		for (int[] row : rows)
			grid.pushRow(row);
		return grid;
	}

	@Override
	protected int flatSize() {
		return elements.size();
	}

	@Override
	protected void flatRemoveRange(int fromIndex, int toIndex) {
		elements.removeRange(fromIndex, toIndex);
	}

	@Override
	protected void flatSwap(int i, int j) {
		int tmp = elements.get(i);
		elements.set(i, elements.get(j));
		elements.set(j, tmp);
	}

	@Override
	protected void flatClear() {
		elements.clear();
	}

	@Override
	protected Iterable<?> formatRow(int row) {
		return iterateRow(row);
	}

	public OptionalInt get(int row, int column) {
		if (contains(row, column))
			return OptionalInt.of(elements.get(flatIndex(row, column)));
		return OptionalInt.empty();
	}

	/**
	 * Overwrites an existing cell. Nothing is changed if the cell does not exist.
	 * @return the previous value, or an empty result if the cell does not exist
	 */
	public OptionalInt replace(int row, int column, int value) {
		if (contains(row, column))
			return OptionalInt.of(elements.set(flatIndex(row, column), value));
		return OptionalInt.empty();
	}

	/**
	 * @throws IllegalStateException if the grid has no rows
	 */
	public GridPosition push(int value) {
		int row = lastRowForPush();
		elements.add(value);
		modCount++;
		return lastPositionOf(row);
	}

	public GridPosition pushNewRow(int value) {
		pushEmptyRow();
		return push(value);
	}

	public int pushRow(int[] values) {
		int start = elements.size();
		elements.add(values, 0, values.length);
		modCount++;
		return rowStarts.addRow(start);
	}

	/**
	 * @throws IndexOutOfBoundsException if there is no such row
	 */
	public GridPosition pushAtRow(int row, int value) {
		checkRow(row);
		int column = rowStarts.size(row, elements.size());
		insert(row, column, value);
		return new GridPosition(row, column);
	}

	/**
	 * @throws IndexOutOfBoundsException if there is no such row or {@code column} exceeds the row length
	 */
	public void insert(int row, int column, int value) {
		int index = checkedInsertionIndex(row, column);
		elements.insert(index, value);
		elementInserted(row);
	}

	public OptionalInt remove() {
		int index = lastElementIndex();
		if (index < 0)
			return OptionalInt.empty();
		int value = elements.get(index);
		removeLastElement();
		return OptionalInt.of(value);
	}

	/**
	 * @return the elements of the deleted row
	 * @throws IndexOutOfBoundsException if there is no such row
	 */
	public int[] removeRow(int row) {
		int[] removed = rowToArray(row);
		deleteRow(row);
		return removed;
	}

	public GridIterator<Integer> gridIterator() {
		return new ElementCursor(0, 0, elements.size());
	}

	/**
	 * @return the elements of {@code row} in column order, boxed
	 * @throws IndexOutOfBoundsException if there is no such row
	 */
	public Iterable<Integer> iterateRow(final int row) {
		checkRow(row);
		return new Iterable<Integer>() {
			@Override
			public Iterator<Integer> iterator() {
				return asIterator(rowIterator(row));
			}
		};
	}

	/**
	 * @throws IndexOutOfBoundsException if there is no such row
	 */
	public GridIterator<Integer> rowIterator(int row) {
		checkRow(row);
		return new ElementCursor(row, rowStarts.start(row), rowStarts.end(row, elements.size()));
	}

	private class ElementCursor extends Cursor<Integer> {
		ElementCursor(int firstRow, int begin, int end) {
			super(firstRow, begin, end);
		}

		@Override
		protected Integer valueAt(int index) {
			return elements.get(index);
		}

		@Override
		protected Integer setValueAt(int index, Integer value) {
			return elements.set(index, Preconditions.checkNotNull(value, "value"));
		}
	}

	/**
	 * @return all elements in row-major order
	 */
	public int[] toArray() {
		return elements.toArray();
	}

	/**
	 * @throws IndexOutOfBoundsException if there is no such row
	 */
	public int[] rowToArray(int row) {
		checkRow(row);
		int start = rowStarts.start(row);
		int end = rowStarts.end(row, elements.size());
		int[] values = new int[end - start];
		for (int i = start; i < end; i++)
			values[i - start] = elements.get(i);
		return values;
	}

	public int[][] toArray2D() {
		int[][] rows = new int[getNumRows()][];
		for (int row = 0; row < rows.length; row++)
			rows[row] = rowToArray(row);
		return rows;
	}

	public DynamicIntGrid copy() {
		return new DynamicIntGrid(this);
	}

	@Override
	public int hashCode() {
		int h = rowStarts.hashCode();
		for (int i = 0; i < elements.size(); i++)
			h = 31 * h + elements.get(i);
		return h;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof DynamicIntGrid))
			return false;
		DynamicIntGrid other = (DynamicIntGrid) obj;
		if ((elements.size() != other.elements.size()) || !rowStarts.equals(other.rowStarts))
			return false;
		for (int i = 0; i < elements.size(); i++)
			if (elements.get(i) != other.elements.get(i))
				return false;
		return true;
	}

}
