package edu.tum.cs.grid;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import com.carrotsearch.hppc.ObjectArrayList;
import com.google.common.base.Preconditions;
import com.google.common.math.IntMath;

/**
 * Jagged grid of object references. Rows can have different lengths, including zero, and grow or shrink
 * individually, while all elements live in one row-major {@link ObjectArrayList}. {@code null} elements are not
 * permitted.
 */
public class DynamicGrid<T> extends AbstractDynamicGrid implements Iterable<T> {

	private static final GridConfiguration config = new GridConfiguration(DynamicGrid.class);
	private static final int defaultInitialCapacity = readInitialCapacity(config);
	private static final EmptyRowPolicy defaultEmptyRowPolicy = readEmptyRowPolicy(config);

	private final ObjectArrayList<T> elements;

	public DynamicGrid() {
		this(defaultInitialCapacity, defaultEmptyRowPolicy);
	}

	public DynamicGrid(int initialCapacity) {
		this(initialCapacity, defaultEmptyRowPolicy);
	}

	public DynamicGrid(int initialCapacity, EmptyRowPolicy emptyRowPolicy) {
		super(emptyRowPolicy);
		Preconditions.checkArgument(initialCapacity >= 0, "negative initial capacity %s", initialCapacity);
		this.elements = new ObjectArrayList<T>(initialCapacity);
	}

	protected DynamicGrid(DynamicGrid<T> other) {
		super(other);
		this.elements = new ObjectArrayList<T>(other.elements.size());
		for (int i = 0; i < other.elements.size(); i++)
			elements.add(other.elements.get(i));
	}

	/**
	 * Creates a {@code numRows} x {@code numColumns} grid whose cells all refer to {@code value}. Use
	 * {@link #generate(int, int, Supplier)} for mutable values.
	 */
	public static <T> DynamicGrid<T> filled(int numRows, int numColumns, T value) {
		Preconditions.checkNotNull(value, "value");
		DynamicGrid<T> grid = newFilledGrid(numRows, numColumns);
		for (int row = 0; row < numRows; row++) {
			grid.rowStarts.addRow(grid.elements.size());
			for (int column = 0; column < numColumns; column++)
				grid.elements.add(value);
		}
		return grid;
	}

	/**
	 * Creates a {@code numRows} x {@code numColumns} grid with one value per cell obtained from {@code factory}, called
	 * in row-major order.
	 */
	public static <T> DynamicGrid<T> generate(int numRows, int numColumns, Supplier<? extends T> factory) {
		Preconditions.checkNotNull(factory, "factory");
		DynamicGrid<T> grid = newFilledGrid(numRows, numColumns);
		for (int row = 0; row < numRows; row++) {
			grid.rowStarts.addRow(grid.elements.size());
			for (int column = 0; column < numColumns; column++)
				grid.elements.add(Preconditions.checkNotNull(factory.get(), "factory returned null"));
		}
		return grid;
	}

	private static <T> DynamicGrid<T> newFilledGrid(int numRows, int numColumns) {
		Preconditions.checkArgument(numRows >= 0, "negative number of rows %s", numRows);
		Preconditions.checkArgument(numColumns >= 0, "negative number of columns %s", numColumns);
		return new DynamicGrid<T>(IntMath.checkedMultiply(numRows, numColumns), defaultEmptyRowPolicy);
	}

	/**
	 * Creates a grid with one row per element of {@code rows}, in the given order.
	 */
	public static <T> DynamicGrid<T> fromRows(Iterable<? extends Iterable<? extends T>> rows) {
		DynamicGrid<T> grid = new DynamicGrid<T>();
		for (Iterable<? extends T> row : rows)
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
		T tmp = elements.get(i);
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

	/**
	 * @return the value of cell ({@code row}, {@code column}), or an empty result if the cell does not exist
	 */
	public Optional<T> get(int row, int column) {
		if (contains(row, column))
			return Optional.of(elements.get(flatIndex(row, column)));
		return Optional.empty();
	}

	/**
	 * Overwrites an existing cell. Nothing is changed if the cell does not exist.
	 * @return the previous value, or an empty result if the cell does not exist
	 */
	public Optional<T> replace(int row, int column, T value) {
		Preconditions.checkNotNull(value, "value");
		if (contains(row, column))
			return Optional.of(elements.set(flatIndex(row, column), value));
		return Optional.empty();
	}

	/**
	 * Appends {@code value} to the last row.
	 * @throws IllegalStateException if the grid has no rows
	 */
	public GridPosition push(T value) {
		Preconditions.checkNotNull(value, "value");
		int row = lastRowForPush();
		elements.add(value);
		modCount++;
		return lastPositionOf(row);
	}

	/**
	 * Appends a new row holding only {@code value}.
	 */
	public GridPosition pushNewRow(T value) {
		Preconditions.checkNotNull(value, "value");
		pushEmptyRow();
		return push(value);
	}

	/**
	 * Appends a new row holding the given values.
	 * @return index of the new row
	 */
	public int pushRow(Iterable<? extends T> values) {
		int start = elements.size();
		try {
			for (T value : values)
				elements.add(Preconditions.checkNotNull(value, "null element in row %s", getNumRows()));
		} catch (RuntimeException ex) {
			elements.removeRange(start, elements.size());
			throw ex;
		}
		modCount++;
		return rowStarts.addRow(start);
	}

	/**
	 * Appends {@code value} to the end of {@code row}.
	 * @throws IndexOutOfBoundsException if there is no such row
	 */
	public GridPosition pushAtRow(int row, T value) {
		checkRow(row);
		int column = rowStarts.size(row, elements.size());
		insert(row, column, value);
		return new GridPosition(row, column);
	}

	/**
	 * Inserts {@code value} into {@code row} before the element currently at {@code column}; a column equal to the row
	 * length appends. All following elements, including those of later rows, move back by one.
	 * @throws IndexOutOfBoundsException if there is no such row or {@code column} exceeds the row length
	 */
	public void insert(int row, int column, T value) {
		Preconditions.checkNotNull(value, "value");
		int index = checkedInsertionIndex(row, column);
		elements.insert(index, value);
		elementInserted(row);
	}

	/**
	 * Removes the last element of the last row.
	 * @return the removed element, or an empty result if the grid has no rows or its last row is empty
	 */
	public Optional<T> remove() {
		int index = lastElementIndex();
		if (index < 0)
			return Optional.empty();
		T value = elements.get(index);
		removeLastElement();
		return Optional.of(value);
	}

	/**
	 * Deletes {@code row} and its elements. Later rows move up by one.
	 * @return the elements of the deleted row
	 * @throws IndexOutOfBoundsException if there is no such row
	 */
	public List<T> removeRow(int row) {
		List<T> removed = copyRow(row);
		deleteRow(row);
		return removed;
	}

	private List<T> copyRow(int row) {
		checkRow(row);
		int start = rowStarts.start(row);
		int end = rowStarts.end(row, elements.size());
		List<T> values = new ArrayList<T>(end - start);
		for (int i = start; i < end; i++)
			values.add(elements.get(i));
		return values;
	}

	/**
	 * @return all elements in row-major order; the iterator does not support removal
	 */
	@Override
	public Iterator<T> iterator() {
		return asIterator(gridIterator());
	}

	/**
	 * @return a cursor over all cells in row-major order
	 */
	public GridIterator<T> gridIterator() {
		return new ElementCursor(0, 0, elements.size());
	}

	/**
	 * @return the elements of {@code row} in column order
	 * @throws IndexOutOfBoundsException if there is no such row
	 */
	public Iterable<T> iterateRow(final int row) {
		checkRow(row);
		return new Iterable<T>() {
			@Override
			public Iterator<T> iterator() {
				return asIterator(rowIterator(row));
			}
		};
	}

	/**
	 * @return a cursor over the cells of {@code row}
	 * @throws IndexOutOfBoundsException if there is no such row
	 */
	public GridIterator<T> rowIterator(int row) {
		checkRow(row);
		return new ElementCursor(row, rowStarts.start(row), rowStarts.end(row, elements.size()));
	}

	private class ElementCursor extends Cursor<T> {
		ElementCursor(int firstRow, int begin, int end) {
			super(firstRow, begin, end);
		}

		@Override
		protected T valueAt(int index) {
			return elements.get(index);
		}

		@Override
		protected T setValueAt(int index, T value) {
			Preconditions.checkNotNull(value, "value");
			return elements.set(index, value);
		}
	}

	/**
	 * @return a copy of the grid as a list of rows
	 */
	public List<List<T>> toRows() {
		List<List<T>> rows = new ArrayList<List<T>>(getNumRows());
		for (int row = 0; row < getNumRows(); row++)
			rows.add(copyRow(row));
		return rows;
	}

	/**
	 * @return an independent grid with the same shape, elements and empty row policy
	 */
	public DynamicGrid<T> copy() {
		return new DynamicGrid<T>(this);
	}

	@Override
	public int hashCode() {
		int h = rowStarts.hashCode();
		for (int i = 0; i < elements.size(); i++)
			h = 31 * h + elements.get(i).hashCode();
		return h;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof DynamicGrid))
			return false;
		DynamicGrid<?> other = (DynamicGrid<?>) obj;
		if ((elements.size() != other.elements.size()) || !rowStarts.equals(other.rowStarts))
			return false;
		for (int i = 0; i < elements.size(); i++)
			if (!elements.get(i).equals(other.elements.get(i)))
				return false;
		return true;
	}

}
