package edu.tum.cs.grid;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.OptionalInt;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.UnmodifiableIterator;

/**
 * Jagged two-dimensional grid stored in a single flat, row-major buffer plus a table of row start offsets. This class
 * owns the offset table and everything that only depends on the shape of the grid; subclasses own the element buffer.
 * <p>
 * Queries ({@link #rowSize(int)}, {@code get}) report coordinates outside the current shape as absent. Operations that
 * require a valid coordinate ({@code insert}, {@code swap}, {@code removeRow}, row iteration) throw an
 * {@link IndexOutOfBoundsException} naming the offending index and its bound, and leave the grid unchanged.
 * <p>
 * Not thread-safe.
 */
public abstract class AbstractDynamicGrid {

	private static final Logger logger = Logger.getLogger(AbstractDynamicGrid.class.getName());

	static final int DEFAULT_INITIAL_CAPACITY = 16;

	protected final RowStartTable rowStarts;
	protected final EmptyRowPolicy emptyRowPolicy;

	/** number of structural modifications, used to detect stale iterators */
	protected int modCount;

	/**
	 * Cursor over the buffer range {@code [begin, end)} whose first cell lies in {@code firstRow}.
	 */
	protected abstract class Cursor<V> implements GridIterator<V> {
		private final int begin;
		private final int end;
		private int index;
		private int row;
		private int column = -1;
		private final int expectedModCount = modCount;

		protected Cursor(int firstRow, int begin, int end) {
			this.row = firstRow;
			this.begin = begin;
			this.end = end;
			this.index = begin - 1;
		}

		protected abstract V valueAt(int index);

		protected abstract V setValueAt(int index, V value);

		@Override
		public boolean hasNext() {
			return ((index + 1) < end);
		}

		@Override
		public void advance() {
			checkForComodification();
			if ((index + 1) >= end)
				throw new NoSuchElementException();
			index++;
			column++;
			// skips empty rows as well
			while (index >= rowStarts.end(row, flatSize())) {
				row++;
				column = 0;
			}
		}

		@Override
		public V getValue() {
			checkCurrent();
			return valueAt(index);
		}

		@Override
		public V setValue(V value) {
			checkCurrent();
			return setValueAt(index, value);
		}

		@Override
		public int getRow() {
			checkCurrent();
			return row;
		}

		@Override
		public int getColumn() {
			checkCurrent();
			return column;
		}

		private void checkCurrent() {
			checkForComodification();
			if (index < begin)
				throw new IllegalStateException("advance() has not been called");
		}

		private void checkForComodification() {
			if (modCount != expectedModCount)
				throw new ConcurrentModificationException();
		}
	}

	protected AbstractDynamicGrid(EmptyRowPolicy emptyRowPolicy) {
		this.emptyRowPolicy = Preconditions.checkNotNull(emptyRowPolicy, "emptyRowPolicy");
		this.rowStarts = new RowStartTable();
	}

	protected AbstractDynamicGrid(AbstractDynamicGrid other) {
		this.emptyRowPolicy = other.emptyRowPolicy;
		this.rowStarts = new RowStartTable(other.rowStarts);
	}

	static int readInitialCapacity(GridConfiguration config) {
		int capacity = config.getLocalIntProperty(GridConfiguration.PROP_INITIAL_CAPACITY,
				DEFAULT_INITIAL_CAPACITY);
		if (capacity < 0) {
			logger.warning("ignoring negative initial capacity " + capacity + ", using " +
					DEFAULT_INITIAL_CAPACITY);
			return DEFAULT_INITIAL_CAPACITY;
		}
		return capacity;
	}

	static EmptyRowPolicy readEmptyRowPolicy(GridConfiguration config) {
		return config.getLocalEnumProperty(GridConfiguration.PROP_EMPTY_ROW_POLICY, EmptyRowPolicy.class,
				EmptyRowPolicy.KEEP);
	}

	protected abstract int flatSize();

	protected abstract void flatRemoveRange(int fromIndex, int toIndex);

	protected abstract void flatSwap(int i, int j);

	protected abstract void flatClear();

	/**
	 * @return the elements of a valid row in column order, for rendering
	 */
	protected abstract Iterable<?> formatRow(int row);

	public int getNumRows() {
		return rowStarts.getNumRows();
	}

	/**
	 * @return total number of elements in all rows
	 */
	public int size() {
		return flatSize();
	}

	public boolean isEmpty() {
		return (flatSize() == 0);
	}

	public EmptyRowPolicy getEmptyRowPolicy() {
		return emptyRowPolicy;
	}

	/**
	 * @return the length of {@code row}, or an empty result if there is no such row
	 */
	public OptionalInt rowSize(int row) {
		if (row >= 0 && row < getNumRows())
			return OptionalInt.of(rowStarts.size(row, flatSize()));
		return OptionalInt.empty();
	}

	protected final boolean contains(int row, int column) {
		return ((row >= 0) && (row < getNumRows()) && (column >= 0) &&
				(column < rowStarts.size(row, flatSize())));
	}

	protected final int flatIndex(int row, int column) {
		return rowStarts.start(row) + column;
	}

	protected final void checkRow(int row) {
		Preconditions.checkElementIndex(row, getNumRows(), "row");
	}

	/**
	 * @return buffer index of an existing cell
	 * @throws IndexOutOfBoundsException if the cell does not exist
	 */
	protected final int checkedFlatIndex(int row, int column) {
		checkRow(row);
		Preconditions.checkElementIndex(column, rowStarts.size(row, flatSize()), "column");
		return flatIndex(row, column);
	}

	/**
	 * @return buffer index at which an element has to be inserted to become cell ({@code row}, {@code column}); the
	 * 	column may equal the row length
	 * @throws IndexOutOfBoundsException if {@code row} does not exist or {@code column} exceeds the row length
	 */
	protected final int checkedInsertionIndex(int row, int column) {
		checkRow(row);
		Preconditions.checkPositionIndex(column, rowStarts.size(row, flatSize()), "column");
		return flatIndex(row, column);
	}

	/**
	 * Has to be called after one element was inserted into the buffer within {@code row}.
	 */
	protected final void elementInserted(int row) {
		rowStarts.shiftAfter(row, 1);
		modCount++;
	}

	/**
	 * Appends a new row of length zero.
	 * @return index of the new row
	 */
	public int pushEmptyRow() {
		modCount++;
		return rowStarts.addRow(flatSize());
	}

	/**
	 * @return index of the row that {@code push} appends to
	 * @throws IllegalStateException if the grid has no rows
	 */
	protected final int lastRowForPush() {
		Preconditions.checkState(getNumRows() > 0, "grid has no rows, use pushNewRow to create the first one");
		return getNumRows() - 1;
	}

	/**
	 * @return position of the element just appended to {@code row}
	 */
	protected final GridPosition lastPositionOf(int row) {
		return new GridPosition(row, rowStarts.size(row, flatSize()) - 1);
	}

	public void swap(GridPosition first, GridPosition second) {
		swap(first.getRow(), first.getColumn(), second.getRow(), second.getColumn());
	}

	/**
	 * Exchanges the values of two existing cells. The shape of the grid does not change.
	 * @throws IndexOutOfBoundsException if one of the cells does not exist
	 */
	public void swap(int firstRow, int firstColumn, int secondRow, int secondColumn) {
		int i = checkedFlatIndex(firstRow, firstColumn);
		int j = checkedFlatIndex(secondRow, secondColumn);
		flatSwap(i, j);
	}

	/**
	 * @return buffer index of the last element of the last row, or -1 if the grid has no rows or its last row is empty
	 */
	protected final int lastElementIndex() {
		int numRows = getNumRows();
		if (numRows == 0)
			return -1;
		if (rowStarts.size(numRows - 1, flatSize()) == 0)
			return -1;
		return flatSize() - 1;
	}

	/**
	 * Removes the element at {@link #lastElementIndex()}, which has to be non-negative, and applies the empty row
	 * policy to the last row.
	 */
	protected final void removeLastElement() {
		int n = flatSize();
		int lastRow = getNumRows() - 1;
		flatRemoveRange(n - 1, n);
		modCount++;
		if ((emptyRowPolicy == EmptyRowPolicy.REMOVE_IF_NOT_FIRST) && (lastRow > 0) &&
				(rowStarts.size(lastRow, flatSize()) == 0)) {
			rowStarts.removeRow(lastRow);
			logger.fine("removed emptied row " + lastRow);
		}
	}

	/**
	 * Removes the elements and the offset entry of an existing row and moves all following rows to the front.
	 */
	protected final void deleteRow(int row) {
		int start = rowStarts.start(row);
		int length = rowStarts.size(row, flatSize());
		flatRemoveRange(start, start + length);
		rowStarts.shiftAfter(row, -length);
		rowStarts.removeRow(row);
		modCount++;
	}

	/**
	 * Removes all rows and elements.
	 */
	public void clear() {
		flatClear();
		rowStarts.clear();
		modCount++;
	}

	/**
	 * @return a read-only {@link Iterator} view of a cursor
	 */
	protected static <E> Iterator<E> asIterator(final GridIterator<E> it) {
		return new UnmodifiableIterator<E>() {
			@Override
			public boolean hasNext() {
				return it.hasNext();
			}

			@Override
			public E next() {
				it.advance();
				return it.getValue();
			}
		};
	}

	boolean isConsistent() {
		return rowStarts.isConsistent(flatSize());
	}

	/**
	 * @return one line per row, elements separated by the configured column separator
	 */
	@Override
	public String toString() {
		return GridFormatter.getDefault().format(this);
	}

}
