package edu.tum.cs.grid;

import com.carrotsearch.hppc.IntArrayList;

/**
 * Per-row offsets into the flat element buffer of a grid. Entry {@code i} is the buffer index of the first element of
 * row {@code i}; the row ends where the next row starts, the last row ends at the end of the buffer. Offsets are kept
 * non-decreasing and the first one is always zero.
 */
final class RowStartTable {

	private final IntArrayList starts;

	RowStartTable() {
		starts = new IntArrayList();
	}

	RowStartTable(RowStartTable other) {
		starts = new IntArrayList(other.starts.size());
		for (int i = 0; i < other.starts.size(); i++)
			starts.add(other.starts.get(i));
	}

	int getNumRows() {
		return starts.size();
	}

	int start(int row) {
		return starts.get(row);
	}

	int end(int row, int numElements) {
		if (row < starts.size() - 1)
			return starts.get(row + 1);
		return numElements;
	}

	int size(int row, int numElements) {
		return end(row, numElements) - starts.get(row);
	}

	/**
	 * Appends a row that starts at {@code start}, which has to be the current length of the element buffer.
	 * @return index of the new row
	 */
	int addRow(int start) {
		starts.add(start);
		return starts.size() - 1;
	}

	/**
	 * Drops the entry of {@code row} without touching any other offset. Callers removing the row's elements from the
	 * buffer have to call {@link #shiftAfter(int, int)} as well.
	 */
	void removeRow(int row) {
		starts.removeRange(row, row + 1);
	}

	/**
	 * Adds {@code delta} to the start of every row after {@code row}. Every structural edit inside a row moves all
	 * following rows, not only the next one.
	 */
	void shiftAfter(int row, int delta) {
		for (int j = row + 1; j < starts.size(); j++)
			starts.set(j, starts.get(j) + delta);
	}

	void clear() {
		starts.clear();
	}

	int[] toArray() {
		return starts.toArray();
	}

	/**
	 * @return true if the offsets describe a valid partition of a buffer holding {@code numElements} elements
	 */
	boolean isConsistent(int numElements) {
		if (starts.isEmpty())
			return (numElements == 0);
		if (starts.get(0) != 0)
			return false;
		for (int i = 1; i < starts.size(); i++)
			if (starts.get(i) < starts.get(i - 1))
				return false;
		return (starts.get(starts.size() - 1) <= numElements);
	}

	@Override
	public int hashCode() {
		int h = 1;
		for (int i = 0; i < starts.size(); i++)
			h = 31 * h + starts.get(i);
		return h;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof RowStartTable))
			return false;
		RowStartTable other = (RowStartTable) obj;
		if (starts.size() != other.starts.size())
			return false;
		for (int i = 0; i < starts.size(); i++)
			if (starts.get(i) != other.starts.get(i))
				return false;
		return true;
	}

}
