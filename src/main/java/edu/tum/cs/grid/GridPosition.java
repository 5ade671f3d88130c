package edu.tum.cs.grid;

import com.google.common.base.Preconditions;

/**
 * Immutable (row, column) coordinate of a grid cell.
 */
public final class GridPosition {

	private final int row;
	private final int column;

	public GridPosition(int row, int column) {
		Preconditions.checkArgument(row >= 0, "negative row index %s", row);
		Preconditions.checkArgument(column >= 0, "negative column index %s", column);
		this.row = row;
		this.column = column;
	}

	public static GridPosition of(int row, int column) {
		return new GridPosition(row, column);
	}

	public int getRow() {
		return row;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public String toString() {
		return "(" + row + ", " + column + ")";
	}

	@Override
	public int hashCode() {
		return 31 * (31 + row) + column;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof GridPosition))
			return false;
		GridPosition other = (GridPosition) obj;
		return ((row == other.row) && (column == other.column));
	}

}
