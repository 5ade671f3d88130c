package edu.tum.cs.grid;

/**
 * Determines what {@link DynamicGrid#remove()} does with the last row once its last element was removed.
 */
public enum EmptyRowPolicy {

	/** The row is kept as a row of length zero. Only {@code removeRow} deletes rows. */
	KEEP,

	/** The row is deleted, unless it is row 0. */
	REMOVE_IF_NOT_FIRST

}
