package edu.tum.cs.grid;

/**
 * Cursor over grid cells in row-major order. {@link #advance()} moves to the next cell; the accessors refer to the
 * cell reached by the last call to {@link #advance()}.
 */
public interface GridIterator<T> {

	public boolean hasNext();

	public void advance();

	public T getValue();

	/**
	 * Overwrites the value of the current cell. The layout of the grid is not affected.
	 * @return the previous value
	 */
	public T setValue(T value);

	public int getRow();

	public int getColumn();

}
