package edu.tum.cs.grid;

import java.io.IOException;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;

/**
 * Renders a grid as text: one line per row, the elements of a row joined by a column separator, every line
 * terminated by {@code '\n'}. Empty rows become empty lines.
 */
public class GridFormatter {

	private static final GridConfiguration config = new GridConfiguration(GridFormatter.class);
	private static final GridFormatter defaultFormatter = new GridFormatter(
			config.getLocalProperty(GridConfiguration.PROP_COLUMN_SEPARATOR, ","));

	private final String columnSeparator;
	private final Joiner joiner;

	public GridFormatter(String columnSeparator) {
		this.columnSeparator = Preconditions.checkNotNull(columnSeparator, "columnSeparator");
		this.joiner = Joiner.on(columnSeparator);
	}

	/**
	 * @return the formatter configured by {@code GridFormatter.columnSeparator}
	 */
	public static GridFormatter getDefault() {
		return defaultFormatter;
	}

	public String getColumnSeparator() {
		return columnSeparator;
	}

	public String format(AbstractDynamicGrid grid) {
		StringBuilder sb = new StringBuilder();
		for (int row = 0; row < grid.getNumRows(); row++)
			joiner.appendTo(sb, grid.formatRow(row)).append('\n');
		return sb.toString();
	}

	public <A extends Appendable> A appendTo(A out, AbstractDynamicGrid grid) throws IOException {
		for (int row = 0; row < grid.getNumRows(); row++) {
			joiner.appendTo(out, grid.formatRow(row));
			out.append('\n');
		}
		return out;
	}

}
