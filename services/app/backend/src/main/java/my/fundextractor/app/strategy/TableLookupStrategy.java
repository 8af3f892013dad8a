package my.fundextractor.app.strategy;

import my.fundextractor.app.table.ExtractedTable;
import my.fundextractor.app.table.TableRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads a cell from the first rows labelled {@code rowLabel} in tables mentioning any keyword. The column
 * is chosen by header terms; without column terms every cell of the row is tried in order.
 */
public class TableLookupStrategy implements ExtractionStrategy {
	private final String id;
	private final List<String> tableKeywords;
	private final String rowLabel;
	private final List<String> columnTerms;
	private final TextPattern valuePattern;

	public TableLookupStrategy(String id,
							   List<String> tableKeywords,
							   String rowLabel,
							   List<String> columnTerms,
							   TextPattern valuePattern) {
		this.id = id;
		this.tableKeywords = List.copyOf(tableKeywords);
		this.rowLabel = rowLabel == null ? null : rowLabel.toLowerCase(Locale.ROOT);
		this.columnTerms = List.copyOf(columnTerms);
		this.valuePattern = valuePattern;
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public List<String> matches(ExtractionContext context) {
		List<String> found = new ArrayList<>();
		for (ExtractedTable table : context.tables()) {
			if (!table.mentionsAny(tableKeywords)) {
				continue;
			}
			int column = columnTerms.isEmpty() ? -1 : table.columnIndex(columnTerms);
			if (!columnTerms.isEmpty() && column < 0) {
				continue;
			}
			for (TableRow row : table.rows()) {
				if (rowLabel != null && !row.joinedText().toLowerCase(Locale.ROOT).contains(rowLabel)) {
					continue;
				}
				if (column >= 0) {
					row.cell(column).flatMap(valuePattern::find).ifPresent(found::add);
				} else {
					for (String cell : row.cells()) {
						valuePattern.find(cell).ifPresent(found::add);
					}
				}
			}
		}
		return found;
	}
}
