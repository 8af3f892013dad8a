package my.fundextractor.app.table;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public record ExtractedTable(
		List<String> headers,
		List<TableRow> rows
) {
	public ExtractedTable {
		headers = headers == null ? List.of() : List.copyOf(headers);
		rows = rows == null ? List.of() : List.copyOf(rows);
	}

	public int columnIndex(List<String> terms) {
		for (int i = 0; i < headers.size(); i++) {
			String header = headers.get(i).toLowerCase(Locale.ROOT);
			for (String term : terms) {
				if (header.contains(term)) {
					return i;
				}
			}
		}
		return -1;
	}

	/**
	 * Header and cell text of the whole table, lower-cased, for keyword checks.
	 */
	public String searchableText() {
		List<String> parts = new ArrayList<>(headers);
		for (TableRow row : rows) {
			parts.add(row.joinedText());
		}
		return String.join(" ", parts).toLowerCase(Locale.ROOT);
	}

	public boolean mentionsAny(List<String> keywords) {
		String text = searchableText();
		for (String keyword : keywords) {
			if (text.contains(keyword)) {
				return true;
			}
		}
		return false;
	}
}
