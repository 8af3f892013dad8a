package my.fundextractor.app.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A table data row. Keyed rows pair headers with cells positionally; a repeated header keeps its last cell.
 */
public record TableRow(
		List<String> cells,
		Map<String, String> byHeader
) {
	public TableRow {
		cells = cells == null ? List.of() : List.copyOf(cells);
		byHeader = byHeader == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(byHeader));
	}

	public static TableRow keyed(List<String> headers, List<String> cells) {
		Map<String, String> mapped = new LinkedHashMap<>();
		for (int i = 0; i < headers.size() && i < cells.size(); i++) {
			mapped.put(headers.get(i), cells.get(i));
		}
		return new TableRow(cells, mapped);
	}

	public static TableRow plain(List<String> cells) {
		return new TableRow(cells, null);
	}

	public boolean isKeyed() {
		return !byHeader.isEmpty();
	}

	public Optional<String> cell(int index) {
		if (index < 0 || index >= cells.size()) {
			return Optional.empty();
		}
		return Optional.of(cells.get(index));
	}

	public String joinedText() {
		return String.join(" ", cells);
	}
}
