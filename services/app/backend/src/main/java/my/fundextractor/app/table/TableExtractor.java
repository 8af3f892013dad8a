package my.fundextractor.app.table;

import my.fundextractor.app.document.FundDocument;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class TableExtractor {
	private static final Logger logger = LoggerFactory.getLogger(TableExtractor.class);

	public List<ExtractedTable> extractTables(FundDocument document) {
		List<ExtractedTable> tables = new ArrayList<>();
		for (Element table : document.tree().select("table")) {
			ExtractedTable extracted = extractTable(table);
			if (extracted != null) {
				tables.add(extracted);
			}
		}
		logger.debug("Extracted {} tables.", tables.size());
		return tables;
	}

	ExtractedTable extractTable(Element table) {
		Elements allRows = ownRows(table);
		Element headerRow = findHeaderRow(allRows);
		List<String> headers = headerRow == null ? List.of() : cellTexts(headerRow);
		if (headers.stream().allMatch(String::isEmpty)) {
			headers = List.of();
		}

		List<TableRow> rows = new ArrayList<>();
		for (Element row : allRows) {
			if (row == headerRow) {
				continue;
			}
			List<String> cells = cellTexts(row);
			if (cells.isEmpty() || cells.stream().allMatch(String::isEmpty)) {
				continue;
			}
			if (!headers.isEmpty()) {
				rows.add(TableRow.keyed(headers, cells));
			} else {
				rows.add(TableRow.plain(cells));
			}
		}
		if (rows.isEmpty()) {
			return null;
		}
		return new ExtractedTable(headers, rows);
	}

	private Element findHeaderRow(Elements allRows) {
		for (Element row : allRows) {
			Element parent = row.parent();
			if (parent != null && "thead".equals(parent.normalName())) {
				return row;
			}
		}
		return allRows.isEmpty() ? null : allRows.first();
	}

	private Elements ownRows(Element table) {
		Elements rows = new Elements();
		for (Element row : table.select("tr")) {
			Element owner = row.closest("table");
			if (owner == table) {
				rows.add(row);
			}
		}
		return rows;
	}

	private List<String> cellTexts(Element row) {
		List<String> cells = new ArrayList<>();
		for (Element cell : row.children()) {
			String tag = cell.normalName();
			if ("td".equals(tag) || "th".equals(tag)) {
				cells.add(FundDocument.flatten(cell));
			}
		}
		return cells;
	}
}
