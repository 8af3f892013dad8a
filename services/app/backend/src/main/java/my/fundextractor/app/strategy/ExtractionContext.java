package my.fundextractor.app.strategy;

import my.fundextractor.app.document.FundDocument;
import my.fundextractor.app.live.LivePage;
import my.fundextractor.app.table.ExtractedTable;
import my.fundextractor.app.table.KeyValueExtractor;
import my.fundextractor.app.table.TableExtractor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-page extraction state: the parsed document, an optional live page, lazily built tables and
 * key/value pairs, and the values resolved so far. Not shared between pages.
 */
public class ExtractionContext {
	private final FundDocument document;
	private final LivePage livePage;
	private final TableExtractor tableExtractor;
	private final KeyValueExtractor keyValueExtractor;
	private final Map<String, String> resolved = new LinkedHashMap<>();
	private List<ExtractedTable> tables;
	private Map<String, String> keyValues;

	public ExtractionContext(FundDocument document,
							 LivePage livePage,
							 TableExtractor tableExtractor,
							 KeyValueExtractor keyValueExtractor) {
		this.document = document;
		this.livePage = livePage;
		this.tableExtractor = tableExtractor;
		this.keyValueExtractor = keyValueExtractor;
	}

	public FundDocument document() {
		return document;
	}

	public Optional<LivePage> livePage() {
		return Optional.ofNullable(livePage);
	}

	public List<ExtractedTable> tables() {
		if (tables == null) {
			tables = List.copyOf(tableExtractor.extractTables(document));
		}
		return tables;
	}

	public Map<String, String> keyValues() {
		if (keyValues == null) {
			keyValues = Collections.unmodifiableMap(keyValueExtractor.extractPairs(document));
		}
		return keyValues;
	}

	public String resolved(String field) {
		return resolved.getOrDefault(field, "");
	}

	public void record(String field, String value) {
		if (value != null && !value.isEmpty()) {
			resolved.put(field, value);
		}
	}
}
