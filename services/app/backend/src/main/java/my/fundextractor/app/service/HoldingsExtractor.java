package my.fundextractor.app.service;

import my.fundextractor.app.config.ExtractionProperties;
import my.fundextractor.app.domain.FundRecord.Holding;
import my.fundextractor.app.strategy.ExtractionContext;
import my.fundextractor.app.table.ExtractedTable;
import my.fundextractor.app.table.TableRow;
import my.fundextractor.app.util.NumberParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class HoldingsExtractor {
	private static final Logger logger = LoggerFactory.getLogger(HoldingsExtractor.class);
	private static final List<String> TABLE_KEYWORDS = List.of("holding", "stock", "company", "instrument");
	private static final List<String> NAME_TERMS = List.of("name", "company", "stock", "holding", "instrument", "security");
	private static final List<String> PERCENT_TERMS = List.of("weight", "allocation", "%", "percentage", "asset", "pct");
	private static final Set<String> GENERIC_NAMES = Set.of("equity", "debt", "cash", "other", "others");
	private static final Pattern PERCENT = Pattern.compile("([\\d.]+)\\s*%");

	private final int limit;
	private final int scanRows;

	public HoldingsExtractor(ExtractionProperties properties) {
		this.limit = properties.limits().holdingsLimit();
		this.scanRows = properties.limits().holdingsScanRows();
	}

	public List<Holding> extract(ExtractionContext context) {
		List<Holding> holdings = new ArrayList<>();
		for (ExtractedTable table : context.tables()) {
			if (!table.mentionsAny(TABLE_KEYWORDS)) {
				continue;
			}
			List<TableRow> rows = table.rows();
			for (int i = 0; i < rows.size() && i < scanRows; i++) {
				readHolding(rows.get(i)).ifPresent(holdings::add);
			}
			if (holdings.size() >= limit) {
				break;
			}
		}
		List<Holding> top = holdings.size() > limit ? holdings.subList(0, limit) : holdings;
		logger.debug("Extracted {} holdings.", top.size());
		return List.copyOf(top);
	}

	private Optional<Holding> readHolding(TableRow row) {
		String name = null;
		String percent = null;
		if (row.isKeyed()) {
			for (Map.Entry<String, String> entry : row.byHeader().entrySet()) {
				String key = entry.getKey().toLowerCase(Locale.ROOT);
				String value = entry.getValue();
				if (isGeneric(value)) {
					continue;
				}
				if (name == null && containsAny(key, NAME_TERMS) && value.length() > 3) {
					name = value;
				} else if (percent == null && containsAny(key, PERCENT_TERMS)) {
					percent = percentOf(value);
				}
			}
		} else {
			// headerless rows: name first, weight in the first cell carrying a percentage
			name = row.cell(0)
					.filter(value -> value.length() > 3 && !isGeneric(value))
					.orElse(null);
			List<String> cells = row.cells();
			for (int i = 1; i < cells.size() && percent == null; i++) {
				if (PERCENT.matcher(cells.get(i)).find()) {
					percent = percentOf(cells.get(i));
				}
			}
		}
		if (name == null || percent == null) {
			return Optional.empty();
		}
		return Optional.of(new Holding(name, percent));
	}

	private String percentOf(String value) {
		Matcher matcher = PERCENT.matcher(value);
		if (matcher.find() && NumberParsing.parseDecimal(matcher.group(1)) != null) {
			return NumberParsing.stripGrouping(matcher.group(1)) + "%";
		}
		if (NumberParsing.parseDecimal(value) != null) {
			return NumberParsing.stripGrouping(value) + "%";
		}
		return null;
	}

	private boolean isGeneric(String value) {
		return GENERIC_NAMES.contains(value.trim().toLowerCase(Locale.ROOT));
	}

	private boolean containsAny(String text, List<String> terms) {
		for (String term : terms) {
			if (text.contains(term)) {
				return true;
			}
		}
		return false;
	}
}
