package my.fundextractor.app.strategy;

import my.fundextractor.app.table.ExtractedTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs patterns over the whole text of tables that mention a term from each required group.
 */
public class TableTextStrategy implements ExtractionStrategy {
	private final String id;
	private final List<List<String>> requiredGroups;
	private final List<TextPattern> patterns;

	public TableTextStrategy(String id, List<List<String>> requiredGroups, List<TextPattern> patterns) {
		this.id = id;
		this.requiredGroups = List.copyOf(requiredGroups);
		this.patterns = List.copyOf(patterns);
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public List<String> matches(ExtractionContext context) {
		List<String> found = new ArrayList<>();
		for (ExtractedTable table : context.tables()) {
			boolean qualifies = requiredGroups.stream().allMatch(table::mentionsAny);
			if (qualifies) {
				found.addAll(TextPattern.findEach(patterns, table.searchableText()));
			}
		}
		return found;
	}
}
