package my.fundextractor.app.strategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads values from the page's label/value pairs whose key matches a pattern.
 */
public class KeyValueStrategy implements ExtractionStrategy {
	private final String id;
	private final Pattern key;
	private final TextPattern valuePattern;

	public KeyValueStrategy(String id, String keyRegex, TextPattern valuePattern) {
		this.id = id;
		this.key = Pattern.compile(keyRegex, Pattern.CASE_INSENSITIVE);
		this.valuePattern = valuePattern;
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public List<String> matches(ExtractionContext context) {
		List<String> found = new ArrayList<>();
		for (Map.Entry<String, String> entry : context.keyValues().entrySet()) {
			if (!key.matcher(entry.getKey()).find()) {
				continue;
			}
			if (valuePattern == null) {
				found.add(entry.getValue());
			} else {
				valuePattern.find(entry.getValue()).ifPresent(found::add);
			}
		}
		return found;
	}
}
