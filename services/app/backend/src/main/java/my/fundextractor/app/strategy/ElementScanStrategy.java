package my.fundextractor.app.strategy;

import my.fundextractor.app.document.FundDocument;
import my.fundextractor.app.util.TextCleaning;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs patterns over the text of the first {@code limit} elements matching a selector, skipping
 * elements that mention an excluded term.
 */
public class ElementScanStrategy implements ExtractionStrategy {
	private final String id;
	private final String selector;
	private final int limit;
	private final String excludedTerm;
	private final List<TextPattern> patterns;

	public ElementScanStrategy(String id, String selector, int limit, String excludedTerm, List<TextPattern> patterns) {
		this.id = id;
		this.selector = selector;
		this.limit = limit;
		this.excludedTerm = excludedTerm;
		this.patterns = List.copyOf(patterns);
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public List<String> matches(ExtractionContext context) {
		Element body = context.document().body();
		if (body == null) {
			return List.of();
		}
		List<String> found = new ArrayList<>();
		int scanned = 0;
		for (Element element : body.select(selector)) {
			if (scanned++ >= limit) {
				break;
			}
			String text = FundDocument.flatten(element);
			if (excludedTerm != null && TextCleaning.containsIgnoreCase(text, excludedTerm)) {
				continue;
			}
			found.addAll(TextPattern.findEach(patterns, text));
		}
		return found;
	}
}
