package my.fundextractor.app.table;

import my.fundextractor.app.document.FundDocument;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Collects label/value pairs from definition lists and label-classed div or span siblings.
 * Keys are lower-cased; the first occurrence of a key wins.
 */
@Component
public class KeyValueExtractor {
	private static final Logger logger = LoggerFactory.getLogger(KeyValueExtractor.class);
	private static final Pattern DIV_LABEL_CLASS = Pattern.compile("label|key|field", Pattern.CASE_INSENSITIVE);
	private static final Pattern SPAN_LABEL_CLASS = Pattern.compile("label|key", Pattern.CASE_INSENSITIVE);
	private static final Pattern SPAN_VALUE_CLASS = Pattern.compile("value|data", Pattern.CASE_INSENSITIVE);
	private static final Set<String> DIV_VALUE_TAGS = Set.of("div", "span", "p");

	public Map<String, String> extractPairs(FundDocument document) {
		Map<String, String> pairs = new LinkedHashMap<>();
		for (Element term : document.tree().select("dt")) {
			Element value = nextSiblingMatching(term, Set.of("dd"), null);
			if (value != null) {
				put(pairs, term, value);
			}
		}
		for (Element label : document.tree().select("div[class]")) {
			if (!DIV_LABEL_CLASS.matcher(label.className()).find()) {
				continue;
			}
			Element value = nextSiblingMatching(label, DIV_VALUE_TAGS, null);
			if (value != null) {
				put(pairs, label, value);
			}
		}
		for (Element label : document.tree().select("span[class]")) {
			if (!SPAN_LABEL_CLASS.matcher(label.className()).find()) {
				continue;
			}
			Element value = nextSiblingMatching(label, Set.of("span"), SPAN_VALUE_CLASS);
			if (value != null) {
				put(pairs, label, value);
			}
		}
		logger.debug("Extracted {} key/value pairs.", pairs.size());
		return pairs;
	}

	private void put(Map<String, String> pairs, Element label, Element value) {
		String key = FundDocument.flatten(label).toLowerCase(Locale.ROOT);
		if (key.isEmpty()) {
			return;
		}
		pairs.putIfAbsent(key, FundDocument.flatten(value));
	}

	private Element nextSiblingMatching(Element element, Set<String> tags, Pattern classPattern) {
		Element sibling = element.nextElementSibling();
		while (sibling != null) {
			if (tags.contains(sibling.normalName())
					&& (classPattern == null || classPattern.matcher(sibling.className()).find())) {
				return sibling;
			}
			sibling = sibling.nextElementSibling();
		}
		return null;
	}
}
