package my.fundextractor.app.strategy;

import my.fundextractor.app.document.FundDocument;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds text nodes carrying a label and reads the value near them: first the labelled element itself,
 * then its next sibling, then the surrounding container.
 */
public class LabelValueStrategy implements ExtractionStrategy {
	private final String id;
	private final Pattern label;
	private final List<TextPattern> valuePatterns;
	private final int contextMinLength;

	public LabelValueStrategy(String id, String labelRegex, List<TextPattern> valuePatterns) {
		this(id, labelRegex, valuePatterns, 0);
	}

	/**
	 * @param contextMinLength the container is widened upwards until its text reaches this length
	 */
	public LabelValueStrategy(String id, String labelRegex, List<TextPattern> valuePatterns, int contextMinLength) {
		this.id = id;
		this.label = Pattern.compile(labelRegex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
		this.valuePatterns = List.copyOf(valuePatterns);
		this.contextMinLength = contextMinLength;
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public List<String> matches(ExtractionContext context) {
		List<String> found = new ArrayList<>();
		for (TextNode node : context.document().textNodesMatching(label)) {
			if (!(node.parent() instanceof Element element)) {
				continue;
			}
			found.addAll(TextPattern.findEach(valuePatterns, FundDocument.flatten(element)));
			Element sibling = element.nextElementSibling();
			if (sibling != null) {
				found.addAll(TextPattern.findEach(valuePatterns, FundDocument.flatten(sibling)));
			}
			Element container = widen(element.parent());
			if (container != null) {
				found.addAll(TextPattern.findEach(valuePatterns, FundDocument.flatten(container)));
			}
		}
		return found;
	}

	private Element widen(Element start) {
		Element current = start;
		while (current != null && contextMinLength > 0
				&& FundDocument.flatten(current).length() < contextMinLength
				&& current.parent() != null) {
			current = current.parent();
		}
		return current;
	}
}
