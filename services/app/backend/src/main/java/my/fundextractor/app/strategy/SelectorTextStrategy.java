package my.fundextractor.app.strategy;

import my.fundextractor.app.document.FundDocument;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Text of the elements matching a CSS selector, for fields that live in a dedicated element.
 */
public class SelectorTextStrategy implements ExtractionStrategy {
	private final String id;
	private final String selector;

	public SelectorTextStrategy(String id, String selector) {
		this.id = id;
		this.selector = selector;
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public List<String> matches(ExtractionContext context) {
		List<String> texts = new ArrayList<>();
		for (Element element : context.document().tree().select(selector)) {
			String text = FundDocument.flatten(element);
			if (!text.isEmpty()) {
				texts.add(text);
			}
		}
		return texts;
	}
}
