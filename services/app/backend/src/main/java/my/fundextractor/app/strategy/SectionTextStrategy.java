package my.fundextractor.app.strategy;

import my.fundextractor.app.document.FundDocument;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runs patterns over the text of a located page section, widening to the parent when the section is short.
 */
public class SectionTextStrategy implements ExtractionStrategy {
	private final String id;
	private final Function<FundDocument, Optional<Element>> sectionFinder;
	private final List<TextPattern> patterns;
	private final int widenBelowLength;

	public SectionTextStrategy(String id,
							   Function<FundDocument, Optional<Element>> sectionFinder,
							   List<TextPattern> patterns,
							   int widenBelowLength) {
		this.id = id;
		this.sectionFinder = sectionFinder;
		this.patterns = List.copyOf(patterns);
		this.widenBelowLength = widenBelowLength;
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public List<String> matches(ExtractionContext context) {
		Optional<Element> section = sectionFinder.apply(context.document());
		if (section.isEmpty()) {
			return List.of();
		}
		Element element = section.get();
		String text = FundDocument.flatten(element);
		if (text.length() < widenBelowLength && element.parent() != null) {
			text = FundDocument.flatten(element.parent());
		}
		return TextPattern.findEach(patterns, text);
	}
}
