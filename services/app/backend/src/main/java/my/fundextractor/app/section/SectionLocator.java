package my.fundextractor.app.section;

import my.fundextractor.app.config.ExtractionProperties;
import my.fundextractor.app.document.FundDocument;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Component
public class SectionLocator {
	private static final Logger logger = LoggerFactory.getLogger(SectionLocator.class);
	private static final String HEADINGS = "h2, h3, h4, h5, h6";
	private static final String CONTAINERS = "div, section, article";

	private static final List<String> RATIO_MARKERS = List.of("P/E", "Top 5", "Alpha");
	private static final List<String> VALUATION_TERMS = List.of("P/E", "P/B");
	private static final List<String> COMPANION_TERMS = List.of("Top 5", "Alpha", "Beta");

	private final int textCap;

	public SectionLocator(ExtractionProperties properties) {
		this.textCap = properties.limits().sectionTextCap();
	}

	public Optional<Element> locate(FundDocument document, Set<String> hints) {
		return locate(document, SectionQuery.of(hints));
	}

	public Optional<Element> locate(FundDocument document, SectionQuery query) {
		Element body = document.body();
		if (body == null) {
			return Optional.empty();
		}
		Optional<Element> byHeading = locateByHeading(body, query);
		if (byHeading.isPresent()) {
			logger.debug("Section {} located by heading.", query.textHints());
			return byHeading;
		}
		Optional<Element> byAttribute = locateByAttribute(body, query);
		if (byAttribute.isPresent()) {
			logger.debug("Section {} located by class or id.", query.attributeHints());
			return byAttribute;
		}
		Optional<Element> byText = locateByText(body, query);
		byText.ifPresent(section -> logger.debug("Section {} located by text.", query.textHints()));
		return byText;
	}

	/**
	 * The block holding the advanced ratio figures: a container near an "advanced ratios" heading,
	 * otherwise the innermost container or table listing valuation ratios next to risk or concentration figures.
	 */
	public Optional<Element> locateRatios(FundDocument document) {
		Element body = document.body();
		if (body == null) {
			return Optional.empty();
		}
		for (Element heading : body.select("h1, h2, h3, h4, h5, h6, [class~=(?i)heading|title]")) {
			String text = FundDocument.flatten(heading).toLowerCase(Locale.ROOT);
			if (!text.contains("advanced") || !text.contains("ratio")) {
				continue;
			}
			Element parent = heading.parent();
			for (int depth = 0; depth < 5 && parent != null; depth++) {
				if (containsAnyExact(FundDocument.flatten(parent), RATIO_MARKERS)) {
					return Optional.of(parent);
				}
				parent = parent.parent();
			}
		}
		Element best = null;
		int bestLength = Integer.MAX_VALUE;
		for (Element candidate : body.select("div, section, table")) {
			String text = FundDocument.flatten(candidate);
			if (containsAnyExact(text, VALUATION_TERMS) && containsAnyExact(text, COMPANION_TERMS)
					&& text.length() < bestLength) {
				best = candidate;
				bestLength = text.length();
			}
		}
		return Optional.ofNullable(best);
	}

	private Optional<Element> locateByHeading(Element body, SectionQuery query) {
		for (Element heading : body.select(HEADINGS)) {
			String text = FundDocument.flatten(heading).toLowerCase(Locale.ROOT);
			if (containsAny(text, query.textHints())) {
				return Optional.of(container(heading.parent(), heading));
			}
		}
		return Optional.empty();
	}

	private Optional<Element> locateByAttribute(Element body, SectionQuery query) {
		for (Element element : body.getAllElements()) {
			if (element == body) {
				continue;
			}
			String className = element.className().toLowerCase(Locale.ROOT);
			String id = element.id().toLowerCase(Locale.ROOT);
			if (containsAny(className, query.attributeHints()) || containsAny(id, query.attributeHints())) {
				return Optional.of(container(element, element));
			}
		}
		return Optional.empty();
	}

	private Optional<Element> locateByText(Element body, SectionQuery query) {
		for (Element element : body.getAllElements()) {
			if (element == body) {
				continue;
			}
			String own = element.ownText().toLowerCase(Locale.ROOT);
			if (!containsAny(own, query.textHints())) {
				continue;
			}
			if (FundDocument.flatten(element).length() < textCap) {
				return Optional.of(container(element, element));
			}
		}
		return Optional.empty();
	}

	private Element container(Element start, Element matched) {
		Element container = start == null ? null : start.closest(CONTAINERS);
		if (container != null) {
			return container;
		}
		Element parent = matched.parent();
		return parent == null ? matched : parent;
	}

	private boolean containsAnyExact(String text, List<String> terms) {
		for (String term : terms) {
			if (text.contains(term)) {
				return true;
			}
		}
		return false;
	}

	private boolean containsAny(String text, Iterable<String> hints) {
		if (text == null || text.isEmpty()) {
			return false;
		}
		for (String hint : hints) {
			if (text.contains(hint)) {
				return true;
			}
		}
		return false;
	}
}
