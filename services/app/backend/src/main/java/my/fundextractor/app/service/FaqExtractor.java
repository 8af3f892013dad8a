package my.fundextractor.app.service;

import my.fundextractor.app.config.ExtractionProperties;
import my.fundextractor.app.document.FundDocument;
import my.fundextractor.app.domain.FundRecord.FaqEntry;
import my.fundextractor.app.live.LivePage;
import my.fundextractor.app.live.LivePageScripts;
import my.fundextractor.app.section.SectionLocator;
import my.fundextractor.app.section.SectionQuery;
import my.fundextractor.app.strategy.ExtractionContext;
import my.fundextractor.app.util.TextCleaning;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class FaqExtractor {
	private static final Logger logger = LoggerFactory.getLogger(FaqExtractor.class);
	private static final SectionQuery FAQ_SECTION = SectionQuery.of(
			List.of("frequently asked", "faq"), List.of("faq"));
	private static final String ACCORDION = "[class~=(?i)accordion|collapse], details, summary";
	private static final String CONTAINERS = "div, section, article";
	private static final List<String> QUESTION_SELECTORS = List.of(
			"h3, h4, h5, h6",
			"button[aria-expanded]",
			"summary",
			"[class~=(?i)question]",
			"[class~=(?i)faq]",
			"[role=button]");
	private static final Set<String> QUESTION_WORDS = Set.of(
			"what", "how", "why", "when", "where", "who", "which", "can", "is", "are", "does", "do");
	private static final Pattern SENTENCE_END = Pattern.compile("[.!?]");
	private static final int LIVE_SCROLL_PASSES = 3;

	private final ExtractionProperties properties;
	private final SectionLocator sectionLocator;
	private final ObjectMapper objectMapper;

	public FaqExtractor(ExtractionProperties properties, SectionLocator sectionLocator) {
		this.properties = properties;
		this.sectionLocator = sectionLocator;
		this.objectMapper = JsonMapper.builder()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	public List<FaqEntry> extract(ExtractionContext context) {
		Optional<LivePage> livePage = context.livePage();
		if (livePage.isPresent()) {
			try {
				List<FaqEntry> live = extractLive(livePage.get());
				if (!live.isEmpty()) {
					logger.debug("Extracted {} FAQ entries from the live page.", live.size());
					return live;
				}
			} catch (RuntimeException ex) {
				logger.warn("Live FAQ extraction failed, falling back to static markup: {}", ex.getMessage());
			}
		}
		List<FaqEntry> entries = extractStatic(context.document());
		logger.debug("Extracted {} FAQ entries from static markup.", entries.size());
		return entries;
	}

	List<FaqEntry> extractLive(LivePage page) {
		for (int i = 0; i < LIVE_SCROLL_PASSES; i++) {
			page.scrollTo(1.0);
			page.waitFor(properties.live().sectionSettle());
		}
		String json = page.evaluateText(LivePageScripts.FAQ_JSON);
		if (json == null || json.isBlank()) {
			return List.of();
		}
		List<FaqEntry> parsed;
		try {
			parsed = objectMapper.readValue(json, new TypeReference<List<FaqEntry>>() {
			});
		} catch (JacksonException ex) {
			throw new IllegalStateException("Live FAQ script returned malformed JSON", ex);
		}
		Set<String> seen = new LinkedHashSet<>();
		List<FaqEntry> entries = new ArrayList<>();
		for (FaqEntry entry : parsed) {
			String question = TextCleaning.collapseWhitespace(entry.question());
			if (!isQuestion(question) || !seen.add(question)) {
				continue;
			}
			entries.add(new FaqEntry(question, answerText(entry.answer())));
			if (entries.size() >= properties.limits().faqMaxEntries()) {
				break;
			}
		}
		return entries;
	}

	List<FaqEntry> extractStatic(FundDocument document) {
		Optional<Element> section = locateSection(document);
		if (section.isEmpty()) {
			return List.of();
		}
		int cap = properties.limits().faqMaxEntries();
		Set<String> seen = new LinkedHashSet<>();
		List<FaqEntry> entries = new ArrayList<>();
		for (String selector : QUESTION_SELECTORS) {
			for (Element candidate : section.get().select(selector)) {
				String question = FundDocument.flatten(candidate);
				if (!isQuestion(question) || !seen.add(question)) {
					continue;
				}
				entries.add(new FaqEntry(question, answerText(findAnswer(candidate, question))));
				if (entries.size() >= cap) {
					return entries;
				}
			}
			if (!entries.isEmpty()) {
				break;
			}
		}
		return entries;
	}

	Optional<Element> locateSection(FundDocument document) {
		Optional<Element> named = sectionLocator.locate(document, FAQ_SECTION);
		if (named.isPresent()) {
			return named;
		}
		Element body = document.body();
		if (body == null) {
			return Optional.empty();
		}
		Element accordion = body.selectFirst(ACCORDION);
		if (accordion != null) {
			return Optional.of(containerOf(accordion));
		}
		return locateByPosition(body);
	}

	private Optional<Element> locateByPosition(Element body) {
		Elements all = body.getAllElements();
		int start = (int) Math.floor(all.size() * (1.0 - properties.limits().faqTailFraction()));
		for (int i = Math.max(1, start); i < all.size(); i++) {
			Element element = all.get(i);
			String text = FundDocument.flatten(element);
			if (!text.contains("?") || text.length() <= 15 || text.length() >= 200) {
				continue;
			}
			String firstWord = text.toLowerCase(Locale.ROOT).split("[\\s?]", 2)[0];
			if (QUESTION_WORDS.contains(firstWord)) {
				return Optional.of(containerOf(element));
			}
		}
		return Optional.empty();
	}

	private String findAnswer(Element question, String questionText) {
		Element next = question.nextElementSibling();
		if (next != null) {
			String text = FundDocument.flatten(next);
			if (!text.isEmpty()) {
				return text;
			}
		}
		Element parent = question.parent();
		if (parent == null) {
			return "";
		}
		Element parentNext = parent.nextElementSibling();
		if (parentNext != null) {
			String text = FundDocument.flatten(parentNext);
			if (!text.isEmpty()) {
				return text;
			}
		}
		String parentText = FundDocument.flatten(parent);
		int index = parentText.indexOf(questionText);
		if (index < 0) {
			return "";
		}
		String rest = parentText.substring(index + questionText.length()).trim();
		int nextQuestion = rest.indexOf('?');
		if (nextQuestion > 0) {
			rest = rest.substring(0, nextQuestion).trim();
		}
		return firstSentences(rest, 3);
	}

	private String firstSentences(String text, int count) {
		List<String> sentences = new ArrayList<>();
		for (String sentence : SENTENCE_END.split(text)) {
			String trimmed = sentence.trim();
			if (!trimmed.isEmpty()) {
				sentences.add(trimmed);
			}
			if (sentences.size() >= count) {
				break;
			}
		}
		return sentences.isEmpty() ? "" : String.join(". ", sentences) + ".";
	}

	private String answerText(String answer) {
		return TextCleaning.clean(answer, properties.limits().faqAnswerMaxChars());
	}

	private boolean isQuestion(String text) {
		return text.contains("?") && text.length() > 10 && text.length() < 250;
	}

	private Element containerOf(Element element) {
		Element container = element.closest(CONTAINERS);
		if (container != null) {
			return container;
		}
		Element parent = element.parent();
		return parent == null ? element : parent;
	}
}
