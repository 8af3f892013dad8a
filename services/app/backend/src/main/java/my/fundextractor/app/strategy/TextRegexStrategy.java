package my.fundextractor.app.strategy;

import my.fundextractor.app.document.FundDocument;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Runs patterns, in order, over the flattened page text or a slice of it.
 */
public class TextRegexStrategy implements ExtractionStrategy {
	private final String id;
	private final Function<FundDocument, String> scope;
	private final List<TextPattern> patterns;

	private TextRegexStrategy(String id, Function<FundDocument, String> scope, List<TextPattern> patterns) {
		this.id = id;
		this.scope = scope;
		this.patterns = List.copyOf(patterns);
	}

	public static TextRegexStrategy fullText(String id, List<TextPattern> patterns) {
		return new TextRegexStrategy(id, FundDocument::text, patterns);
	}

	/**
	 * Only the text following the first occurrence of {@code anchor}, up to {@code length} characters.
	 */
	public static TextRegexStrategy afterAnchor(String id, String anchor, int length, List<TextPattern> patterns) {
		String needle = anchor.toLowerCase(Locale.ROOT);
		return new TextRegexStrategy(id, document -> {
			String text = document.text();
			int index = text.toLowerCase(Locale.ROOT).indexOf(needle);
			if (index < 0) {
				return "";
			}
			return text.substring(index, Math.min(text.length(), index + length));
		}, patterns);
	}

	/**
	 * Only the leading fraction of the page text; short pages are searched whole.
	 */
	public static TextRegexStrategy leading(String id, double fraction, List<TextPattern> patterns) {
		return new TextRegexStrategy(id, document -> {
			String text = document.text();
			if (text.length() <= 100) {
				return text;
			}
			return text.substring(0, (int) (text.length() * fraction));
		}, patterns);
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public List<String> matches(ExtractionContext context) {
		return TextPattern.findEach(patterns, scope.apply(context.document()));
	}
}
