package my.fundextractor.app.strategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A case-insensitive regular expression plus the way a raw value is taken from its first match.
 */
public final class TextPattern {
	private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\d+)}");

	private final Pattern pattern;
	private final Function<MatchResult, String> extractor;

	private TextPattern(String regex, Function<MatchResult, String> extractor) {
		this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
		this.extractor = extractor;
	}

	public static TextPattern group(String regex) {
		return group(regex, 1);
	}

	public static TextPattern group(String regex, int group) {
		return new TextPattern(regex, match -> group <= match.groupCount() ? match.group(group) : null);
	}

	/**
	 * Takes the first group that participated in the match, for alternations with one group per branch.
	 */
	public static TextPattern firstGroup(String regex) {
		return new TextPattern(regex, match -> {
			for (int i = 1; i <= match.groupCount(); i++) {
				if (match.group(i) != null) {
					return match.group(i);
				}
			}
			return null;
		});
	}

	/**
	 * Fills {@code {n}} placeholders in the template with the matched groups.
	 */
	public static TextPattern template(String regex, String template) {
		return new TextPattern(regex, match -> {
			Matcher placeholders = PLACEHOLDER.matcher(template);
			StringBuilder builder = new StringBuilder();
			while (placeholders.find()) {
				int index = Integer.parseInt(placeholders.group(1));
				String value = index <= match.groupCount() ? match.group(index) : null;
				placeholders.appendReplacement(builder, Matcher.quoteReplacement(value == null ? "" : value));
			}
			placeholders.appendTail(builder);
			return builder.toString();
		});
	}

	public Optional<String> find(String text) {
		if (text == null || text.isEmpty()) {
			return Optional.empty();
		}
		Matcher matcher = pattern.matcher(text);
		if (!matcher.find()) {
			return Optional.empty();
		}
		return Optional.ofNullable(extractor.apply(matcher.toMatchResult()));
	}

	public static List<String> findEach(List<TextPattern> patterns, String text) {
		List<String> found = new ArrayList<>();
		for (TextPattern pattern : patterns) {
			pattern.find(text).ifPresent(found::add);
		}
		return found;
	}

	public String regex() {
		return pattern.pattern();
	}
}
