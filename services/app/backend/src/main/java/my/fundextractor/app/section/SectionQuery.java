package my.fundextractor.app.section;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Hints for locating a named page section. Text hints are matched against heading and element text,
 * attribute hints against class and id values.
 */
public record SectionQuery(
		List<String> textHints,
		List<String> attributeHints
) {
	public SectionQuery {
		textHints = lowerCase(textHints);
		attributeHints = lowerCase(attributeHints);
	}

	public static SectionQuery of(Set<String> hints) {
		Set<String> attributes = new LinkedHashSet<>();
		for (String hint : hints) {
			String lower = hint.toLowerCase(Locale.ROOT).trim();
			attributes.add(lower.replaceAll("\\s+", ""));
			attributes.add(lower.replaceAll("\\s+", "-"));
			attributes.add(lower.replaceAll("\\s+", "_"));
		}
		return new SectionQuery(new ArrayList<>(hints), new ArrayList<>(attributes));
	}

	public static SectionQuery of(List<String> textHints, List<String> attributeHints) {
		return new SectionQuery(textHints, attributeHints);
	}

	private static List<String> lowerCase(List<String> values) {
		if (values == null) {
			return List.of();
		}
		List<String> lowered = new ArrayList<>();
		for (String value : values) {
			if (value != null && !value.isBlank()) {
				lowered.add(value.toLowerCase(Locale.ROOT).trim());
			}
		}
		return List.copyOf(lowered);
	}
}
