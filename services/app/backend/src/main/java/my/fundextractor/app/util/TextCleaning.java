package my.fundextractor.app.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextCleaning {
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private TextCleaning() {
	}

	public static String collapseWhitespace(String value) {
		if (value == null || value.isEmpty()) {
			return "";
		}
		return WHITESPACE.matcher(value.replace('\u00A0', ' ')).replaceAll(" ").trim();
	}

	/**
	 * Collapses whitespace and cuts the text at the last word boundary before {@code maxLength},
	 * appending an ellipsis when anything was cut.
	 */
	public static String clean(String value, int maxLength) {
		String collapsed = collapseWhitespace(value);
		if (collapsed.length() <= maxLength) {
			return collapsed;
		}
		String head = collapsed.substring(0, maxLength);
		int lastSpace = head.lastIndexOf(' ');
		if (lastSpace > 0) {
			head = head.substring(0, lastSpace);
		}
		return head + "...";
	}

	public static boolean containsIgnoreCase(String haystack, String needle) {
		if (haystack == null || needle == null) {
			return false;
		}
		return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
	}
}
