package my.fundextractor.app.util;

import java.math.BigDecimal;
import java.util.regex.Pattern;

public final class NumberParsing {
	private static final Pattern PLAIN_NUMBER = Pattern.compile("[-+]?\\d+(?:\\.\\d+)?");

	private NumberParsing() {
	}

	public static BigDecimal parseDecimal(String token) {
		String cleaned = stripDecorations(token);
		if (cleaned == null) {
			return null;
		}
		String normalized = cleaned.replace(",", "");
		if (normalized.endsWith(".")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		if (!PLAIN_NUMBER.matcher(normalized).matches()) {
			return null;
		}
		try {
			return new BigDecimal(normalized);
		} catch (NumberFormatException ex) {
			return null;
		}
	}

	public static Integer parseInteger(String token) {
		BigDecimal value = parseDecimal(token);
		if (value == null) {
			return null;
		}
		try {
			return value.intValueExact();
		} catch (ArithmeticException ex) {
			return null;
		}
	}

	public static String stripGrouping(String token) {
		String cleaned = stripDecorations(token);
		return cleaned == null ? "" : cleaned.replace(",", "");
	}

	private static String stripDecorations(String token) {
		if (token == null || token.isBlank()) {
			return null;
		}
		String cleaned = token.trim()
				.replace("₹", "")
				.replace("\u00A0", "")
				.replace("\u202F", "")
				.replace(" ", "")
				.replace("%", "");
		if (cleaned.isBlank() || "+".equals(cleaned) || "-".equals(cleaned)) {
			return null;
		}
		return cleaned;
	}
}
