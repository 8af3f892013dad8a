package my.fundextractor.app.normalize;

import my.fundextractor.app.config.ExtractionProperties;
import my.fundextractor.app.util.NumberParsing;
import my.fundextractor.app.util.TextCleaning;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class ValueRules {
	private static final Pattern FUND_NAME_SUFFIX = Pattern.compile("\\s*-\\s*NAV.*$", Pattern.CASE_INSENSITIVE);
	private static final Pattern DIGITS_WITH_GROUPING = Pattern.compile("\\d[\\d,]*");
	private static final Pattern NAV_DATE = Pattern.compile("\\d{1,2}\\s+[A-Za-z]+\\s+\\d{2,4}");
	private static final List<String> RISK_LEVELS = List.of(
			"Very High", "Moderately High", "High", "Moderate", "Moderately Low", "Low to Moderate", "Low");

	private final ExtractionProperties.Bounds bounds;
	private final int freeTextMin;
	private final int freeTextMax;

	public ValueRules(ExtractionProperties properties) {
		this.bounds = properties.bounds();
		this.freeTextMin = properties.limits().freeTextMinChars();
		this.freeTextMax = properties.limits().freeTextMaxChars();
	}

	public ValueRule nav() {
		return new ValueRule("nav",
				within(bounds.nav()),
				raw -> "₹" + NumberParsing.stripGrouping(raw));
	}

	public ValueRule aum() {
		return new ValueRule("aum", within(bounds.aum()), ValueRules::croreAmount);
	}

	public ValueRule fundSize() {
		return new ValueRule("fund_size", within(bounds.fundSize()), ValueRules::croreAmount);
	}

	public ValueRule peRatio() {
		return new ValueRule("pe_ratio", within(bounds.peRatio()), ValueRules::plainNumber);
	}

	public ValueRule pbRatio() {
		return new ValueRule("pb_ratio", within(bounds.pbRatio()), ValueRules::plainNumber);
	}

	public ValueRule percentage() {
		return new ValueRule("percentage", ValueRules::isNumber, raw -> plainNumber(raw) + "%");
	}

	public ValueRule number() {
		return new ValueRule("number", ValueRules::isNumber, ValueRules::plainNumber);
	}

	/**
	 * Whole rupee amounts; a value already carrying its rupee sign keeps exactly one.
	 */
	public ValueRule money() {
		return new ValueRule("money",
				raw -> {
					String amount = rupeeDigits(raw);
					return DIGITS_WITH_GROUPING.matcher(amount).matches() && isPositive(amount);
				},
				raw -> "₹" + rupeeDigits(raw));
	}

	public ValueRule rank() {
		return new ValueRule("rank",
				raw -> {
					Integer value = NumberParsing.parseInteger(raw);
					return value != null && value >= 1;
				},
				raw -> String.valueOf(NumberParsing.parseInteger(raw)));
	}

	public ValueRule rating() {
		return new ValueRule("rating",
				raw -> {
					Integer value = NumberParsing.parseInteger(raw);
					return value != null && bounds.rating().contains(BigDecimal.valueOf(value));
				},
				raw -> String.valueOf(NumberParsing.parseInteger(raw)));
	}

	public ValueRule lockIn() {
		return new ValueRule("lock_in",
				raw -> {
					Integer value = NumberParsing.parseInteger(raw);
					return value != null && value >= 1;
				},
				raw -> NumberParsing.parseInteger(raw) + " years");
	}

	public ValueRule riskLevel() {
		return new ValueRule("risk_level",
				raw -> canonicalRiskLevel(raw) != null,
				raw -> canonicalRiskLevel(raw) + " Risk");
	}

	public ValueRule date() {
		return new ValueRule("date",
				raw -> raw != null && NAV_DATE.matcher(raw.trim()).matches(),
				TextCleaning::collapseWhitespace);
	}

	public ValueRule freeText() {
		return freeText(freeTextMax);
	}

	public ValueRule freeText(int maxLength) {
		return new ValueRule("free_text",
				raw -> TextCleaning.collapseWhitespace(raw).length() >= freeTextMin,
				raw -> TextCleaning.clean(raw, maxLength));
	}

	/**
	 * Short labels such as a fund type or category name; anything non-blank up to the given length.
	 */
	public ValueRule label(int maxLength) {
		return new ValueRule("label",
				raw -> !TextCleaning.collapseWhitespace(raw).isEmpty(),
				raw -> TextCleaning.clean(raw, maxLength));
	}

	public ValueRule fundName() {
		return new ValueRule("fund_name",
				raw -> !cleanFundName(raw).isEmpty(),
				raw -> TextCleaning.clean(cleanFundName(raw), freeTextMax));
	}

	public ValueRule exitLoad() {
		return new ValueRule("exit_load",
				raw -> !TextCleaning.collapseWhitespace(raw).isEmpty(),
				raw -> TextCleaning.clean(raw, freeTextMax));
	}

	static String croreAmount(String raw) {
		BigDecimal value = NumberParsing.parseDecimal(raw);
		DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.ROOT));
		format.setRoundingMode(RoundingMode.HALF_EVEN);
		String formatted = format.format(value);
		if (formatted.contains(".")) {
			formatted = formatted.replaceAll("0+$", "");
			if (formatted.endsWith(".")) {
				formatted = formatted.substring(0, formatted.length() - 1);
			}
		}
		return "₹" + formatted + "Cr";
	}

	static String plainNumber(String raw) {
		return NumberParsing.stripGrouping(raw);
	}

	static String canonicalRiskLevel(String raw) {
		String collapsed = TextCleaning.collapseWhitespace(raw);
		if (collapsed.isEmpty()) {
			return null;
		}
		String withoutSuffix = collapsed.replaceAll("(?i)\\s*risk$", "");
		for (String level : RISK_LEVELS) {
			if (level.equalsIgnoreCase(withoutSuffix)) {
				return level;
			}
		}
		return null;
	}

	static String rupeeDigits(String raw) {
		if (raw == null) {
			return "";
		}
		String trimmed = raw.trim();
		if (trimmed.startsWith("₹")) {
			trimmed = trimmed.substring(1).trim();
		}
		return trimmed;
	}

	private static boolean isNumber(String raw) {
		return NumberParsing.parseDecimal(raw) != null;
	}

	private static boolean isPositive(String raw) {
		BigDecimal value = NumberParsing.parseDecimal(raw);
		return value != null && value.signum() > 0;
	}

	private static CandidateValidator within(ExtractionProperties.Range range) {
		return raw -> range.contains(NumberParsing.parseDecimal(raw));
	}

	private static String cleanFundName(String raw) {
		String collapsed = TextCleaning.collapseWhitespace(raw);
		return FUND_NAME_SUFFIX.matcher(collapsed).replaceAll("").trim();
	}
}
