package my.fundextractor.app.service;

import my.fundextractor.app.config.ExtractionProperties;
import my.fundextractor.app.live.LivePage;
import my.fundextractor.app.live.LivePageScripts;
import my.fundextractor.app.normalize.ValueRules;
import my.fundextractor.app.section.SectionLocator;
import my.fundextractor.app.section.SectionQuery;
import my.fundextractor.app.strategy.ElementScanStrategy;
import my.fundextractor.app.strategy.ExtractionStrategy;
import my.fundextractor.app.strategy.FieldSpec;
import my.fundextractor.app.strategy.InferenceStrategy;
import my.fundextractor.app.strategy.KeyValueStrategy;
import my.fundextractor.app.strategy.LabelValueStrategy;
import my.fundextractor.app.strategy.LivePageStrategy;
import my.fundextractor.app.strategy.LivePageStrategy.Preparation;
import my.fundextractor.app.strategy.SectionTextStrategy;
import my.fundextractor.app.strategy.SelectorTextStrategy;
import my.fundextractor.app.strategy.TableLookupStrategy;
import my.fundextractor.app.strategy.TableTextStrategy;
import my.fundextractor.app.strategy.TextPattern;
import my.fundextractor.app.strategy.TextRegexStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static my.fundextractor.app.service.FieldNames.*;

/**
 * The ordered strategy chain for every record field. Fields are listed so that inference strategies
 * only read fields resolved before them.
 */
@Component
public class FieldCatalog {
	private static final Logger logger = LoggerFactory.getLogger(FieldCatalog.class);

	private static final String NAV_DATE = "(\\d+\\s+\\w+\\s+\\d+)";
	private static final String NAV_AMOUNT = "([\\d,]*\\d(?:\\.\\d+)?)";
	private static final String CRORE_AMOUNT = "([\\d,]+\\.?\\d*)\\s*(?:Cr|Crore)";
	private static final String RUPEES = "₹\\s*([\\d,]+)";
	private static final String PERCENT = "(-?[\\d.]+)\\s*%";
	private static final String RISK_LEVELS =
			"Very High|Moderately High|Moderately Low|High|Low to Moderate|Moderate|Low";
	private static final String RISK_SELECTOR = "[class*='risk' i], [id*='risk' i]";

	private static final List<TextPattern> FUND_SIZE_PATTERNS = List.of(
			TextPattern.group("Fund Size[:\\s]+₹\\s*" + CRORE_AMOUNT),
			TextPattern.group("₹\\s*" + CRORE_AMOUNT + ".*?Fund Size"));

	private static final List<TextPattern> AUM_PATTERNS = List.of(
			TextPattern.group("AUM[:\\s]+₹\\s*" + CRORE_AMOUNT),
			TextPattern.group("Assets Under Management[:\\s]+₹\\s*" + CRORE_AMOUNT),
			TextPattern.group("Assets Under Management[:\\s]+" + CRORE_AMOUNT),
			TextPattern.group("AUM[:.\\s]+" + CRORE_AMOUNT),
			TextPattern.group("₹\\s*" + CRORE_AMOUNT + ".*?AUM"),
			TextPattern.group(CRORE_AMOUNT + ".*?Assets Under Management"));

	private static final List<TextPattern> RISK_PATTERNS = List.of(
			TextPattern.group("Risk Level[:\\s]+((?:" + RISK_LEVELS + ")(?:\\s+Risk)?)"),
			TextPattern.group("Riskometer[:\\s]+((?:" + RISK_LEVELS + ")(?:\\s+Risk)?)"),
			TextPattern.group("\\b((?:" + RISK_LEVELS + ")\\s+Risk)\\b"),
			TextPattern.group("Risk[:\\s]+(" + RISK_LEVELS + ")\\b"));

	private static final String LOCK_IN_UNIT = "\\s*(?:years?|yrs?|Y\\b)";
	private static final List<TextPattern> LOCK_IN_PATTERNS = List.of(
			TextPattern.group("Lock[- ]?in(?:\\s+period)?[:\\s]+(\\d+)" + LOCK_IN_UNIT),
			TextPattern.group("(\\d+)" + LOCK_IN_UNIT + "\\s+lock[- ]?in"));

	private static final String EXIT_UNIT = "(days?|months?|years?)";
	private static final List<TextPattern> EXIT_LOAD_PATTERNS = List.of(
			TextPattern.template("Exit load for units in excess of ([\\d.]+)% of the investment[,\\s]+([\\d.]+)% "
							+ "will be charged for redemption within (\\d+)\\s*" + EXIT_UNIT,
					"Exit load for units in excess of {1}% of the investment, {2}% will be charged for redemption within {3} {4}"),
			TextPattern.template("Exit load for units in excess of ([\\d.]+)%[^,]{0,50}?([\\d.]+)%[^,]{0,100}?"
							+ "redemption within (\\d+)\\s*" + EXIT_UNIT,
					"Exit load for units in excess of {1}% of the investment, {2}% will be charged for redemption within {3} {4}"),
			TextPattern.template("Exit load of ([\\d.]+)% if redeemed within (\\d+)\\s*" + EXIT_UNIT,
					"Exit load of {1}% if redeemed within {2} {3}"),
			TextPattern.template("Exit load[:\\s]+([\\d.]+)%[^.]{0,100}?(?:if|within|redeemed|days?|months?|years?)",
					"Exit load of {1}%"),
			TextPattern.template("Exit load[:\\s]+(?:Nil|N/A|None|0%)", "Nil"));

	private static final List<TextPattern> PE_PATTERNS = List.of(
			TextPattern.group("P/E\\s+Ratio[:\\s]+(\\d+\\.?\\d*)"),
			TextPattern.group("\\bPE\\s+Ratio[:\\s]+(\\d+\\.?\\d*)"),
			TextPattern.group("P/E[:\\s]+(\\d+\\.?\\d*)"),
			TextPattern.group("\\bPE[:\\s]+(\\d+\\.?\\d*)"),
			TextPattern.group("Price(?:\\s+to|/)\\s*Earnings(?:\\s+Ratio)?[:\\s]+(\\d+\\.?\\d*)"));

	private static final List<TextPattern> PB_PATTERNS = List.of(
			TextPattern.group("P/B\\s+Ratio[:\\s]+(\\d+\\.?\\d*)"),
			TextPattern.group("\\bPB\\s+Ratio[:\\s]+(\\d+\\.?\\d*)"),
			TextPattern.group("P/B[:\\s]+(\\d+\\.?\\d*)"),
			TextPattern.group("\\bPB[:\\s]+(\\d+\\.?\\d*)"),
			TextPattern.group("Price(?:\\s+to|/)\\s*Book(?:\\s+Value)?(?:\\s+Ratio)?[:\\s]+(\\d+\\.?\\d*)"));

	private static final SectionQuery OBJECTIVE_SECTION = SectionQuery.of(
			List.of("fund objective", "investment objective"), List.of("objective"));
	private static final Set<String> RETURNS_SECTION_HINTS = Set.of("annualised returns", "returns and rankings");

	private final ExtractionProperties properties;
	private final ValueRules rules;
	private final SectionLocator sectionLocator;
	private final List<FieldSpec> fields;

	public FieldCatalog(ExtractionProperties properties, ValueRules rules, SectionLocator sectionLocator) {
		this.properties = properties;
		this.rules = rules;
		this.sectionLocator = sectionLocator;
		this.fields = List.copyOf(buildFields());
		logger.info("Field catalog ready ({} fields).", fields.size());
	}

	public List<FieldSpec> fields() {
		return fields;
	}

	private List<FieldSpec> buildFields() {
		List<FieldSpec> specs = new ArrayList<>();
		specs.add(FieldSpec.of(FUND_NAME, rules.fundName(),
				new SelectorTextStrategy("fund-name-title", "title"),
				new SelectorTextStrategy("fund-name-heading", "h1")));
		specs.add(navValue());
		specs.add(navDate());
		specs.add(fundSize());
		specs.add(aum());
		specs.add(fundCategory());
		specs.add(category());
		specs.add(fundType());
		specs.add(riskLevel());
		specs.add(lockInPeriod());
		specs.add(rating());
		specs.addAll(minimumInvestments());
		specs.add(returns(PERIOD_1Y, "1\\s*Y", 1, List.of("1y", "1 year", "1 yr")));
		specs.add(returns(PERIOD_3Y, "3\\s*Y", 2, List.of("3y", "3 year", "3 yr")));
		specs.add(returns(PERIOD_5Y, "5\\s*Y", 3, List.of("5y", "5 year", "5 yr")));
		specs.add(returns(PERIOD_SINCE_INCEPTION, "(?:All|Since Inception)", 4,
				List.of("all", "since inception", "inception", "max")));
		specs.add(categoryAverage(PERIOD_1Y, "1\\s*Y", 1, List.of("1y", "1 year", "1 yr")));
		specs.add(categoryAverage(PERIOD_3Y, "3\\s*Y", 2, List.of("3y", "3 year", "3 yr")));
		specs.add(categoryAverage(PERIOD_5Y, "5\\s*Y", 3, List.of("5y", "5 year", "5 yr")));
		specs.add(rank(PERIOD_1Y, "1\\s*Y", 1, List.of("1y", "1 year", "1 yr")));
		specs.add(rank(PERIOD_3Y, "3\\s*Y", 2, List.of("3y", "3 year", "3 yr")));
		specs.add(rank(PERIOD_5Y, "5\\s*Y", 3, List.of("5y", "5 year", "5 yr")));
		specs.addAll(costAndTax());
		specs.addAll(advancedRatios());
		return specs;
	}

	private FieldSpec navValue() {
		return FieldSpec.of(NAV_VALUE, rules.nav(),
				new LabelValueStrategy("nav-label", "Latest NAV|Current NAV|NAV.*as of", List.of(
						TextPattern.group("as of\\s+\\d+\\s+\\w+\\s+\\d+.*?₹\\s*" + NAV_AMOUNT))),
				TextRegexStrategy.fullText("nav-text", List.of(
						TextPattern.group("Latest NAV.*?as of\\s+\\d+\\s+\\w+\\s+\\d+.*?₹\\s*" + NAV_AMOUNT),
						TextPattern.group("NAV.*?as (?:of|on)\\s+\\d+\\s+\\w+\\s+\\d+.*?₹\\s*" + NAV_AMOUNT),
						TextPattern.group("(?:Latest |Current )?NAV[:\\s]+₹\\s*" + NAV_AMOUNT))));
	}

	private FieldSpec navDate() {
		return FieldSpec.of(NAV_AS_OF, rules.date(),
				new LabelValueStrategy("nav-date-label", "Latest NAV|Current NAV|NAV.*as of", List.of(
						TextPattern.group("as of\\s+" + NAV_DATE + ".*?₹\\s*" + NAV_AMOUNT))),
				TextRegexStrategy.fullText("nav-date-text", List.of(
						TextPattern.group("Latest NAV.*?as of\\s+" + NAV_DATE),
						TextPattern.group("NAV.*?as (?:of|on)\\s+" + NAV_DATE))));
	}

	private FieldSpec fundSize() {
		TextPattern labelled = FUND_SIZE_PATTERNS.get(0);
		return FieldSpec.of(FUND_SIZE, rules.fundSize(),
				LivePageStrategy.script("fund-size-live-top", Preparation.none(),
						LivePageScripts.FUND_SIZE_TOP_TEXT, FUND_SIZE_PATTERNS),
				new ElementScanStrategy("fund-size-top-blocks", "div, section, header", 10,
						"Fund Objective", List.of(labelled)),
				TextRegexStrategy.leading("fund-size-leading-text",
						properties.limits().leadingTextFraction(), List.of(labelled)),
				new LabelValueStrategy("fund-size-label", "Fund Size", List.of(
						TextPattern.group("₹\\s*" + CRORE_AMOUNT))));
	}

	private FieldSpec aum() {
		ExtractionProperties.Live live = properties.live();
		Preparation revealObjective = Preparation.scrollThrough(live.scrollSteps(), live.settle())
				.andThen(page -> page.evaluateText(LivePageScripts.SCROLL_TO_OBJECTIVE))
				.andThen(page -> page.waitFor(live.sectionSettle()));
		int window = properties.limits().objectiveWindowChars();
		List<TextPattern> windowPatterns = AUM_PATTERNS.subList(0, 3);
		return FieldSpec.of(AUM, rules.aum(),
				LivePageStrategy.script("aum-objective-live", revealObjective,
						LivePageScripts.OBJECTIVE_SECTION_TEXT, AUM_PATTERNS),
				new SectionTextStrategy("aum-objective-section",
						document -> sectionLocator.locate(document, OBJECTIVE_SECTION), AUM_PATTERNS, 500),
				TextRegexStrategy.afterAnchor("aum-fund-objective-window", "fund objective", window, windowPatterns),
				TextRegexStrategy.afterAnchor("aum-investment-objective-window", "investment objective", window,
						windowPatterns),
				new LabelValueStrategy("aum-label", "AUM|Assets Under Management", List.of(
						TextPattern.group("₹?\\s*" + CRORE_AMOUNT))),
				TextRegexStrategy.fullText("aum-text", AUM_PATTERNS.subList(0, 4)));
	}

	private FieldSpec fundCategory() {
		TextPattern category = TextPattern.group(
				"Category(?!\\s*(?:average|rank))[:\\s]+([A-Z][^\\n]{5,40}?)(?:\\s|$)");
		return FieldSpec.of(FUND_CATEGORY, rules.freeText(50),
				new KeyValueStrategy("fund-category-pair", "^(?:fund\\s+)?category$", null),
				new LabelValueStrategy("fund-category-label", "Category", List.of(category)),
				TextRegexStrategy.fullText("fund-category-text", List.of(category)));
	}

	private FieldSpec category() {
		return FieldSpec.of(CATEGORY, rules.label(50),
				new LabelValueStrategy("category-label", "Category", List.of(
						TextPattern.group("Category[:\\s]+(Equity\\s+ELSS|ELSS|Equity|Debt|Hybrid)"))),
				TextRegexStrategy.fullText("category-text", List.of(
						TextPattern.group("Category[:\\s]+(Equity\\s+ELSS|Equity\\s+[A-Z]+|ELSS|Debt|Hybrid)"))),
				InferenceStrategy.copyOf("category-from-summary", FUND_CATEGORY));
	}

	private FieldSpec fundType() {
		return FieldSpec.of(FUND_TYPE, rules.label(50),
				InferenceStrategy.keywords("fund-type-from-name", List.of(FUND_NAME, FUND_CATEGORY), List.of(
						Map.entry("ELSS", "ELSS"),
						Map.entry("Large Cap", "Large Cap"),
						Map.entry("Flexi Cap", "Flexi Cap"),
						Map.entry("Mid Cap", "Mid Cap"),
						Map.entry("Small Cap", "Small Cap"))));
	}

	private FieldSpec riskLevel() {
		return FieldSpec.of(RISK_LEVEL, rules.riskLevel(),
				new LivePageStrategy("risk-live", Preparation.none(), FieldCatalog::riskText, RISK_PATTERNS),
				new LabelValueStrategy("risk-label", "Risk", RISK_PATTERNS, 200),
				new ElementScanStrategy("risk-marked-blocks", "[class~=(?i)risk], [id~=(?i)risk]", 20, null,
						RISK_PATTERNS),
				TextRegexStrategy.fullText("risk-text", List.of(
						RISK_PATTERNS.get(0),
						RISK_PATTERNS.get(1),
						TextPattern.group("Category.*?Risk[:\\s]+(Very High|High|Moderate|Low)\\b"),
						RISK_PATTERNS.get(2))),
				InferenceStrategy.keywords("risk-from-category", List.of(FUND_NAME, FUND_CATEGORY), List.of(
						Map.entry("ELSS", "Very High"),
						Map.entry("Equity", "Very High"),
						Map.entry("Debt", "Low"),
						Map.entry("Bond", "Low"),
						Map.entry("Hybrid", "Moderate"))));
	}

	private FieldSpec lockInPeriod() {
		return FieldSpec.of(LOCK_IN_PERIOD, rules.lockIn(),
				TextRegexStrategy.fullText("lock-in-text", LOCK_IN_PATTERNS),
				new LabelValueStrategy("lock-in-label", "Lock[- ]?in", List.of(
						TextPattern.group("(\\d+)" + LOCK_IN_UNIT))),
				InferenceStrategy.keywords("lock-in-elss", List.of(FUND_NAME, FUND_CATEGORY), List.of(
						Map.entry("ELSS", "3"))));
	}

	private FieldSpec rating() {
		TextPattern digits = TextPattern.group("\\b(\\d+)\\b");
		return FieldSpec.of(RATING, rules.rating(),
				new KeyValueStrategy("rating-pair", "rating", digits),
				new LabelValueStrategy("rating-label", "Rating|Star", List.of(digits)));
	}

	private List<FieldSpec> minimumInvestments() {
		String sip = "Min(?:imum)?\\.?\\s*SIP(?:\\s*Amount)?[:\\s]+" + RUPEES;
		String first = "(?:First|1st|Initial)\\s*(?:Investment|Amount)[:\\s]+" + RUPEES;
		String lumpsum = "Min(?:imum)?\\.?\\s*(?:Lumpsum|One[- ]time)(?:\\s*Amount)?[:\\s]+" + RUPEES;
		String second = "(?:Subsequent|2nd|Additional)\\s*(?:Investment|Amount)(?:\\s*onwards)?[:\\s]+" + RUPEES;
		TextPattern amount = TextPattern.group(RUPEES);
		return List.of(
				FieldSpec.of(MIN_SIP, rules.money(),
						LivePageStrategy.script("min-sip-live", Preparation.none(),
								LivePageScripts.INVESTMENT_TEXT, List.of(TextPattern.group(sip))),
						new LabelValueStrategy("min-sip-label", "Min(?:imum)?\\.?\\s*SIP|SIP\\s*Amount", List.of(amount)),
						TextRegexStrategy.fullText("min-sip-text", List.of(
								TextPattern.group(sip),
								TextPattern.group("SIP[:\\s]+" + RUPEES)))),
				FieldSpec.of(MIN_FIRST_INVESTMENT, rules.money(),
						LivePageStrategy.script("min-first-live", Preparation.none(),
								LivePageScripts.INVESTMENT_TEXT,
								List.of(TextPattern.group(first), TextPattern.group(lumpsum))),
						new LabelValueStrategy("min-first-label",
								"(?:First|1st|Initial)\\s*(?:Investment|Amount)|Lumpsum|One[- ]time", List.of(amount)),
						TextRegexStrategy.fullText("min-first-text",
								List.of(TextPattern.group(first), TextPattern.group(lumpsum))),
						InferenceStrategy.copyOf("min-first-from-sip", MIN_SIP)),
				FieldSpec.of(MIN_SECOND_INVESTMENT, rules.money(),
						LivePageStrategy.script("min-second-live", Preparation.none(),
								LivePageScripts.INVESTMENT_TEXT, List.of(TextPattern.group(second))),
						new LabelValueStrategy("min-second-label",
								"(?:Subsequent|2nd|Additional)\\s*(?:Investment|Amount)", List.of(amount)),
						TextRegexStrategy.fullText("min-second-text", List.of(TextPattern.group(second))),
						InferenceStrategy.copyOf("min-second-from-sip", MIN_SIP)));
	}

	private FieldSpec returns(String period, String periodLabel, int column, List<String> columnTerms) {
		String rowRegex = "Fund returns\\s+" + PERCENT + "\\s+" + PERCENT + "\\s+" + PERCENT + "\\s+" + PERCENT;
		TextPattern rowColumn = TextPattern.group(rowRegex, column);
		return FieldSpec.of(RETURNS_PREFIX + period, rules.percentage(),
				new TableLookupStrategy("returns-table-" + period, List.of("return", "1y", "3y"),
						"fund return", columnTerms, TextPattern.group(PERCENT)),
				new SectionTextStrategy("returns-section-" + period,
						document -> sectionLocator.locate(document, RETURNS_SECTION_HINTS), List.of(rowColumn), 1000),
				TextRegexStrategy.fullText("returns-text-" + period, List.of(
						rowColumn,
						TextPattern.group("Fund returns.*?\\b" + periodLabel + "[:\\s]+" + PERCENT),
						TextPattern.group("\\b" + periodLabel + "[:\\s]+" + PERCENT))));
	}

	private FieldSpec categoryAverage(String period, String periodLabel, int column, List<String> columnTerms) {
		String rowRegex = "Category average\\s+" + PERCENT + "\\s+" + PERCENT + "\\s+" + PERCENT;
		return FieldSpec.of(CATEGORY_AVERAGE_PREFIX + period, rules.percentage(),
				new TableLookupStrategy("category-average-table-" + period, List.of("return", "category"),
						"category average", columnTerms, TextPattern.group(PERCENT)),
				TextRegexStrategy.fullText("category-average-text-" + period, List.of(
						TextPattern.group(rowRegex, column),
						TextPattern.group("Category average.*?\\b" + periodLabel + "[:\\s]+" + PERCENT))));
	}

	private FieldSpec rank(String period, String periodLabel, int column, List<String> columnTerms) {
		return FieldSpec.of(RANK_PREFIX + period, rules.rank(),
				new TableLookupStrategy("rank-table-" + period, List.of("rank"),
						"rank", columnTerms, TextPattern.group("\\b(\\d+)\\b")),
				TextRegexStrategy.fullText("rank-text-" + period, List.of(
						TextPattern.group("Rank.*?category\\s+(\\d+)\\s+(\\d+)\\s+(\\d+)", column),
						TextPattern.group("Rank.*?\\b" + periodLabel + "[:\\s]+(\\d+)"))));
	}

	private List<FieldSpec> costAndTax() {
		TextPattern percent = TextPattern.group("([\\d.]+)\\s*%");
		TextPattern taxSentence = TextPattern.group(
				"((?:If you redeem|Returns are taxed|taxed at)(?:[^\\n]{20,200}?\\.(?=\\s|$)|[^\\n]{20,200}))");
		return List.of(
				FieldSpec.of(EXPENSE_RATIO, rules.percentage(),
						new KeyValueStrategy("expense-ratio-pair", "expense ratio", percent),
						new LabelValueStrategy("expense-ratio-label", "Expense Ratio", List.of(percent)),
						TextRegexStrategy.fullText("expense-ratio-text", List.of(
								TextPattern.group("(?:Total\\s+)?Expense Ratio[:\\s]+(?:\\(TER\\)\\s*)?([\\d.]+)\\s*%")))),
				FieldSpec.of(EXPENSE_RATIO_EFFECTIVE_FROM, rules.date(),
						TextRegexStrategy.fullText("expense-ratio-date-text", List.of(TextPattern.group(
								"Expense ratio.{0,80}?(?:effective from|w\\.e\\.f\\.?|as on|as of)\\s*"
										+ "(\\d{1,2}\\s+[A-Za-z]+\\s+\\d{4})"))),
						InferenceStrategy.copyOf("expense-ratio-date-from-nav", NAV_AS_OF)),
				FieldSpec.of(EXIT_LOAD, rules.exitLoad(),
						LivePageStrategy.script("exit-load-live", Preparation.none(),
								LivePageScripts.EXIT_LOAD_TEXT, EXIT_LOAD_PATTERNS),
						new LabelValueStrategy("exit-load-label", "Exit load", EXIT_LOAD_PATTERNS, 1000),
						TextRegexStrategy.fullText("exit-load-text", EXIT_LOAD_PATTERNS),
						InferenceStrategy.constant("exit-load-default", "Nil")),
				FieldSpec.of(STAMP_DUTY, rules.percentage(),
						new LabelValueStrategy("stamp-duty-label", "Stamp duty", List.of(percent)),
						TextRegexStrategy.fullText("stamp-duty-text", List.of(
								TextPattern.group("Stamp duty[:\\s]+([\\d.]+)\\s*%")))),
				FieldSpec.of(TAX_IMPLICATION, rules.freeText(),
						new LabelValueStrategy("tax-label", "Tax", List.of(taxSentence), 500),
						TextRegexStrategy.fullText("tax-text", List.of(
								TextPattern.group("Tax implication[:\\s]+([^\\n]{20,200})"),
								taxSentence))));
	}

	private List<FieldSpec> advancedRatios() {
		List<FieldSpec> specs = new ArrayList<>();
		specs.add(FieldSpec.of(PE_RATIO, rules.peRatio(),
				ratioStrategies("pe", PE_PATTERNS, List.of("p/e", "pe ratio", "price to earnings"),
						"P/E|PE Ratio|Price to Earnings")));
		specs.add(FieldSpec.of(PB_RATIO, rules.pbRatio(),
				ratioStrategies("pb", PB_PATTERNS, List.of("p/b", "pb ratio", "price to book"),
						"P/B|PB Ratio|Price to Book")));
		specs.add(FieldSpec.of(ALPHA, rules.number(), ratioStrategies("alpha",
				List.of(TextPattern.group("Alpha[:\\s]+(-?[\\d.]+)")), List.of("alpha"), null)));
		specs.add(FieldSpec.of(BETA, rules.number(), ratioStrategies("beta",
				List.of(TextPattern.group("Beta[:\\s]+(-?[\\d.]+)")), List.of("beta"), null)));
		specs.add(FieldSpec.of(SHARPE_RATIO, rules.number(), ratioStrategies("sharpe",
				List.of(TextPattern.group("Sharpe(?:\\s+Ratio)?[:\\s]+(-?[\\d.]+)")), List.of("sharpe"), null)));
		specs.add(FieldSpec.of(SORTINO_RATIO, rules.number(), ratioStrategies("sortino",
				List.of(TextPattern.group("Sortino(?:\\s+Ratio)?[:\\s]+(-?[\\d.]+)")), List.of("sortino"), null)));
		specs.add(FieldSpec.of(TOP_5_WEIGHT, rules.percentage(), weightStrategies("top-5", "5")));
		specs.add(FieldSpec.of(TOP_20_WEIGHT, rules.percentage(), weightStrategies("top-20", "20")));
		return specs;
	}

	private ExtractionStrategy[] ratioStrategies(String name,
												 List<TextPattern> patterns,
												 List<String> tableTerms,
												 String labelRegex) {
		List<ExtractionStrategy> strategies = new ArrayList<>();
		strategies.add(LivePageStrategy.script(name + "-live", Preparation.none(),
				LivePageScripts.ADVANCED_RATIOS_TEXT, patterns));
		strategies.add(new SectionTextStrategy(name + "-ratios-section", sectionLocator::locateRatios, patterns, 0));
		if (labelRegex != null) {
			strategies.add(new LabelValueStrategy(name + "-label", labelRegex, patterns));
		}
		strategies.add(new TableTextStrategy(name + "-table", List.of(tableTerms), patterns));
		strategies.add(TextRegexStrategy.fullText(name + "-text", patterns));
		return strategies.toArray(new ExtractionStrategy[0]);
	}

	private ExtractionStrategy[] weightStrategies(String name, String count) {
		List<TextPattern> patterns = List.of(TextPattern.group(
				"Top\\s*" + count + "(?:\\s+(?:holdings|stocks))?(?:\\s+weight)?[:\\s]+([\\d.]+)\\s*%"));
		return new ExtractionStrategy[]{
				LivePageStrategy.script(name + "-live", Preparation.none(), LivePageScripts.ADVANCED_RATIOS_TEXT, patterns),
				new SectionTextStrategy(name + "-ratios-section", sectionLocator::locateRatios, patterns, 0),
				new TableLookupStrategy(name + "-table", List.of("top " + count), "top " + count, List.of(),
						TextPattern.group("([\\d.]+)\\s*%")),
				TextRegexStrategy.fullText(name + "-text", patterns)
		};
	}

	private static String riskText(LivePage page) {
		StringBuilder text = new StringBuilder();
		String body = page.evaluateText(LivePageScripts.BODY_TEXT);
		if (body != null) {
			text.append(body);
		}
		for (String marked : page.querySelectorAllText(RISK_SELECTOR)) {
			text.append(' ').append(marked);
		}
		return text.toString();
	}
}
