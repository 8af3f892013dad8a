package my.fundextractor.app.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The extracted record for one fund page. Every key is always present; unresolved text fields are empty strings.
 */
@JsonPropertyOrder({"fund_name", "nav", "fund_size", "aum", "faq", "summary", "minimum_investments", "returns",
		"category_info", "cost_and_tax", "top_5_holdings", "advanced_ratios", "source_url", "last_scraped"})
public record FundRecord(
		@JsonProperty("fund_name") String fundName,
		@JsonProperty("nav") Nav nav,
		@JsonProperty("fund_size") String fundSize,
		@JsonProperty("aum") String aum,
		@JsonProperty("faq") List<FaqEntry> faq,
		@JsonProperty("summary") Summary summary,
		@JsonProperty("minimum_investments") MinimumInvestments minimumInvestments,
		@JsonProperty("returns") Returns returns,
		@JsonProperty("category_info") CategoryInfo categoryInfo,
		@JsonProperty("cost_and_tax") CostAndTax costAndTax,
		@JsonProperty("top_5_holdings") List<Holding> top5Holdings,
		@JsonProperty("advanced_ratios") AdvancedRatios advancedRatios,
		@JsonProperty("source_url") String sourceUrl,
		@JsonProperty("last_scraped") String lastScraped
) {
	public FundRecord {
		fundName = text(fundName);
		nav = nav == null ? Nav.EMPTY : nav;
		fundSize = text(fundSize);
		aum = text(aum);
		faq = faq == null ? List.of() : List.copyOf(faq);
		summary = summary == null ? Summary.EMPTY : summary;
		minimumInvestments = minimumInvestments == null ? MinimumInvestments.EMPTY : minimumInvestments;
		returns = returns == null ? Returns.EMPTY : returns;
		categoryInfo = categoryInfo == null ? CategoryInfo.EMPTY : categoryInfo;
		costAndTax = costAndTax == null ? CostAndTax.EMPTY : costAndTax;
		top5Holdings = top5Holdings == null ? List.of() : List.copyOf(top5Holdings);
		advancedRatios = advancedRatios == null ? AdvancedRatios.EMPTY : advancedRatios;
		sourceUrl = text(sourceUrl);
		lastScraped = text(lastScraped);
	}

	private static String text(String value) {
		return value == null ? "" : value;
	}

	@JsonPropertyOrder({"value", "as_of"})
	public record Nav(
			@JsonProperty("value") String value,
			@JsonProperty("as_of") String asOf
	) {
		public static final Nav EMPTY = new Nav("", "");

		public Nav {
			value = text(value);
			asOf = text(asOf);
		}
	}

	@JsonPropertyOrder({"question", "answer"})
	public record FaqEntry(
			@JsonProperty("question") String question,
			@JsonProperty("answer") String answer
	) {
		public FaqEntry {
			question = text(question);
			answer = text(answer);
		}
	}

	@JsonPropertyOrder({"fund_category", "fund_type", "risk_level", "lock_in_period", "rating"})
	public record Summary(
			@JsonProperty("fund_category") String fundCategory,
			@JsonProperty("fund_type") String fundType,
			@JsonProperty("risk_level") String riskLevel,
			@JsonProperty("lock_in_period") String lockInPeriod,
			@JsonProperty("rating") String rating
	) {
		public static final Summary EMPTY = new Summary("", "", "", "", "");

		public Summary {
			fundCategory = text(fundCategory);
			fundType = text(fundType);
			riskLevel = text(riskLevel);
			lockInPeriod = text(lockInPeriod);
			rating = text(rating);
		}
	}

	@JsonPropertyOrder({"min_sip", "min_first_investment", "min_2nd_investment_onwards"})
	public record MinimumInvestments(
			@JsonProperty("min_sip") String minSip,
			@JsonProperty("min_first_investment") String minFirstInvestment,
			@JsonProperty("min_2nd_investment_onwards") String minSecondInvestmentOnwards
	) {
		public static final MinimumInvestments EMPTY = new MinimumInvestments("", "", "");

		public MinimumInvestments {
			minSip = text(minSip);
			minFirstInvestment = text(minFirstInvestment);
			minSecondInvestmentOnwards = text(minSecondInvestmentOnwards);
		}
	}

	@JsonPropertyOrder({"1y", "3y", "5y", "since_inception"})
	public record Returns(
			@JsonProperty("1y") String oneYear,
			@JsonProperty("3y") String threeYears,
			@JsonProperty("5y") String fiveYears,
			@JsonProperty("since_inception") String sinceInception
	) {
		public static final Returns EMPTY = new Returns("", "", "", "");

		public Returns {
			oneYear = text(oneYear);
			threeYears = text(threeYears);
			fiveYears = text(fiveYears);
			sinceInception = text(sinceInception);
		}
	}

	@JsonPropertyOrder({"category", "category_average_annualised", "rank_within_category"})
	public record CategoryInfo(
			@JsonProperty("category") String category,
			@JsonProperty("category_average_annualised") Map<String, String> categoryAverageAnnualised,
			@JsonProperty("rank_within_category") Map<String, Integer> rankWithinCategory
	) {
		public static final CategoryInfo EMPTY = new CategoryInfo("", Map.of(), Map.of());

		public CategoryInfo {
			category = text(category);
			categoryAverageAnnualised = ordered(categoryAverageAnnualised);
			rankWithinCategory = ordered(rankWithinCategory);
		}
	}

	@JsonPropertyOrder({"expense_ratio", "expense_ratio_effective_from", "exit_load", "stamp_duty", "tax_implication"})
	public record CostAndTax(
			@JsonProperty("expense_ratio") String expenseRatio,
			@JsonProperty("expense_ratio_effective_from") String expenseRatioEffectiveFrom,
			@JsonProperty("exit_load") String exitLoad,
			@JsonProperty("stamp_duty") String stampDuty,
			@JsonProperty("tax_implication") String taxImplication
	) {
		public static final CostAndTax EMPTY = new CostAndTax("", "", "", "", "");

		public CostAndTax {
			expenseRatio = text(expenseRatio);
			expenseRatioEffectiveFrom = text(expenseRatioEffectiveFrom);
			exitLoad = text(exitLoad);
			stampDuty = text(stampDuty);
			taxImplication = text(taxImplication);
		}
	}

	@JsonPropertyOrder({"name", "asset_pct"})
	public record Holding(
			@JsonProperty("name") String name,
			@JsonProperty("asset_pct") String assetPct
	) {
		public Holding {
			name = text(name);
			assetPct = text(assetPct);
		}
	}

	@JsonPropertyOrder({"pe_ratio", "pb_ratio", "alpha", "beta", "sharpe_ratio", "sortino_ratio",
			"top_5_weight_pct", "top_20_weight_pct"})
	public record AdvancedRatios(
			@JsonProperty("pe_ratio") String peRatio,
			@JsonProperty("pb_ratio") String pbRatio,
			@JsonProperty("alpha") String alpha,
			@JsonProperty("beta") String beta,
			@JsonProperty("sharpe_ratio") String sharpeRatio,
			@JsonProperty("sortino_ratio") String sortinoRatio,
			@JsonProperty("top_5_weight_pct") String top5WeightPct,
			@JsonProperty("top_20_weight_pct") String top20WeightPct
	) {
		public static final AdvancedRatios EMPTY = new AdvancedRatios("", "", "", "", "", "", "", "");

		public AdvancedRatios {
			peRatio = text(peRatio);
			pbRatio = text(pbRatio);
			alpha = text(alpha);
			beta = text(beta);
			sharpeRatio = text(sharpeRatio);
			sortinoRatio = text(sortinoRatio);
			top5WeightPct = text(top5WeightPct);
			top20WeightPct = text(top20WeightPct);
		}
	}

	private static <V> Map<String, V> ordered(Map<String, V> values) {
		if (values == null || values.isEmpty()) {
			return Map.of();
		}
		return Collections.unmodifiableMap(new LinkedHashMap<>(values));
	}
}
