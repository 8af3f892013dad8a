package my.fundextractor.app.service;

public final class FieldNames {
	public static final String FUND_NAME = "fund_name";
	public static final String NAV_VALUE = "nav.value";
	public static final String NAV_AS_OF = "nav.as_of";
	public static final String FUND_SIZE = "fund_size";
	public static final String AUM = "aum";
	public static final String FUND_CATEGORY = "summary.fund_category";
	public static final String FUND_TYPE = "summary.fund_type";
	public static final String RISK_LEVEL = "summary.risk_level";
	public static final String LOCK_IN_PERIOD = "summary.lock_in_period";
	public static final String RATING = "summary.rating";
	public static final String MIN_SIP = "minimum_investments.min_sip";
	public static final String MIN_FIRST_INVESTMENT = "minimum_investments.min_first_investment";
	public static final String MIN_SECOND_INVESTMENT = "minimum_investments.min_2nd_investment_onwards";
	public static final String RETURNS_PREFIX = "returns.";
	public static final String CATEGORY = "category_info.category";
	public static final String CATEGORY_AVERAGE_PREFIX = "category_info.category_average_annualised.";
	public static final String RANK_PREFIX = "category_info.rank_within_category.";
	public static final String EXPENSE_RATIO = "cost_and_tax.expense_ratio";
	public static final String EXPENSE_RATIO_EFFECTIVE_FROM = "cost_and_tax.expense_ratio_effective_from";
	public static final String EXIT_LOAD = "cost_and_tax.exit_load";
	public static final String STAMP_DUTY = "cost_and_tax.stamp_duty";
	public static final String TAX_IMPLICATION = "cost_and_tax.tax_implication";
	public static final String PE_RATIO = "advanced_ratios.pe_ratio";
	public static final String PB_RATIO = "advanced_ratios.pb_ratio";
	public static final String ALPHA = "advanced_ratios.alpha";
	public static final String BETA = "advanced_ratios.beta";
	public static final String SHARPE_RATIO = "advanced_ratios.sharpe_ratio";
	public static final String SORTINO_RATIO = "advanced_ratios.sortino_ratio";
	public static final String TOP_5_WEIGHT = "advanced_ratios.top_5_weight_pct";
	public static final String TOP_20_WEIGHT = "advanced_ratios.top_20_weight_pct";

	public static final String PERIOD_1Y = "1y";
	public static final String PERIOD_3Y = "3y";
	public static final String PERIOD_5Y = "5y";
	public static final String PERIOD_SINCE_INCEPTION = "since_inception";

	private FieldNames() {
	}
}
