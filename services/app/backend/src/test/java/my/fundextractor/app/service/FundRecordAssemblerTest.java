package my.fundextractor.app.service;

import my.fundextractor.app.config.ExtractionProperties;
import my.fundextractor.app.domain.ExtractionOutcome;
import my.fundextractor.app.domain.FundRecord;
import my.fundextractor.app.live.LivePageScripts;
import my.fundextractor.app.normalize.ValueRules;
import my.fundextractor.app.section.SectionLocator;
import my.fundextractor.app.strategy.FieldChainRunner;
import my.fundextractor.app.support.ExtractorFixtures;
import my.fundextractor.app.support.StubLivePage;
import my.fundextractor.app.table.KeyValueExtractor;
import my.fundextractor.app.table.TableExtractor;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static my.fundextractor.app.support.ExtractorFixtures.FUND_URL;
import static my.fundextractor.app.support.ExtractorFixtures.page;
import static my.fundextractor.app.support.ExtractorFixtures.parse;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FundRecordAssemblerTest {
	private static final String NAV_PAGE = page("XYZ Fund - NAV, Mutual Fund Performance",
			"<div>Latest NAV as of 01 Jan 2024 ₹145.20</div>");

	private final FundRecordAssembler assembler = ExtractorFixtures.assembler();

	@Test
	void buildRecord_readsNameAndNav() {
		FundRecord record = assembler.buildRecord(parse(NAV_PAGE), null, FUND_URL);

		assertThat(record.fundName()).isEqualTo("XYZ Fund");
		assertThat(record.nav()).isEqualTo(new FundRecord.Nav("₹145.20", "01 Jan 2024"));
		assertThat(record.sourceUrl()).isEqualTo(FUND_URL);
		assertThat(record.lastScraped()).isEqualTo("2024-01-02");
	}

	@Test
	void buildRecord_fillsDerivedDefaults() {
		FundRecord record = assembler.buildRecord(parse(NAV_PAGE), null, FUND_URL);

		assertThat(record.costAndTax().expenseRatioEffectiveFrom()).isEqualTo("01 Jan 2024");
		assertThat(record.costAndTax().exitLoad()).isEqualTo("Nil");
		assertThat(record.aum()).isEmpty();
		assertThat(record.summary().riskLevel()).isEmpty();
	}

	@Test
	void buildRecord_isDeterministicForSamePage() {
		FundRecord first = assembler.buildRecord(parse(NAV_PAGE), null, FUND_URL);
		FundRecord second = assembler.buildRecord(parse(NAV_PAGE), null, FUND_URL);

		assertThat(second).isEqualTo(first);
	}

	@Test
	void buildRecord_emptyPageStillHasFullShape() {
		FundRecord record = assembler.buildRecord(parse("<html></html>"), null, FUND_URL);

		assertThat(record.fundName()).isEmpty();
		assertThat(record.nav()).isEqualTo(FundRecord.Nav.EMPTY);
		assertThat(record.faq()).isEmpty();
		assertThat(record.summary()).isEqualTo(FundRecord.Summary.EMPTY);
		assertThat(record.minimumInvestments()).isEqualTo(FundRecord.MinimumInvestments.EMPTY);
		assertThat(record.returns()).isEqualTo(FundRecord.Returns.EMPTY);
		assertThat(record.categoryInfo()).isEqualTo(FundRecord.CategoryInfo.EMPTY);
		assertThat(record.costAndTax()).isEqualTo(new FundRecord.CostAndTax("", "", "Nil", "", ""));
		assertThat(record.top5Holdings()).isEmpty();
		assertThat(record.advancedRatios()).isEqualTo(FundRecord.AdvancedRatios.EMPTY);
	}

	@Test
	void assemble_livePageOutranksStaticMarkup() {
		String html = page("XYZ Fund", "<div class=\"fund-header\"><p>Fund Size: ₹200 Cr</p></div>");
		StubLivePage livePage = new StubLivePage().onScript(LivePageScripts.FUND_SIZE_TOP_TEXT, "Fund Size ₹100 Cr");

		ExtractionOutcome live = assembler.assemble(parse(html), livePage, FUND_URL, false);
		ExtractionOutcome offline = assembler.assemble(parse(html), null, FUND_URL, false);

		assertThat(live.record().fundSize()).isEqualTo("₹100Cr");
		assertThat(live.report().winningStrategies()).containsEntry(FieldNames.FUND_SIZE, "fund-size-live-top");
		assertThat(offline.record().fundSize()).isEqualTo("₹200Cr");
		assertThat(offline.report().winningStrategies()).containsEntry(FieldNames.FUND_SIZE, "fund-size-top-blocks");
	}

	@Test
	void assemble_readsAumFromObjectiveSection() {
		String html = page("XYZ Fund", "<div class=\"fund-objective\"><h3>Fund Objective</h3>"
				+ "<p>The scheme seeks long term capital appreciation. AUM: ₹48,870.60 Cr</p></div>");

		ExtractionOutcome outcome = assembler.assemble(parse(html), null, FUND_URL, false);

		assertThat(outcome.record().aum()).isEqualTo("₹48,870.6Cr");
		assertThat(outcome.report().winningStrategies()).containsEntry(FieldNames.AUM, "aum-objective-section");
	}

	@Test
	void assemble_infersSummaryFromCategory() {
		String html = page("XYZ ELSS Tax Saver Fund Direct Growth - NAV, Mutual Fund Performance",
				"<div class=\"details\"><dl><dt>Category</dt><dd>Equity ELSS</dd>"
						+ "<dt>Rating</dt><dd>4</dd><dt>Expense Ratio</dt><dd>0.68%</dd></dl></div>");

		FundRecord record = assembler.buildRecord(parse(html), null, FUND_URL);

		assertThat(record.fundName()).isEqualTo("XYZ ELSS Tax Saver Fund Direct Growth");
		assertThat(record.summary()).isEqualTo(new FundRecord.Summary(
				"Equity ELSS", "ELSS", "Very High Risk", "3 years", "4"));
		assertThat(record.categoryInfo().category()).isEqualTo("Equity ELSS");
		assertThat(record.costAndTax().expenseRatio()).isEqualTo("0.68%");
	}

	@Test
	void assemble_readsReturnsAveragesAndRanksFromTable() {
		String html = page("XYZ Fund", "<section><h2>Annualised returns</h2><table>"
				+ "<thead><tr><th>Name</th><th>1Y</th><th>3Y</th><th>5Y</th><th>All</th></tr></thead><tbody>"
				+ "<tr><td>Fund returns</td><td>24.1%</td><td>18.3%</td><td>20.5%</td><td>16.2%</td></tr>"
				+ "<tr><td>Category average</td><td>21.0%</td><td>15.4%</td><td>17.9%</td><td>-</td></tr>"
				+ "<tr><td>Rank within category</td><td>3</td><td>5</td><td>2</td><td>-</td></tr>"
				+ "</tbody></table></section>");

		FundRecord record = assembler.buildRecord(parse(html), null, FUND_URL);

		assertThat(record.returns()).isEqualTo(new FundRecord.Returns("24.1%", "18.3%", "20.5%", "16.2%"));
		assertThat(record.categoryInfo().categoryAverageAnnualised())
				.containsExactly(Map.entry("1y", "21.0%"), Map.entry("3y", "15.4%"), Map.entry("5y", "17.9%"));
		assertThat(record.categoryInfo().rankWithinCategory())
				.containsExactly(Map.entry("1y", 3), Map.entry("3y", 5), Map.entry("5y", 2));
	}

	@Test
	void assemble_readsAdvancedRatiosBlock() {
		String html = page("XYZ Fund", "<div class=\"ratios\"><h3>Advanced Ratios</h3>"
				+ "<div>P/E Ratio 24.5</div><div>P/B Ratio 3.2</div><div>Alpha 2.1</div><div>Beta 0.92</div>"
				+ "<div>Sharpe 1.15</div><div>Sortino 1.8</div><div>Top 5 38.2%</div><div>Top 20 61.4%</div></div>");

		FundRecord record = assembler.buildRecord(parse(html), null, FUND_URL);

		assertThat(record.advancedRatios()).isEqualTo(new FundRecord.AdvancedRatios(
				"24.5", "3.2", "2.1", "0.92", "1.15", "1.8", "38.2%", "61.4%"));
	}

	@Test
	void assemble_reportsExhaustedFields() {
		ExtractionOutcome outcome = assembler.assemble(parse(NAV_PAGE), null, FUND_URL, true);

		assertThat(outcome.report().pageLooksBlocked()).isTrue();
		assertThat(outcome.report().winningStrategies())
				.containsEntry(FieldNames.FUND_NAME, "fund-name-title")
				.containsEntry(FieldNames.NAV_VALUE, "nav-label")
				.containsEntry(FieldNames.EXIT_LOAD, "exit-load-default");
		assertThat(outcome.report().exhaustedFields()).contains(FieldNames.AUM, FieldNames.PE_RATIO)
				.doesNotContain(FieldNames.FUND_NAME);
	}

	@Test
	void buildRecord_keepsOneDecimalNav() {
		FundRecord record = assembler.buildRecord(parse(page("XYZ Fund",
				"<div>Latest NAV as of 01 Jan 2024 ₹145.2</div>")), null, FUND_URL);
		FundRecord small = assembler.buildRecord(parse(page("XYZ Fund",
				"<div>Latest NAV as of 01 Jan 2024 ₹9.5</div>")), null, FUND_URL);

		assertThat(record.nav()).isEqualTo(new FundRecord.Nav("₹145.2", "01 Jan 2024"));
		assertThat(small.nav().value()).isEqualTo("₹9.5");
	}

	@Test
	void buildRecord_dropsNavOutsideBounds() {
		FundRecord record = assembler.buildRecord(parse(page("XYZ Fund",
				"<div>Latest NAV as of 01 Jan 2024 ₹99999.00</div>")), null, FUND_URL);

		assertThat(record.nav().value()).isEmpty();
		assertThat(record.nav().asOf()).isEqualTo("01 Jan 2024");
	}

	@Test
	void assemble_structuredPairOutranksFreeText() {
		String freeText = "<p>Total Expense Ratio: 1.2% as per the last factsheet</p>";
		String pair = "<dl><dt>Expense Ratio</dt><dd>0.5%</dd></dl>";

		ExtractionOutcome both = assembler.assemble(parse(page("XYZ Fund", freeText + pair)), null, FUND_URL, false);
		ExtractionOutcome textOnly = assembler.assemble(parse(page("XYZ Fund", freeText)), null, FUND_URL, false);

		assertThat(both.record().costAndTax().expenseRatio()).isEqualTo("0.5%");
		assertThat(both.report().winningStrategies()).containsEntry(FieldNames.EXPENSE_RATIO, "expense-ratio-pair");
		assertThat(textOnly.record().costAndTax().expenseRatio()).isEqualTo("1.2%");
	}

	@Test
	void assemble_fallsBackToSipForOtherMinimums() {
		String html = page("XYZ Fund", "<div><span>Min. SIP amount</span><span>₹500</span></div>");

		ExtractionOutcome outcome = assembler.assemble(parse(html), null, FUND_URL, false);

		assertThat(outcome.record().minimumInvestments())
				.isEqualTo(new FundRecord.MinimumInvestments("₹500", "₹500", "₹500"));
		assertThat(outcome.report().winningStrategies())
				.containsEntry(FieldNames.MIN_FIRST_INVESTMENT, "min-first-from-sip")
				.containsEntry(FieldNames.MIN_SECOND_INVESTMENT, "min-second-from-sip");
	}

	@Test
	void buildRecord_acceptsFundSizeAcrossFullRange() {
		assertThat(fundSizeOf("₹150,000 Cr")).isEqualTo("₹150,000Cr");
		assertThat(fundSizeOf("₹0.5 Cr")).isEqualTo("₹0.5Cr");
		assertThat(fundSizeOf("₹1,500,000 Cr")).isEmpty();
	}

	@Test
	void buildRecord_keepsRecordWhenHoldingsExtractionFails() {
		ExtractionProperties properties = ExtractorFixtures.properties();
		SectionLocator sectionLocator = new SectionLocator(properties);
		HoldingsExtractor holdingsExtractor = mock(HoldingsExtractor.class);
		when(holdingsExtractor.extract(any())).thenThrow(new IllegalStateException("table walk failed"));
		FundRecordAssembler failingHoldings = new FundRecordAssembler(
				new FieldCatalog(properties, new ValueRules(properties), sectionLocator),
				new FieldChainRunner(),
				new TableExtractor(),
				new KeyValueExtractor(),
				new FaqExtractor(properties, sectionLocator),
				holdingsExtractor,
				ExtractorFixtures.FIXED_CLOCK);

		FundRecord record = failingHoldings.buildRecord(parse(NAV_PAGE), null, FUND_URL);

		assertThat(record.top5Holdings()).isEmpty();
		assertThat(record.nav()).isEqualTo(new FundRecord.Nav("₹145.20", "01 Jan 2024"));
	}

	private String fundSizeOf(String amount) {
		String html = page("XYZ Fund", "<div class=\"fund-header\"><p>Fund Size: " + amount + "</p></div>");
		return assembler.buildRecord(parse(html), null, FUND_URL).fundSize();
	}
}
