package my.fundextractor.app.service;

import my.fundextractor.app.domain.FundRecord;
import my.fundextractor.app.support.ExtractorFixtures;
import org.junit.jupiter.api.Test;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FundRecordJsonWriterTest {
	private final FundRecordJsonWriter writer = new FundRecordJsonWriter();

	@Test
	void toJsonArray_writesSingleRecordArrayInFieldOrder() {
		FundRecord record = ExtractorFixtures.assembler().buildRecord(ExtractorFixtures.parse(
				ExtractorFixtures.page("XYZ Fund - NAV", "<div>Latest NAV as of 01 Jan 2024 ₹145.20</div>")),
				null, ExtractorFixtures.FUND_URL);

		String json = writer.toJsonArray(record);
		List<Map<String, Object>> parsed = JsonMapper.builder().build()
				.readValue(json, new TypeReference<List<Map<String, Object>>>() {
				});

		assertThat(json).startsWith("[").contains("\n").contains("₹145.20");
		assertThat(parsed).hasSize(1);
		Map<String, Object> fund = parsed.get(0);
		assertThat(fund.keySet()).containsExactly("fund_name", "nav", "fund_size", "aum", "faq", "summary",
				"minimum_investments", "returns", "category_info", "cost_and_tax", "top_5_holdings",
				"advanced_ratios", "source_url", "last_scraped");
		assertThat(fund).containsEntry("fund_name", "XYZ Fund").containsEntry("fund_size", "");
		assertThat(fund.get("nav")).isEqualTo(Map.of("value", "₹145.20", "as_of", "01 Jan 2024"));
		assertThat(fund.get("faq")).isEqualTo(List.of());
	}

	@Test
	void toJsonArray_usesSnakeCaseNestedKeys() {
		FundRecord record = new FundRecord("XYZ Fund", null, "", "", null, null, null,
				new FundRecord.Returns("24.1%", "", "", ""),
				new FundRecord.CategoryInfo("Equity", Map.of("1y", "21.0%"), Map.of("1y", 3)),
				null, List.of(new FundRecord.Holding("HDFC Bank Ltd.", "8.21%")), null, "", "");

		String json = writer.toJsonArray(record);

		assertThat(json).contains("\"min_2nd_investment_onwards\"", "\"since_inception\"",
				"\"category_average_annualised\"", "\"rank_within_category\"", "\"asset_pct\"",
				"\"top_20_weight_pct\"", "\"1y\"");
	}
}
