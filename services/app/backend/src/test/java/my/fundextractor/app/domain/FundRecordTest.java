package my.fundextractor.app.domain;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FundRecordTest {
	@Test
	void missingPartsBecomeEmptyValues() {
		FundRecord record = new FundRecord(null, null, null, null, null, null, null, null, null, null, null, null,
				null, null);

		assertThat(record.fundName()).isEmpty();
		assertThat(record.nav()).isEqualTo(FundRecord.Nav.EMPTY);
		assertThat(record.faq()).isEmpty();
		assertThat(record.top5Holdings()).isEmpty();
		assertThat(record.costAndTax()).isEqualTo(FundRecord.CostAndTax.EMPTY);
		assertThat(record.sourceUrl()).isEmpty();
	}

	@Test
	void categoryMapsKeepInsertionOrderAndAreReadOnly() {
		Map<String, Integer> ranks = new LinkedHashMap<>();
		ranks.put("5y", 2);
		ranks.put("1y", 3);
		FundRecord.CategoryInfo info = new FundRecord.CategoryInfo(null, null, ranks);
		ranks.put("3y", 9);

		assertThat(info.category()).isEmpty();
		assertThat(info.categoryAverageAnnualised()).isEmpty();
		assertThat(info.rankWithinCategory()).containsExactly(Map.entry("5y", 2), Map.entry("1y", 3));
		assertThatThrownBy(() -> info.rankWithinCategory().put("3y", 1))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void reportCountsResolvedFields() {
		ExtractionReport report = new ExtractionReport(Map.of("fund_name", "fund-name-title"), List.of("aum"), false);

		assertThat(report.resolvedCount()).isEqualTo(1);
		assertThat(report.exhaustedFields()).containsExactly("aum");
	}
}
