package my.fundextractor.app.normalize;

import my.fundextractor.app.config.ExtractionProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ValueRulesTest {
	private final ValueRules rules = new ValueRules(ExtractionProperties.defaults());

	@Test
	void nav_rejectsValuesOutsideBounds() {
		ValueRule nav = rules.nav();

		assertThat(nav.validator().accepts("99999.00")).isFalse();
		assertThat(nav.validator().accepts("0.50")).isFalse();
		assertThat(nav.validator().accepts("1,234.50")).isTrue();
		assertThat(nav.normalizer().normalize("1,234.50")).isEqualTo("₹1234.50");
	}

	@Test
	void aum_keepsGroupingAndDropsTrailingZeros() {
		ValueRule aum = rules.aum();

		assertThat(aum.validator().accepts("48,870.60")).isTrue();
		assertThat(aum.normalizer().normalize("48,870.60")).isEqualTo("₹48,870.6Cr");
		assertThat(aum.normalizer().normalize("100")).isEqualTo("₹100Cr");
		assertThat(aum.validator().accepts("0.05")).isFalse();
	}

	@Test
	void fundSize_formatsCrore() {
		assertThat(rules.fundSize().normalizer().normalize("12,345.670")).isEqualTo("₹12,345.67Cr");
		assertThat(rules.fundSize().validator().accepts("250000")).isTrue();
	}

	@Test
	void fundSize_sharesAumBounds() {
		ValueRule fundSize = rules.fundSize();

		assertThat(fundSize.validator().accepts("0.1")).isTrue();
		assertThat(fundSize.validator().accepts("1,000,000")).isTrue();
		assertThat(fundSize.validator().accepts("0.09")).isFalse();
		assertThat(fundSize.validator().accepts("1000000.5")).isFalse();
	}

	@Test
	void ratios_respectValuationBounds() {
		assertThat(rules.peRatio().validator().accepts("4.9")).isFalse();
		assertThat(rules.peRatio().normalizer().normalize("24.50")).isEqualTo("24.50");
		assertThat(rules.pbRatio().validator().accepts("25")).isFalse();
		assertThat(rules.pbRatio().validator().accepts("3.2")).isTrue();
	}

	@Test
	void rating_acceptsWholeStarsOnly() {
		ValueRule rating = rules.rating();

		assertThat(rating.validator().accepts("4")).isTrue();
		assertThat(rating.validator().accepts("6")).isFalse();
		assertThat(rating.validator().accepts("4.5")).isFalse();
		assertThat(rating.normalizer().normalize("4")).isEqualTo("4");
	}

	@Test
	void lockIn_isExpressedInYears() {
		assertThat(rules.lockIn().validator().accepts("0")).isFalse();
		assertThat(rules.lockIn().normalizer().normalize("3")).isEqualTo("3 years");
	}

	@Test
	void riskLevel_isCanonicalized() {
		ValueRule risk = rules.riskLevel();

		assertThat(risk.normalizer().normalize("very high")).isEqualTo("Very High Risk");
		assertThat(risk.normalizer().normalize("Moderately High Risk")).isEqualTo("Moderately High Risk");
		assertThat(risk.normalizer().normalize("Low to Moderate")).isEqualTo("Low to Moderate Risk");
		assertThat(risk.validator().accepts("Extreme")).isFalse();
	}

	@Test
	void money_keepsDigitsAsWritten() {
		ValueRule money = rules.money();

		assertThat(money.validator().accepts("1,000")).isTrue();
		assertThat(money.normalizer().normalize("1,000")).isEqualTo("₹1,000");
		assertThat(money.validator().accepts("0")).isFalse();
		assertThat(money.validator().accepts("1.5")).isFalse();
	}

	@Test
	void money_keepsSingleRupeeSign() {
		ValueRule money = rules.money();

		assertThat(money.validator().accepts("₹500")).isTrue();
		assertThat(money.normalizer().normalize("₹500")).isEqualTo("₹500");
		assertThat(money.normalizer().normalize("₹ 1,000")).isEqualTo("₹1,000");
		assertThat(money.validator().accepts("₹0")).isFalse();
	}

	@Test
	void percentageAndNumber_keepSign() {
		assertThat(rules.percentage().normalizer().normalize("-2.3")).isEqualTo("-2.3%");
		assertThat(rules.number().normalizer().normalize("-0.45")).isEqualTo("-0.45");
		assertThat(rules.number().validator().accepts("--")).isFalse();
	}

	@Test
	void date_requiresDayMonthYear() {
		assertThat(rules.date().validator().accepts("01 Jan 2024")).isTrue();
		assertThat(rules.date().validator().accepts("2024-01-01")).isFalse();
	}

	@Test
	void freeText_enforcesMinimumAndTruncates() {
		ValueRule freeText = rules.freeText(20);

		assertThat(freeText.validator().accepts("abc")).isFalse();
		assertThat(freeText.normalizer().normalize("Returns are taxed at fifteen percent"))
				.isEqualTo("Returns are taxed...");
	}

	@Test
	void fundName_dropsNavSuffix() {
		ValueRule fundName = rules.fundName();

		assertThat(fundName.normalizer().normalize("XYZ Fund - NAV, Mutual Fund Performance")).isEqualTo("XYZ Fund");
		assertThat(fundName.validator().accepts(" - NAV")).isFalse();
	}

	@Test
	void rank_mustBePositive() {
		assertThat(rules.rank().validator().accepts("0")).isFalse();
		assertThat(rules.rank().normalizer().normalize("12")).isEqualTo("12");
	}
}
