package my.fundextractor.app.strategy;

import my.fundextractor.app.support.ExtractorFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InferenceStrategyTest {
	private final ExtractionContext context = ExtractorFixtures.context("<html><body></body></html>");

	@Test
	void copyOfReadsResolvedField() {
		InferenceStrategy strategy = InferenceStrategy.copyOf("min-first-from-sip", "min_sip");

		assertThat(strategy.matches(context)).isEmpty();
		context.record("min_sip", "₹500");
		assertThat(strategy.matches(context)).containsExactly("₹500");
	}

	@Test
	void constantAlwaysMatches() {
		assertThat(InferenceStrategy.constant("exit-load-default", "Nil").matches(context)).containsExactly("Nil");
	}

	@Test
	void keywordsFollowRuleOrderAcrossSourceFields() {
		context.record("fund_name", "XYZ Balanced Debt Fund");
		context.record("fund_category", "Hybrid");
		InferenceStrategy strategy = InferenceStrategy.keywords("risk-from-category",
				List.of("fund_name", "fund_category"),
				List.of(Map.entry("Hybrid", "Moderate"), Map.entry("Debt", "Low")));

		assertThat(strategy.matches(context)).containsExactly("Moderate");
	}

	@Test
	void keywordsIgnoreCase() {
		context.record("fund_name", "xyz elss tax saver");
		InferenceStrategy strategy = InferenceStrategy.keywords("lock-in-elss",
				List.of("fund_name"), List.of(Map.entry("ELSS", "3")));

		assertThat(strategy.matches(context)).containsExactly("3");
	}
}
