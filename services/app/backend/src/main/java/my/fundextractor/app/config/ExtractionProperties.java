package my.fundextractor.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "extractor")
public record ExtractionProperties(
		@Valid @NotNull Bounds bounds,
		@Valid @NotNull Limits limits,
		@Valid @NotNull Live live
) {
	public static ExtractionProperties defaults() {
		return new ExtractionProperties(
				new Bounds(
						Range.of("1", "10000"),
						Range.of("0.1", "1000000"),
						Range.of("0.1", "1000000"),
						Range.of("5", "100"),
						Range.of("0.1", "20"),
						Range.of("1", "5")
				),
				new Limits(10, 500, 5, 10, 5000, 2000, 0.33, 0.3, 5, 200),
				new Live(Duration.ofMillis(500), Duration.ofSeconds(2), 5)
		);
	}

	public record Bounds(
			@NotNull Range nav,
			@NotNull Range aum,
			@NotNull Range fundSize,
			@NotNull Range peRatio,
			@NotNull Range pbRatio,
			@NotNull Range rating
	) {
	}

	public record Range(
			@NotNull BigDecimal min,
			@NotNull BigDecimal max
	) {
		public static Range of(String min, String max) {
			return new Range(new BigDecimal(min), new BigDecimal(max));
		}

		public boolean contains(BigDecimal value) {
			return value != null && value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
		}
	}

	public record Limits(
			int faqMaxEntries,
			int faqAnswerMaxChars,
			int holdingsLimit,
			int holdingsScanRows,
			int sectionTextCap,
			int objectiveWindowChars,
			double leadingTextFraction,
			double faqTailFraction,
			int freeTextMinChars,
			int freeTextMaxChars
	) {
	}

	public record Live(
			@NotNull Duration settle,
			@NotNull Duration sectionSettle,
			int scrollSteps
	) {
	}
}
