package my.fundextractor.app.domain;

public record ExtractionOutcome(
		FundRecord record,
		ExtractionReport report
) {
}
