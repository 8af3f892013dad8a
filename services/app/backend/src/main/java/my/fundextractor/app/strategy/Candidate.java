package my.fundextractor.app.strategy;

public record Candidate(
		String rawText,
		String strategyId,
		int priority
) {
}
