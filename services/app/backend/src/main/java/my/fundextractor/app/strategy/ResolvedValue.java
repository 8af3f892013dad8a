package my.fundextractor.app.strategy;

public record ResolvedValue(
		String field,
		String value,
		String strategyId
) {
}
