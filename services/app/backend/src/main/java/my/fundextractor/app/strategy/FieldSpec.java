package my.fundextractor.app.strategy;

import my.fundextractor.app.normalize.CandidateNormalizer;
import my.fundextractor.app.normalize.CandidateValidator;
import my.fundextractor.app.normalize.ValueRule;

import java.util.List;
import java.util.Objects;

public record FieldSpec(
		String fieldName,
		List<ExtractionStrategy> strategies,
		CandidateValidator validator,
		CandidateNormalizer normalizer
) {
	public FieldSpec {
		Objects.requireNonNull(fieldName, "fieldName");
		strategies = strategies == null ? List.of() : List.copyOf(strategies);
		Objects.requireNonNull(validator, "validator");
		Objects.requireNonNull(normalizer, "normalizer");
	}

	public static FieldSpec of(String fieldName, ValueRule rule, ExtractionStrategy... strategies) {
		return new FieldSpec(fieldName, List.of(strategies), rule.validator(), rule.normalizer());
	}
}
