package my.fundextractor.app.normalize;

import java.util.Objects;

/**
 * Validation and canonical formatting for one kind of field value.
 */
public record ValueRule(
		String kind,
		CandidateValidator validator,
		CandidateNormalizer normalizer
) {
	public ValueRule {
		Objects.requireNonNull(kind, "kind");
		Objects.requireNonNull(validator, "validator");
		Objects.requireNonNull(normalizer, "normalizer");
	}
}
