package my.fundextractor.app.normalize;

@FunctionalInterface
public interface CandidateValidator {
	boolean accepts(String raw);

	default CandidateValidator and(CandidateValidator other) {
		return raw -> accepts(raw) && other.accepts(raw);
	}
}
