package my.fundextractor.app.normalize;

@FunctionalInterface
public interface CandidateNormalizer {
	String normalize(String raw);
}
