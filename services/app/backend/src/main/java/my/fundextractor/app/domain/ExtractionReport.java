package my.fundextractor.app.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Which strategy produced each resolved field, and which fields every strategy failed to resolve.
 */
public record ExtractionReport(
		Map<String, String> winningStrategies,
		List<String> exhaustedFields,
		boolean pageLooksBlocked
) {
	public ExtractionReport {
		winningStrategies = winningStrategies == null
				? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(winningStrategies));
		exhaustedFields = exhaustedFields == null ? List.of() : List.copyOf(exhaustedFields);
	}

	public int resolvedCount() {
		return winningStrategies.size();
	}
}
