package my.fundextractor.app.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Runs a field's strategies in priority order and stops at the first candidate that passes validation.
 */
@Component
public class FieldChainRunner {
	private static final Logger logger = LoggerFactory.getLogger(FieldChainRunner.class);

	public Optional<ResolvedValue> extract(ExtractionContext context, FieldSpec spec) {
		List<ExtractionStrategy> strategies = spec.strategies();
		for (int priority = 0; priority < strategies.size(); priority++) {
			ExtractionStrategy strategy = strategies.get(priority);
			List<String> matches;
			try {
				matches = strategy.matches(context);
			} catch (RuntimeException ex) {
				logger.warn("Strategy {} failed for field {}: {}", strategy.id(), spec.fieldName(), ex.getMessage());
				logger.debug("Strategy failure detail", ex);
				continue;
			}
			if (matches == null) {
				continue;
			}
			for (String raw : matches) {
				Candidate candidate = new Candidate(raw, strategy.id(), priority);
				Optional<ResolvedValue> resolved = accept(spec, candidate);
				if (resolved.isPresent()) {
					context.record(spec.fieldName(), resolved.get().value());
					return resolved;
				}
			}
		}
		logger.debug("No strategy resolved field {}.", spec.fieldName());
		return Optional.empty();
	}

	private Optional<ResolvedValue> accept(FieldSpec spec, Candidate candidate) {
		if (candidate.rawText() == null || candidate.rawText().isBlank()) {
			return Optional.empty();
		}
		String raw = candidate.rawText().trim();
		if (!spec.validator().accepts(raw)) {
			logger.debug("Rejected {} candidate '{}' from {}.", spec.fieldName(), raw, candidate.strategyId());
			return Optional.empty();
		}
		String normalized = spec.normalizer().normalize(raw);
		if (normalized == null || normalized.isBlank()) {
			return Optional.empty();
		}
		logger.debug("Resolved {}='{}' via {} (priority {}).",
				spec.fieldName(), normalized, candidate.strategyId(), candidate.priority());
		return Optional.of(new ResolvedValue(spec.fieldName(), normalized, candidate.strategyId()));
	}
}
