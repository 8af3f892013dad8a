package my.fundextractor.app.strategy;

import my.fundextractor.app.util.TextCleaning;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Derives a value from fields resolved earlier in the same record rather than from the page.
 */
public class InferenceStrategy implements ExtractionStrategy {
	private final String id;
	private final Function<ExtractionContext, Optional<String>> inference;

	public InferenceStrategy(String id, Function<ExtractionContext, Optional<String>> inference) {
		this.id = id;
		this.inference = inference;
	}

	public static InferenceStrategy copyOf(String id, String field) {
		return new InferenceStrategy(id, context -> {
			String value = context.resolved(field);
			return value.isEmpty() ? Optional.empty() : Optional.of(value);
		});
	}

	public static InferenceStrategy constant(String id, String value) {
		return new InferenceStrategy(id, context -> Optional.of(value));
	}

	/**
	 * Maps the first keyword, in rule order, found in any of the source fields to its value.
	 */
	public static InferenceStrategy keywords(String id,
											 List<String> sourceFields,
											 List<Map.Entry<String, String>> keywordValues) {
		List<Map.Entry<String, String>> rules = List.copyOf(keywordValues);
		return new InferenceStrategy(id, context -> {
			for (Map.Entry<String, String> entry : rules) {
				for (String field : sourceFields) {
					if (TextCleaning.containsIgnoreCase(context.resolved(field), entry.getKey())) {
						return Optional.of(entry.getValue());
					}
				}
			}
			return Optional.empty();
		});
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public List<String> matches(ExtractionContext context) {
		return inference.apply(context).map(List::of).orElse(List.of());
	}
}
