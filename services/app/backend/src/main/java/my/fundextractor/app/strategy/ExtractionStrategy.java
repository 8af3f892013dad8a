package my.fundextractor.app.strategy;

import java.util.List;

/**
 * One way of finding a raw value on a page. Matches are returned in document order; an empty list
 * means the strategy found nothing.
 */
public interface ExtractionStrategy {
	String id();

	List<String> matches(ExtractionContext context);
}
