package my.fundextractor.app.strategy;

import my.fundextractor.app.live.LivePage;
import my.fundextractor.app.util.TextCleaning;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads text from a live page, after an optional preparation such as scrolling, and runs patterns over it.
 * Yields nothing when no live page is attached.
 */
public class LivePageStrategy implements ExtractionStrategy {
	private final String id;
	private final Preparation preparation;
	private final Function<LivePage, String> textSource;
	private final List<TextPattern> patterns;

	public LivePageStrategy(String id,
							Preparation preparation,
							Function<LivePage, String> textSource,
							List<TextPattern> patterns) {
		this.id = id;
		this.preparation = preparation;
		this.textSource = textSource;
		this.patterns = List.copyOf(patterns);
	}

	public static LivePageStrategy script(String id, Preparation preparation, String script, List<TextPattern> patterns) {
		return new LivePageStrategy(id, preparation, page -> page.evaluateText(script), patterns);
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public List<String> matches(ExtractionContext context) {
		Optional<LivePage> livePage = context.livePage();
		if (livePage.isEmpty()) {
			return List.of();
		}
		LivePage page = livePage.get();
		preparation.prepare(page);
		String text = TextCleaning.collapseWhitespace(textSource.apply(page));
		return TextPattern.findEach(patterns, text);
	}

	@FunctionalInterface
	public interface Preparation {
		void prepare(LivePage page);

		static Preparation none() {
			return page -> {
			};
		}

		/**
		 * Scrolls from the top to the bottom in equal steps, letting lazily loaded content settle after each.
		 */
		static Preparation scrollThrough(int steps, Duration settle) {
			return page -> {
				page.scrollTo(0.0);
				page.waitFor(settle);
				int count = Math.max(1, steps);
				for (int i = 1; i <= count; i++) {
					page.scrollTo((double) i / count);
					page.waitFor(settle);
				}
			};
		}

		default Preparation andThen(Preparation next) {
			return page -> {
				prepare(page);
				next.prepare(page);
			};
		}
	}
}
