package my.fundextractor.app.live;

import java.time.Duration;
import java.util.List;

/**
 * A rendered page in a live browser session, optionally supplied alongside the static markup.
 */
public interface LivePage {
	void scrollTo(double fraction);

	void waitFor(Duration duration);

	String evaluateText(String script);

	List<String> querySelectorAllText(String selector);
}
