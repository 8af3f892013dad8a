package my.fundextractor.app.support;

import my.fundextractor.app.live.LivePage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Live page answering scripts and selectors from fixed text, recording scroll positions.
 */
public class StubLivePage implements LivePage {
	private final Map<String, String> scriptResults = new HashMap<>();
	private final Map<String, List<String>> selectorResults = new HashMap<>();
	private final List<Double> scrolls = new ArrayList<>();
	private final List<String> evaluated = new ArrayList<>();

	public StubLivePage onScript(String script, String result) {
		scriptResults.put(script, result);
		return this;
	}

	public StubLivePage onSelector(String selector, List<String> texts) {
		selectorResults.put(selector, texts);
		return this;
	}

	@Override
	public void scrollTo(double fraction) {
		scrolls.add(fraction);
	}

	@Override
	public void waitFor(Duration duration) {
	}

	@Override
	public String evaluateText(String script) {
		evaluated.add(script);
		return scriptResults.getOrDefault(script, "");
	}

	@Override
	public List<String> querySelectorAllText(String selector) {
		return selectorResults.getOrDefault(selector, List.of());
	}

	public List<Double> scrolls() {
		return scrolls;
	}

	public List<String> evaluated() {
		return evaluated;
	}
}
