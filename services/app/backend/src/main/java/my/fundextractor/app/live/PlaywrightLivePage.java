package my.fundextractor.app.live;

import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

public class PlaywrightLivePage implements LivePage {
	private static final Logger logger = LoggerFactory.getLogger(PlaywrightLivePage.class);

	private final Page page;

	public PlaywrightLivePage(Page page) {
		this.page = Objects.requireNonNull(page, "page");
	}

	@Override
	public void scrollTo(double fraction) {
		double clamped = Math.max(0.0, Math.min(1.0, fraction));
		String script = String.format(Locale.ROOT,
				"() => window.scrollTo(0, document.body.scrollHeight * %.4f)", clamped);
		try {
			page.evaluate(script);
		} catch (PlaywrightException ex) {
			throw new LivePageException("Failed to scroll live page", ex);
		}
	}

	@Override
	public void waitFor(Duration duration) {
		if (duration == null || duration.isZero() || duration.isNegative()) {
			return;
		}
		page.waitForTimeout(duration.toMillis());
	}

	@Override
	public String evaluateText(String script) {
		try {
			Object result = page.evaluate(script);
			return result == null ? null : result.toString();
		} catch (PlaywrightException ex) {
			throw new LivePageException("Failed to evaluate script on live page", ex);
		}
	}

	@Override
	public List<String> querySelectorAllText(String selector) {
		List<String> texts = new ArrayList<>();
		try {
			for (ElementHandle handle : page.querySelectorAll(selector)) {
				String text = handle.textContent();
				if (text != null && !text.isBlank()) {
					texts.add(text.trim());
				}
			}
		} catch (PlaywrightException ex) {
			throw new LivePageException("Failed to query live page for " + selector, ex);
		}
		logger.debug("Live page returned {} elements for {}.", texts.size(), selector);
		return texts;
	}
}
