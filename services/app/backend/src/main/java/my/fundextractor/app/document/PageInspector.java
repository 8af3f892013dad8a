package my.fundextractor.app.document;

import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class PageInspector {
	private static final Logger logger = LoggerFactory.getLogger(PageInspector.class);
	private static final List<String> BLOCKED_TITLE_TERMS = List.of("blocked", "access denied", "captcha");
	private static final String CONTENT_CONTAINERS =
			"main, div[class~=(?i)fund|scheme|details]";
	private static final String DATA_MARKERS =
			"table, div[class~=(?i)nav|aum|expense|holding]";

	public boolean isBlockedOrEmpty(FundDocument document) {
		String title = document.title().toLowerCase(Locale.ROOT);
		for (String term : BLOCKED_TITLE_TERMS) {
			if (title.contains(term)) {
				logger.warn("Page title suggests a blocked response: {}", document.title());
				return true;
			}
		}
		Element body = document.body();
		if (body == null) {
			logger.warn("Page has no body.");
			return true;
		}
		boolean hasContainer = !body.select(CONTENT_CONTAINERS).isEmpty();
		boolean hasData = !body.select(DATA_MARKERS).isEmpty();
		if (!hasContainer && !hasData) {
			logger.warn("Page has no fund content containers; it may not have rendered.");
			return true;
		}
		return false;
	}
}
