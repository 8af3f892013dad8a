package my.fundextractor.app.document;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class DocumentParser {
	private static final Logger logger = LoggerFactory.getLogger(DocumentParser.class);
	private static final Pattern MARKUP = Pattern.compile("<\\s*[a-zA-Z!/]");

	public FundDocument parse(String html) {
		return parse(html, "");
	}

	public FundDocument parse(String html, String baseUri) {
		if (html == null || html.isBlank()) {
			throw new DocumentParseException("Page content is empty");
		}
		if (!MARKUP.matcher(html).find()) {
			throw new DocumentParseException("Page content is not HTML");
		}
		try {
			Document tree = Jsoup.parse(html, baseUri == null ? "" : baseUri);
			FundDocument document = new FundDocument(tree);
			logger.debug("Parsed page (chars={}, textChars={}, title={}).",
					html.length(), document.text().length(), document.title());
			return document;
		} catch (RuntimeException ex) {
			throw new DocumentParseException("Failed to parse page content", ex);
		}
	}
}
