package my.fundextractor.app.service;

import my.fundextractor.app.document.DocumentParseException;
import my.fundextractor.app.document.DocumentParser;
import my.fundextractor.app.document.FundDocument;
import my.fundextractor.app.document.PageInspector;
import my.fundextractor.app.domain.ExtractionOutcome;
import my.fundextractor.app.domain.FundRecord;
import my.fundextractor.app.live.LivePage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class FundExtractionService {
	private static final Logger logger = LoggerFactory.getLogger(FundExtractionService.class);

	private final DocumentParser documentParser;
	private final PageInspector pageInspector;
	private final FundRecordAssembler assembler;

	public FundExtractionService(DocumentParser documentParser,
								 PageInspector pageInspector,
								 FundRecordAssembler assembler) {
		this.documentParser = documentParser;
		this.pageInspector = pageInspector;
		this.assembler = assembler;
	}

	public Optional<FundRecord> extract(String html, String sourceUrl) {
		return extract(html, sourceUrl, null);
	}

	public Optional<FundRecord> extract(String html, String sourceUrl, LivePage livePage) {
		return extractWithReport(html, sourceUrl, livePage).map(ExtractionOutcome::record);
	}

	public Optional<ExtractionOutcome> extractWithReport(String html, String sourceUrl, LivePage livePage) {
		FundDocument document;
		try {
			document = documentParser.parse(html, sourceUrl);
		} catch (DocumentParseException ex) {
			logger.warn("Skipping {}: {}", sourceUrl, ex.getMessage());
			return Optional.empty();
		}
		boolean blocked = pageInspector.isBlockedOrEmpty(document);
		if (blocked) {
			logger.warn("Page {} looks blocked or unrendered; extracting what is available.", sourceUrl);
		}
		return Optional.of(assembler.assemble(document, livePage, sourceUrl, blocked));
	}
}
