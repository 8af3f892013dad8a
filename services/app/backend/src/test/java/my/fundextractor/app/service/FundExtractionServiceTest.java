package my.fundextractor.app.service;

import my.fundextractor.app.document.DocumentParser;
import my.fundextractor.app.document.FundDocument;
import my.fundextractor.app.document.PageInspector;
import my.fundextractor.app.domain.ExtractionOutcome;
import my.fundextractor.app.domain.ExtractionReport;
import my.fundextractor.app.domain.FundRecord;
import my.fundextractor.app.support.ExtractorFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static my.fundextractor.app.support.ExtractorFixtures.FUND_URL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FundExtractionServiceTest {
	@Mock
	private FundRecordAssembler assembler;

	@Test
	void extract_skipsContentThatIsNotHtml() {
		FundExtractionService service = new FundExtractionService(new DocumentParser(), new PageInspector(), assembler);

		assertThat(service.extract("Access denied", FUND_URL)).isEmpty();
		assertThat(service.extract("", FUND_URL)).isEmpty();
		verify(assembler, never()).assemble(any(), any(), any(), anyBoolean());
	}

	@Test
	void extract_flagsUnrenderedPagesButStillAssembles() {
		FundExtractionService service = new FundExtractionService(new DocumentParser(), new PageInspector(), assembler);
		ExtractionOutcome outcome = new ExtractionOutcome(
				new FundRecord("", null, "", "", null, null, null, null, null, null, null, null, FUND_URL, "2024-01-02"),
				new ExtractionReport(Map.of(), List.of(), true));
		when(assembler.assemble(any(FundDocument.class), isNull(), eq(FUND_URL), eq(true))).thenReturn(outcome);

		Optional<ExtractionOutcome> result = service.extractWithReport("<html><body><p>Loading</p></body></html>",
				FUND_URL, null);

		assertThat(result).contains(outcome);
	}

	@Test
	void extract_returnsRecordForRenderedPage() {
		FundExtractionService service = ExtractorFixtures.service();
		String html = ExtractorFixtures.page("XYZ Fund - NAV, Mutual Fund Performance",
				"<main><div class=\"fund-details\">Latest NAV as of 01 Jan 2024 ₹145.20</div></main>");

		Optional<ExtractionOutcome> outcome = service.extractWithReport(html, FUND_URL, null);

		assertThat(outcome).isPresent();
		assertThat(outcome.get().report().pageLooksBlocked()).isFalse();
		assertThat(outcome.get().record().nav().value()).isEqualTo("₹145.20");
		assertThat(service.extract(html, FUND_URL)).contains(outcome.get().record());
	}
}
