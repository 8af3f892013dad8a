package my.fundextractor.app.document;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PageInspectorTest {
	private final DocumentParser parser = new DocumentParser();
	private final PageInspector inspector = new PageInspector();

	@Test
	void blockedTitleIsFlagged() {
		FundDocument document = parser.parse("<html><head><title>Access Denied</title></head>"
				+ "<body><main>Fund details</main></body></html>");

		assertThat(inspector.isBlockedOrEmpty(document)).isTrue();
	}

	@Test
	void pageWithoutContainersIsFlagged() {
		FundDocument document = parser.parse("<html><body><p>Loading...</p></body></html>");

		assertThat(inspector.isBlockedOrEmpty(document)).isTrue();
	}

	@Test
	void fundContainerIsEnough() {
		FundDocument document = parser.parse("<html><body><div class=\"scheme-header\">XYZ Fund</div></body></html>");

		assertThat(inspector.isBlockedOrEmpty(document)).isFalse();
	}

	@Test
	void dataTableIsEnough() {
		FundDocument document = parser.parse("<html><body><table><tr><td>NAV</td></tr></table></body></html>");

		assertThat(inspector.isBlockedOrEmpty(document)).isFalse();
	}
}
