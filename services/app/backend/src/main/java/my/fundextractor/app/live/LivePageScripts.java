package my.fundextractor.app.live;

/**
 * Browser-side scripts evaluated on a live page. Each returns plain text (or a JSON string) so that
 * pattern matching stays on the Java side.
 */
public final class LivePageScripts {
	public static final String BODY_TEXT = "() => document.body ? document.body.innerText : ''";

	public static final String FUND_SIZE_TOP_TEXT = """
			() => {
				const topHeight = Math.min(window.innerHeight * 3, document.body.scrollHeight * 0.3);
				let text = '';
				for (const el of document.querySelectorAll('*')) {
					const y = el.getBoundingClientRect().top + window.scrollY;
					if (y > topHeight) {
						continue;
					}
					const content = el.textContent || '';
					if (content.includes('Fund Size') && !content.includes('Fund Objective')) {
						text += ' ' + content;
					}
				}
				return text;
			}
			""";

	public static final String SCROLL_TO_OBJECTIVE = """
			() => {
				for (const el of document.querySelectorAll('h2, h3, h4, h5, h6, div, section')) {
					const text = (el.textContent || '').toLowerCase();
					if (text.includes('fund objective') || text.includes('investment objective')) {
						el.scrollIntoView({ block: 'center' });
						return 'scrolled';
					}
				}
				return '';
			}
			""";

	public static final String OBJECTIVE_SECTION_TEXT = """
			() => {
				const matches = (el) => {
					const text = (el.textContent || '').toLowerCase();
					return text.includes('fund objective') || text.includes('investment objective');
				};
				let section = null;
				for (const header of document.querySelectorAll('h2, h3, h4, h5, h6')) {
					if (matches(header)) {
						section = header.closest('div, section, article, main') || header.parentElement;
						break;
					}
				}
				if (!section) {
					for (const el of document.querySelectorAll('[class*="objective" i], [id*="objective" i]')) {
						if (matches(el)) {
							section = el;
							break;
						}
					}
				}
				if (!section) {
					for (const el of document.querySelectorAll('*')) {
						if (matches(el) && (el.textContent || '').length < 200) {
							section = el.closest('div, section, article') || el.parentElement;
							break;
						}
					}
				}
				if (!section) {
					return '';
				}
				const parentText = section.parentElement ? (section.parentElement.textContent || '') : '';
				return (section.textContent || '') + ' ' + parentText;
			}
			""";

	public static final String INVESTMENT_TEXT = """
			() => {
				let text = document.body.innerText;
				document.querySelectorAll('[class*="investment" i], [class*="minimum" i], [class*="sip" i]').forEach(section => {
					text += ' ' + section.innerText;
				});
				return text;
			}
			""";

	public static final String EXIT_LOAD_TEXT = """
			() => {
				let text = document.body.innerText;
				document.querySelectorAll('[class*="exit" i], [class*="load" i], [id*="exit" i], [class*="cost" i]').forEach(section => {
					let parent = section;
					for (let i = 0; i < 5 && parent; i++) {
						parent = parent.parentElement;
						if (parent) {
							text += ' ' + parent.innerText;
						}
					}
				});
				return text;
			}
			""";

	public static final String ADVANCED_RATIOS_TEXT = """
			() => {
				const has = (text, terms) => terms.some(term => text.includes(term));
				for (const heading of document.querySelectorAll('h1, h2, h3, h4, h5, h6, [class*="heading"], [class*="title"]')) {
					const headingText = heading.innerText.toLowerCase();
					if (headingText.includes('advanced') && headingText.includes('ratio')) {
						let parent = heading.parentElement;
						for (let i = 0; i < 5 && parent; i++) {
							if (has(parent.innerText, ['P/E', 'Top 5', 'Alpha'])) {
								return parent.innerText;
							}
							parent = parent.parentElement;
						}
					}
				}
				for (const section of document.querySelectorAll('div, section, table')) {
					const text = section.innerText;
					if (has(text, ['P/E', 'P/B']) && has(text, ['Top 5', 'Alpha', 'Beta'])) {
						return text;
					}
				}
				return document.body.innerText;
			}
			""";

	public static final String FAQ_JSON = """
			() => {
				const faqs = [];
				const all = Array.from(document.querySelectorAll('*'));
				let section = null;
				for (const el of all) {
					const text = (el.textContent || '').toLowerCase();
					if ((text.includes('frequently asked') || text.includes('faq')) && ['H2', 'H3', 'H4'].includes(el.tagName)) {
						section = el.closest('div, section, article, main') || el.parentElement;
						break;
					}
				}
				if (!section) {
					const accordions = document.querySelectorAll('[class*="accordion" i], [class*="collapse" i], details, summary');
					if (accordions.length > 0) {
						section = accordions[0].closest('div, section, article') || accordions[0].parentElement;
					}
				}
				if (!section) {
					const startY = Math.max(0, document.body.scrollHeight * 0.7);
					const words = ['what', 'how', 'why', 'when', 'where', 'who', 'which', 'can', 'is', 'are', 'does', 'do'];
					for (const el of all) {
						const y = el.getBoundingClientRect().top + window.scrollY;
						const text = (el.textContent || '').trim();
						if (y >= startY && text.includes('?') && text.length > 15 && text.length < 200
								&& words.includes(text.toLowerCase().split(/[\\s?]/)[0])) {
							section = el.closest('div, section, article') || el.parentElement;
							break;
						}
					}
				}
				if (!section) {
					return '[]';
				}
				const selectors = ['h3', 'h4', 'h5', 'h6', 'button[aria-expanded]', 'summary',
					'[class*="question" i]', '[class*="faq" i]', '[role="button"]'];
				const seen = new Set();
				for (const selector of selectors) {
					for (const q of section.querySelectorAll(selector)) {
						const question = (q.textContent || '').trim().replace(/\\s+/g, ' ');
						if (!question.includes('?') || question.length <= 10 || question.length >= 250 || seen.has(question)) {
							continue;
						}
						seen.add(question);
						let answer = q.nextElementSibling ? (q.nextElementSibling.textContent || '').trim() : '';
						if (!answer && q.parentElement && q.parentElement.nextElementSibling) {
							answer = (q.parentElement.nextElementSibling.textContent || '').trim();
						}
						faqs.push({ question: question, answer: answer });
					}
					if (faqs.length > 0) {
						break;
					}
				}
				return JSON.stringify(faqs);
			}
			""";

	private LivePageScripts() {
	}
}
