package my.fundextractor.app.service;

import my.fundextractor.app.document.FundDocument;
import my.fundextractor.app.domain.ExtractionOutcome;
import my.fundextractor.app.domain.ExtractionReport;
import my.fundextractor.app.domain.FundRecord;
import my.fundextractor.app.live.LivePage;
import my.fundextractor.app.strategy.ExtractionContext;
import my.fundextractor.app.strategy.FieldChainRunner;
import my.fundextractor.app.strategy.FieldSpec;
import my.fundextractor.app.strategy.ResolvedValue;
import my.fundextractor.app.table.KeyValueExtractor;
import my.fundextractor.app.table.TableExtractor;
import my.fundextractor.app.util.NumberParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import static my.fundextractor.app.service.FieldNames.*;

/**
 * Runs every field chain over one page and composes the results into a fully shaped record.
 */
@Service
public class FundRecordAssembler {
	private static final Logger logger = LoggerFactory.getLogger(FundRecordAssembler.class);
	private static final List<String> AVERAGE_PERIODS = List.of(PERIOD_1Y, PERIOD_3Y, PERIOD_5Y);

	private final FieldCatalog catalog;
	private final FieldChainRunner runner;
	private final TableExtractor tableExtractor;
	private final KeyValueExtractor keyValueExtractor;
	private final FaqExtractor faqExtractor;
	private final HoldingsExtractor holdingsExtractor;
	private final Clock clock;

	public FundRecordAssembler(FieldCatalog catalog,
							   FieldChainRunner runner,
							   TableExtractor tableExtractor,
							   KeyValueExtractor keyValueExtractor,
							   FaqExtractor faqExtractor,
							   HoldingsExtractor holdingsExtractor,
							   Clock clock) {
		this.catalog = catalog;
		this.runner = runner;
		this.tableExtractor = tableExtractor;
		this.keyValueExtractor = keyValueExtractor;
		this.faqExtractor = faqExtractor;
		this.holdingsExtractor = holdingsExtractor;
		this.clock = clock;
	}

	public FundRecord buildRecord(FundDocument document, LivePage livePage, String sourceUrl) {
		return assemble(document, livePage, sourceUrl, false).record();
	}

	public ExtractionOutcome assemble(FundDocument document, LivePage livePage, String sourceUrl, boolean pageLooksBlocked) {
		ExtractionContext context = new ExtractionContext(document, livePage, tableExtractor, keyValueExtractor);
		Map<String, String> values = new LinkedHashMap<>();
		Map<String, String> winners = new LinkedHashMap<>();
		List<String> exhausted = new ArrayList<>();
		for (FieldSpec spec : catalog.fields()) {
			Optional<ResolvedValue> resolved = runner.extract(context, spec);
			if (resolved.isPresent()) {
				values.put(spec.fieldName(), resolved.get().value());
				winners.put(spec.fieldName(), resolved.get().strategyId());
			} else {
				exhausted.add(spec.fieldName());
			}
		}

		List<FundRecord.FaqEntry> faq = listOrEmpty("faq", () -> faqExtractor.extract(context));
		List<FundRecord.Holding> holdings = listOrEmpty("top_5_holdings", () -> holdingsExtractor.extract(context));

		FundRecord record = new FundRecord(
				value(values, FUND_NAME),
				new FundRecord.Nav(value(values, NAV_VALUE), value(values, NAV_AS_OF)),
				value(values, FUND_SIZE),
				value(values, AUM),
				faq,
				new FundRecord.Summary(
						value(values, FUND_CATEGORY),
						value(values, FUND_TYPE),
						value(values, RISK_LEVEL),
						value(values, LOCK_IN_PERIOD),
						value(values, RATING)),
				new FundRecord.MinimumInvestments(
						value(values, MIN_SIP),
						value(values, MIN_FIRST_INVESTMENT),
						value(values, MIN_SECOND_INVESTMENT)),
				new FundRecord.Returns(
						value(values, RETURNS_PREFIX + PERIOD_1Y),
						value(values, RETURNS_PREFIX + PERIOD_3Y),
						value(values, RETURNS_PREFIX + PERIOD_5Y),
						value(values, RETURNS_PREFIX + PERIOD_SINCE_INCEPTION)),
				new FundRecord.CategoryInfo(
						value(values, CATEGORY),
						categoryAverages(values),
						ranks(values)),
				new FundRecord.CostAndTax(
						value(values, EXPENSE_RATIO),
						value(values, EXPENSE_RATIO_EFFECTIVE_FROM),
						value(values, EXIT_LOAD),
						value(values, STAMP_DUTY),
						value(values, TAX_IMPLICATION)),
				holdings,
				new FundRecord.AdvancedRatios(
						value(values, PE_RATIO),
						value(values, PB_RATIO),
						value(values, ALPHA),
						value(values, BETA),
						value(values, SHARPE_RATIO),
						value(values, SORTINO_RATIO),
						value(values, TOP_5_WEIGHT),
						value(values, TOP_20_WEIGHT)),
				sourceUrl,
				LocalDate.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE));

		ExtractionReport report = new ExtractionReport(winners, exhausted, pageLooksBlocked);
		logger.info("Assembled record for {} ({} of {} fields resolved, {} FAQ entries, {} holdings).",
				sourceUrl, report.resolvedCount(), catalog.fields().size(), faq.size(), holdings.size());
		if (logger.isDebugEnabled()) {
			logger.debug("Winning strategies: {}", winners);
			logger.debug("Exhausted fields: {}", exhausted);
		}
		return new ExtractionOutcome(record, report);
	}

	private Map<String, String> categoryAverages(Map<String, String> values) {
		Map<String, String> averages = new LinkedHashMap<>();
		for (String period : AVERAGE_PERIODS) {
			String average = value(values, CATEGORY_AVERAGE_PREFIX + period);
			if (!average.isEmpty()) {
				averages.put(period, average);
			}
		}
		return averages;
	}

	private Map<String, Integer> ranks(Map<String, String> values) {
		Map<String, Integer> ranks = new LinkedHashMap<>();
		for (String period : AVERAGE_PERIODS) {
			Integer rank = NumberParsing.parseInteger(value(values, RANK_PREFIX + period));
			if (rank != null) {
				ranks.put(period, rank);
			}
		}
		return ranks;
	}

	private <T> List<T> listOrEmpty(String field, Supplier<List<T>> extraction) {
		try {
			return extraction.get();
		} catch (RuntimeException ex) {
			logger.warn("Extraction of {} failed: {}", field, ex.getMessage());
			logger.debug("Extraction failure detail", ex);
			return List.of();
		}
	}

	private String value(Map<String, String> values, String field) {
		return values.getOrDefault(field, "");
	}
}
