package my.fundextractor.app.service;

import my.fundextractor.app.domain.FundRecord;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;

import java.util.List;

/**
 * Serializes records the way downstream consumers read them: a JSON array holding the single record,
 * pretty printed, with non-ASCII text left unescaped.
 */
@Component
public class FundRecordJsonWriter {
	private final ObjectMapper objectMapper;

	public FundRecordJsonWriter() {
		this.objectMapper = JsonMapper.builder()
				.enable(SerializationFeature.INDENT_OUTPUT)
				.build();
	}

	public String toJsonArray(FundRecord record) {
		try {
			return objectMapper.writeValueAsString(List.of(record));
		} catch (JacksonException ex) {
			throw new IllegalStateException("Failed to serialize fund record for " + record.sourceUrl(), ex);
		}
	}
}
