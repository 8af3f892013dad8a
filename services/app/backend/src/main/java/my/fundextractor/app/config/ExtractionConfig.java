package my.fundextractor.app.config;

import my.fundextractor.app.normalize.ValueRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ExtractionProperties.class)
public class ExtractionConfig {
	private static final Logger logger = LoggerFactory.getLogger(ExtractionConfig.class);

	@Bean
	@ConditionalOnMissingBean
	public Clock extractionClock() {
		return Clock.systemDefaultZone();
	}

	@Bean
	public ValueRules valueRules(ExtractionProperties properties) {
		ExtractionProperties.Bounds bounds = properties.bounds();
		logger.info("Value rules configured (nav={}..{}, aum={}..{}, fundSize={}..{}).",
				bounds.nav().min(), bounds.nav().max(),
				bounds.aum().min(), bounds.aum().max(),
				bounds.fundSize().min(), bounds.fundSize().max());
		return new ValueRules(properties);
	}
}
