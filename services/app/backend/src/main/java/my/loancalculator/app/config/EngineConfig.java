package my.loancalculator.app.config;

import my.loancalculator.app.importer.LoanInputParser;
import my.loancalculator.app.schedule.ScheduleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.MathContext;
import java.math.RoundingMode;

@Configuration
public class EngineConfig {
	private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

	@Bean
	public ScheduleEngine scheduleEngine(AppProperties appProperties) {
		int precision = appProperties.engine().precision();
		logger.info("Schedule engine precision: {} significant digits", precision);
		return new ScheduleEngine(new MathContext(precision, RoundingMode.HALF_EVEN));
	}

	@Bean
	public LoanInputParser loanInputParser() {
		return new LoanInputParser();
	}
}
