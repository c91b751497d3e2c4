package my.loancalculator.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Engine engine,
		@Valid Schedule schedule,
		@Valid Scenarios scenarios,
		@Valid Database database
) {
	public AppProperties {
		engine = engine == null ? new Engine(null, null) : engine;
		schedule = schedule == null ? new Schedule(null) : schedule;
		scenarios = scenarios == null ? new Scenarios(null) : scenarios;
		database = database == null ? new Database(null, null) : database;
	}

	/**
	 * @param precision    significant digits of every engine calculation
	 * @param batchThreads worker threads for batch scenario evaluation
	 */
	public record Engine(
			@Min(10) @Max(100) Integer precision,
			@Min(1) @Max(64) Integer batchThreads
	) {
		public Engine {
			precision = precision == null ? 28 : precision;
			batchThreads = batchThreads == null ? 4 : batchThreads;
		}
	}

	public record Schedule(
			@Min(1) Integer maxRows
	) {
		public Schedule {
			maxRows = maxRows == null ? 120 : maxRows;
		}
	}

	/**
	 * @param maxPerUser saved scenarios kept per user token; zero or less keeps all
	 */
	public record Scenarios(
			Integer maxPerUser
	) {
		public Scenarios {
			maxPerUser = maxPerUser == null ? 10 : maxPerUser;
		}
	}

	public record Database(
			@Min(1) Integer startupTimeoutSeconds,
			@Min(1) Integer startupIntervalSeconds
	) {
		public Database {
			startupTimeoutSeconds = startupTimeoutSeconds == null ? 60 : startupTimeoutSeconds;
			startupIntervalSeconds = startupIntervalSeconds == null ? 5 : startupIntervalSeconds;
		}
	}
}
