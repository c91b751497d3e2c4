package my.loancalculator.app.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class MetricComparisonDto {
	private final String metric;
	private final BigDecimal scenario1;
	private final BigDecimal scenario2;
	private final BigDecimal diff;

	@JsonCreator
	public MetricComparisonDto(@JsonProperty("metric") String metric,
							   @JsonProperty("scenario1") BigDecimal scenario1,
							   @JsonProperty("scenario2") BigDecimal scenario2,
							   @JsonProperty("diff") BigDecimal diff) {
		this.metric = metric;
		this.scenario1 = scenario1;
		this.scenario2 = scenario2;
		this.diff = diff;
	}

	public static MetricComparisonDto of(String metric, BigDecimal scenario1, BigDecimal scenario2) {
		return new MetricComparisonDto(metric, scenario1, scenario2, scenario2.subtract(scenario1));
	}
}
