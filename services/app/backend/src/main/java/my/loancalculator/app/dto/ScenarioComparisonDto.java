package my.loancalculator.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Side-by-side metrics of two scenarios; diff is scenario2 minus scenario1.")
public record ScenarioComparisonDto(
		@JsonProperty("scenario1") ScheduleSummaryDto scenario1,
		@JsonProperty("scenario2") ScheduleSummaryDto scenario2,
		@JsonProperty("metrics") List<MetricComparisonDto> metrics
) {
}
