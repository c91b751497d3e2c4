package my.loancalculator.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

public record ComparisonScenarioDto(
		@JsonProperty("id") String id,
		@JsonProperty("name") String name,
		@JsonProperty("summary") ScheduleSummaryDto summary,
		@JsonProperty("schedule") List<ScheduleEntryDto> schedule,
		@JsonProperty("created_at") LocalDateTime createdAt
) {
}
