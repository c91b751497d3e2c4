package my.loancalculator.app.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LoanScheduleResponseDto(
		@JsonProperty("summary") ScheduleSummaryDto summary,
		@JsonProperty("schedule") List<ScheduleEntryDto> schedule,
		@JsonProperty("truncated") int truncated,
		@JsonProperty("comparison") @JsonInclude(JsonInclude.Include.NON_NULL) BaselineComparisonDto comparison
) {
}
