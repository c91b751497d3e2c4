package my.loancalculator.app.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

public record LoanSummaryResponseDto(
		@JsonProperty("summary") ScheduleSummaryDto summary,
		@JsonProperty("comparison") @JsonInclude(JsonInclude.Include.NON_NULL) BaselineComparisonDto comparison
) {
}
