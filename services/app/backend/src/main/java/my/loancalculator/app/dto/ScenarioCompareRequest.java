package my.loancalculator.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record ScenarioCompareRequest(
		@JsonProperty("scenario1") @NotNull @Valid LoanScheduleRequest scenario1,
		@JsonProperty("scenario2") @NotNull @Valid LoanScheduleRequest scenario2
) {
}
