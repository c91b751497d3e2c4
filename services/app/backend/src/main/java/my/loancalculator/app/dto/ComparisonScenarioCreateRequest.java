package my.loancalculator.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Saves the schedule computed from {@code loan} under {@code name}; a blank name falls back to a generated one.
 */
public record ComparisonScenarioCreateRequest(
		@JsonProperty("name") @Size(max = 255) String name,
		@JsonProperty("loan") @NotNull @Valid LoanScheduleRequest loan
) {
}
