package my.loancalculator.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

@Schema(description = "Savings against the same loan without overpayments or a constant payment.")
public record BaselineComparisonDto(
		@JsonProperty("baseline_total_interest") BigDecimal baselineTotalInterest,
		@JsonProperty("interest_saved") BigDecimal interestSaved,
		@JsonProperty("total_cost_saved") BigDecimal totalCostSaved,
		@JsonProperty("months_saved") int monthsSaved
) {
}
