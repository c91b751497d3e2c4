package my.loancalculator.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

@Schema(description = "Headline metrics of one simulated schedule. Dates are YYYY-MM.")
public record ScheduleSummaryDto(
		@JsonProperty("principal_financed") BigDecimal principalFinanced,
		@JsonProperty("total_interest") BigDecimal totalInterest,
		@JsonProperty("total_overpayment") BigDecimal totalOverpayment,
		@JsonProperty("total_cost") BigDecimal totalCost,
		@JsonProperty("apr") BigDecimal apr,
		@JsonProperty("term_months") int termMonths,
		@JsonProperty("original_end_date") String originalEndDate,
		@JsonProperty("new_end_date") String newEndDate,
		@JsonProperty("payments_made") int paymentsMade,
		@JsonProperty("max_payment") BigDecimal maxPayment
) {
}
