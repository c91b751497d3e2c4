package my.loancalculator.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record ScheduleEntryDto(
		@JsonProperty("period_index") int periodIndex,
		@JsonProperty("month") String month,
		@JsonProperty("starting_balance") BigDecimal startingBalance,
		@JsonProperty("payment") BigDecimal payment,
		@JsonProperty("principal_component") BigDecimal principalComponent,
		@JsonProperty("interest_component") BigDecimal interestComponent,
		@JsonProperty("overpayment_amount") BigDecimal overpaymentAmount,
		@JsonProperty("ending_balance") BigDecimal endingBalance,
		@JsonProperty("tranche_disbursed_amount") BigDecimal trancheDisbursedAmount,
		@JsonProperty("is_holiday") boolean holiday
) {
}
