package my.loancalculator.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import my.loancalculator.app.model.LoanConfiguration;

import java.math.BigDecimal;
import java.util.List;

@Schema(description = "Loan scenario in its textual input form; amounts accept k/m suffixes.")
public record LoanScheduleRequest(
		@JsonProperty("principal") @NotBlank String principal,
		@JsonProperty("rate") @NotNull @DecimalMin("0") BigDecimal rate,
		@JsonProperty("term") @NotNull @Positive @Max(LoanConfiguration.MAX_TERM) Integer term,
		@JsonProperty("loan_type") String loanType,
		@JsonProperty("start_date") @NotBlank String startDate,
		@JsonProperty("down_payment") String downPayment,
		@JsonProperty("tranches") List<String> tranches,
		@JsonProperty("overpayments") List<String> overpayments,
		@JsonProperty("holidays") List<String> holidays,
		@JsonProperty("monthly_overpayment") String monthlyOverpayment,
		@JsonProperty("constant_payment") String constantPayment
) {
}
