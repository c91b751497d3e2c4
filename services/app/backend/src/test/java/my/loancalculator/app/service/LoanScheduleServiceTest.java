package my.loancalculator.app.service;

import my.loancalculator.app.config.AppProperties;
import my.loancalculator.app.dto.LoanScheduleRequest;
import my.loancalculator.app.dto.LoanScheduleResponseDto;
import my.loancalculator.app.dto.LoanSummaryResponseDto;
import my.loancalculator.app.dto.MetricComparisonDto;
import my.loancalculator.app.dto.ScenarioCompareRequest;
import my.loancalculator.app.dto.ScenarioComparisonDto;
import my.loancalculator.app.importer.LoanInputParseException;
import my.loancalculator.app.importer.LoanInputParser;
import my.loancalculator.app.schedule.ScheduleEngine;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LoanScheduleServiceTest {
	private final LoanScheduleService service = new LoanScheduleService(
			new ScheduleEngine(),
			new LoanInputParser(),
			new ScheduleDtoMapper(),
			new AppProperties(null, new AppProperties.Schedule(5), null, null));

	@Test
	void scheduleIsTruncatedToConfiguredRows() {
		LoanScheduleResponseDto response = service.schedule(request(null, null));

		assertThat(response.schedule()).hasSize(5);
		assertThat(response.truncated()).isEqualTo(7);
		assertThat(response.summary().paymentsMade()).isEqualTo(12);
		assertThat(response.summary().maxPayment()).isEqualByComparingTo("8606.64");
		assertThat(response.schedule().get(0).month()).isEqualTo("2024-01");
		assertThat(response.comparison()).isNull();
	}

	@Test
	void overpaymentsAreComparedAgainstBaseline() {
		LoanSummaryResponseDto response = service.summary(request(List.of("2024-03:20000:term"), null));

		assertThat(response.comparison()).isNotNull();
		assertThat(response.comparison().monthsSaved()).isPositive();
		assertThat(response.comparison().interestSaved()).isPositive();
		assertThat(response.comparison().totalCostSaved()).isEqualByComparingTo(response.comparison().interestSaved());
		assertThat(response.comparison().baselineTotalInterest())
				.isCloseTo(response.summary().totalInterest().add(response.comparison().interestSaved()), within(new BigDecimal("0.01")));
	}

	@Test
	void constantPaymentAlsoTriggersComparison() {
		LoanSummaryResponseDto response = service.summary(request(null, "10000"));

		assertThat(response.comparison()).isNotNull();
		assertThat(response.summary().totalOverpayment()).isPositive();
	}

	@Test
	void compareReportsScenarioTwoMinusScenarioOne() {
		ScenarioComparisonDto comparison = service.compare(new ScenarioCompareRequest(
				request(null, null),
				request(List.of("2024-03:20000:term"), null)));

		assertThat(comparison.metrics()).extracting(MetricComparisonDto::getMetric)
				.containsExactly("total_cost", "total_interest", "payments_made");
		MetricComparisonDto payments = comparison.metrics().get(2);
		assertThat(payments.getScenario1()).isEqualByComparingTo("12");
		assertThat(payments.getDiff()).isNegative();
		MetricComparisonDto interest = comparison.metrics().get(1);
		assertThat(interest.getDiff())
				.isEqualByComparingTo(interest.getScenario2().subtract(interest.getScenario1()));
	}

	@Test
	void parseErrorsPropagate() {
		LoanScheduleRequest broken = new LoanScheduleRequest("ten", new BigDecimal("6"), 12, null, "2024-01",
				null, null, null, null, null, null);

		assertThatThrownBy(() -> service.schedule(broken)).isInstanceOf(LoanInputParseException.class);
	}

	static LoanScheduleRequest request(List<String> overpayments, String constantPayment) {
		return new LoanScheduleRequest("100k", new BigDecimal("6"), 12, "annuity", "2024-01", null,
				null, overpayments, null, null, constantPayment);
	}
}
