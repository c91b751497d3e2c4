package my.loancalculator.app.service;

import my.loancalculator.app.model.LoanConfiguration;
import my.loancalculator.app.model.ScheduleResult;
import my.loancalculator.app.schedule.ScheduleEngine;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleExportServiceTest {
	private final ObjectMapper objectMapper = JsonMapper.builder().build();
	private final ScheduleExportService service = new ScheduleExportService(new ScheduleDtoMapper(), objectMapper);
	private final ScheduleResult result = new ScheduleEngine().simulate(LoanConfiguration.builder()
			.principal(new BigDecimal("100000"))
			.rate(new BigDecimal("6"))
			.term(12)
			.startMonth(YearMonth.of(2024, 1))
			.holidays(Set.of(YearMonth.of(2024, 2)))
			.build());

	@Test
	void csvHasHeaderAndOneRowPerEntry() {
		String[] lines = service.toCsv(result).split("\n");

		assertThat(lines).hasSize(result.periodCount() + 1);
		assertThat(lines[0]).isEqualTo("period_index,month,starting_balance,payment,principal_component,"
				+ "interest_component,overpayment_amount,ending_balance,tranche_disbursed_amount,is_holiday");
		assertThat(lines[1]).isEqualTo("1,2024-01,100000.00,8606.64,8106.64,500.00,0.00,91893.36,0.00,false");
		assertThat(lines[2]).startsWith("2,2024-02,91893.36,0.00,0.00,459.47,").endsWith(",true");
	}

	@Test
	void jsonCarriesSummaryAndSchedule() {
		JsonNode root = objectMapper.readTree(service.toJson(result));

		assertThat(root.get("summary").get("term_months").asInt()).isEqualTo(12);
		assertThat(root.get("summary").get("original_end_date").asString()).isEqualTo("2024-12");
		assertThat(root.get("schedule").size()).isEqualTo(result.periodCount());
		assertThat(root.get("schedule").get(1).get("is_holiday").asBoolean()).isTrue();
	}

	@Test
	void exportFormatIsCaseInsensitive() {
		assertThat(ExportFormat.from("JSON")).isEqualTo(ExportFormat.JSON);
		assertThat(ExportFormat.from(null)).isEqualTo(ExportFormat.CSV);
		assertThatThrownBy(() -> ExportFormat.from("xlsx")).isInstanceOf(IllegalArgumentException.class);
	}
}
