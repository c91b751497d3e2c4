package my.loancalculator.app.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = my.loancalculator.app.AppApplication.class)
@ActiveProfiles("test")
class LoanScheduleApiIntegrationTest {
	private static final String BASIC_LOAN = """
			{"principal": "100k", "rate": 6, "term": 12, "start_date": "2024-01"}
			""";

	private MockMvc mockMvc;

	@Autowired
	private WebApplicationContext context;

	@BeforeEach
	void setUp() {
		mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
	}

	@Test
	void scheduleReturnsSummaryAndRows() throws Exception {
		mockMvc.perform(post("/api/loans/schedule")
						.contentType(MediaType.APPLICATION_JSON)
						.content(BASIC_LOAN))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.summary.principal_financed").value(100000.00))
				.andExpect(jsonPath("$.summary.payments_made").value(12))
				.andExpect(jsonPath("$.summary.max_payment").value(8606.64))
				.andExpect(jsonPath("$.summary.original_end_date").value("2024-12"))
				.andExpect(jsonPath("$.summary.new_end_date").value("2024-12"))
				.andExpect(jsonPath("$.schedule", hasSize(12)))
				.andExpect(jsonPath("$.schedule[0].month").value("2024-01"))
				.andExpect(jsonPath("$.schedule[0].is_holiday").value(false))
				.andExpect(jsonPath("$.schedule[11].ending_balance").value(0.00))
				.andExpect(jsonPath("$.truncated").value(0))
				.andExpect(jsonPath("$.comparison").doesNotExist());
	}

	@Test
	void summaryComparesOverpaymentsWithBaseline() throws Exception {
		mockMvc.perform(post("/api/loans/summary")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"principal": "100k", "rate": 6, "term": 12, "start_date": "2024-01",
								 "overpayments": ["2024-03:20000:term"]}
								"""))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.summary.total_overpayment").value(20000.00))
				.andExpect(jsonPath("$.comparison.months_saved").value(2))
				.andExpect(jsonPath("$.comparison.interest_saved").exists());
	}

	@Test
	void malformedAmountReportsField() throws Exception {
		mockMvc.perform(post("/api/loans/schedule")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"principal": "lots", "rate": 6, "term": 12, "start_date": "2024-01"}
								"""))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.field").value("principal"))
				.andExpect(jsonPath("$.path").value("/api/loans/schedule"));
	}

	@Test
	void downPaymentCoveringPrincipalIsRejected() throws Exception {
		mockMvc.perform(post("/api/loans/schedule")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"principal": "100k", "down_payment": "100k", "rate": 6, "term": 12,
								 "start_date": "2024-01"}
								"""))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.field").value("principal"));
	}

	@Test
	void missingFieldsFailValidation() throws Exception {
		mockMvc.perform(post("/api/loans/schedule")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"principal": "100k", "rate": -1, "term": 0}
								"""))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.errors", hasSize(3)));
	}

	@Test
	void termBeyondHundredYearsFailsValidation() throws Exception {
		mockMvc.perform(post("/api/loans/schedule")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"principal": "100k", "rate": 6, "term": 1000000000, "start_date": "2024-01"}
								"""))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.errors", hasSize(1)))
				.andExpect(jsonPath("$.errors[0]").value(containsString("term")));
	}

	@Test
	void malformedStartDateNamesRequestProperty() throws Exception {
		mockMvc.perform(post("/api/loans/schedule")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"principal": "100k", "rate": 6, "term": 12, "start_date": "2024-13"}
								"""))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.field").value("start_date"));
	}

	@Test
	void endlessHolidaysReportDivergence() throws Exception {
		mockMvc.perform(post("/api/loans/schedule")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"principal": "10k", "rate": 6, "term": 2, "start_date": "2024-01",
								 "holidays": ["2024-01", "2024-02", "2024-03", "2024-04"]}
								"""))
				.andExpect(status().isUnprocessableEntity())
				.andExpect(jsonPath("$.period").value(4))
				.andExpect(jsonPath("$.month").value("2024-04"));
	}

	@Test
	void malformedBodyIsBadRequest() throws Exception {
		mockMvc.perform(post("/api/loans/schedule")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{not json"))
				.andExpect(status().isBadRequest());
	}

	@Test
	void compareReportsMetricDiffs() throws Exception {
		mockMvc.perform(post("/api/loans/compare")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"scenario1": {"principal": "100k", "rate": 6, "term": 12, "start_date": "2024-01"},
								 "scenario2": {"principal": "100k", "rate": 6, "term": 24, "start_date": "2024-01"}}
								"""))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.metrics", hasSize(3)))
				.andExpect(jsonPath("$.metrics[2].metric").value("payments_made"))
				.andExpect(jsonPath("$.metrics[2].diff").value(12));
	}

	@Test
	void batchEvaluatesEachScenarioIndependently() throws Exception {
		mockMvc.perform(post("/api/loans/batch")
						.contentType(MediaType.APPLICATION_JSON)
						.content("[" + BASIC_LOAN + ", {\"principal\": \"x\", \"rate\": 6, \"term\": 12, \"start_date\": \"2024-01\"}]"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$", hasSize(2)))
				.andExpect(jsonPath("$[0].summary.payments_made").value(12))
				.andExpect(jsonPath("$[1].index").value(1))
				.andExpect(jsonPath("$[1].error").value(containsString("Invalid amount")));
	}

	@Test
	void exportWritesCsvAttachment() throws Exception {
		mockMvc.perform(post("/api/loans/export")
						.contentType(MediaType.APPLICATION_JSON)
						.content(BASIC_LOAN))
				.andExpect(status().isOk())
				.andExpect(header().string("Content-Disposition", "attachment; filename=schedule.csv"))
				.andExpect(content().string(startsWith("period_index,month,starting_balance")));
	}

	@Test
	void unknownExportFormatIsRejected() throws Exception {
		mockMvc.perform(post("/api/loans/export")
						.param("format", "xlsx")
						.contentType(MediaType.APPLICATION_JSON)
						.content(BASIC_LOAN))
				.andExpect(status().isBadRequest());
	}
}
