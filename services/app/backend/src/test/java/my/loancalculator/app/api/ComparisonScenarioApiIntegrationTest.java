package my.loancalculator.app.api;

import my.loancalculator.app.support.TestDatabaseCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = my.loancalculator.app.AppApplication.class)
@ActiveProfiles("test")
class ComparisonScenarioApiIntegrationTest {
	private static final String TOKEN = "token-a";

	private MockMvc mockMvc;

	@Autowired
	private WebApplicationContext context;

	@Autowired
	private TestDatabaseCleaner databaseCleaner;

	@BeforeEach
	void setUp() {
		mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
		databaseCleaner.clean();
	}

	@AfterEach
	void tearDown() {
		databaseCleaner.clean();
	}

	@Test
	void keepsOnlyNewestScenariosPerToken() throws Exception {
		for (int i = 1; i <= 4; i++) {
			mockMvc.perform(post("/api/scenarios")
							.header(ComparisonScenarioController.USER_TOKEN_HEADER, TOKEN)
							.contentType(MediaType.APPLICATION_JSON)
							.content(scenario("Plan " + i, 12 * i)))
					.andExpect(status().isCreated())
					.andExpect(jsonPath("$.name").value("Plan " + i))
					.andExpect(jsonPath("$.summary.term_months").value(12 * i));
		}

		mockMvc.perform(get("/api/scenarios").header(ComparisonScenarioController.USER_TOKEN_HEADER, TOKEN))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$", hasSize(3)))
				.andExpect(jsonPath("$[0].name").value("Plan 2"))
				.andExpect(jsonPath("$[2].name").value("Plan 4"))
				.andExpect(jsonPath("$[2].schedule", hasSize(48)));

		mockMvc.perform(get("/api/scenarios").header(ComparisonScenarioController.USER_TOKEN_HEADER, "token-b"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$", hasSize(0)));
	}

	@Test
	void blankTokenStoresNothing() throws Exception {
		mockMvc.perform(post("/api/scenarios")
						.contentType(MediaType.APPLICATION_JSON)
						.content(scenario("Anonymous", 12)))
				.andExpect(status().isNoContent());

		mockMvc.perform(get("/api/scenarios"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$", hasSize(0)));
	}

	@Test
	void removeAndClear() throws Exception {
		mockMvc.perform(post("/api/scenarios")
						.header(ComparisonScenarioController.USER_TOKEN_HEADER, TOKEN)
						.contentType(MediaType.APPLICATION_JSON)
						.content(scenario("", 12)))
				.andExpect(status().isCreated())
				.andExpect(jsonPath("$.name").value("Scenario 1"));
		mockMvc.perform(post("/api/scenarios")
						.header(ComparisonScenarioController.USER_TOKEN_HEADER, TOKEN)
						.contentType(MediaType.APPLICATION_JSON)
						.content(scenario("Second", 24)))
				.andExpect(status().isCreated());

		mockMvc.perform(delete("/api/scenarios/does-not-exist")
						.header(ComparisonScenarioController.USER_TOKEN_HEADER, TOKEN))
				.andExpect(status().isNotFound());

		mockMvc.perform(delete("/api/scenarios").header(ComparisonScenarioController.USER_TOKEN_HEADER, TOKEN))
				.andExpect(status().isNoContent());

		mockMvc.perform(get("/api/scenarios").header(ComparisonScenarioController.USER_TOKEN_HEADER, TOKEN))
				.andExpect(jsonPath("$", hasSize(0)));
	}

	@Test
	void invalidLoanIsRejected() throws Exception {
		mockMvc.perform(post("/api/scenarios")
						.header(ComparisonScenarioController.USER_TOKEN_HEADER, TOKEN)
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"name\": \"Broken\"}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.errors", hasSize(1)));
	}

	private static String scenario(String name, int term) {
		return """
				{"name": "%s", "loan": {"principal": "100k", "rate": 5, "term": %d, "start_date": "2024-01"}}
				""".formatted(name, term);
	}
}
