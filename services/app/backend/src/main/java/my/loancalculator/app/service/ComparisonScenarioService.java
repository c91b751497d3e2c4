package my.loancalculator.app.service;

import my.loancalculator.app.config.AppProperties;
import my.loancalculator.app.domain.ComparisonScenario;
import my.loancalculator.app.dto.ComparisonScenarioCreateRequest;
import my.loancalculator.app.dto.ComparisonScenarioDto;
import my.loancalculator.app.dto.ScheduleEntryDto;
import my.loancalculator.app.dto.ScheduleSummaryDto;
import my.loancalculator.app.model.ScheduleResult;
import my.loancalculator.app.repository.ComparisonScenarioRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Saved comparison scenarios, scoped to an opaque user token. Only the newest scenarios per token are kept.
 */
@Service
public class ComparisonScenarioService {
	private static final Logger logger = LoggerFactory.getLogger(ComparisonScenarioService.class);
	private static final TypeReference<List<ScheduleEntryDto>> ENTRY_LIST = new TypeReference<>() {
	};

	private final ComparisonScenarioRepository repository;
	private final LoanScheduleService loanScheduleService;
	private final ScheduleDtoMapper mapper;
	private final ObjectMapper objectMapper;
	private final AppProperties appProperties;

	public ComparisonScenarioService(ComparisonScenarioRepository repository,
									 LoanScheduleService loanScheduleService,
									 ScheduleDtoMapper mapper,
									 ObjectMapper objectMapper,
									 AppProperties appProperties) {
		this.repository = repository;
		this.loanScheduleService = loanScheduleService;
		this.mapper = mapper;
		this.objectMapper = objectMapper;
		this.appProperties = appProperties;
	}

	public List<ComparisonScenarioDto> list(String userToken) {
		if (isBlank(userToken)) {
			return List.of();
		}
		return repository.findByUserTokenOrderByCreatedAtAsc(userToken).stream()
				.map(this::toDto)
				.toList();
	}

	/**
	 * Simulates the loan and stores its summary and schedule. Returns {@code null} without storing anything when
	 * the token is blank.
	 */
	@Transactional
	public ComparisonScenarioDto add(String userToken, ComparisonScenarioCreateRequest request) {
		if (request == null || request.loan() == null) {
			throw new IllegalArgumentException("Loan input is required");
		}
		ScheduleResult result = loanScheduleService.simulate(request.loan());
		if (isBlank(userToken)) {
			return null;
		}
		ScheduleSummaryDto summary = mapper.toSummaryDto(result.summary());
		List<ScheduleEntryDto> schedule = mapper.toEntryDtos(result.entries());

		ComparisonScenario scenario = new ComparisonScenario();
		scenario.setId(UUID.randomUUID().toString());
		scenario.setUserToken(userToken);
		scenario.setName(resolveName(request.name(), userToken));
		scenario.setSummaryJson(write(summary));
		scenario.setScheduleJson(write(schedule));
		scenario.setCreatedAt(nextCreatedAt(userToken));
		ComparisonScenario saved = repository.save(scenario);
		trim(userToken);
		logger.debug("Saved comparison scenario {} ({} periods)", saved.getId(), schedule.size());
		return toDto(saved);
	}

	@Transactional
	public void remove(String userToken, String scenarioId) {
		if (isBlank(userToken)) {
			return;
		}
		ComparisonScenario scenario = repository.findByIdAndUserToken(scenarioId, userToken)
				.orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Comparison scenario not found"));
		repository.delete(scenario);
	}

	@Transactional
	public int clear(String userToken) {
		if (isBlank(userToken)) {
			return 0;
		}
		return repository.deleteByUserToken(userToken);
	}

	private void trim(String userToken) {
		int maxPerUser = appProperties.scenarios().maxPerUser();
		if (maxPerUser <= 0) {
			return;
		}
		List<ComparisonScenario> newestFirst = repository.findByUserTokenOrderByCreatedAtDesc(userToken);
		if (newestFirst.size() <= maxPerUser) {
			return;
		}
		List<ComparisonScenario> expired = newestFirst.subList(maxPerUser, newestFirst.size());
		repository.deleteAll(expired);
		logger.debug("Trimmed {} old comparison scenarios", expired.size());
	}

	// Keeps insertion order stable when two saves land in the same clock tick.
	private LocalDateTime nextCreatedAt(String userToken) {
		LocalDateTime now = LocalDateTime.now().truncatedTo(ChronoUnit.MICROS);
		return repository.findFirstByUserTokenOrderByCreatedAtDesc(userToken)
				.map(ComparisonScenario::getCreatedAt)
				.filter(latest -> !now.isAfter(latest))
				.map(latest -> latest.plus(1, ChronoUnit.MICROS))
				.orElse(now);
	}

	private String resolveName(String name, String userToken) {
		if (!isBlank(name)) {
			return name.trim();
		}
		return "Scenario " + (repository.findByUserTokenOrderByCreatedAtAsc(userToken).size() + 1);
	}

	private ComparisonScenarioDto toDto(ComparisonScenario scenario) {
		try {
			return new ComparisonScenarioDto(
					scenario.getId(),
					scenario.getName(),
					objectMapper.readValue(scenario.getSummaryJson(), ScheduleSummaryDto.class),
					objectMapper.readValue(scenario.getScheduleJson(), ENTRY_LIST),
					scenario.getCreatedAt()
			);
		} catch (JacksonException ex) {
			throw new IllegalStateException("Stored comparison scenario " + scenario.getId() + " is unreadable", ex);
		}
	}

	private String write(Object value) {
		try {
			return objectMapper.writeValueAsString(value);
		} catch (JacksonException ex) {
			throw new IllegalStateException("Failed to serialize comparison scenario", ex);
		}
	}

	private boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
