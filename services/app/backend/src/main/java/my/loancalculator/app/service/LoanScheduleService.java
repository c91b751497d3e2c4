package my.loancalculator.app.service;

import my.loancalculator.app.config.AppProperties;
import my.loancalculator.app.dto.BaselineComparisonDto;
import my.loancalculator.app.dto.LoanScheduleRequest;
import my.loancalculator.app.dto.LoanScheduleResponseDto;
import my.loancalculator.app.dto.LoanSummaryResponseDto;
import my.loancalculator.app.dto.MetricComparisonDto;
import my.loancalculator.app.dto.ScenarioCompareRequest;
import my.loancalculator.app.dto.ScenarioComparisonDto;
import my.loancalculator.app.dto.ScheduleEntryDto;
import my.loancalculator.app.dto.ScheduleSummaryDto;
import my.loancalculator.app.importer.LoanInputParser;
import my.loancalculator.app.model.LoanConfiguration;
import my.loancalculator.app.model.ScheduleResult;
import my.loancalculator.app.model.ScheduleSummary;
import my.loancalculator.app.schedule.ScheduleEngine;
import my.loancalculator.app.schedule.SimulationDivergenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

@Service
public class LoanScheduleService {
	private static final Logger logger = LoggerFactory.getLogger(LoanScheduleService.class);

	private final ScheduleEngine engine;
	private final LoanInputParser parser;
	private final ScheduleDtoMapper mapper;
	private final AppProperties appProperties;

	public LoanScheduleService(ScheduleEngine engine,
							   LoanInputParser parser,
							   ScheduleDtoMapper mapper,
							   AppProperties appProperties) {
		this.engine = engine;
		this.parser = parser;
		this.mapper = mapper;
		this.appProperties = appProperties;
	}

	public ScheduleResult simulate(LoanScheduleRequest request) {
		LoanConfiguration config = parser.parse(request);
		ScheduleResult result = engine.simulate(config);
		logger.debug("Simulated {} {} loan over {} months: {} periods, payoff {}",
				config.loanType(), config.financedPrincipal().toPlainString(), config.term(),
				result.periodCount(), result.summary().newEndDate());
		return result;
	}

	public LoanScheduleResponseDto schedule(LoanScheduleRequest request) {
		LoanConfiguration config = parser.parse(request);
		ScheduleResult result = engine.simulate(config);
		int maxRows = appProperties.schedule().maxRows();
		List<ScheduleEntryDto> rows = mapper.toEntryDtos(result.entries().subList(0, Math.min(maxRows, result.periodCount())));
		int truncated = Math.max(0, result.periodCount() - maxRows);
		if (truncated > 0) {
			logger.debug("Schedule of {} periods truncated to {} rows", result.periodCount(), maxRows);
		}
		return new LoanScheduleResponseDto(
				mapper.toSummaryDto(result.summary()),
				rows,
				truncated,
				baselineComparison(config, result)
		);
	}

	public LoanSummaryResponseDto summary(LoanScheduleRequest request) {
		LoanConfiguration config = parser.parse(request);
		ScheduleResult result = engine.simulate(config);
		return new LoanSummaryResponseDto(mapper.toSummaryDto(result.summary()),
				baselineComparison(config, result));
	}

	public ScenarioComparisonDto compare(ScenarioCompareRequest request) {
		if (request == null || request.scenario1() == null || request.scenario2() == null) {
			throw new IllegalArgumentException("Both scenarios are required");
		}
		ScheduleSummary first = simulate(request.scenario1()).summary();
		ScheduleSummary second = simulate(request.scenario2()).summary();
		ScheduleSummaryDto firstDto = mapper.toSummaryDto(first);
		ScheduleSummaryDto secondDto = mapper.toSummaryDto(second);
		List<MetricComparisonDto> metrics = List.of(
				MetricComparisonDto.of(ScheduleSummary.TOTAL_COST, firstDto.totalCost(), secondDto.totalCost()),
				MetricComparisonDto.of(ScheduleSummary.TOTAL_INTEREST, firstDto.totalInterest(), secondDto.totalInterest()),
				MetricComparisonDto.of(ScheduleSummary.PAYMENTS_MADE,
						BigDecimal.valueOf(first.paymentsMade()), BigDecimal.valueOf(second.paymentsMade()))
		);
		return new ScenarioComparisonDto(firstDto, secondDto, metrics);
	}

	/**
	 * Savings against the same loan without overpayments and target payment, or {@code null} when the loan has
	 * neither or the baseline does not converge.
	 */
	BaselineComparisonDto baselineComparison(LoanConfiguration config, ScheduleResult result) {
		if (!config.hasPrepayments()) {
			return null;
		}
		ScheduleResult baseline;
		try {
			baseline = engine.simulate(config.withoutPrepayments());
		} catch (SimulationDivergenceException ex) {
			logger.warn("Baseline schedule did not converge at period {}; comparison omitted", ex.getPeriod());
			return null;
		}
		ScheduleSummary base = baseline.summary();
		ScheduleSummary summary = result.summary();
		return new BaselineComparisonDto(
				ScheduleDtoMapper.money(base.totalInterest()),
				ScheduleDtoMapper.money(base.totalInterest().subtract(summary.totalInterest())),
				ScheduleDtoMapper.money(base.totalCost().subtract(summary.totalCost())),
				baseline.periodCount() - result.periodCount()
		);
	}
}
