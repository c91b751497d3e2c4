package my.loancalculator.app.service;

import jakarta.annotation.PreDestroy;
import my.loancalculator.app.config.AppProperties;
import my.loancalculator.app.dto.BatchResultItemDto;
import my.loancalculator.app.dto.LoanScheduleRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Evaluates independent loan scenarios on a bounded worker pool. Each scenario succeeds or fails on its own.
 */
@Service
public class ScenarioBatchService {
	static final int MAX_BATCH_SIZE = 100;

	private static final Logger logger = LoggerFactory.getLogger(ScenarioBatchService.class);

	private final LoanScheduleService loanScheduleService;
	private final ScheduleDtoMapper mapper;
	private final ExecutorService executor;

	public ScenarioBatchService(LoanScheduleService loanScheduleService,
								ScheduleDtoMapper mapper,
								AppProperties appProperties) {
		this.loanScheduleService = loanScheduleService;
		this.mapper = mapper;
		this.executor = Executors.newFixedThreadPool(appProperties.engine().batchThreads());
	}

	public List<BatchResultItemDto> evaluate(List<LoanScheduleRequest> requests) {
		if (requests == null || requests.isEmpty()) {
			return List.of();
		}
		if (requests.size() > MAX_BATCH_SIZE) {
			throw new IllegalArgumentException("At most " + MAX_BATCH_SIZE + " scenarios per batch; got " + requests.size());
		}
		List<Future<BatchResultItemDto>> futures = new ArrayList<>(requests.size());
		for (int i = 0; i < requests.size(); i++) {
			int index = i;
			LoanScheduleRequest request = requests.get(i);
			futures.add(executor.submit(() -> BatchResultItemDto.success(index,
					mapper.toSummaryDto(loanScheduleService.simulate(request).summary()))));
		}

		List<BatchResultItemDto> results = new ArrayList<>(futures.size());
		for (int i = 0; i < futures.size(); i++) {
			results.add(await(i, futures.get(i)));
		}
		logger.debug("Evaluated batch of {} scenarios", results.size());
		return results;
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private BatchResultItemDto await(int index, Future<BatchResultItemDto> future) {
		try {
			return future.get();
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Batch evaluation interrupted", ex);
		} catch (ExecutionException ex) {
			Throwable cause = ex.getCause();
			if (cause instanceof IllegalArgumentException || cause instanceof IllegalStateException) {
				logger.warn("Batch scenario {} rejected: {}", index, cause.getMessage());
				return BatchResultItemDto.failure(index, cause.getMessage());
			}
			logger.error("Batch scenario {} failed", index, cause);
			return BatchResultItemDto.failure(index, "Unexpected error while evaluating scenario");
		}
	}
}
