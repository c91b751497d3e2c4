package my.loancalculator.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.loancalculator.app.dto.BatchResultItemDto;
import my.loancalculator.app.dto.LoanScheduleRequest;
import my.loancalculator.app.dto.LoanScheduleResponseDto;
import my.loancalculator.app.dto.LoanSummaryResponseDto;
import my.loancalculator.app.dto.ScenarioCompareRequest;
import my.loancalculator.app.dto.ScenarioComparisonDto;
import my.loancalculator.app.model.ScheduleResult;
import my.loancalculator.app.service.ExportFormat;
import my.loancalculator.app.service.LoanScheduleService;
import my.loancalculator.app.service.ScenarioBatchService;
import my.loancalculator.app.service.ScheduleExportService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/loans")
@Tag(name = "Loan Schedules")
public class LoanScheduleController {
	private final LoanScheduleService loanScheduleService;
	private final ScenarioBatchService scenarioBatchService;
	private final ScheduleExportService scheduleExportService;

	public LoanScheduleController(LoanScheduleService loanScheduleService,
								  ScenarioBatchService scenarioBatchService,
								  ScheduleExportService scheduleExportService) {
		this.loanScheduleService = loanScheduleService;
		this.scenarioBatchService = scenarioBatchService;
		this.scheduleExportService = scheduleExportService;
	}

	@PostMapping("/schedule")
	@Operation(summary = "Simulate a loan and return its schedule")
	public LoanScheduleResponseDto schedule(@Valid @RequestBody LoanScheduleRequest request) {
		return loanScheduleService.schedule(request);
	}

	@PostMapping("/summary")
	@Operation(summary = "Simulate a loan and return only its summary")
	public LoanSummaryResponseDto summary(@Valid @RequestBody LoanScheduleRequest request) {
		return loanScheduleService.summary(request);
	}

	@PostMapping("/compare")
	@Operation(summary = "Compare two loan scenarios")
	public ScenarioComparisonDto compare(@Valid @RequestBody ScenarioCompareRequest request) {
		return loanScheduleService.compare(request);
	}

	@PostMapping("/batch")
	@Operation(summary = "Summarize several loan scenarios in parallel")
	public List<BatchResultItemDto> batch(@RequestBody List<LoanScheduleRequest> requests) {
		return scenarioBatchService.evaluate(requests);
	}

	@PostMapping("/export")
	@Operation(summary = "Export a simulated schedule as CSV or JSON")
	public ResponseEntity<byte[]> export(@Valid @RequestBody LoanScheduleRequest request,
										 @RequestParam(name = "format", defaultValue = "csv") String format) {
		ExportFormat exportFormat = ExportFormat.from(format);
		ScheduleResult result = loanScheduleService.simulate(request);
		String body = scheduleExportService.export(result, exportFormat);
		return ResponseEntity.ok()
				.header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=schedule." + exportFormat.extension())
				.contentType(MediaType.parseMediaType(exportFormat.contentType()))
				.body(body.getBytes(StandardCharsets.UTF_8));
	}
}
