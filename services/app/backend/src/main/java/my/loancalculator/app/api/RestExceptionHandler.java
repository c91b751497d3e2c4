package my.loancalculator.app.api;

import jakarta.servlet.http.HttpServletRequest;
import my.loancalculator.app.importer.LoanInputParseException;
import my.loancalculator.app.model.LoanConfigurationException;
import my.loancalculator.app.schedule.SimulationDivergenceException;
import my.loancalculator.app.util.MonthCalendar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

@RestControllerAdvice
public class RestExceptionHandler {
	private static final Logger logger = LoggerFactory.getLogger(RestExceptionHandler.class);

	@ExceptionHandler(LoanConfigurationException.class)
	public ProblemDetail handleConfiguration(LoanConfigurationException ex, HttpServletRequest request) {
		logger.warn("Invalid loan configuration on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = badRequest("Invalid loan configuration", ex.getMessage(), request);
		detail.setProperty("field", ex.getField());
		return detail;
	}

	@ExceptionHandler(LoanInputParseException.class)
	public ProblemDetail handleParse(LoanInputParseException ex, HttpServletRequest request) {
		logger.warn("Unreadable loan input on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = badRequest("Invalid loan input", ex.getMessage(), request);
		detail.setProperty("field", ex.getField());
		return detail;
	}

	@ExceptionHandler(SimulationDivergenceException.class)
	public ProblemDetail handleDivergence(SimulationDivergenceException ex, HttpServletRequest request) {
		logger.warn("Schedule diverged on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
		detail.setTitle("Schedule did not converge");
		detail.setDetail(ex.getMessage());
		detail.setProperty("period", ex.getPeriod());
		detail.setProperty("month", MonthCalendar.format(ex.getMonth()));
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(IllegalArgumentException.class)
	public ProblemDetail handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
		logger.warn("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
		return badRequest("Bad Request", ex.getMessage(), request);
	}

	@ExceptionHandler(HttpMessageNotReadableException.class)
	public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
		logger.warn("Unreadable body on {}: {}", request.getRequestURI(), ex.getMessage());
		return badRequest("Bad Request", "Malformed request body.", request);
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ProblemDetail handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
		logger.warn("Validation failed on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
		detail.setTitle("Validation failed");
		List<String> errors = ex.getBindingResult().getFieldErrors().stream()
				.map(this::formatFieldError)
				.toList();
		detail.setProperty("errors", errors);
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(ResponseStatusException.class)
	public ProblemDetail handleStatus(ResponseStatusException ex, HttpServletRequest request) {
		ProblemDetail detail = ProblemDetail.forStatus(ex.getStatusCode());
		detail.setTitle(ex.getStatusCode().is4xxClientError() ? "Request failed" : "Server error");
		detail.setDetail(ex.getReason());
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(NoResourceFoundException.class)
	public ProblemDetail handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
		detail.setTitle("Not Found");
		detail.setDetail("Resource not found.");
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(Exception.class)
	public ProblemDetail handleUnhandled(Exception ex, HttpServletRequest request) {
		logger.error("Unexpected error on {}", request.getRequestURI(), ex);
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
		detail.setTitle("Internal Server Error");
		detail.setDetail("Unexpected error");
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	private ProblemDetail badRequest(String title, String message, HttpServletRequest request) {
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
		detail.setTitle(title);
		detail.setDetail(message);
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	private String formatFieldError(FieldError error) {
		return error.getField() + ": " + error.getDefaultMessage();
	}
}
