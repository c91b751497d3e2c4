package my.loancalculator.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.loancalculator.app.dto.ComparisonScenarioCreateRequest;
import my.loancalculator.app.dto.ComparisonScenarioDto;
import my.loancalculator.app.service.ComparisonScenarioService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/scenarios")
@Tag(name = "Comparison Scenarios")
public class ComparisonScenarioController {
	static final String USER_TOKEN_HEADER = "X-User-Token";

	private final ComparisonScenarioService comparisonScenarioService;

	public ComparisonScenarioController(ComparisonScenarioService comparisonScenarioService) {
		this.comparisonScenarioService = comparisonScenarioService;
	}

	@GetMapping
	@Operation(summary = "List saved comparison scenarios, oldest first")
	public List<ComparisonScenarioDto> list(@RequestHeader(name = USER_TOKEN_HEADER, required = false) String userToken) {
		return comparisonScenarioService.list(userToken);
	}

	@PostMapping
	@Operation(summary = "Simulate a loan and save it as a comparison scenario")
	public ResponseEntity<ComparisonScenarioDto> add(@RequestHeader(name = USER_TOKEN_HEADER, required = false) String userToken,
													 @Valid @RequestBody ComparisonScenarioCreateRequest request) {
		ComparisonScenarioDto saved = comparisonScenarioService.add(userToken, request);
		if (saved == null) {
			return ResponseEntity.noContent().build();
		}
		return ResponseEntity.status(HttpStatus.CREATED).body(saved);
	}

	@DeleteMapping("/{id}")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	@Operation(summary = "Remove one saved comparison scenario")
	public void remove(@RequestHeader(name = USER_TOKEN_HEADER, required = false) String userToken,
					   @PathVariable String id) {
		comparisonScenarioService.remove(userToken, id);
	}

	@DeleteMapping
	@ResponseStatus(HttpStatus.NO_CONTENT)
	@Operation(summary = "Remove all saved comparison scenarios of the user")
	public void clear(@RequestHeader(name = USER_TOKEN_HEADER, required = false) String userToken) {
		comparisonScenarioService.clear(userToken);
	}
}
