package my.portfoliooptimizer.app.api;

import jakarta.validation.Valid;
import my.portfoliooptimizer.app.dto.OptimizationJobResponseDto;
import my.portfoliooptimizer.app.dto.PortfolioInputRequest;
import my.portfoliooptimizer.app.service.OptimizationJobService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/optimize/jobs")
public class OptimizationJobController {
	private final OptimizationJobService optimizationJobService;

	public OptimizationJobController(OptimizationJobService optimizationJobService) {
		this.optimizationJobService = optimizationJobService;
	}

	@PostMapping
	@ResponseStatus(HttpStatus.ACCEPTED)
	public OptimizationJobResponseDto start(@Valid @RequestBody PortfolioInputRequest request) {
		return optimizationJobService.start(request);
	}

	@GetMapping("/{jobId}")
	public OptimizationJobResponseDto get(@PathVariable("jobId") String jobId) {
		return optimizationJobService.get(jobId);
	}
}
