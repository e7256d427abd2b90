package my.portfoliooptimizer.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.portfoliooptimizer.app.model.OptimizationResult;

public record OptimizationJobResponseDto(
		@JsonProperty("job_id") String jobId,
		@JsonProperty("status") OptimizationJobStatus status,
		@JsonProperty("result") OptimizationResult result,
		@JsonProperty("error") String error
) {
}
