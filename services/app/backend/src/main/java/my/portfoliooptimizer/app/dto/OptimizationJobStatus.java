package my.portfoliooptimizer.app.dto;

public enum OptimizationJobStatus {
	PENDING,
	RUNNING,
	DONE,
	FAILED
}
