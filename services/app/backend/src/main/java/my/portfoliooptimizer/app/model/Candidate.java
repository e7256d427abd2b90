package my.portfoliooptimizer.app.model;

import java.util.List;

public record Candidate(List<Holding> holdings, PerformanceMetrics metrics, int sectorScore) {
	public Candidate {
		holdings = List.copyOf(holdings);
	}
}
