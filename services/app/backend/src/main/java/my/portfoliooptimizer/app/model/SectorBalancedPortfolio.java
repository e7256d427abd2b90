package my.portfoliooptimizer.app.model;

import java.util.List;

public record SectorBalancedPortfolio(List<Holding> holdings,
									  PerformanceMetrics metrics,
									  List<SectorAllocation> sectorDistribution,
									  SectorBalanceReport sectorBalanceReport,
									  int iterations,
									  boolean converged) {
	public SectorBalancedPortfolio {
		holdings = List.copyOf(holdings);
		sectorDistribution = List.copyOf(sectorDistribution);
	}
}
