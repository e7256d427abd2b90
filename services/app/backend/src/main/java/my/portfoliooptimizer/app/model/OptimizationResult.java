package my.portfoliooptimizer.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OptimizationResult(PortfolioAnalysis current,
								 OptimizedPortfolio optimized,
								 List<Recommendation> recommendations,
								 List<FrontierPoint> efficientFrontier,
								 boolean sectorRebalancingApplied,
								 SectorBalanceReport currentSectorBalance,
								 SectorBalancedPortfolio sectorBalancedPortfolio,
								 SearchSummary search) {
	public OptimizationResult {
		recommendations = List.copyOf(recommendations);
		efficientFrontier = List.copyOf(efficientFrontier);
	}

	public record OptimizedPortfolio(PerformanceMetrics metrics,
									 List<OptimizedHolding> holdings,
									 List<SectorAllocation> sectorDistribution,
									 SectorBalanceReport sectorBalanceReport) {
		public OptimizedPortfolio {
			holdings = List.copyOf(holdings);
			sectorDistribution = List.copyOf(sectorDistribution);
		}
	}

	public record SearchSummary(long seed,
								int iterations,
								int candidatesEvaluated,
								boolean stoppedEarly,
								boolean timedOut,
								long elapsedMillis) {
	}
}
