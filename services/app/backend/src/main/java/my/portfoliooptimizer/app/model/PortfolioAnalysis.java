package my.portfoliooptimizer.app.model;

import java.time.LocalDate;
import java.util.List;

public record PortfolioAnalysis(PerformanceMetrics metrics,
								List<ValuePoint> valueSeries,
								List<YearlyReturn> yearlyReturns,
								List<DrawdownPoint> drawdowns,
								List<Holding> holdings,
								List<SectorAllocation> sectorDistribution,
								LocalDate startDate,
								LocalDate endDate,
								double periodYears) {
	public PortfolioAnalysis {
		valueSeries = List.copyOf(valueSeries);
		yearlyReturns = List.copyOf(yearlyReturns);
		drawdowns = List.copyOf(drawdowns);
		holdings = List.copyOf(holdings);
		sectorDistribution = sectorDistribution == null ? List.of() : List.copyOf(sectorDistribution);
	}
}
