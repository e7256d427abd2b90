package my.portfoliooptimizer.app.dto;

import my.portfoliooptimizer.app.model.PerformanceMetrics;
import my.portfoliooptimizer.app.model.ValuePoint;
import my.portfoliooptimizer.app.model.YearlyReturn;

import java.util.List;

public record BenchmarkAnalysisDto(String ticker,
								   List<ValuePoint> values,
								   PerformanceMetrics metrics,
								   List<YearlyReturn> yearlyReturns) {
}
