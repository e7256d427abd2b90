package my.portfoliooptimizer.app.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import my.portfoliooptimizer.app.model.Holding;
import my.portfoliooptimizer.app.model.PortfolioAnalysis;
import my.portfoliooptimizer.app.model.SectorBalanceReport;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResponseDto(PortfolioAnalysis portfolio,
								  BenchmarkAnalysisDto benchmark,
								  List<ChartPointDto> chartData,
								  SectorBalanceReport sectorBalanceReport,
								  List<Holding> adjustedHoldings) {
}
