package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.dto.AnalysisResponseDto;
import my.portfoliooptimizer.app.dto.BenchmarkAnalysisDto;
import my.portfoliooptimizer.app.dto.ChartPointDto;
import my.portfoliooptimizer.app.market.SectorLookup;
import my.portfoliooptimizer.app.model.Holding;
import my.portfoliooptimizer.app.model.Holdings;
import my.portfoliooptimizer.app.model.PerformanceMetrics;
import my.portfoliooptimizer.app.model.PortfolioAnalysis;
import my.portfoliooptimizer.app.model.PriceMatrix;
import my.portfoliooptimizer.app.model.SectorBalanceReport;
import my.portfoliooptimizer.app.model.ValuePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

@Service
public class PortfolioAnalyticsService {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioAnalyticsService.class);

	private final MarketDataService marketDataService;
	private final MetricsEngine metricsEngine;
	private final SectorBalanceEvaluator sectorBalanceEvaluator;
	private final SectorAdjuster sectorAdjuster;
	private final SectorLookup sectorLookup;

	public PortfolioAnalyticsService(MarketDataService marketDataService,
									 MetricsEngine metricsEngine,
									 SectorBalanceEvaluator sectorBalanceEvaluator,
									 SectorAdjuster sectorAdjuster,
									 SectorLookup sectorLookup) {
		this.marketDataService = marketDataService;
		this.metricsEngine = metricsEngine;
		this.sectorBalanceEvaluator = sectorBalanceEvaluator;
		this.sectorAdjuster = sectorAdjuster;
		this.sectorLookup = sectorLookup;
	}

	public AnalysisResponseDto analyze(List<Holding> input, boolean rebalanceSectors) {
		List<Holding> holdings = Holdings.normalize(Holdings.merge(input));
		MarketDataService.PreparedData data = marketDataService.prepareAnalysis(holdings);
		String benchmarkTicker = marketDataService.benchmarkTicker();
		List<ValuePoint> benchmarkValues = data.hasBenchmark()
				? metricsEngine.computeValueSeries(data.prices(), List.of(new Holding(benchmarkTicker, Holdings.FULL_ALLOCATION)))
				: List.of();

		PortfolioAnalysis portfolio = analyzePortfolio(data.prices(), holdings, data.range(), data.riskFreeRate(),
				benchmarkValues);
		PerformanceMetrics benchmarkMetrics = metricsEngine.computeMetrics(benchmarkValues, data.range().years(),
				data.riskFreeRate(), benchmarkValues);
		BenchmarkAnalysisDto benchmark = new BenchmarkAnalysisDto(benchmarkTicker, benchmarkValues, benchmarkMetrics,
				metricsEngine.yearlyReturns(benchmarkValues));

		List<ChartPointDto> chartData = new ArrayList<>(portfolio.valueSeries().size());
		for (int i = 0; i < portfolio.valueSeries().size(); i++) {
			ValuePoint point = portfolio.valueSeries().get(i);
			Double benchmarkValue = i < benchmarkValues.size() ? benchmarkValues.get(i).value() : null;
			chartData.add(new ChartPointDto(point.date(), point.value(), benchmarkValue));
		}

		SectorBalanceReport report = null;
		List<Holding> adjustedHoldings = null;
		if (rebalanceSectors) {
			SectorBalanceReport check = sectorBalanceEvaluator.check(holdings, sectorLookup);
			if (check.hasViolations()) {
				report = check;
				SectorAdjuster.Result adjusted = sectorAdjuster.adjust(holdings, sectorLookup,
						new LinkedHashSet<>(marketDataService.coveringTickers(data.range())));
				adjustedHoldings = adjusted.holdings();
			}
		}
		logger.info("Analyzed {} holdings over {} to {} ({} years)", holdings.size(), data.range().start(),
				data.range().end(), String.format("%.2f", data.range().years()));
		return new AnalysisResponseDto(portfolio, benchmark, chartData, report, adjustedHoldings);
	}

	/**
	 * Metrics, value series, yearly returns, drawdowns and sector distribution of the holdings over
	 * the aligned prices. The benchmark series feeds the relative metrics when its length matches.
	 */
	public PortfolioAnalysis analyzePortfolio(PriceMatrix prices,
											  List<Holding> holdings,
											  MarketDataService.DateRange range,
											  double riskFreeRate,
											  List<ValuePoint> benchmarkValues) {
		List<ValuePoint> values = metricsEngine.computeValueSeries(prices, holdings);
		PerformanceMetrics metrics = metricsEngine.computeMetrics(values, range.years(), riskFreeRate, benchmarkValues);
		return new PortfolioAnalysis(
				metrics,
				values,
				metricsEngine.yearlyReturns(values),
				metricsEngine.drawdowns(values),
				holdings,
				sectorBalanceEvaluator.sectorDistribution(holdings, sectorLookup),
				range.start(),
				range.end(),
				range.years()
		);
	}

	public SectorBalanceReport checkSectorBalance(List<Holding> holdings) {
		return sectorBalanceEvaluator.check(Holdings.merge(holdings), sectorLookup);
	}
}
