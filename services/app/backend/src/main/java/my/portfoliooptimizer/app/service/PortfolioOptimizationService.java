package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.config.AppProperties;
import my.portfoliooptimizer.app.dto.PortfolioInputRequest;
import my.portfoliooptimizer.app.market.SectorLookup;
import my.portfoliooptimizer.app.model.Candidate;
import my.portfoliooptimizer.app.model.Holding;
import my.portfoliooptimizer.app.model.Holdings;
import my.portfoliooptimizer.app.model.OptimizationResult;
import my.portfoliooptimizer.app.model.OptimizedHolding;
import my.portfoliooptimizer.app.model.PerformanceMetrics;
import my.portfoliooptimizer.app.model.PortfolioAnalysis;
import my.portfoliooptimizer.app.model.RiskTolerance;
import my.portfoliooptimizer.app.model.SectorBalancedPortfolio;
import my.portfoliooptimizer.app.model.ValuePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class PortfolioOptimizationService {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioOptimizationService.class);

	private final MarketDataService marketDataService;
	private final PortfolioAnalyticsService analyticsService;
	private final MetricsEngine metricsEngine;
	private final SearchEngine searchEngine;
	private final SectorBalanceEvaluator sectorBalanceEvaluator;
	private final FrontierBuilder frontierBuilder;
	private final RecommendationBuilder recommendationBuilder;
	private final SectorLookup sectorLookup;
	private final Long configuredSeed;

	public PortfolioOptimizationService(MarketDataService marketDataService,
										PortfolioAnalyticsService analyticsService,
										MetricsEngine metricsEngine,
										SearchEngine searchEngine,
										SectorBalanceEvaluator sectorBalanceEvaluator,
										FrontierBuilder frontierBuilder,
										RecommendationBuilder recommendationBuilder,
										SectorLookup sectorLookup,
										AppProperties properties) {
		this.marketDataService = marketDataService;
		this.analyticsService = analyticsService;
		this.metricsEngine = metricsEngine;
		this.searchEngine = searchEngine;
		this.sectorBalanceEvaluator = sectorBalanceEvaluator;
		this.frontierBuilder = frontierBuilder;
		this.recommendationBuilder = recommendationBuilder;
		this.sectorLookup = sectorLookup;
		this.configuredSeed = properties == null || properties.optimizer() == null ? null : properties.optimizer().seed();
	}

	public OptimizationResult optimize(PortfolioInputRequest request) {
		return optimize(request.toHoldings(), request.tolerance(), request.targetReturn(), request.rebalance(),
				request.seed());
	}

	public OptimizationResult optimize(List<Holding> input,
									   RiskTolerance riskTolerance,
									   Double targetReturn,
									   boolean rebalanceSectors,
									   Long requestedSeed) {
		List<Holding> holdings = Holdings.normalize(Holdings.merge(input));
		MarketDataService.PreparedData data = marketDataService.prepareOptimization(holdings);
		double years = data.range().years();
		List<ValuePoint> benchmarkValues = data.hasBenchmark()
				? metricsEngine.computeValueSeries(data.prices(),
				List.of(new Holding(marketDataService.benchmarkTicker(), Holdings.FULL_ALLOCATION)))
				: List.of();
		PortfolioAnalysis current = analyticsService.analyzePortfolio(data.prices(), holdings, data.range(),
				data.riskFreeRate(), benchmarkValues);

		long seed = resolveSeed(requestedSeed);
		logger.info("Optimizing {} holdings against {} tickers (riskTolerance={}, targetReturn={}, rebalanceSectors={}, seed={})",
				holdings.size(), data.tickers().size(), riskTolerance.id(), targetReturn, rebalanceSectors, seed);

		SearchEngine.Outcome outcome = searchEngine.search(new SearchEngine.Request(
				holdings,
				riskTolerance,
				targetReturn,
				rebalanceSectors,
				data.tickers(),
				data.prices(),
				years,
				data.riskFreeRate(),
				sectorLookup,
				seed
		));

		Candidate best = outcome.best();
		PerformanceMetrics optimizedMetrics = metricsEngine.computeMetrics(
				metricsEngine.computeValueSeries(data.prices(), best.holdings()), years, data.riskFreeRate(), benchmarkValues);
		List<Holding> reference = outcome.sectorRebalancingApplied()
				? outcome.sectorAdjustment().holdings()
				: holdings;

		OptimizationResult.OptimizedPortfolio optimized = new OptimizationResult.OptimizedPortfolio(
				optimizedMetrics,
				optimizedHoldings(best.holdings(), reference),
				sectorBalanceEvaluator.sectorDistribution(best.holdings(), sectorLookup),
				sectorBalanceEvaluator.check(best.holdings(), sectorLookup)
		);

		SectorBalancedPortfolio sectorBalanced = null;
		if (outcome.sectorRebalancingApplied()) {
			SectorAdjuster.Result adjustment = outcome.sectorAdjustment();
			sectorBalanced = new SectorBalancedPortfolio(
					adjustment.holdings(),
					outcome.sectorBalanced().metrics(),
					sectorBalanceEvaluator.sectorDistribution(adjustment.holdings(), sectorLookup),
					adjustment.report(),
					adjustment.iterations(),
					adjustment.converged()
			);
		}

		OptimizationResult.SearchSummary summary = new OptimizationResult.SearchSummary(
				seed,
				outcome.iterations(),
				outcome.pool().size(),
				outcome.stoppedEarly(),
				outcome.timedOut(),
				outcome.elapsedMillis()
		);
		logger.info("Optimization finished after {} iterations and {} candidates in {} ms (sharpe {} -> {})",
				summary.iterations(), summary.candidatesEvaluated(), summary.elapsedMillis(),
				String.format("%.3f", current.metrics().sharpeRatio()), String.format("%.3f", optimizedMetrics.sharpeRatio()));

		return new OptimizationResult(
				current,
				optimized,
				recommendationBuilder.build(holdings, best.holdings(), riskTolerance),
				frontierBuilder.build(outcome.pool(), current.metrics(), optimizedMetrics,
						sectorBalanced == null ? null : sectorBalanced.metrics()),
				outcome.sectorRebalancingApplied(),
				rebalanceSectors ? outcome.baselineReport() : null,
				sectorBalanced,
				summary
		);
	}

	/**
	 * Winner holdings, largest first, with the change against the reference portfolio.
	 */
	static List<OptimizedHolding> optimizedHoldings(List<Holding> holdings, List<Holding> reference) {
		Map<String, Double> before = Holdings.byTicker(reference);
		List<OptimizedHolding> result = new ArrayList<>(holdings.size());
		for (Holding holding : holdings) {
			double change = holding.allocation() - before.getOrDefault(holding.ticker(), 0.0);
			result.add(new OptimizedHolding(holding.ticker(), holding.allocation(), change));
		}
		result.sort(Comparator.comparingDouble(OptimizedHolding::allocation).reversed());
		return result;
	}

	private long resolveSeed(Long requestedSeed) {
		if (requestedSeed != null) {
			return requestedSeed;
		}
		if (configuredSeed != null) {
			return configuredSeed;
		}
		return ThreadLocalRandom.current().nextLong();
	}
}
