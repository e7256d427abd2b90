package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.market.SectorLookup;
import my.portfoliooptimizer.app.model.Candidate;
import my.portfoliooptimizer.app.model.Holding;
import my.portfoliooptimizer.app.model.Holdings;
import my.portfoliooptimizer.app.model.PerformanceMetrics;
import my.portfoliooptimizer.app.model.PriceMatrix;
import my.portfoliooptimizer.app.model.RiskTolerance;
import my.portfoliooptimizer.app.model.SectorBalanceReport;
import my.portfoliooptimizer.app.model.TargetAdjustment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.TreeSet;

/**
 * Time-boxed stochastic search over allocations. Each iteration evaluates a local batch built
 * around the seed portfolio and a global batch drawn from the whole universe, then checks the
 * stop condition. All random draws happen on the calling thread, so a seed replays the same
 * result whether evaluation runs sequentially or on the worker pool.
 */
@Service
public class SearchEngine {
	private static final Logger logger = LoggerFactory.getLogger(SearchEngine.class);
	static final double MUST_INCLUDE_MIN_SHARPE = -0.2;
	static final double TARGET_STOP_DISTANCE = 1.5;
	static final double TARGET_SELECT_DISTANCE = 2.0;
	// Applied to |baseline|, so a negative baseline Sharpe still gets a lower viability bar and a
	// higher improvement bar. For positive baselines this equals 0.8x and 1.1x.
	static final double ABS_BASELINE_VIABILITY_SLACK = 0.2;
	static final double ABS_BASELINE_IMPROVEMENT_GAIN = 0.1;
	static final int FALLBACK_POOL_SIZE = 50;
	static final double TOP_SCORE_SHARE = 0.2;
	static final int MIN_HOLDINGS_CAP = 15;
	static final int MAX_HOLDINGS_CAP = 50;
	private static final int MIN_HOLDINGS = 2;
	private static final int POOL_TICKERS_PER_SECTOR = 3;
	private static final double CAP_TOLERANCE = 1e-6;

	private final MetricsEngine metricsEngine;
	private final SectorBalanceEvaluator evaluator;
	private final CandidateGenerator generator;
	private final SectorAdjuster adjuster;
	private final BatchEvaluator batchEvaluator;
	private final SearchSettings settings;
	private final Clock clock;

	public SearchEngine(MetricsEngine metricsEngine,
						SectorBalanceEvaluator evaluator,
						CandidateGenerator generator,
						SectorAdjuster adjuster,
						BatchEvaluator batchEvaluator,
						SearchSettings settings,
						Clock clock) {
		this.metricsEngine = metricsEngine;
		this.evaluator = evaluator;
		this.generator = generator;
		this.adjuster = adjuster;
		this.batchEvaluator = batchEvaluator == null ? BatchEvaluator.sequential() : batchEvaluator;
		this.settings = settings == null ? SearchSettings.defaults() : settings;
		this.clock = clock == null ? Clock.systemUTC() : clock;
	}

	public Outcome search(Request request) {
		Run run = new Run(request);
		SearchState state = SearchState.INIT;
		while (state != SearchState.DONE) {
			state = switch (state) {
				case INIT -> run.init();
				case BATCH_LOCAL -> run.localBatch();
				case BATCH_GLOBAL -> run.globalBatch();
				case CHECK_STOP -> run.checkStop();
				case SELECT -> run.select();
				case DONE -> SearchState.DONE;
			};
		}
		return run.outcome();
	}

	Candidate evaluate(List<Holding> holdings, PriceMatrix prices, double years, double riskFreeRate, SectorLookup sectors) {
		PerformanceMetrics metrics = metricsEngine.computeMetrics(
				metricsEngine.computeValueSeries(prices, holdings), years, riskFreeRate, null);
		int score = evaluator.check(holdings, sectors).overallScore();
		return new Candidate(holdings, metrics, score);
	}

	static double viabilityThreshold(double baselineSharpe) {
		return baselineSharpe - ABS_BASELINE_VIABILITY_SLACK * Math.abs(baselineSharpe);
	}

	static double improvementThreshold(double baselineSharpe) {
		return baselineSharpe + ABS_BASELINE_IMPROVEMENT_GAIN * Math.abs(baselineSharpe);
	}

	static int holdingsCap(int baselineCount, int universeSize) {
		int cap = Math.min(Math.max(2 * baselineCount, MIN_HOLDINGS_CAP), MAX_HOLDINGS_CAP);
		return Math.max(1, Math.min(cap, universeSize));
	}

	/**
	 * Narrows the pool to viable candidates, then by sector score, then picks by target return or
	 * risk tolerance. Ties keep the earlier candidate.
	 */
	static Candidate selectBest(List<Candidate> pool,
								double baselineSharpe,
								boolean rebalanceSectors,
								Double targetReturn,
								RiskTolerance riskTolerance) {
		if (pool.isEmpty()) {
			return null;
		}
		double threshold = viabilityThreshold(baselineSharpe);
		List<Candidate> viable = new ArrayList<>();
		for (Candidate candidate : pool) {
			if (candidate.metrics().sharpeRatio() >= threshold) {
				viable.add(candidate);
			}
		}
		if (viable.isEmpty()) {
			viable = pool.stream()
					.sorted(Comparator.comparingDouble((Candidate c) -> c.metrics().sharpeRatio()).reversed())
					.limit(FALLBACK_POOL_SIZE)
					.toList();
		}

		List<Candidate> narrowed;
		if (rebalanceSectors) {
			int bestScore = viable.stream().mapToInt(Candidate::sectorScore).max().orElse(0);
			int wanted = bestScore >= SectorBalanceReport.PERFECT_SCORE ? SectorBalanceReport.PERFECT_SCORE : bestScore;
			narrowed = viable.stream().filter(c -> c.sectorScore() == wanted).toList();
		} else {
			int keep = Math.max(1, (int) Math.ceil(viable.size() * TOP_SCORE_SHARE));
			narrowed = viable.stream()
					.sorted(Comparator.comparingInt(Candidate::sectorScore).reversed())
					.limit(keep)
					.toList();
		}

		if (targetReturn != null) {
			double target = targetReturn;
			List<Candidate> near = narrowed.stream()
					.filter(c -> Math.abs(c.metrics().annualizedReturn() - target) <= TARGET_SELECT_DISTANCE)
					.toList();
			if (!near.isEmpty()) {
				return near.stream().min(Comparator.comparingDouble(c -> c.metrics().volatility())).orElseThrow();
			}
			return narrowed.stream()
					.min(Comparator.comparingDouble(c -> Math.abs(c.metrics().annualizedReturn() - target)))
					.orElseThrow();
		}
		Comparator<Candidate> policy = switch (riskTolerance == null ? RiskTolerance.MODERATE : riskTolerance) {
			case CONSERVATIVE -> Comparator.comparingDouble(c -> c.metrics().volatility());
			case AGGRESSIVE -> Comparator.comparingDouble((Candidate c) -> c.metrics().annualizedReturn()).reversed();
			case MODERATE -> Comparator.comparingDouble((Candidate c) -> c.metrics().sharpeRatio()).reversed();
		};
		return narrowed.stream().min(policy).orElseThrow();
	}

	private final class Run {
		private final Request request;
		private final SplittableRandom random;
		private final Instant started;
		private final Instant deadline;
		private final List<Candidate> pool = new ArrayList<>();

		private List<String> universe;
		private List<String> localUniverse;
		private Set<String> mustInclude;
		private Map<String, TargetAdjustment> adjustments;
		private List<Holding> seed;
		private Candidate baseline;
		private SectorBalanceReport baselineReport;
		private SectorAdjuster.Result sectorAdjustment;
		private Candidate sectorBalanced;
		private boolean sectorMode;
		private int minHoldings;
		private int maxHoldings;
		private int iterations;
		private boolean stoppedEarly;
		private boolean timedOut;
		private Candidate best;

		private Run(Request request) {
			this.request = request;
			this.random = new SplittableRandom(request.seed());
			this.started = clock.instant();
			this.deadline = started.plus(settings.timeout());
		}

		private SearchState init() {
			PriceMatrix prices = request.prices();
			List<Holding> holdings = new ArrayList<>();
			for (Holding holding : Holdings.merge(request.holdings())) {
				if (prices.contains(holding.ticker())) {
					holdings.add(holding);
				}
			}
			holdings = Holdings.normalize(holdings);
			baseline = evaluate(holdings);
			baselineReport = evaluator.check(holdings, request.sectors());
			universe = new ArrayList<>();
			for (String ticker : new TreeSet<>(request.universe())) {
				if (prices.contains(ticker)) {
					universe.add(ticker);
				}
			}

			sectorMode = request.rebalanceSectors() && baselineReport.hasViolations();
			seed = holdings;
			if (sectorMode) {
				sectorAdjustment = adjuster.adjust(holdings, request.sectors(), new LinkedHashSet<>(universe));
				seed = sectorAdjustment.holdings();
				sectorBalanced = evaluate(seed);
				adjustments = evaluator.targetAdjustments(baselineReport, holdings, request.sectors());
				logger.debug("Sector-balanced seed after {} iterations, score {}",
						sectorAdjustment.iterations(), sectorAdjustment.report().overallScore());
			}

			Set<String> seedTickers = new TreeSet<>(Holdings.tickers(holdings));
			seedTickers.addAll(Holdings.tickers(seed));
			mustInclude = mustInclude(seedTickers);
			localUniverse = localUniverse(seedTickers);

			maxHoldings = Math.max(holdingsCap(holdings.size(), universe.size()), mustInclude.size());
			int floor = request.riskTolerance() == RiskTolerance.CONSERVATIVE
					? CandidateGenerator.CONSERVATIVE_MIN_HOLDINGS
					: MIN_HOLDINGS;
			minHoldings = Math.min(Math.max(floor, mustInclude.size()), maxHoldings);

			List<Holding> riskAdjustedSeed = generator.adjustForRisk(seed, request.riskTolerance());
			if (acceptable(riskAdjustedSeed)) {
				pool.add(evaluate(riskAdjustedSeed));
			}
			if (universe.isEmpty()) {
				return SearchState.SELECT;
			}
			return SearchState.BATCH_LOCAL;
		}

		private SearchState localBatch() {
			List<List<Holding>> batch = new ArrayList<>();
			for (int i = 0; i < settings.localBatchSize(); i++) {
				List<Holding> parent = i % 2 == 0 || best == null ? seed : best.holdings();
				List<Holding> raw = switch (i % 3) {
					case 0 -> generator.mutateWeights(parent, settings.mutationRate(), random);
					case 1 -> parent.size() < minHoldings
							? generator.addHolding(parent, localUniverse, random)
							: generator.swapHolding(parent, localUniverse, mustInclude, random);
					default -> sample(localUniverse);
				};
				addIfAcceptable(batch, raw);
			}
			evaluateBatch(batch);
			if (deadlinePassed()) {
				timedOut = true;
				return SearchState.SELECT;
			}
			return SearchState.BATCH_GLOBAL;
		}

		private SearchState globalBatch() {
			List<List<Holding>> batch = new ArrayList<>();
			for (int i = 0; i < settings.globalBatchSize(); i++) {
				addIfAcceptable(batch, sample(universe));
			}
			evaluateBatch(batch);
			return SearchState.CHECK_STOP;
		}

		private SearchState checkStop() {
			iterations++;
			logger.debug("Search iteration {}: pool={}, best sharpe={}",
					iterations, pool.size(), best == null ? 0 : best.metrics().sharpeRatio());
			if (stopConditionMet()) {
				stoppedEarly = true;
				return SearchState.SELECT;
			}
			if (iterations >= settings.maxRetries()) {
				return SearchState.SELECT;
			}
			if (deadlinePassed()) {
				timedOut = true;
				return SearchState.SELECT;
			}
			return SearchState.BATCH_LOCAL;
		}

		private SearchState select() {
			if (timedOut) {
				logger.warn("Optimization search hit its {}s budget after {} iterations; selecting from {} candidates",
						settings.timeout().toSeconds(), iterations, pool.size());
			}
			Candidate selected = selectBest(pool, baseline.metrics().sharpeRatio(), request.rebalanceSectors(),
					request.targetReturn(), request.riskTolerance());
			if (selected == null) {
				selected = evaluate(Holdings.normalize(generator.adjustForRisk(seed, request.riskTolerance())));
				if (request.riskTolerance() == RiskTolerance.CONSERVATIVE
						&& Holdings.maxAllocation(selected.holdings()) > CandidateGenerator.CONSERVATIVE_CAP + CAP_TOLERANCE) {
					// too few tickers to spread below the cap; the fallback holds equal weights
					logger.warn("Universe of {} tickers cannot satisfy the {}% conservative position cap; returning equal weights",
							universe.size(), CandidateGenerator.CONSERVATIVE_CAP);
				}
			}
			best = selected;
			return SearchState.DONE;
		}

		private Outcome outcome() {
			long elapsed = clock.instant().toEpochMilli() - started.toEpochMilli();
			return new Outcome(baseline, best, pool, baselineReport, sectorMode, sectorAdjustment, sectorBalanced,
					iterations, stoppedEarly, timedOut, Math.max(0, elapsed));
		}

		private List<Holding> sample(List<String> tickers) {
			int upper = Math.max(minHoldings, Math.min(maxHoldings, tickers.size()));
			int size = minHoldings + random.nextInt(upper - minHoldings + 1);
			if (sectorMode) {
				return generator.sectorBiasedPortfolio(tickers, mustInclude, size, adjustments,
						settings.rebalancingStrength(), request.sectors(), random);
			}
			return generator.randomPortfolio(tickers, mustInclude, size, random);
		}

		private void addIfAcceptable(List<List<Holding>> batch, List<Holding> raw) {
			List<Holding> adjusted = generator.adjustForRisk(raw, request.riskTolerance());
			if (acceptable(adjusted)) {
				batch.add(adjusted);
			}
		}

		private boolean acceptable(List<Holding> holdings) {
			if (holdings.isEmpty() || !Holdings.isFullyAllocated(holdings)) {
				return false;
			}
			if (request.riskTolerance() == RiskTolerance.CONSERVATIVE) {
				return holdings.size() >= CandidateGenerator.CONSERVATIVE_MIN_HOLDINGS
						&& Holdings.maxAllocation(holdings) <= CandidateGenerator.CONSERVATIVE_CAP + CAP_TOLERANCE;
			}
			return true;
		}

		private void evaluateBatch(List<List<Holding>> batch) {
			List<Candidate> evaluated = batchEvaluator.map(batch, this::evaluate);
			for (Candidate candidate : evaluated) {
				pool.add(candidate);
				if (best == null || candidate.metrics().sharpeRatio() > best.metrics().sharpeRatio()) {
					best = candidate;
				}
			}
		}

		private boolean stopConditionMet() {
			if (request.targetReturn() != null) {
				double target = request.targetReturn();
				return pool.stream().anyMatch(c -> Math.abs(c.metrics().annualizedReturn() - target) <= TARGET_STOP_DISTANCE);
			}
			if (sectorMode) {
				return pool.stream().anyMatch(c -> c.sectorScore() >= SectorBalanceReport.PERFECT_SCORE);
			}
			double threshold = improvementThreshold(baseline.metrics().sharpeRatio());
			return pool.stream().anyMatch(c -> c.metrics().sharpeRatio() > threshold);
		}

		private boolean deadlinePassed() {
			return !clock.instant().isBefore(deadline);
		}

		/**
		 * Tickers whose own Sharpe ratio clears the floor, or the single best one when none does.
		 */
		private Set<String> mustInclude(Set<String> candidates) {
			Set<String> result = new LinkedHashSet<>();
			String bestTicker = null;
			double bestSharpe = Double.NEGATIVE_INFINITY;
			for (String ticker : candidates) {
				double sharpe = evaluate(List.of(new Holding(ticker, Holdings.FULL_ALLOCATION))).metrics().sharpeRatio();
				if (sharpe > MUST_INCLUDE_MIN_SHARPE) {
					result.add(ticker);
				}
				if (sharpe > bestSharpe) {
					bestSharpe = sharpe;
					bestTicker = ticker;
				}
			}
			if (result.isEmpty() && bestTicker != null) {
				logger.debug("No ticker clears the must-include floor; keeping {}", bestTicker);
				result.add(bestTicker);
			}
			return result;
		}

		private List<String> localUniverse(Set<String> seedTickers) {
			Set<String> local = new TreeSet<>(seedTickers);
			if (sectorMode && adjustments != null) {
				Map<String, List<String>> sectorPool = evaluator.sectorStockPool(request.sectors());
				Set<String> available = new LinkedHashSet<>(universe);
				for (Map.Entry<String, TargetAdjustment> entry : adjustments.entrySet()) {
					if (!entry.getValue().isIncrease()) {
						continue;
					}
					int added = 0;
					for (String ticker : new TreeSet<>(sectorPool.getOrDefault(entry.getKey(), List.of()))) {
						if (added >= POOL_TICKERS_PER_SECTOR) {
							break;
						}
						if (available.contains(ticker) && local.add(ticker)) {
							added++;
						}
					}
				}
			}
			return new ArrayList<>(local);
		}

		private Candidate evaluate(List<Holding> holdings) {
			return SearchEngine.this.evaluate(holdings, request.prices(), request.years(), request.riskFreeRate(),
					request.sectors());
		}
	}

	public enum SearchState {
		INIT,
		BATCH_LOCAL,
		BATCH_GLOBAL,
		CHECK_STOP,
		SELECT,
		DONE
	}

	public record Request(List<Holding> holdings,
						  RiskTolerance riskTolerance,
						  Double targetReturn,
						  boolean rebalanceSectors,
						  List<String> universe,
						  PriceMatrix prices,
						  double years,
						  double riskFreeRate,
						  SectorLookup sectors,
						  long seed) {
		public Request {
			holdings = List.copyOf(holdings);
			universe = List.copyOf(universe);
			riskTolerance = riskTolerance == null ? RiskTolerance.MODERATE : riskTolerance;
		}
	}

	/**
	 * @param sectorAdjustment null unless sector rebalancing was applied
	 * @param sectorBalanced   metrics of the sector-adjusted seed, null unless rebalancing was applied
	 */
	public record Outcome(Candidate baseline,
						  Candidate best,
						  List<Candidate> pool,
						  SectorBalanceReport baselineReport,
						  boolean sectorRebalancingApplied,
						  SectorAdjuster.Result sectorAdjustment,
						  Candidate sectorBalanced,
						  int iterations,
						  boolean stoppedEarly,
						  boolean timedOut,
						  long elapsedMillis) {
		public Outcome {
			pool = List.copyOf(pool);
		}
	}
}
