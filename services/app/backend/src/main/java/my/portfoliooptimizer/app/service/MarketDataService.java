package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.config.AppProperties;
import my.portfoliooptimizer.app.market.PriceStore;
import my.portfoliooptimizer.app.model.Holding;
import my.portfoliooptimizer.app.model.PriceMatrix;
import my.portfoliooptimizer.app.model.PricePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Prepares date-aligned price data for analysis and optimization runs.
 */
@Service
public class MarketDataService {
	private static final Logger logger = LoggerFactory.getLogger(MarketDataService.class);
	static final double MIN_YEARS = 0.1;
	private static final double DAYS_PER_YEAR = 365.25;
	private static final String DEFAULT_BENCHMARK = "^GSPC";
	private static final String DEFAULT_RISK_FREE = "^IRX";

	private final PriceStore priceStore;
	private final String benchmarkTicker;
	private final String riskFreeTicker;
	private final double defaultRiskFreeRate;

	public MarketDataService(PriceStore priceStore, AppProperties properties) {
		this.priceStore = priceStore;
		AppProperties.Market market = properties == null ? null : properties.market();
		this.benchmarkTicker = market == null || market.benchmarkTicker() == null
				? DEFAULT_BENCHMARK
				: market.benchmarkTicker().trim().toUpperCase(Locale.ROOT);
		this.riskFreeTicker = market == null || market.riskFreeTicker() == null
				? DEFAULT_RISK_FREE
				: market.riskFreeTicker().trim().toUpperCase(Locale.ROOT);
		this.defaultRiskFreeRate = market == null || market.defaultRiskFreeRate() == null
				? MetricsEngine.DEFAULT_RISK_FREE_RATE
				: market.defaultRiskFreeRate();
	}

	public String benchmarkTicker() {
		return benchmarkTicker;
	}

	/**
	 * Holdings plus benchmark and risk-free series over their common date range. The benchmark and
	 * risk-free series are optional; holdings tickers are not.
	 */
	public PreparedData prepareAnalysis(List<Holding> holdings) {
		Map<String, List<PricePoint>> series = requireSeries(holdings);
		Optional<List<PricePoint>> benchmark = priceStore.findSeries(benchmarkTicker);
		Optional<List<PricePoint>> riskFree = priceStore.findSeries(riskFreeTicker);
		benchmark.filter(points -> !points.isEmpty()).ifPresentOrElse(
				points -> series.put(benchmarkTicker, points),
				() -> logger.warn("Benchmark series {} not available; relative metrics stay at 0", benchmarkTicker));
		if (riskFree.isEmpty()) {
			logger.warn("Risk-free series {} not available; using {}%", riskFreeTicker, defaultRiskFreeRate);
		}

		Map<String, List<PricePoint>> rangeSource = new LinkedHashMap<>(series);
		riskFree.filter(points -> !points.isEmpty()).ifPresent(points -> rangeSource.put(riskFreeTicker, points));
		DateRange range = requireRange(commonDateRange(rangeSource));

		Map<String, List<PricePoint>> aligned = align(series, range);
		return new PreparedData(PriceMatrix.of(aligned), List.copyOf(aligned.keySet()), range,
				riskFreeRate(riskFree.orElse(List.of()), range), aligned.containsKey(benchmarkTicker));
	}

	/**
	 * The range comes from the holdings; the universe is every other stored ticker whose history
	 * covers that range. Benchmark and risk-free tickers never enter the universe.
	 */
	public PreparedData prepareOptimization(List<Holding> holdings) {
		Map<String, List<PricePoint>> holdingSeries = requireSeries(holdings);
		DateRange range = requireRange(commonDateRange(holdingSeries));

		Map<String, List<PricePoint>> covering = new LinkedHashMap<>();
		for (String ticker : coveringTickers(range)) {
			priceStore.findSeries(ticker).ifPresent(points -> covering.put(ticker, points));
		}
		priceStore.findSeries(benchmarkTicker)
				.filter(points -> covers(points, range))
				.ifPresent(points -> covering.put(benchmarkTicker, points));
		covering.putAll(holdingSeries);
		Map<String, List<PricePoint>> aligned = align(covering, range);

		List<String> universe = new ArrayList<>();
		for (String ticker : aligned.keySet()) {
			if (!ticker.equals(benchmarkTicker)) {
				universe.add(ticker);
			}
		}
		List<PricePoint> riskFree = priceStore.findSeries(riskFreeTicker).orElse(List.of());
		logger.debug("Optimization universe: {} tickers over {} to {}", universe.size(), range.start(), range.end());
		return new PreparedData(PriceMatrix.of(aligned), universe, range, riskFreeRate(riskFree, range),
				aligned.containsKey(benchmarkTicker));
	}

	/**
	 * Stored tickers, other than the benchmark and risk-free series, whose history spans the range.
	 */
	public List<String> coveringTickers(DateRange range) {
		List<String> result = new ArrayList<>();
		for (String ticker : new TreeSet<>(priceStore.tickers())) {
			if (ticker.equals(benchmarkTicker) || ticker.equals(riskFreeTicker)) {
				continue;
			}
			if (priceStore.findSeries(ticker).filter(points -> covers(points, range)).isPresent()) {
				result.add(ticker);
			}
		}
		return result;
	}

	/**
	 * Latest first date and earliest last date across the series.
	 */
	public static DateRange commonDateRange(Map<String, List<PricePoint>> series) {
		LocalDate latestStart = null;
		LocalDate earliestEnd = null;
		for (List<PricePoint> points : series.values()) {
			if (points == null || points.isEmpty()) {
				continue;
			}
			LocalDate start = points.get(0).date();
			LocalDate end = points.get(points.size() - 1).date();
			if (latestStart == null || start.isAfter(latestStart)) {
				latestStart = start;
			}
			if (earliestEnd == null || end.isBefore(earliestEnd)) {
				earliestEnd = end;
			}
		}
		if (latestStart == null) {
			return new DateRange(null, null, 0);
		}
		return new DateRange(latestStart, earliestEnd, ChronoUnit.DAYS.between(latestStart, earliestEnd) / DAYS_PER_YEAR);
	}

	static Map<String, List<PricePoint>> align(Map<String, List<PricePoint>> series, DateRange range) {
		Map<String, List<PricePoint>> aligned = new LinkedHashMap<>();
		for (Map.Entry<String, List<PricePoint>> entry : series.entrySet()) {
			List<PricePoint> inRange = new ArrayList<>();
			for (PricePoint point : entry.getValue()) {
				if (!point.date().isBefore(range.start()) && !point.date().isAfter(range.end())) {
					inRange.add(point);
				}
			}
			if (!inRange.isEmpty()) {
				aligned.put(entry.getKey(), inRange);
			}
		}
		return aligned;
	}

	double riskFreeRate(List<PricePoint> riskFree, DateRange range) {
		double sum = 0;
		int count = 0;
		for (PricePoint point : riskFree) {
			if (range.start() != null && (point.date().isBefore(range.start()) || point.date().isAfter(range.end()))) {
				continue;
			}
			sum += point.adjustedClose();
			count++;
		}
		return count == 0 ? defaultRiskFreeRate : sum / count;
	}

	private Map<String, List<PricePoint>> requireSeries(List<Holding> holdings) {
		Set<String> tickers = new LinkedHashSet<>();
		for (Holding holding : holdings) {
			tickers.add(holding.ticker());
		}
		Map<String, List<PricePoint>> series = new LinkedHashMap<>();
		List<String> missing = new ArrayList<>();
		for (String ticker : tickers) {
			Optional<List<PricePoint>> points = priceStore.findSeries(ticker).filter(list -> !list.isEmpty());
			if (points.isPresent()) {
				series.put(ticker, points.get());
			} else {
				missing.add(ticker);
			}
		}
		if (!missing.isEmpty()) {
			throw new MissingInstrumentException(missing);
		}
		return series;
	}

	private static DateRange requireRange(DateRange range) {
		if (range.start() == null || range.years() < MIN_YEARS) {
			throw new InsufficientHistoryException("Insufficient historical data", range.years());
		}
		return range;
	}

	private static boolean covers(List<PricePoint> points, DateRange range) {
		return !points.isEmpty()
				&& !points.get(0).date().isAfter(range.start())
				&& !points.get(points.size() - 1).date().isBefore(range.end());
	}

	public record DateRange(LocalDate start, LocalDate end, double years) {
	}

	/**
	 * @param tickers holdings (and benchmark) for analysis; the optimization universe for optimization
	 */
	public record PreparedData(PriceMatrix prices,
							   List<String> tickers,
							   DateRange range,
							   double riskFreeRate,
							   boolean hasBenchmark) {
		public PreparedData {
			tickers = List.copyOf(tickers);
		}
	}
}
