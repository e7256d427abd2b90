package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.model.BenchmarkStatistics;
import my.portfoliooptimizer.app.model.DrawdownPoint;
import my.portfoliooptimizer.app.model.Holding;
import my.portfoliooptimizer.app.model.PerformanceMetrics;
import my.portfoliooptimizer.app.model.PriceMatrix;
import my.portfoliooptimizer.app.model.ValuePoint;
import my.portfoliooptimizer.app.model.YearlyReturn;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class MetricsEngine {
	public static final double INITIAL_CAPITAL = 10_000.0;
	public static final double DEFAULT_RISK_FREE_RATE = 2.0;
	static final int TRADING_DAYS = 252;
	private static final double DAYS_PER_YEAR = 365.25;

	/**
	 * Buys each holding at its first available price with {@link #INITIAL_CAPITAL} and carries the
	 * share counts forward. Dates where the portfolio is worth nothing are skipped.
	 */
	public List<ValuePoint> computeValueSeries(PriceMatrix prices, List<Holding> holdings) {
		List<ValuePoint> values = new ArrayList<>();
		if (prices == null || holdings == null || holdings.isEmpty()) {
			return values;
		}
		List<String> tickers = new ArrayList<>();
		List<Double> shares = new ArrayList<>();
		for (Holding holding : holdings) {
			double initialPrice = prices.initialPrice(holding.ticker());
			if (Double.isNaN(initialPrice) || initialPrice <= 0) {
				continue;
			}
			tickers.add(holding.ticker());
			shares.add(INITIAL_CAPITAL * (holding.allocation() / 100.0) / initialPrice);
		}
		List<LocalDate> dates = prices.dates();
		for (int i = 0; i < dates.size(); i++) {
			double total = 0;
			for (int t = 0; t < tickers.size(); t++) {
				double price = prices.priceAt(tickers.get(t), i);
				if (!Double.isNaN(price)) {
					total += shares.get(t) * price;
				}
			}
			if (total > 0) {
				values.add(new ValuePoint(dates.get(i), total));
			}
		}
		return values;
	}

	public PerformanceMetrics computeMetrics(List<ValuePoint> values, double years) {
		return computeMetrics(values, years, DEFAULT_RISK_FREE_RATE, null);
	}

	/**
	 * @param years         period length; derived from the series dates when not positive
	 * @param riskFreeRate  annual risk-free rate in percent
	 * @param benchmark     optional benchmark series, used only when its length matches
	 */
	public PerformanceMetrics computeMetrics(List<ValuePoint> values,
											 double years,
											 double riskFreeRate,
											 List<ValuePoint> benchmark) {
		if (values == null || values.size() < 2) {
			return PerformanceMetrics.empty();
		}
		double periodYears = years > 0 ? years : yearsBetween(values.get(0).date(), values.get(values.size() - 1).date());
		double initial = values.get(0).value();
		double last = values.get(values.size() - 1).value();
		double totalReturn = (last - initial) / initial * 100;
		double annualizedReturn = periodYears > 0 ? (Math.pow(last / initial, 1 / periodYears) - 1) * 100 : 0;

		double[] dailyReturns = dailyReturns(values);
		double volatility = sampleStdev(dailyReturns) * Math.sqrt(TRADING_DAYS) * 100;
		double excessReturn = annualizedReturn - riskFreeRate;
		double sharpeRatio = volatility > 0 ? excessReturn / volatility : 0;

		double downsideDeviation = downsideDeviation(dailyReturns, riskFreeRate / TRADING_DAYS);
		double sortinoRatio = downsideDeviation > 0
				? excessReturn / (downsideDeviation * Math.sqrt(TRADING_DAYS))
				: 0;

		List<YearlyReturn> yearlyReturns = yearlyReturns(values);
		double bestYear = 0;
		double worstYear = 0;
		int positiveYears = 0;
		int negativeYears = 0;
		if (!yearlyReturns.isEmpty()) {
			bestYear = Double.NEGATIVE_INFINITY;
			worstYear = Double.POSITIVE_INFINITY;
			for (YearlyReturn yearly : yearlyReturns) {
				bestYear = Math.max(bestYear, yearly.returnPct());
				worstYear = Math.min(worstYear, yearly.returnPct());
				if (yearly.returnPct() > 0) {
					positiveYears++;
				} else {
					negativeYears++;
				}
			}
		}

		BenchmarkStatistics relative = BenchmarkStatistics.none();
		if (benchmark != null && benchmark.size() == values.size()) {
			relative = benchmarkStatistics(dailyReturns, dailyReturns(benchmark), riskFreeRate);
		}

		return new PerformanceMetrics(
				totalReturn,
				annualizedReturn,
				volatility,
				sharpeRatio,
				maxDrawdown(values),
				bestYear,
				worstYear,
				positiveYears,
				negativeYears,
				sortinoRatio,
				downsideDeviation,
				relative.beta(),
				relative.alpha(),
				relative.informationRatio(),
				relative.trackingError(),
				relative.rSquare()
		);
	}

	/**
	 * Beta, alpha, R², tracking error and information ratio of the portfolio returns against the
	 * benchmark returns. Zero variances leave the dependent figure at 0.
	 */
	BenchmarkStatistics benchmarkStatistics(double[] portfolioReturns, double[] benchmarkReturns, double riskFreeRate) {
		int length = Math.min(portfolioReturns.length, benchmarkReturns.length);
		if (length == 0) {
			return BenchmarkStatistics.none();
		}
		double[] port = slice(portfolioReturns, length);
		double[] bench = slice(benchmarkReturns, length);
		double dailyRf = riskFreeRate / 100 / TRADING_DAYS;
		double meanPort = mean(port);
		double meanBench = mean(bench);

		double varBench = populationVariance(bench);
		double varPort = populationVariance(port);
		double covariance = populationCovariance(port, bench);

		double beta = varBench > 0 ? covariance / varBench : 0;
		if (!Double.isFinite(beta)) {
			beta = 0;
		}
		double alpha = ((meanPort - dailyRf) - beta * (meanBench - dailyRf)) * TRADING_DAYS * 100;

		double[] activeReturns = new double[length];
		for (int i = 0; i < length; i++) {
			activeReturns[i] = (port[i] - dailyRf) - (bench[i] - dailyRf);
		}
		double trackingError = sampleStdev(activeReturns) * Math.sqrt(TRADING_DAYS) * 100;
		double informationRatio = trackingError > 0
				? ((meanPort - meanBench) * TRADING_DAYS * 100) / trackingError
				: 0;
		double rSquare = varBench > 0 && varPort > 0
				? (covariance * covariance) / (varBench * varPort)
				: 0;
		return new BenchmarkStatistics(beta, alpha, informationRatio, trackingError, rSquare);
	}

	public List<YearlyReturn> yearlyReturns(List<ValuePoint> values) {
		Map<Integer, double[]> byYear = new LinkedHashMap<>();
		if (values != null) {
			for (ValuePoint point : values) {
				int year = point.date().getYear();
				double[] bounds = byYear.get(year);
				if (bounds == null) {
					byYear.put(year, new double[]{point.value(), point.value()});
				} else {
					bounds[1] = point.value();
				}
			}
		}
		List<YearlyReturn> result = new ArrayList<>();
		byYear.forEach((year, bounds) -> {
			double start = bounds[0];
			double yearly = start > 0 ? (bounds[1] - start) / start * 100 : 0;
			result.add(new YearlyReturn(year, yearly));
		});
		result.sort((a, b) -> Integer.compare(a.year(), b.year()));
		return result;
	}

	public List<DrawdownPoint> drawdowns(List<ValuePoint> values) {
		List<DrawdownPoint> result = new ArrayList<>();
		if (values == null || values.isEmpty()) {
			return result;
		}
		double peak = values.get(0).value();
		for (ValuePoint point : values) {
			peak = Math.max(peak, point.value());
			double drawdown = peak > 0 ? (point.value() - peak) / peak * 100 : 0;
			result.add(new DrawdownPoint(point.date(), drawdown));
		}
		return result;
	}

	public double maxDrawdown(List<ValuePoint> values) {
		double max = 0;
		for (DrawdownPoint point : drawdowns(values)) {
			max = Math.min(max, point.drawdown());
		}
		return max;
	}

	static double[] dailyReturns(List<ValuePoint> values) {
		if (values == null || values.size() < 2) {
			return new double[0];
		}
		double[] returns = new double[values.size() - 1];
		for (int i = 1; i < values.size(); i++) {
			double previous = values.get(i - 1).value();
			returns[i - 1] = previous != 0 ? (values.get(i).value() - previous) / previous : 0;
		}
		return returns;
	}

	/**
	 * Root mean square shortfall below the daily risk-free rate, with returns in percent.
	 */
	static double downsideDeviation(double[] dailyReturns, double dailyRiskFree) {
		double sumSquares = 0;
		int count = 0;
		for (double value : dailyReturns) {
			double pct = value * 100;
			if (pct < dailyRiskFree) {
				sumSquares += (pct - dailyRiskFree) * (pct - dailyRiskFree);
				count++;
			}
		}
		return count == 0 ? 0 : Math.sqrt(sumSquares / count);
	}

	static double mean(double[] values) {
		if (values.length == 0) {
			return 0;
		}
		double sum = 0;
		for (double value : values) {
			sum += value;
		}
		return sum / values.length;
	}

	static double sampleStdev(double[] values) {
		if (values.length < 2) {
			return 0;
		}
		double avg = mean(values);
		double sum = 0;
		for (double value : values) {
			sum += (value - avg) * (value - avg);
		}
		return Math.sqrt(sum / (values.length - 1));
	}

	static double populationVariance(double[] values) {
		return populationCovariance(values, values);
	}

	static double populationCovariance(double[] x, double[] y) {
		if (x.length == 0) {
			return 0;
		}
		double meanX = mean(x);
		double meanY = mean(y);
		double sum = 0;
		for (int i = 0; i < x.length; i++) {
			sum += (x[i] - meanX) * (y[i] - meanY);
		}
		return sum / x.length;
	}

	static double yearsBetween(LocalDate start, LocalDate end) {
		if (start == null || end == null) {
			return 0;
		}
		return ChronoUnit.DAYS.between(start, end) / DAYS_PER_YEAR;
	}

	private static double[] slice(double[] values, int length) {
		if (values.length == length) {
			return values;
		}
		double[] copy = new double[length];
		System.arraycopy(values, 0, copy, 0, length);
		return copy;
	}
}
