package my.portfoliooptimizer.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Risk/return figures of one value series. Returns, volatility, drawdown, alpha and tracking
 * error are in percent; ratios are plain numbers. Non-finite inputs are stored as 0, so no NaN
 * or infinity ever leaves the engine.
 */
public record PerformanceMetrics(double totalReturn,
								 double annualizedReturn,
								 double volatility,
								 double sharpeRatio,
								 double maxDrawdown,
								 double bestYear,
								 double worstYear,
								 int positiveYears,
								 int negativeYears,
								 double sortinoRatio,
								 double downsideDeviation,
								 double beta,
								 double alpha,
								 double informationRatio,
								 double trackingError,
								 @JsonProperty("rSquare") double rSquare) {
	private static final PerformanceMetrics EMPTY = new PerformanceMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

	public PerformanceMetrics {
		totalReturn = finite(totalReturn);
		annualizedReturn = finite(annualizedReturn);
		volatility = finite(volatility);
		sharpeRatio = finite(sharpeRatio);
		maxDrawdown = finite(maxDrawdown);
		bestYear = finite(bestYear);
		worstYear = finite(worstYear);
		sortinoRatio = finite(sortinoRatio);
		downsideDeviation = finite(downsideDeviation);
		beta = finite(beta);
		alpha = finite(alpha);
		informationRatio = finite(informationRatio);
		trackingError = finite(trackingError);
		rSquare = finite(rSquare);
	}

	/**
	 * Sentinel for series with fewer than two points.
	 */
	public static PerformanceMetrics empty() {
		return EMPTY;
	}

	public boolean isEmpty() {
		return equals(EMPTY);
	}

	private static double finite(double value) {
		return Double.isFinite(value) ? value : 0;
	}
}
