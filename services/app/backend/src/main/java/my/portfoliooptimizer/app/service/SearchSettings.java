package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.config.AppProperties;

import java.time.Duration;

public record SearchSettings(int maxRetries,
							 Duration timeout,
							 int localBatchSize,
							 int globalBatchSize,
							 double mutationRate,
							 double rebalancingStrength) {
	private static final int DEFAULT_MAX_RETRIES = 10;
	private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
	private static final int DEFAULT_BATCH_SIZE = 40;
	private static final double DEFAULT_MUTATION_RATE = 0.3;
	private static final double DEFAULT_REBALANCING_STRENGTH = 0.8;

	public static SearchSettings defaults() {
		return new SearchSettings(DEFAULT_MAX_RETRIES, DEFAULT_TIMEOUT, DEFAULT_BATCH_SIZE, DEFAULT_BATCH_SIZE,
				DEFAULT_MUTATION_RATE, DEFAULT_REBALANCING_STRENGTH);
	}

	public static SearchSettings from(AppProperties.Optimizer optimizer) {
		if (optimizer == null) {
			return defaults();
		}
		return new SearchSettings(
				positiveOr(optimizer.maxRetries(), DEFAULT_MAX_RETRIES),
				optimizer.timeout() == null || optimizer.timeout().isNegative() || optimizer.timeout().isZero()
						? DEFAULT_TIMEOUT
						: optimizer.timeout(),
				positiveOr(optimizer.localBatchSize(), DEFAULT_BATCH_SIZE),
				positiveOr(optimizer.globalBatchSize(), DEFAULT_BATCH_SIZE),
				optimizer.mutationRate() == null ? DEFAULT_MUTATION_RATE : optimizer.mutationRate(),
				optimizer.rebalancingStrength() == null ? DEFAULT_REBALANCING_STRENGTH : optimizer.rebalancingStrength()
		);
	}

	private static int positiveOr(Integer value, int fallback) {
		return value == null || value <= 0 ? fallback : value;
	}
}
