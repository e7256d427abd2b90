package my.portfoliooptimizer.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FrontierPoint(double volatility,
							@JsonProperty("return") double returnPct,
							@JsonProperty("isCurrent") boolean current,
							@JsonProperty("isOptimal") boolean optimal,
							@JsonProperty("isSectorBalanced") boolean sectorBalanced) {
	public static FrontierPoint sample(PerformanceMetrics metrics) {
		return new FrontierPoint(metrics.volatility(), metrics.annualizedReturn(), false, false, false);
	}
}
