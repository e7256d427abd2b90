package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.model.Holding;
import my.portfoliooptimizer.app.model.Holdings;
import my.portfoliooptimizer.app.model.Recommendation;
import my.portfoliooptimizer.app.model.RiskTolerance;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class RecommendationBuilder {
	static final double MIN_CHANGE = 1.0;

	/**
	 * One entry per ticker whose allocation moves by at least {@value #MIN_CHANGE} point, largest
	 * moves first.
	 */
	public List<Recommendation> build(List<Holding> current, List<Holding> recommended, RiskTolerance riskTolerance) {
		Map<String, Double> before = Holdings.byTicker(current);
		Map<String, Double> after = Holdings.byTicker(recommended);
		Set<String> tickers = new LinkedHashSet<>(before.keySet());
		tickers.addAll(after.keySet());

		List<Recommendation> recommendations = new ArrayList<>();
		for (String ticker : tickers) {
			double currentAllocation = before.getOrDefault(ticker, 0.0);
			double recommendedAllocation = after.getOrDefault(ticker, 0.0);
			double change = recommendedAllocation - currentAllocation;
			if (Math.abs(change) < MIN_CHANGE) {
				continue;
			}
			String action;
			if (change > 0) {
				action = currentAllocation == 0 ? "Add position" : "Increase allocation";
			} else {
				action = recommendedAllocation == 0 ? "Remove position" : "Decrease allocation";
			}
			recommendations.add(new Recommendation(action, ticker, currentAllocation, recommendedAllocation, change,
					rationale(change > 0, riskTolerance)));
		}
		recommendations.sort(Comparator.comparingDouble((Recommendation r) -> Math.abs(r.change())).reversed());
		return recommendations;
	}

	static String rationale(boolean increase, RiskTolerance riskTolerance) {
		RiskTolerance tolerance = riskTolerance == null ? RiskTolerance.MODERATE : riskTolerance;
		if (increase) {
			return switch (tolerance) {
				case CONSERVATIVE -> "Provides stability and reduces overall portfolio volatility while maintaining growth potential";
				case AGGRESSIVE -> "Offers strong growth potential and enhances overall portfolio returns";
				case MODERATE -> "Improves risk-adjusted returns and portfolio diversification";
			};
		}
		return switch (tolerance) {
			case CONSERVATIVE -> "Reduces exposure to higher volatility while maintaining diversification";
			case AGGRESSIVE -> "Reallocates capital to higher-performing opportunities";
			case MODERATE -> "Optimizes allocation for better risk-adjusted returns";
		};
	}
}
