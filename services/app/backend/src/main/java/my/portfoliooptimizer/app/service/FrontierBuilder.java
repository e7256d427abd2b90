package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.model.Candidate;
import my.portfoliooptimizer.app.model.FrontierPoint;
import my.portfoliooptimizer.app.model.PerformanceMetrics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class FrontierBuilder {
	static final int TARGET_POINTS = 50;

	/**
	 * Candidates sorted by volatility and thinned to roughly {@value #TARGET_POINTS} points, followed
	 * by the current and optimal markers and, when given, the sector-balanced marker.
	 */
	public List<FrontierPoint> build(List<Candidate> candidates,
									 PerformanceMetrics current,
									 PerformanceMetrics optimal,
									 PerformanceMetrics sectorBalanced) {
		List<Candidate> sorted = new ArrayList<>(candidates == null ? List.of() : candidates);
		sorted.sort(Comparator.comparingDouble(candidate -> candidate.metrics().volatility()));
		int step = Math.max(1, sorted.size() / TARGET_POINTS);

		List<FrontierPoint> points = new ArrayList<>();
		for (int i = 0; i < sorted.size(); i += step) {
			points.add(FrontierPoint.sample(sorted.get(i).metrics()));
		}
		points.add(new FrontierPoint(current.volatility(), current.annualizedReturn(), true, false, false));
		points.add(new FrontierPoint(optimal.volatility(), optimal.annualizedReturn(), false, true, false));
		if (sectorBalanced != null) {
			points.add(new FrontierPoint(sectorBalanced.volatility(), sectorBalanced.annualizedReturn(), false, false, true));
		}
		return points;
	}
}
