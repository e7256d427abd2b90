package my.portfoliooptimizer.app.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Copy-on-write helpers for holdings lists. Every method returns a fresh list and never
 * touches its argument.
 */
public final class Holdings {
	public static final double FULL_ALLOCATION = 100.0;
	public static final double SUM_TOLERANCE = 0.01;

	private Holdings() {
	}

	public static double total(Collection<Holding> holdings) {
		double total = 0;
		if (holdings == null) {
			return total;
		}
		for (Holding holding : holdings) {
			total += holding.allocation();
		}
		return total;
	}

	public static List<Holding> normalize(List<Holding> holdings) {
		List<Holding> result = new ArrayList<>();
		if (holdings == null || holdings.isEmpty()) {
			return result;
		}
		double total = total(holdings);
		if (total <= 0) {
			double equal = FULL_ALLOCATION / holdings.size();
			for (Holding holding : holdings) {
				result.add(holding.withAllocation(equal));
			}
			return result;
		}
		for (Holding holding : holdings) {
			result.add(holding.withAllocation(holding.allocation() / total * FULL_ALLOCATION));
		}
		return result;
	}

	public static List<Holding> dropBelow(List<Holding> holdings, double minimum, Set<String> keep) {
		List<Holding> result = new ArrayList<>();
		for (Holding holding : holdings) {
			if (holding.allocation() >= minimum || (keep != null && keep.contains(holding.ticker()))) {
				result.add(holding);
			}
		}
		return result;
	}

	/**
	 * Merges duplicate tickers by summing their allocations, keeping first-seen order.
	 */
	public static List<Holding> merge(List<Holding> holdings) {
		Map<String, Double> merged = new LinkedHashMap<>();
		if (holdings != null) {
			for (Holding holding : holdings) {
				merged.merge(holding.ticker(), holding.allocation(), Double::sum);
			}
		}
		List<Holding> result = new ArrayList<>();
		merged.forEach((ticker, allocation) -> result.add(new Holding(ticker, allocation)));
		return result;
	}

	public static Map<String, Double> byTicker(List<Holding> holdings) {
		Map<String, Double> result = new LinkedHashMap<>();
		if (holdings != null) {
			for (Holding holding : holdings) {
				result.merge(holding.ticker(), holding.allocation(), Double::sum);
			}
		}
		return result;
	}

	public static Set<String> tickers(List<Holding> holdings) {
		Set<String> result = new LinkedHashSet<>();
		if (holdings != null) {
			for (Holding holding : holdings) {
				result.add(holding.ticker());
			}
		}
		return result;
	}

	public static double maxAllocation(List<Holding> holdings) {
		double max = 0;
		for (Holding holding : holdings) {
			max = Math.max(max, holding.allocation());
		}
		return max;
	}

	public static boolean isFullyAllocated(List<Holding> holdings) {
		return Math.abs(total(holdings) - FULL_ALLOCATION) <= SUM_TOLERANCE;
	}
}
