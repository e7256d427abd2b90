package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.market.SectorLookup;
import my.portfoliooptimizer.app.model.Holding;
import my.portfoliooptimizer.app.model.Holdings;
import my.portfoliooptimizer.app.model.RiskTolerance;
import my.portfoliooptimizer.app.model.TargetAdjustment;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Builds and mutates allocation candidates. All randomness comes from the generator passed in,
 * so a seeded generator replays the same candidates.
 */
@Service
public class CandidateGenerator {
	static final double MIN_ALLOCATION = 0.5;
	static final double CONSERVATIVE_CAP = 30.0;
	static final int CONSERVATIVE_MIN_HOLDINGS = 4;
	private static final double AGGRESSIVE_BOOST = 1.5;
	private static final double MIN_REDUCTION_FACTOR = 0.1;

	public List<Holding> randomPortfolio(List<String> universe,
										 Set<String> mustInclude,
										 int targetSize,
										 RandomGenerator random) {
		List<String> selected = selectTickers(universe, mustInclude, targetSize, random);
		List<Holding> holdings = new ArrayList<>(selected.size());
		for (String ticker : selected) {
			holdings.add(new Holding(ticker, random.nextDouble()));
		}
		return Holdings.normalize(holdings);
	}

	/**
	 * Random weights scaled up for tickers in underweight sectors and down for overweight ones.
	 * Allocations under {@value #MIN_ALLOCATION}% are dropped unless the ticker must be included.
	 */
	public List<Holding> sectorBiasedPortfolio(List<String> universe,
											   Set<String> mustInclude,
											   int targetSize,
											   Map<String, TargetAdjustment> adjustments,
											   double strength,
											   SectorLookup sectors,
											   RandomGenerator random) {
		List<String> selected = selectTickers(universe, mustInclude, targetSize, random);
		List<Holding> weighted = new ArrayList<>(selected.size());
		for (String ticker : selected) {
			double weight = random.nextDouble();
			TargetAdjustment adjustment = adjustments == null ? null : adjustments.get(sectors.getSector(ticker));
			if (adjustment != null) {
				double magnitude = Math.abs(adjustment.delta()) / 100;
				if (adjustment.isIncrease()) {
					weight *= 1 + magnitude * strength * 2;
				} else if (adjustment.isReduction()) {
					weight *= Math.max(MIN_REDUCTION_FACTOR, 1 - magnitude * strength);
				}
			}
			weighted.add(new Holding(ticker, weight));
		}
		List<Holding> normalized = Holdings.normalize(weighted);
		List<Holding> filtered = Holdings.dropBelow(normalized, MIN_ALLOCATION, mustInclude);
		return Holdings.normalize(filtered.isEmpty() ? normalized : filtered);
	}

	/**
	 * Moves every weight by up to {@code ±mutationRate × weight}.
	 */
	public List<Holding> mutateWeights(List<Holding> holdings, double mutationRate, RandomGenerator random) {
		List<Holding> mutated = new ArrayList<>(holdings.size());
		for (Holding holding : holdings) {
			double shift = (random.nextDouble() * 2 - 1) * mutationRate * holding.allocation();
			mutated.add(holding.withAllocation(Math.max(0, holding.allocation() + shift)));
		}
		return Holdings.normalize(mutated);
	}

	/**
	 * Replaces one holding that is not required with a ticker the candidate does not hold yet,
	 * entering at the average weight.
	 */
	public List<Holding> swapHolding(List<Holding> holdings,
									 List<String> universe,
									 Set<String> mustInclude,
									 RandomGenerator random) {
		Set<String> held = Holdings.tickers(holdings);
		List<String> unseen = new ArrayList<>();
		for (String ticker : universe) {
			if (!held.contains(ticker)) {
				unseen.add(ticker);
			}
		}
		List<Integer> removable = new ArrayList<>();
		for (int i = 0; i < holdings.size(); i++) {
			if (mustInclude == null || !mustInclude.contains(holdings.get(i).ticker())) {
				removable.add(i);
			}
		}
		if (unseen.isEmpty() || removable.isEmpty() || holdings.size() < 2) {
			return Holdings.normalize(holdings);
		}
		int removed = removable.get(random.nextInt(removable.size()));
		String added = unseen.get(random.nextInt(unseen.size()));
		double average = Holdings.total(holdings) / holdings.size();
		List<Holding> swapped = new ArrayList<>(holdings.size());
		for (int i = 0; i < holdings.size(); i++) {
			if (i != removed) {
				swapped.add(holdings.get(i));
			}
		}
		swapped.add(new Holding(added, average));
		return Holdings.normalize(swapped);
	}

	/**
	 * Adds one ticker the candidate does not hold yet at the average weight.
	 */
	public List<Holding> addHolding(List<Holding> holdings, List<String> universe, RandomGenerator random) {
		Set<String> held = Holdings.tickers(holdings);
		List<String> unseen = new ArrayList<>();
		for (String ticker : universe) {
			if (!held.contains(ticker)) {
				unseen.add(ticker);
			}
		}
		if (unseen.isEmpty()) {
			return Holdings.normalize(holdings);
		}
		double average = holdings.isEmpty() ? 1 : Holdings.total(holdings) / holdings.size();
		List<Holding> grown = new ArrayList<>(holdings);
		grown.add(new Holding(unseen.get(random.nextInt(unseen.size())), average));
		return Holdings.normalize(grown);
	}

	/**
	 * Conservative caps every allocation at {@value #CONSERVATIVE_CAP}%, aggressive lifts the two
	 * largest holdings to at least 1.5× the equal-weight share, moderate keeps the candidate.
	 */
	public List<Holding> adjustForRisk(List<Holding> holdings, RiskTolerance riskTolerance) {
		if (holdings == null || holdings.isEmpty()) {
			return new ArrayList<>();
		}
		List<Holding> normalized = Holdings.normalize(holdings);
		if (riskTolerance == RiskTolerance.CONSERVATIVE) {
			return capAllocations(normalized, CONSERVATIVE_CAP);
		}
		if (riskTolerance == RiskTolerance.AGGRESSIVE) {
			double average = Holdings.FULL_ALLOCATION / normalized.size();
			List<Holding> sorted = new ArrayList<>(normalized);
			sorted.sort(Comparator.comparingDouble(Holding::allocation).reversed());
			for (int i = 0; i < Math.min(2, sorted.size()); i++) {
				Holding holding = sorted.get(i);
				sorted.set(i, holding.withAllocation(Math.max(holding.allocation(), average * AGGRESSIVE_BOOST)));
			}
			return Holdings.normalize(sorted);
		}
		return normalized;
	}

	/**
	 * Caps allocations and spreads the excess over the uncapped holdings until no allocation
	 * exceeds the cap. Falls back to equal weights when the cap cannot be met.
	 */
	static List<Holding> capAllocations(List<Holding> holdings, double cap) {
		List<Holding> current = Holdings.normalize(holdings);
		if (current.size() * cap < Holdings.FULL_ALLOCATION) {
			List<Holding> equal = new ArrayList<>(current.size());
			for (Holding holding : current) {
				equal.add(holding.withAllocation(Holdings.FULL_ALLOCATION / current.size()));
			}
			return equal;
		}
		for (int round = 0; round < current.size(); round++) {
			double excess = 0;
			double uncappedTotal = 0;
			for (Holding holding : current) {
				if (holding.allocation() > cap) {
					excess += holding.allocation() - cap;
				} else if (holding.allocation() < cap) {
					uncappedTotal += holding.allocation();
				}
			}
			if (excess <= 1e-9) {
				break;
			}
			List<Holding> next = new ArrayList<>(current.size());
			for (Holding holding : current) {
				if (holding.allocation() >= cap) {
					next.add(holding.withAllocation(cap));
				} else if (uncappedTotal > 0) {
					next.add(holding.withAllocation(holding.allocation() + excess * holding.allocation() / uncappedTotal));
				} else {
					next.add(holding);
				}
			}
			current = next;
		}
		return current;
	}

	/**
	 * Required tickers first, then a random sample of the rest up to the target size.
	 */
	List<String> selectTickers(List<String> universe, Set<String> mustInclude, int targetSize, RandomGenerator random) {
		Set<String> selected = new LinkedHashSet<>();
		if (mustInclude != null) {
			selected.addAll(mustInclude);
		}
		List<String> remaining = new ArrayList<>();
		for (String ticker : universe) {
			if (!selected.contains(ticker)) {
				remaining.add(ticker);
			}
		}
		for (int i = remaining.size() - 1; i > 0; i--) {
			int j = random.nextInt(i + 1);
			String swap = remaining.get(i);
			remaining.set(i, remaining.get(j));
			remaining.set(j, swap);
		}
		int index = 0;
		while (selected.size() < targetSize && index < remaining.size()) {
			selected.add(remaining.get(index++));
		}
		return new ArrayList<>(selected);
	}
}
