package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.market.SectorLookup;
import my.portfoliooptimizer.app.model.Holding;
import my.portfoliooptimizer.app.model.Holdings;
import my.portfoliooptimizer.app.model.SectorBalanceReport;
import my.portfoliooptimizer.app.model.TargetAdjustment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reweights a holdings set, adding tickers from empty underweight sectors, until the sector
 * balance check reports no hard violations and no soft warnings.
 */
@Service
public class SectorAdjuster {
	private static final Logger logger = LoggerFactory.getLogger(SectorAdjuster.class);
	static final int MAX_ITERATIONS = 20;
	static final int MAX_NEW_TICKERS_PER_SECTOR = 2;
	private static final double HARD_AGGRESSIVENESS = 0.9;
	private static final double SOFT_AGGRESSIVENESS = 0.95;

	private final SectorBalanceEvaluator evaluator;

	public SectorAdjuster(SectorBalanceEvaluator evaluator) {
		this.evaluator = evaluator;
	}

	/**
	 * @param eligible tickers that may be added; only tickers with price history belong here
	 */
	public Result adjust(List<Holding> holdings, SectorLookup sectors, Set<String> eligible) {
		List<Holding> current = Holdings.normalize(Holdings.merge(holdings));
		SectorBalanceReport report = evaluator.check(current, sectors);
		int iterations = 0;
		while (report.hasViolations() && iterations < MAX_ITERATIONS) {
			iterations++;
			current = adjustOnce(current, report, sectors, eligible);
			report = evaluator.check(current, sectors);
			logger.debug("Sector adjustment iteration {}: score={}, hard={}, soft={}",
					iterations, report.overallScore(), report.hardViolations(), report.softWarnings());
		}
		if (report.hasViolations()) {
			logger.info("Sector adjustment stopped after {} iterations with {} hard violations and {} soft warnings",
					iterations, report.hardViolations(), report.softWarnings());
		}
		return new Result(current, report, iterations, report.isCompliant());
	}

	/**
	 * One reweighting step. Flagged sectors move to their targets, then the weight they give up is
	 * placed where the rules have headroom: held sectors first, then sectors of the pool that are
	 * not held yet. Whatever finds no place is spread by renormalization.
	 */
	List<Holding> adjustOnce(List<Holding> holdings,
							 SectorBalanceReport report,
							 SectorLookup sectors,
							 Set<String> eligible) {
		Map<String, TargetAdjustment> adjustments = evaluator.targetAdjustments(report, holdings, sectors);
		double aggressiveness = report.hardViolations() > 0 ? HARD_AGGRESSIVENESS : SOFT_AGGRESSIVENESS;
		Map<String, Double> weights = sectorWeights(holdings, sectors);
		Map<String, Double> targets = new LinkedHashMap<>(weights);
		Map<String, List<String>> newcomers = new LinkedHashMap<>();
		Set<String> reduced = new HashSet<>();
		Set<String> held = Holdings.tickers(holdings);

		for (Map.Entry<String, TargetAdjustment> entry : adjustments.entrySet()) {
			String sector = entry.getKey();
			TargetAdjustment adjustment = entry.getValue();
			if (adjustment.isReduction() && adjustment.current() > 0) {
				targets.put(sector, adjustment.target() * aggressiveness);
				reduced.add(sector);
			} else if (adjustment.isIncrease() && adjustment.current() > 0) {
				targets.put(sector, adjustment.target());
			} else if (adjustment.isIncrease()) {
				List<String> tickers = newTickers(sector, sectors, held, eligible);
				if (!tickers.isEmpty()) {
					newcomers.put(sector, tickers);
					held.addAll(tickers);
					targets.put(sector, adjustment.target());
				}
			}
		}

		double freed = Holdings.FULL_ALLOCATION - total(targets);
		if (!reduced.isEmpty() && freed > 0) {
			double remaining = fillHeldSectors(targets, reduced, freed);
			remaining = openSectors(targets, newcomers, held, remaining, sectors, eligible);
			if (remaining > Holdings.SUM_TOLERANCE) {
				logger.debug("No sector headroom left for {}% of freed weight", remaining);
			}
		}

		List<Holding> next = new ArrayList<>(holdings.size() + newcomers.size() * MAX_NEW_TICKERS_PER_SECTOR);
		for (Holding holding : holdings) {
			String sector = sectors.getSector(holding.ticker());
			double weight = weights.getOrDefault(sector, 0.0);
			double target = targets.getOrDefault(sector, weight);
			next.add(weight <= 0 || target == weight ? holding : holding.withAllocation(holding.allocation() * target / weight));
		}
		newcomers.forEach((sector, tickers) -> {
			for (String ticker : tickers) {
				next.add(new Holding(ticker, targets.get(sector) / tickers.size()));
			}
		});
		List<Holding> normalized = Holdings.normalize(next);
		List<Holding> trimmed = Holdings.dropBelow(normalized, CandidateGenerator.MIN_ALLOCATION, null);
		return Holdings.normalize(trimmed.isEmpty() ? normalized : trimmed);
	}

	/**
	 * Hands {@code amount} to held sectors that are not being reduced, lightest first, each up to
	 * its headroom. Returns what is left.
	 */
	private double fillHeldSectors(Map<String, Double> targets, Set<String> reduced, double amount) {
		List<String> recipients = new ArrayList<>();
		for (String sector : targets.keySet()) {
			if (!reduced.contains(sector)) {
				recipients.add(sector);
			}
		}
		recipients.sort(Comparator.comparingDouble((String sector) -> targets.get(sector))
				.thenComparing(Comparator.naturalOrder()));
		double remaining = amount;
		for (String sector : recipients) {
			if (remaining <= 0) {
				break;
			}
			double share = Math.min(remaining, evaluator.headroom(sector, targets));
			if (share > 0) {
				targets.merge(sector, share, Double::sum);
				remaining -= share;
			}
		}
		return remaining;
	}

	/**
	 * Places {@code amount} in sectors not held yet, defensive sectors first, adding up to
	 * {@link #MAX_NEW_TICKERS_PER_SECTOR} eligible tickers each. Returns what is left.
	 */
	private double openSectors(Map<String, Double> targets,
							   Map<String, List<String>> newcomers,
							   Set<String> held,
							   double amount,
							   SectorLookup sectors,
							   Set<String> eligible) {
		double remaining = amount;
		for (String sector : openingOrder(sectors)) {
			if (remaining < CandidateGenerator.MIN_ALLOCATION) {
				break;
			}
			if (targets.containsKey(sector)) {
				continue;
			}
			List<String> tickers = newTickers(sector, sectors, held, eligible);
			if (tickers.isEmpty()) {
				continue;
			}
			double share = Math.min(remaining, evaluator.headroom(sector, targets));
			if (share < CandidateGenerator.MIN_ALLOCATION * tickers.size()) {
				continue;
			}
			targets.put(sector, share);
			newcomers.put(sector, tickers);
			held.addAll(tickers);
			remaining -= share;
		}
		return remaining;
	}

	private List<String> openingOrder(SectorLookup sectors) {
		Set<String> pool = new TreeSet<>(evaluator.sectorStockPool(sectors).keySet());
		List<String> order = new ArrayList<>(pool.size());
		for (String sector : SectorBalanceEvaluator.DEFENSIVE_SECTORS) {
			if (pool.remove(sector)) {
				order.add(sector);
			}
		}
		order.addAll(pool);
		return order;
	}

	private static Map<String, Double> sectorWeights(List<Holding> holdings, SectorLookup sectors) {
		Map<String, Double> weights = new LinkedHashMap<>();
		for (Holding holding : holdings) {
			weights.merge(sectors.getSector(holding.ticker()), holding.allocation(), Double::sum);
		}
		return weights;
	}

	private static double total(Map<String, Double> weights) {
		double total = 0;
		for (double weight : weights.values()) {
			total += weight;
		}
		return total;
	}

	private List<String> newTickers(String sector, SectorLookup sectors, Set<String> held, Set<String> eligible) {
		List<String> result = new ArrayList<>();
		for (String ticker : new TreeSet<>(sectors.tickersBySector(sector))) {
			if (result.size() >= MAX_NEW_TICKERS_PER_SECTOR) {
				break;
			}
			if (!held.contains(ticker) && (eligible == null || eligible.contains(ticker))) {
				result.add(ticker);
			}
		}
		return result;
	}

	public record Result(List<Holding> holdings,
						 SectorBalanceReport report,
						 int iterations,
						 boolean converged) {
		public Result {
			holdings = List.copyOf(holdings);
		}
	}
}
