package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.market.SectorLookup;
import my.portfoliooptimizer.app.model.AdjustmentPriority;
import my.portfoliooptimizer.app.model.BalanceStatus;
import my.portfoliooptimizer.app.model.Holding;
import my.portfoliooptimizer.app.model.SectorAllocation;
import my.portfoliooptimizer.app.model.SectorBalanceCheck;
import my.portfoliooptimizer.app.model.SectorBalanceReport;
import my.portfoliooptimizer.app.model.TargetAdjustment;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
public class SectorBalanceEvaluator {
	static final List<List<String>> CORRELATED_SECTOR_PAIRS = List.of(
			List.of("Information Technology", "Communication Services"),
			List.of("Energy", "Materials"),
			List.of("Consumer Staples", "Health Care"),
			List.of("Industrials", "Financials"),
			List.of("Consumer Discretionary", "Communication Services")
	);
	static final List<String> DEFENSIVE_SECTORS = List.of("Consumer Staples", "Health Care", "Utilities");
	static final List<String> ENERGY_MATERIALS = List.of("Energy", "Materials");
	static final String REAL_ESTATE = "Real Estate";

	private static final double SINGLE_SECTOR_TARGET_HARD = 25;
	private static final double SINGLE_SECTOR_TARGET_SOFT = 30;
	private static final double CORRELATED_REDUCTION = 0.7;
	private static final double CORRELATED_FLOOR = 15;
	private static final double DEFENSIVE_TARGET_HARD = 8;
	private static final double DEFENSIVE_TARGET_SOFT = 5;
	private static final double REIT_CEILING = 15;
	private static final double ENERGY_MATERIALS_CEILING = 12;
	private static final double SECTOR_HEADROOM_CEILING = 25;
	private static final double GROUP_HEADROOM_CEILING = 40;
	private static final double REIT_HEADROOM_CEILING = 12;

	private final SectorBalanceThresholds thresholds;

	public SectorBalanceEvaluator(SectorBalanceThresholds thresholds) {
		this.thresholds = thresholds == null ? SectorBalanceThresholds.DEFAULTS : thresholds;
	}

	public SectorBalanceReport check(List<Holding> holdings, SectorLookup sectors) {
		List<SectorAllocation> normalized = normalizedDistribution(holdings, sectors);
		Map<String, Double> bySector = toMap(normalized);
		List<SectorBalanceCheck> checks = new ArrayList<>();

		if (!normalized.isEmpty()) {
			SectorAllocation largest = normalized.get(0);
			BalanceStatus status = ceilingStatus(largest.allocation(),
					thresholds.singleSectorHard(), thresholds.singleSectorSoft(), Double.NaN);
			checks.add(new SectorBalanceCheck(1, status, largest.allocation(), largest.sector(), null,
					String.format(Locale.ROOT, "Single sector '%s' weight: %.1f%%", largest.sector(), largest.allocation())));
		}

		for (List<String> group : correlatedGroups(bySector.keySet())) {
			double groupWeight = sum(bySector, group);
			BalanceStatus status = ceilingStatus(groupWeight,
					thresholds.correlatedGroupHard(), thresholds.correlatedGroupSoft(), Double.NaN);
			if (status.isFlagged()) {
				checks.add(new SectorBalanceCheck(2, status, groupWeight, null, group,
						String.format(Locale.ROOT, "Correlated sector group %s total: %.1f%%", group, groupWeight)));
			}
		}

		double defensive = sum(bySector, DEFENSIVE_SECTORS);
		BalanceStatus defensiveStatus = BalanceStatus.OK;
		if (defensive < thresholds.defensiveHard()) {
			defensiveStatus = BalanceStatus.HARD_VIOLATION;
		} else if (defensive < thresholds.defensiveSoft()) {
			defensiveStatus = BalanceStatus.SOFT_WARNING;
		}
		checks.add(new SectorBalanceCheck(3, defensiveStatus, defensive, null, null,
				String.format(Locale.ROOT, "Defensive sectors total: %.1f%%", defensive)));

		double reit = 0;
		for (SectorAllocation allocation : normalized) {
			if (allocation.sector().contains(REAL_ESTATE)) {
				reit += allocation.allocation();
			}
		}
		checks.add(new SectorBalanceCheck(4,
				ceilingStatus(reit, thresholds.reitHard(), thresholds.reitSoft(), Double.NaN),
				reit, null, null,
				String.format(Locale.ROOT, "REITs total: %.1f%%", reit)));

		double energyMaterials = sum(bySector, ENERGY_MATERIALS);
		checks.add(new SectorBalanceCheck(5,
				ceilingStatus(energyMaterials, thresholds.energyMaterialsHard(), thresholds.energyMaterialsSoft(),
						thresholds.energyMaterialsAdvisory()),
				energyMaterials, null, null,
				String.format(Locale.ROOT, "Energy + Materials total: %.1f%%", energyMaterials)));

		return score(checks);
	}

	SectorBalanceReport score(List<SectorBalanceCheck> checks) {
		int hard = 0;
		int soft = 0;
		int advisory = 0;
		for (SectorBalanceCheck check : checks) {
			switch (check.status()) {
				case HARD_VIOLATION -> hard++;
				case SOFT_WARNING -> soft++;
				case ADVISORY -> advisory++;
				default -> {
				}
			}
		}
		int score = SectorBalanceReport.PERFECT_SCORE
				- thresholds.hardPenalty() * hard
				- thresholds.softPenalty() * soft
				- thresholds.advisoryPenalty() * advisory;
		return new SectorBalanceReport(checks, hard, soft, advisory, Math.max(0, score));
	}

	/**
	 * Allocation summed per sector, largest first.
	 */
	public List<SectorAllocation> sectorDistribution(List<Holding> holdings, SectorLookup sectors) {
		Map<String, Double> bySector = new LinkedHashMap<>();
		if (holdings != null) {
			for (Holding holding : holdings) {
				bySector.merge(sectors.getSector(holding.ticker()), holding.allocation(), Double::sum);
			}
		}
		List<SectorAllocation> result = new ArrayList<>();
		bySector.forEach((sector, allocation) -> result.add(new SectorAllocation(sector, allocation)));
		result.sort(Comparator.comparingDouble(SectorAllocation::allocation).reversed()
				.thenComparing(SectorAllocation::sector));
		return result;
	}

	List<SectorAllocation> normalizedDistribution(List<Holding> holdings, SectorLookup sectors) {
		List<SectorAllocation> distribution = sectorDistribution(holdings, sectors);
		double total = 0;
		for (SectorAllocation allocation : distribution) {
			total += allocation.allocation();
		}
		if (total <= 0) {
			return List.of();
		}
		List<SectorAllocation> normalized = new ArrayList<>(distribution.size());
		for (SectorAllocation allocation : distribution) {
			normalized.add(new SectorAllocation(allocation.sector(), allocation.allocation() / total * 100));
		}
		return normalized;
	}

	/**
	 * Connected components of size greater than one in the correlated-sector graph, restricted
	 * to the sectors present.
	 */
	static List<List<String>> correlatedGroups(Set<String> presentSectors) {
		Map<String, Set<String>> adjacency = new LinkedHashMap<>();
		for (String sector : presentSectors) {
			adjacency.put(sector, new LinkedHashSet<>());
		}
		for (List<String> pair : CORRELATED_SECTOR_PAIRS) {
			String first = pair.get(0);
			String second = pair.get(1);
			if (adjacency.containsKey(first) && adjacency.containsKey(second)) {
				adjacency.get(first).add(second);
				adjacency.get(second).add(first);
			}
		}
		List<List<String>> groups = new ArrayList<>();
		Set<String> visited = new LinkedHashSet<>();
		for (String sector : adjacency.keySet()) {
			if (!visited.add(sector)) {
				continue;
			}
			List<String> component = new ArrayList<>();
			Deque<String> stack = new ArrayDeque<>();
			stack.push(sector);
			while (!stack.isEmpty()) {
				String current = stack.pop();
				component.add(current);
				for (String neighbor : adjacency.get(current)) {
					if (visited.add(neighbor)) {
						stack.push(neighbor);
					}
				}
			}
			if (component.size() > 1) {
				groups.add(List.copyOf(component));
			}
		}
		return groups;
	}

	/**
	 * Per-sector targets that would clear the flagged checks of the report.
	 */
	public Map<String, TargetAdjustment> targetAdjustments(SectorBalanceReport report,
														   List<Holding> holdings,
														   SectorLookup sectors) {
		Map<String, TargetAdjustment> adjustments = new LinkedHashMap<>();
		if (report == null) {
			return adjustments;
		}
		Map<String, Double> current = toMap(normalizedDistribution(holdings, sectors));
		for (SectorBalanceCheck check : report.checks()) {
			if (!check.status().isFlagged()) {
				continue;
			}
			AdjustmentPriority priority = AdjustmentPriority.of(check.status());
			boolean hard = check.status() == BalanceStatus.HARD_VIOLATION;
			switch (check.rule()) {
				case 1 -> {
					if (check.sector() != null) {
						double target = hard ? SINGLE_SECTOR_TARGET_HARD : SINGLE_SECTOR_TARGET_SOFT;
						reduce(adjustments, check.sector(), current.getOrDefault(check.sector(), 0.0), target, priority);
					}
				}
				case 2 -> {
					if (check.members() != null) {
						for (String sector : check.members()) {
							double weight = current.getOrDefault(sector, 0.0);
							reduce(adjustments, sector, weight, Math.max(CORRELATED_FLOOR, weight * CORRELATED_REDUCTION), priority);
						}
					}
				}
				case 3 -> {
					double target = hard ? DEFENSIVE_TARGET_HARD : DEFENSIVE_TARGET_SOFT;
					for (String sector : DEFENSIVE_SECTORS) {
						double weight = current.getOrDefault(sector, 0.0);
						if (weight < target && !adjustments.containsKey(sector)) {
							adjustments.put(sector, TargetAdjustment.of(weight, target, priority));
						}
					}
				}
				case 4 -> {
					for (Map.Entry<String, Double> entry : current.entrySet()) {
						if (entry.getKey().contains(REAL_ESTATE)) {
							reduce(adjustments, entry.getKey(), entry.getValue(), REIT_CEILING, priority);
						}
					}
				}
				case 5 -> {
					// the ceiling bounds the combined weight; members shrink in proportion
					double combined = sum(current, ENERGY_MATERIALS);
					if (combined > ENERGY_MATERIALS_CEILING) {
						for (String sector : ENERGY_MATERIALS) {
							double weight = current.getOrDefault(sector, 0.0);
							reduce(adjustments, sector, weight, weight * ENERGY_MATERIALS_CEILING / combined, priority);
						}
					}
				}
				default -> {
				}
			}
		}
		return adjustments;
	}

	/**
	 * Weight the sector can take on top of {@code weights} while every rule stays clear of its
	 * soft threshold. Zero when the sector, its correlated group or its rule bucket is full.
	 */
	double headroom(String sector, Map<String, Double> weights) {
		double headroom = SECTOR_HEADROOM_CEILING - weights.getOrDefault(sector, 0.0);
		if (sector.contains(REAL_ESTATE)) {
			double reit = 0;
			for (Map.Entry<String, Double> entry : weights.entrySet()) {
				if (entry.getKey().contains(REAL_ESTATE)) {
					reit += entry.getValue();
				}
			}
			headroom = Math.min(headroom, REIT_HEADROOM_CEILING - reit);
		}
		if (ENERGY_MATERIALS.contains(sector)) {
			headroom = Math.min(headroom, ENERGY_MATERIALS_CEILING - sum(weights, ENERGY_MATERIALS));
		}
		Set<String> present = new LinkedHashSet<>();
		for (Map.Entry<String, Double> entry : weights.entrySet()) {
			if (entry.getValue() > 0) {
				present.add(entry.getKey());
			}
		}
		present.add(sector);
		for (List<String> group : correlatedGroups(present)) {
			if (group.contains(sector)) {
				headroom = Math.min(headroom, GROUP_HEADROOM_CEILING - sum(weights, group));
			}
		}
		return Math.max(0, headroom);
	}

	/**
	 * Sector to tickers, for every sector known to the lookup.
	 */
	public Map<String, List<String>> sectorStockPool(SectorLookup sectors) {
		Map<String, List<String>> pool = new HashMap<>();
		for (String ticker : sectors.allTickers()) {
			String sector = sectors.getSector(ticker);
			if (!SectorLookup.UNKNOWN_SECTOR.equals(sector)) {
				pool.computeIfAbsent(sector, key -> new ArrayList<>()).add(ticker);
			}
		}
		return pool;
	}

	private void reduce(Map<String, TargetAdjustment> adjustments,
						String sector,
						double current,
						double target,
						AdjustmentPriority priority) {
		if (current <= target) {
			return;
		}
		TargetAdjustment existing = adjustments.get(sector);
		if (existing == null) {
			adjustments.put(sector, TargetAdjustment.of(current, target, priority));
		} else if (existing.isReduction()) {
			adjustments.put(sector, TargetAdjustment.of(current, Math.min(existing.target(), target),
					existing.priority().max(priority)));
		}
	}

	private BalanceStatus ceilingStatus(double value, double hard, double soft, double advisory) {
		if (value > hard) {
			return BalanceStatus.HARD_VIOLATION;
		}
		if (value > soft) {
			return BalanceStatus.SOFT_WARNING;
		}
		if (!Double.isNaN(advisory) && value > advisory) {
			return BalanceStatus.ADVISORY;
		}
		return BalanceStatus.OK;
	}

	private static Map<String, Double> toMap(List<SectorAllocation> distribution) {
		Map<String, Double> result = new LinkedHashMap<>();
		for (SectorAllocation allocation : distribution) {
			result.put(allocation.sector(), allocation.allocation());
		}
		return result;
	}

	private static double sum(Map<String, Double> bySector, List<String> sectors) {
		double total = 0;
		for (String sector : sectors) {
			total += bySector.getOrDefault(sector, 0.0);
		}
		return total;
	}
}
