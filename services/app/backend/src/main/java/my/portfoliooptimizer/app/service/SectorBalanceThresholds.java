package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.config.AppProperties;

/**
 * Concentration limits and score penalties of the sector balance rules, in percent of the
 * portfolio. The defaults are product heuristics; they are tunable through configuration.
 */
public record SectorBalanceThresholds(double singleSectorHard,
									  double singleSectorSoft,
									  double correlatedGroupHard,
									  double correlatedGroupSoft,
									  double defensiveHard,
									  double defensiveSoft,
									  double reitHard,
									  double reitSoft,
									  double energyMaterialsHard,
									  double energyMaterialsSoft,
									  double energyMaterialsAdvisory,
									  int hardPenalty,
									  int softPenalty,
									  int advisoryPenalty) {
	public static final SectorBalanceThresholds DEFAULTS = new SectorBalanceThresholds(
			40, 30,
			60, 50,
			5, 10,
			20, 15,
			25, 20, 15,
			30, 15, 5
	);

	public static SectorBalanceThresholds from(AppProperties.SectorBalance properties) {
		if (properties == null) {
			return DEFAULTS;
		}
		return new SectorBalanceThresholds(
				valueOr(properties.singleSectorHard(), DEFAULTS.singleSectorHard),
				valueOr(properties.singleSectorSoft(), DEFAULTS.singleSectorSoft),
				valueOr(properties.correlatedGroupHard(), DEFAULTS.correlatedGroupHard),
				valueOr(properties.correlatedGroupSoft(), DEFAULTS.correlatedGroupSoft),
				valueOr(properties.defensiveHard(), DEFAULTS.defensiveHard),
				valueOr(properties.defensiveSoft(), DEFAULTS.defensiveSoft),
				valueOr(properties.reitHard(), DEFAULTS.reitHard),
				valueOr(properties.reitSoft(), DEFAULTS.reitSoft),
				valueOr(properties.energyMaterialsHard(), DEFAULTS.energyMaterialsHard),
				valueOr(properties.energyMaterialsSoft(), DEFAULTS.energyMaterialsSoft),
				valueOr(properties.energyMaterialsAdvisory(), DEFAULTS.energyMaterialsAdvisory),
				properties.hardPenalty() == null ? DEFAULTS.hardPenalty : properties.hardPenalty(),
				properties.softPenalty() == null ? DEFAULTS.softPenalty : properties.softPenalty(),
				properties.advisoryPenalty() == null ? DEFAULTS.advisoryPenalty : properties.advisoryPenalty()
		);
	}

	private static double valueOr(Double value, double fallback) {
		return value == null ? fallback : value;
	}
}
