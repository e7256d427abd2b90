package my.portfoliooptimizer.app.model;

import java.util.List;

public record SectorBalanceReport(List<SectorBalanceCheck> checks,
								  int hardViolations,
								  int softWarnings,
								  int advisories,
								  int overallScore) {
	public static final int PERFECT_SCORE = 100;

	public SectorBalanceReport {
		checks = checks == null ? List.of() : List.copyOf(checks);
	}

	public boolean isCompliant() {
		return hardViolations == 0 && softWarnings == 0;
	}

	public boolean hasViolations() {
		return !isCompliant();
	}
}
