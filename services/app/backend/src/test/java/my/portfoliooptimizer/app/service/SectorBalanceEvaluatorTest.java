package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.market.InMemoryMarketDataStore;
import my.portfoliooptimizer.app.model.BalanceStatus;
import my.portfoliooptimizer.app.model.Holding;
import my.portfoliooptimizer.app.model.SectorAllocation;
import my.portfoliooptimizer.app.model.SectorBalanceCheck;
import my.portfoliooptimizer.app.model.SectorBalanceReport;
import my.portfoliooptimizer.app.model.TargetAdjustment;
import my.portfoliooptimizer.app.support.TestMarketData;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SectorBalanceEvaluatorTest {
	private final SectorBalanceEvaluator evaluator = new SectorBalanceEvaluator(SectorBalanceThresholds.DEFAULTS);

	@Test
	void singleTechSectorViolatesConcentrationAndDefensiveRules() {
		InMemoryMarketDataStore sectors = sectors(Map.of(
				"AAPL", "Information Technology",
				"MSFT", "Information Technology",
				"GOOGL", "Information Technology"
		));

		SectorBalanceReport report = evaluator.check(List.of(
				new Holding("AAPL", 50),
				new Holding("MSFT", 30),
				new Holding("GOOGL", 20)
		), sectors);

		assertThat(rule(report, 1).status()).isEqualTo(BalanceStatus.HARD_VIOLATION);
		assertThat(rule(report, 1).value()).isCloseTo(100, within(1e-9));
		assertThat(rule(report, 3).status()).isEqualTo(BalanceStatus.HARD_VIOLATION);
		assertThat(report.hardViolations()).isEqualTo(2);
		assertThat(report.softWarnings()).isZero();
		assertThat(report.overallScore()).isEqualTo(40);
	}

	@Test
	void balancedPortfolioScoresPerfect() {
		InMemoryMarketDataStore sectors = TestMarketData.sampleUniverse();

		SectorBalanceReport report = evaluator.check(List.of(
				new Holding("AAPL", 20),
				new Holding("JPM", 20),
				new Holding("PG", 20),
				new Holding("NEE", 20),
				new Holding("AMZN", 20)
		), sectors);

		assertThat(report.isCompliant()).isTrue();
		assertThat(report.overallScore()).isEqualTo(SectorBalanceReport.PERFECT_SCORE);
		assertThat(report.checks()).extracting(SectorBalanceCheck::rule).containsExactly(1, 3, 4, 5);
	}

	@Test
	void correlatedGroupIsReportedWithMembers() {
		InMemoryMarketDataStore sectors = TestMarketData.sampleUniverse();

		SectorBalanceReport report = evaluator.check(List.of(
				new Holding("AAPL", 28),
				new Holding("GOOGL", 27),
				new Holding("AMZN", 25),
				new Holding("PG", 10),
				new Holding("JNJ", 10)
		), sectors);

		SectorBalanceCheck group = rule(report, 2);
		assertThat(group.status()).isEqualTo(BalanceStatus.HARD_VIOLATION);
		assertThat(group.value()).isCloseTo(80, within(1e-9));
		assertThat(group.members()).containsExactlyInAnyOrder(
				"Information Technology", "Communication Services", "Consumer Discretionary");
	}

	@Test
	void energyAndMaterialsRaiseAdvisoryBeforeWarnings() {
		InMemoryMarketDataStore sectors = TestMarketData.sampleUniverse();

		SectorBalanceReport report = evaluator.check(List.of(
				new Holding("XOM", 9),
				new Holding("LIN", 9),
				new Holding("PG", 20),
				new Holding("JPM", 22),
				new Holding("AAPL", 20),
				new Holding("NEE", 20)
		), sectors);

		assertThat(rule(report, 5).status()).isEqualTo(BalanceStatus.ADVISORY);
		assertThat(report.advisories()).isEqualTo(1);
		assertThat(report.overallScore()).isEqualTo(95);
	}

	@Test
	void realEstateCeilingAppliesToSectorNamesContainingRealEstate() {
		InMemoryMarketDataStore sectors = sectors(Map.of(
				"PLD", "Real Estate",
				"SPG", "Real Estate Investment Trusts",
				"PG", "Consumer Staples",
				"JPM", "Financials",
				"CAT", "Industrials"
		));

		SectorBalanceReport report = evaluator.check(List.of(
				new Holding("PLD", 12),
				new Holding("SPG", 12),
				new Holding("PG", 26),
				new Holding("JPM", 25),
				new Holding("CAT", 25)
		), sectors);

		assertThat(rule(report, 4).status()).isEqualTo(BalanceStatus.HARD_VIOLATION);
		assertThat(rule(report, 4).value()).isCloseTo(24, within(1e-9));
	}

	@Test
	void checkIsIdempotent() {
		InMemoryMarketDataStore sectors = TestMarketData.sampleUniverse();
		List<Holding> holdings = List.of(new Holding("AAPL", 45), new Holding("XOM", 35), new Holding("PG", 20));

		assertThat(evaluator.check(holdings, sectors)).isEqualTo(evaluator.check(holdings, sectors));
	}

	@Test
	void scoreNeverRisesWhenViolationsAreAdded() {
		SectorBalanceCheck ok = new SectorBalanceCheck(1, BalanceStatus.OK, 20, "X", null, "");
		SectorBalanceCheck advisory = new SectorBalanceCheck(5, BalanceStatus.ADVISORY, 16, null, null, "");
		SectorBalanceCheck soft = new SectorBalanceCheck(4, BalanceStatus.SOFT_WARNING, 16, null, null, "");
		SectorBalanceCheck hard = new SectorBalanceCheck(3, BalanceStatus.HARD_VIOLATION, 0, null, null, "");

		int base = evaluator.score(List.of(ok)).overallScore();
		int withAdvisory = evaluator.score(List.of(ok, advisory)).overallScore();
		int withSoft = evaluator.score(List.of(ok, advisory, soft)).overallScore();
		int withHard = evaluator.score(List.of(ok, advisory, soft, hard)).overallScore();
		int floor = evaluator.score(List.of(hard, hard, hard, hard)).overallScore();

		assertThat(base).isEqualTo(100);
		assertThat(withAdvisory).isLessThanOrEqualTo(base).isEqualTo(95);
		assertThat(withSoft).isLessThanOrEqualTo(withAdvisory).isEqualTo(80);
		assertThat(withHard).isLessThanOrEqualTo(withSoft).isEqualTo(50);
		assertThat(floor).isZero();
	}

	@Test
	void correlatedGroupsAreConnectedComponents() {
		List<List<String>> groups = SectorBalanceEvaluator.correlatedGroups(Set.of(
				"Information Technology", "Communication Services", "Consumer Discretionary",
				"Energy", "Materials", "Utilities"
		));

		assertThat(groups).hasSize(2);
		assertThat(groups).anySatisfy(group -> assertThat(group).containsExactlyInAnyOrder(
				"Information Technology", "Communication Services", "Consumer Discretionary"));
		assertThat(groups).anySatisfy(group -> assertThat(group).containsExactlyInAnyOrder("Energy", "Materials"));
	}

	@Test
	void targetAdjustmentsFollowRuleSeverity() {
		InMemoryMarketDataStore sectors = sectors(Map.of(
				"AAPL", "Information Technology",
				"MSFT", "Information Technology",
				"GOOGL", "Information Technology"
		));
		List<Holding> holdings = List.of(new Holding("AAPL", 50), new Holding("MSFT", 30), new Holding("GOOGL", 20));
		SectorBalanceReport report = evaluator.check(holdings, sectors);

		Map<String, TargetAdjustment> adjustments = evaluator.targetAdjustments(report, holdings, sectors);

		assertThat(adjustments.get("Information Technology").target()).isEqualTo(25);
		assertThat(adjustments.get("Information Technology").isReduction()).isTrue();
		assertThat(adjustments.get("Consumer Staples").target()).isEqualTo(8);
		assertThat(adjustments.get("Health Care").isIncrease()).isTrue();
		assertThat(adjustments.get("Utilities").delta()).isCloseTo(8, within(1e-9));
	}

	@Test
	void energyAndMaterialsTargetsBoundTheirCombinedWeight() {
		InMemoryMarketDataStore sectors = TestMarketData.sampleUniverse();
		List<Holding> holdings = List.of(
				new Holding("AAPL", 30),
				new Holding("JNJ", 25),
				new Holding("NEE", 22),
				new Holding("XOM", 11.5),
				new Holding("LIN", 11.5)
		);
		SectorBalanceReport report = evaluator.check(holdings, sectors);
		assertThat(rule(report, 5).status()).isEqualTo(BalanceStatus.SOFT_WARNING);

		Map<String, TargetAdjustment> adjustments = evaluator.targetAdjustments(report, holdings, sectors);

		assertThat(adjustments.get("Energy").isReduction()).isTrue();
		assertThat(adjustments.get("Energy").target()).isCloseTo(6, within(1e-9));
		assertThat(adjustments.get("Materials").target()).isCloseTo(6, within(1e-9));
	}

	@Test
	void headroomStaysBelowSectorGroupAndBucketCeilings() {
		Map<String, Double> weights = new LinkedHashMap<>();
		weights.put("Consumer Staples", 25.0);
		weights.put("Information Technology", 22.5);
		weights.put("Materials", 10.0);

		assertThat(evaluator.headroom("Health Care", weights)).isCloseTo(15, within(1e-9));
		assertThat(evaluator.headroom("Utilities", weights)).isCloseTo(25, within(1e-9));
		assertThat(evaluator.headroom("Communication Services", weights)).isCloseTo(17.5, within(1e-9));
		assertThat(evaluator.headroom("Information Technology", weights)).isCloseTo(2.5, within(1e-9));
		assertThat(evaluator.headroom("Energy", weights)).isCloseTo(2, within(1e-9));
		assertThat(evaluator.headroom("Real Estate", weights)).isCloseTo(12, within(1e-9));
		assertThat(evaluator.headroom("Consumer Staples", Map.of("Consumer Staples", 31.0))).isZero();
	}

	@Test
	void sectorDistributionIsSortedByAllocation() {
		InMemoryMarketDataStore sectors = TestMarketData.sampleUniverse();

		List<SectorAllocation> distribution = evaluator.sectorDistribution(List.of(
				new Holding("PG", 10),
				new Holding("AAPL", 30),
				new Holding("MSFT", 20),
				new Holding("UNKNOWN", 40)
		), sectors);

		assertThat(distribution).extracting(SectorAllocation::sector)
				.containsExactly("Information Technology", "Unknown", "Consumer Staples");
		assertThat(distribution.get(0).allocation()).isCloseTo(50, within(1e-9));
	}

	private static SectorBalanceCheck rule(SectorBalanceReport report, int rule) {
		return report.checks().stream().filter(check -> check.rule() == rule).findFirst().orElseThrow();
	}

	private static InMemoryMarketDataStore sectors(Map<String, String> bySector) {
		return TestMarketData.store(Map.of(), new LinkedHashMap<>(bySector));
	}
}
