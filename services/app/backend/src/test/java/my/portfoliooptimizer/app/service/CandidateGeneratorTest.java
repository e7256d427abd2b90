package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.market.InMemoryMarketDataStore;
import my.portfoliooptimizer.app.model.AdjustmentPriority;
import my.portfoliooptimizer.app.model.Holding;
import my.portfoliooptimizer.app.model.Holdings;
import my.portfoliooptimizer.app.model.RiskTolerance;
import my.portfoliooptimizer.app.model.TargetAdjustment;
import my.portfoliooptimizer.app.support.TestMarketData;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CandidateGeneratorTest {
	private static final List<String> UNIVERSE = List.of("AAPL", "MSFT", "NVDA", "JPM", "PG", "KO", "JNJ", "NEE", "XOM", "LIN");

	private final CandidateGenerator generator = new CandidateGenerator();

	@Test
	void randomPortfolioIncludesRequiredTickersAndSumsToFullAllocation() {
		List<Holding> holdings = generator.randomPortfolio(UNIVERSE, Set.of("NEE", "XOM"), 5, new SplittableRandom(3));

		assertThat(holdings).hasSize(5);
		assertThat(Holdings.tickers(holdings)).contains("NEE", "XOM");
		assertThat(Holdings.total(holdings)).isCloseTo(100, within(Holdings.SUM_TOLERANCE));
	}

	@Test
	void sameSeedReplaysSameCandidate() {
		List<Holding> first = generator.randomPortfolio(UNIVERSE, Set.of(), 6, new SplittableRandom(42));
		List<Holding> second = generator.randomPortfolio(UNIVERSE, Set.of(), 6, new SplittableRandom(42));

		assertThat(first).isEqualTo(second);
	}

	@Test
	void sectorBiasFavoursUnderweightSectors() {
		InMemoryMarketDataStore sectors = TestMarketData.sampleUniverse();
		Map<String, TargetAdjustment> adjustments = Map.of(
				"Information Technology", TargetAdjustment.of(80, 25, AdjustmentPriority.HIGH),
				"Consumer Staples", TargetAdjustment.of(0, 8, AdjustmentPriority.HIGH)
		);
		double tech = 0;
		double staples = 0;
		SplittableRandom random = new SplittableRandom(7);
		for (int i = 0; i < 200; i++) {
			List<Holding> holdings = generator.sectorBiasedPortfolio(
					List.of("AAPL", "MSFT", "PG", "KO"), Set.of(), 4, adjustments, 0.8, sectors, random);
			assertThat(Holdings.total(holdings)).isCloseTo(100, within(Holdings.SUM_TOLERANCE));
			for (Holding holding : holdings) {
				if (sectors.getSector(holding.ticker()).equals("Consumer Staples")) {
					staples += holding.allocation();
				} else {
					tech += holding.allocation();
				}
			}
		}

		assertThat(staples).isGreaterThan(tech);
	}

	@Test
	void sectorBiasDropsTinyAllocationsUnlessRequired() {
		InMemoryMarketDataStore sectors = TestMarketData.sampleUniverse();
		Map<String, TargetAdjustment> adjustments = Map.of(
				"Energy", TargetAdjustment.of(100, 0, AdjustmentPriority.HIGH)
		);
		SplittableRandom random = new SplittableRandom(1);
		for (int i = 0; i < 100; i++) {
			List<Holding> holdings = generator.sectorBiasedPortfolio(
					UNIVERSE, Set.of("XOM"), UNIVERSE.size(), adjustments, 1.0, sectors, random);
			assertThat(Holdings.tickers(holdings)).contains("XOM");
			for (Holding holding : holdings) {
				if (!holding.ticker().equals("XOM")) {
					assertThat(holding.allocation()).isGreaterThanOrEqualTo(CandidateGenerator.MIN_ALLOCATION * 0.9);
				}
			}
		}
	}

	@Test
	void mutateWeightsKeepsTickersAndRenormalizes() {
		List<Holding> source = List.of(new Holding("AAPL", 40), new Holding("PG", 35), new Holding("NEE", 25));

		List<Holding> mutated = generator.mutateWeights(source, 0.3, new SplittableRandom(9));

		assertThat(mutated).extracting(Holding::ticker).containsExactly("AAPL", "PG", "NEE");
		assertThat(Holdings.total(mutated)).isCloseTo(100, within(Holdings.SUM_TOLERANCE));
		assertThat(source.get(0).allocation()).isEqualTo(40);
	}

	@Test
	void swapNeverRemovesRequiredTickers() {
		List<Holding> source = List.of(new Holding("AAPL", 50), new Holding("PG", 50));
		SplittableRandom random = new SplittableRandom(5);

		for (int i = 0; i < 50; i++) {
			List<Holding> swapped = generator.swapHolding(source, UNIVERSE, Set.of("AAPL"), random);
			assertThat(swapped).hasSize(2);
			assertThat(Holdings.tickers(swapped)).contains("AAPL").doesNotContain("PG");
			assertThat(Holdings.total(swapped)).isCloseTo(100, within(Holdings.SUM_TOLERANCE));
		}
	}

	@Test
	void addHoldingGrowsCandidateByOneUnseenTicker() {
		List<Holding> source = List.of(new Holding("AAPL", 60), new Holding("PG", 40));

		List<Holding> grown = generator.addHolding(source, UNIVERSE, new SplittableRandom(2));

		assertThat(grown).hasSize(3);
		assertThat(Holdings.tickers(grown)).contains("AAPL", "PG");
		assertThat(Holdings.total(grown)).isCloseTo(100, within(Holdings.SUM_TOLERANCE));
	}

	@Test
	void conservativeCapsEveryAllocation() {
		List<Holding> source = List.of(
				new Holding("AAPL", 70),
				new Holding("PG", 10),
				new Holding("NEE", 10),
				new Holding("JNJ", 5),
				new Holding("KO", 5)
		);

		List<Holding> adjusted = generator.adjustForRisk(source, RiskTolerance.CONSERVATIVE);

		assertThat(Holdings.maxAllocation(adjusted)).isLessThanOrEqualTo(CandidateGenerator.CONSERVATIVE_CAP + 1e-9);
		assertThat(Holdings.total(adjusted)).isCloseTo(100, within(Holdings.SUM_TOLERANCE));
	}

	@Test
	void aggressiveLiftsTheTwoLargestHoldings() {
		List<Holding> source = List.of(
				new Holding("AAPL", 26),
				new Holding("PG", 25),
				new Holding("NEE", 25),
				new Holding("JNJ", 24)
		);

		List<Holding> adjusted = generator.adjustForRisk(source, RiskTolerance.AGGRESSIVE);

		Map<String, Double> byTicker = Holdings.byTicker(adjusted);
		assertThat(byTicker.get("AAPL")).isGreaterThan(byTicker.get("NEE"));
		assertThat(byTicker.get("PG")).isGreaterThan(byTicker.get("JNJ"));
		assertThat(Holdings.total(adjusted)).isCloseTo(100, within(Holdings.SUM_TOLERANCE));
	}

	@Test
	void moderateLeavesCandidateUnchanged() {
		List<Holding> source = List.of(new Holding("AAPL", 60), new Holding("PG", 40));

		List<Holding> adjusted = generator.adjustForRisk(source, RiskTolerance.MODERATE);

		assertThat(adjusted).extracting(Holding::ticker).containsExactly("AAPL", "PG");
		assertThat(adjusted.get(0).allocation()).isCloseTo(60, within(1e-9));
		assertThat(adjusted.get(1).allocation()).isCloseTo(40, within(1e-9));
	}
}
