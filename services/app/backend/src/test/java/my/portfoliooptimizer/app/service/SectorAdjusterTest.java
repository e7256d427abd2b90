package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.market.InMemoryMarketDataStore;
import my.portfoliooptimizer.app.model.Holding;
import my.portfoliooptimizer.app.model.Holdings;
import my.portfoliooptimizer.app.support.TestMarketData;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SectorAdjusterTest {
	private final SectorBalanceEvaluator evaluator = new SectorBalanceEvaluator(SectorBalanceThresholds.DEFAULTS);
	private final SectorAdjuster adjuster = new SectorAdjuster(evaluator);
	private final InMemoryMarketDataStore sectors = TestMarketData.sampleUniverse();
	private static final List<String> UNIVERSE = List.of(
			"AAPL", "MSFT", "NVDA", "GOOGL", "JPM", "CAT", "XOM", "LIN",
			"PG", "KO", "JNJ", "UNH", "NEE", "PLD", "AMZN");

	@Test
	void concentratedTechPortfolioConvergesByAddingDefensiveNames() {
		List<Holding> holdings = List.of(
				new Holding("AAPL", 50),
				new Holding("MSFT", 30),
				new Holding("NVDA", 20)
		);

		SectorAdjuster.Result result = adjuster.adjust(holdings, sectors, Set.copyOf(sectors.tickers()));

		assertThat(result.converged()).isTrue();
		assertThat(result.iterations()).isBetween(1, SectorAdjuster.MAX_ITERATIONS);
		assertThat(result.report().hardViolations()).isZero();
		assertThat(result.report().softWarnings()).isZero();
		assertThat(Holdings.tickers(result.holdings())).contains("AAPL", "MSFT", "NVDA", "PG", "JNJ", "NEE");
		assertThat(Holdings.total(result.holdings())).isCloseTo(100, within(Holdings.SUM_TOLERANCE));
		assertThat(holdings.get(0).allocation()).isEqualTo(50);
	}

	@Test
	void addsAtMostTwoTickersPerEmptySector() {
		List<Holding> holdings = List.of(new Holding("AAPL", 100));

		SectorAdjuster.Result result = adjuster.adjust(holdings, sectors, Set.copyOf(sectors.tickers()));

		long staples = result.holdings().stream()
				.filter(holding -> sectors.getSector(holding.ticker()).equals("Consumer Staples"))
				.count();
		assertThat(staples).isLessThanOrEqualTo(SectorAdjuster.MAX_NEW_TICKERS_PER_SECTOR);
	}

	@Test
	void compliantPortfolioIsReturnedWithoutIterations() {
		List<Holding> holdings = List.of(
				new Holding("AAPL", 20),
				new Holding("JPM", 20),
				new Holding("PG", 20),
				new Holding("NEE", 20),
				new Holding("AMZN", 20)
		);

		SectorAdjuster.Result result = adjuster.adjust(holdings, sectors, Set.copyOf(sectors.tickers()));

		assertThat(result.iterations()).isZero();
		assertThat(result.converged()).isTrue();
		assertThat(result.holdings()).extracting(Holding::ticker).containsExactly("AAPL", "JPM", "PG", "NEE", "AMZN");
		assertThat(result.holdings()).allSatisfy(holding -> assertThat(holding.allocation()).isCloseTo(20, within(1e-9)));
	}

	@Test
	void energyAndMaterialsAreTrimmedAsOneBucket() {
		List<Holding> holdings = List.of(
				new Holding("AAPL", 30),
				new Holding("JNJ", 25),
				new Holding("NEE", 22),
				new Holding("XOM", 11.5),
				new Holding("LIN", 11.5)
		);

		SectorAdjuster.Result result = adjuster.adjust(holdings, sectors, Set.copyOf(UNIVERSE));

		assertThat(result.converged()).isTrue();
		assertThat(Holdings.tickers(result.holdings())).contains("XOM", "LIN");
		Map<String, Double> weights = Holdings.byTicker(result.holdings());
		double energyMaterials = weights.get("XOM") + weights.get("LIN");
		assertThat(energyMaterials).isLessThanOrEqualTo(15);
	}

	@Test
	void twoSectorPortfolioSpreadsIntoNewSectors() {
		List<Holding> holdings = List.of(new Holding("PG", 50), new Holding("MSFT", 50));

		SectorAdjuster.Result result = adjuster.adjust(holdings, sectors, Set.copyOf(UNIVERSE));

		assertThat(result.converged()).isTrue();
		assertThat(Holdings.tickers(result.holdings())).contains("PG", "MSFT");
		assertThat(evaluator.sectorDistribution(result.holdings(), sectors))
				.allSatisfy(allocation -> assertThat(allocation.allocation()).isLessThanOrEqualTo(30));
		assertThat(Holdings.total(result.holdings())).isCloseTo(100, within(Holdings.SUM_TOLERANCE));
	}

	@Test
	void singleSectorPortfolioConverges() {
		SectorAdjuster.Result result = adjuster.adjust(List.of(new Holding("JNJ", 100)), sectors, Set.copyOf(UNIVERSE));

		assertThat(result.converged()).isTrue();
		assertThat(result.report().overallScore()).isEqualTo(100);
		assertThat(Holdings.tickers(result.holdings())).contains("JNJ");
		assertThat(result.holdings().size()).isGreaterThan(3);
	}

	@Test
	void randomPortfoliosConvergeWhenEveryTickerIsEligible() {
		SplittableRandom random = new SplittableRandom(2024);
		Set<String> eligible = Set.copyOf(UNIVERSE);
		for (int run = 0; run < 300; run++) {
			List<String> shuffled = new ArrayList<>(UNIVERSE);
			Collections.shuffle(shuffled, new Random(random.nextLong()));
			int size = 1 + random.nextInt(6);
			List<Holding> holdings = new ArrayList<>();
			for (int i = 0; i < size; i++) {
				holdings.add(new Holding(shuffled.get(i), 1 + random.nextInt(100)));
			}
			List<Holding> before = List.copyOf(holdings);

			SectorAdjuster.Result result = adjuster.adjust(holdings, sectors, eligible);

			assertThat(result.converged()).as("adjusting %s", before).isTrue();
			assertThat(Holdings.total(result.holdings())).as("adjusting %s", before)
					.isCloseTo(100, within(Holdings.SUM_TOLERANCE));
			assertThat(holdings).isEqualTo(before);
		}
	}

	@Test
	void stopsAfterIterationLimitWhenNothingCanBeAdded() {
		List<Holding> holdings = List.of(new Holding("AAPL", 60), new Holding("MSFT", 40));

		SectorAdjuster.Result result = adjuster.adjust(holdings, sectors, Set.of());

		assertThat(result.converged()).isFalse();
		assertThat(result.iterations()).isEqualTo(SectorAdjuster.MAX_ITERATIONS);
		assertThat(result.report().hardViolations()).isPositive();
		assertThat(Holdings.tickers(result.holdings())).containsExactly("AAPL", "MSFT");
	}
}
