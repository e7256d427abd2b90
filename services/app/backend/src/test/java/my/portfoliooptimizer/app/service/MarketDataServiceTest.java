package my.portfoliooptimizer.app.service;

import my.portfoliooptimizer.app.market.InMemoryMarketDataStore;
import my.portfoliooptimizer.app.model.Holding;
import my.portfoliooptimizer.app.model.PricePoint;
import my.portfoliooptimizer.app.support.TestMarketData;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static my.portfoliooptimizer.app.support.TestMarketData.START;
import static my.portfoliooptimizer.app.support.TestMarketData.TRADING_DAYS;
import static my.portfoliooptimizer.app.support.TestMarketData.randomWalk;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MarketDataServiceTest {
	private static final LocalDate LATE_START = LocalDate.of(2022, 6, 1);

	@Test
	void analysisAlignsHoldingsAndBenchmarkOverCommonRange() {
		MarketDataService service = new MarketDataService(store(true, true), null);

		MarketDataService.PreparedData data = service.prepareAnalysis(List.of(
				new Holding("AAPL", 60), new Holding("LATE", 40)));

		assertThat(data.tickers()).containsExactly("AAPL", "LATE", "^GSPC");
		assertThat(data.hasBenchmark()).isTrue();
		assertThat(data.range().start()).isEqualTo(LATE_START);
		assertThat(data.prices().dates().get(0)).isEqualTo(LATE_START);
		assertThat(data.riskFreeRate()).isCloseTo(4.0, within(1e-9));
	}

	@Test
	void missingBenchmarkAndRiskFreeSeriesFallBackToDefaults() {
		MarketDataService service = new MarketDataService(store(false, false), null);

		MarketDataService.PreparedData data = service.prepareAnalysis(List.of(new Holding("AAPL", 100)));

		assertThat(data.hasBenchmark()).isFalse();
		assertThat(data.tickers()).containsExactly("AAPL");
		assertThat(data.riskFreeRate()).isEqualTo(MetricsEngine.DEFAULT_RISK_FREE_RATE);
	}

	@Test
	void unknownTickersAreReportedTogether() {
		MarketDataService service = new MarketDataService(store(true, true), null);

		assertThatThrownBy(() -> service.prepareAnalysis(List.of(
				new Holding("AAPL", 50), new Holding("NOPE", 25), new Holding("GONE", 25))))
				.isInstanceOfSatisfying(MissingInstrumentException.class, ex ->
						assertThat(ex.getMissingTickers()).containsExactly("NOPE", "GONE"));
	}

	@Test
	void shortHistoryIsRejected() {
		MarketDataService service = new MarketDataService(store(true, true), null);

		assertThatThrownBy(() -> service.prepareOptimization(List.of(new Holding("NEWCO", 100))))
				.isInstanceOfSatisfying(InsufficientHistoryException.class, ex ->
						assertThat(ex.getYears()).isLessThan(MarketDataService.MIN_YEARS));
	}

	@Test
	void optimizationUniverseKeepsOnlyTickersCoveringTheRange() {
		MarketDataService service = new MarketDataService(store(true, true), null);

		MarketDataService.PreparedData data = service.prepareOptimization(List.of(new Holding("AAPL", 100)));

		assertThat(data.tickers()).containsExactlyInAnyOrder("AAPL", "MSFT");
		assertThat(data.prices().contains("^GSPC")).isTrue();
		assertThat(data.hasBenchmark()).isTrue();
		assertThat(data.range().start()).isEqualTo(START);
		assertThat(data.riskFreeRate()).isCloseTo(4.0, within(1e-9));
	}

	@Test
	void commonDateRangeUsesLatestStartAndEarliestEnd() {
		Map<String, List<PricePoint>> series = new LinkedHashMap<>();
		series.put("A", TestMarketData.series(LocalDate.of(2024, 1, 1), 1, 2, 3, 4, 5));
		series.put("B", TestMarketData.series(LocalDate.of(2024, 1, 3), 1, 2, 3, 4, 5));
		series.put("C", List.of());

		MarketDataService.DateRange range = MarketDataService.commonDateRange(series);

		assertThat(range.start()).isEqualTo(LocalDate.of(2024, 1, 3));
		assertThat(range.end()).isEqualTo(LocalDate.of(2024, 1, 5));
		assertThat(range.years()).isCloseTo(2 / 365.25, within(1e-12));

		MarketDataService.DateRange empty = MarketDataService.commonDateRange(Map.of());
		assertThat(empty.start()).isNull();
		assertThat(empty.years()).isZero();
	}

	private static InMemoryMarketDataStore store(boolean withBenchmark, boolean withRiskFree) {
		Map<String, List<PricePoint>> series = new LinkedHashMap<>();
		series.put("AAPL", randomWalk(START, TRADING_DAYS, 180, 0.0005, 0.018, 1));
		series.put("MSFT", randomWalk(START, TRADING_DAYS, 330, 0.0004, 0.016, 2));
		series.put("LATE", randomWalk(LATE_START, 120, 50, 0.0003, 0.02, 3));
		series.put("NEWCO", randomWalk(LocalDate.of(2022, 12, 1), 20, 10, 0.001, 0.03, 4));
		if (withBenchmark) {
			series.put("^GSPC", randomWalk(START, TRADING_DAYS, 4000, 0.0002, 0.011, 5));
		}
		if (withRiskFree) {
			List<PricePoint> riskFree = new ArrayList<>();
			for (LocalDate date = LocalDate.of(2021, 12, 1); date.isBefore(START); date = date.plusDays(1)) {
				riskFree.add(new PricePoint(date, 1.0));
			}
			riskFree.addAll(randomWalk(START, TRADING_DAYS, 4.0, 0, 0, 6));
			series.put("^IRX", riskFree);
		}
		return TestMarketData.store(series, Map.of("AAPL", "Information Technology", "MSFT", "Information Technology"));
	}
}
