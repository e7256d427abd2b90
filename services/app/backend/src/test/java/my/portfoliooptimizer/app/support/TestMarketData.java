package my.portfoliooptimizer.app.support;

import my.portfoliooptimizer.app.market.CompanyProfile;
import my.portfoliooptimizer.app.market.InMemoryMarketDataStore;
import my.portfoliooptimizer.app.model.PricePoint;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;

public final class TestMarketData {
	public static final LocalDate START = LocalDate.of(2022, 1, 3);
	public static final int TRADING_DAYS = 260;

	private static final Object[][] UNIVERSE = {
			{"AAPL", "Information Technology", 0.0005, 0.018},
			{"MSFT", "Information Technology", 0.0004, 0.016},
			{"NVDA", "Information Technology", 0.0007, 0.030},
			{"GOOGL", "Communication Services", 0.0003, 0.020},
			{"JPM", "Financials", 0.0002, 0.015},
			{"CAT", "Industrials", 0.0004, 0.016},
			{"XOM", "Energy", 0.0008, 0.020},
			{"LIN", "Materials", 0.0002, 0.014},
			{"PG", "Consumer Staples", 0.0002, 0.009},
			{"KO", "Consumer Staples", 0.0003, 0.008},
			{"JNJ", "Health Care", 0.0002, 0.009},
			{"UNH", "Health Care", 0.0004, 0.013},
			{"NEE", "Utilities", 0.0001, 0.012},
			{"PLD", "Real Estate", 0.0001, 0.016},
			{"AMZN", "Consumer Discretionary", -0.0002, 0.022}
	};

	private TestMarketData() {
	}

	/**
	 * Fifteen tickers across eleven sectors plus a benchmark, one year of business days each.
	 */
	public static InMemoryMarketDataStore sampleUniverse() {
		Map<String, List<PricePoint>> series = new LinkedHashMap<>();
		List<CompanyProfile> companies = new ArrayList<>();
		long seed = 11;
		for (Object[] row : UNIVERSE) {
			String ticker = (String) row[0];
			series.put(ticker, randomWalk(START, TRADING_DAYS, 100, (double) row[2], (double) row[3], seed++));
			companies.add(new CompanyProfile(ticker, ticker + " Inc.", (String) row[1], ""));
		}
		series.put("^GSPC", randomWalk(START, TRADING_DAYS, 4000, 0.0002, 0.011, 99));
		return new InMemoryMarketDataStore(series, companies);
	}

	public static InMemoryMarketDataStore store(Map<String, List<PricePoint>> series, Map<String, String> sectors) {
		List<CompanyProfile> companies = new ArrayList<>();
		sectors.forEach((ticker, sector) -> companies.add(new CompanyProfile(ticker, ticker, sector, "")));
		return new InMemoryMarketDataStore(series, companies);
	}

	/**
	 * Consecutive calendar days starting at {@code start}.
	 */
	public static List<PricePoint> series(LocalDate start, double... prices) {
		List<PricePoint> points = new ArrayList<>(prices.length);
		for (int i = 0; i < prices.length; i++) {
			points.add(new PricePoint(start.plusDays(i), prices[i]));
		}
		return points;
	}

	public static List<PricePoint> randomWalk(LocalDate start, int days, double startPrice, double drift, double volatility, long seed) {
		SplittableRandom random = new SplittableRandom(seed);
		List<PricePoint> points = new ArrayList<>(days);
		LocalDate date = start;
		double price = startPrice;
		while (points.size() < days) {
			if (date.getDayOfWeek() != DayOfWeek.SATURDAY && date.getDayOfWeek() != DayOfWeek.SUNDAY) {
				points.add(new PricePoint(date, price));
				double shock = (random.nextDouble() * 2 - 1) * Math.sqrt(3) * volatility;
				price = Math.max(0.01, price * (1 + drift + shock));
			}
			date = date.plusDays(1);
		}
		return points;
	}
}
