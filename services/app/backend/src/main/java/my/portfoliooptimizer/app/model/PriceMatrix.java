package my.portfoliooptimizer.app.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Date-aligned, forward-filled price grid. Each ticker row holds the price on that date or
 * the most recent prior price; cells before a ticker's first price are NaN.
 */
public final class PriceMatrix {
	private final List<LocalDate> dates;
	private final Map<String, double[]> prices;

	private PriceMatrix(List<LocalDate> dates, Map<String, double[]> prices) {
		this.dates = dates;
		this.prices = prices;
	}

	public static PriceMatrix of(Map<String, List<PricePoint>> series) {
		Set<LocalDate> allDates = new TreeSet<>();
		if (series != null) {
			for (List<PricePoint> points : series.values()) {
				for (PricePoint point : points) {
					allDates.add(point.date());
				}
			}
		}
		List<LocalDate> dates = List.copyOf(allDates);
		Map<String, double[]> prices = new LinkedHashMap<>();
		if (series != null) {
			for (Map.Entry<String, List<PricePoint>> entry : series.entrySet()) {
				prices.put(entry.getKey(), forwardFill(dates, entry.getValue()));
			}
		}
		return new PriceMatrix(dates, prices);
	}

	private static double[] forwardFill(List<LocalDate> dates, List<PricePoint> points) {
		double[] row = new double[dates.size()];
		Arrays.fill(row, Double.NaN);
		List<PricePoint> sorted = new ArrayList<>(points);
		sorted.sort((a, b) -> a.date().compareTo(b.date()));
		int cursor = 0;
		double last = Double.NaN;
		for (int i = 0; i < dates.size(); i++) {
			LocalDate date = dates.get(i);
			while (cursor < sorted.size() && !sorted.get(cursor).date().isAfter(date)) {
				last = sorted.get(cursor).adjustedClose();
				cursor++;
			}
			row[i] = last;
		}
		return row;
	}

	public List<LocalDate> dates() {
		return dates;
	}

	public int size() {
		return dates.size();
	}

	public Set<String> tickers() {
		return Collections.unmodifiableSet(prices.keySet());
	}

	public boolean contains(String ticker) {
		return prices.containsKey(ticker);
	}

	public double priceAt(String ticker, int index) {
		double[] row = prices.get(ticker);
		return row == null ? Double.NaN : row[index];
	}

	/**
	 * First available price of the ticker, or NaN when it has none.
	 */
	public double initialPrice(String ticker) {
		double[] row = prices.get(ticker);
		if (row == null) {
			return Double.NaN;
		}
		for (double value : row) {
			if (!Double.isNaN(value)) {
				return value;
			}
		}
		return Double.NaN;
	}
}
