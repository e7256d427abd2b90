package my.portfoliooptimizer.app.market;

import my.portfoliooptimizer.app.model.PricePoint;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only snapshot of prices and company metadata, built once and shared by all requests.
 */
public class InMemoryMarketDataStore implements PriceStore, SectorLookup {
	private final Map<String, List<PricePoint>> series;
	private final Map<String, CompanyProfile> companies;
	private final Map<String, List<String>> tickersBySector;

	public InMemoryMarketDataStore(Map<String, List<PricePoint>> series, Collection<CompanyProfile> companies) {
		Map<String, List<PricePoint>> sortedSeries = new TreeMap<>();
		if (series != null) {
			series.forEach((ticker, points) -> {
				List<PricePoint> copy = new ArrayList<>(points);
				copy.sort(Comparator.comparing(PricePoint::date));
				sortedSeries.put(normalize(ticker), List.copyOf(copy));
			});
		}
		Map<String, CompanyProfile> byTicker = new TreeMap<>();
		Map<String, List<String>> bySector = new LinkedHashMap<>();
		if (companies != null) {
			for (CompanyProfile company : companies) {
				if (company == null || company.ticker() == null || company.ticker().isBlank()) {
					continue;
				}
				byTicker.put(normalize(company.ticker()), company);
			}
			byTicker.forEach((ticker, company) -> {
				if (company.sector() != null && !company.sector().isBlank()) {
					bySector.computeIfAbsent(company.sector(), key -> new ArrayList<>()).add(ticker);
				}
			});
		}
		this.series = sortedSeries;
		this.companies = byTicker;
		this.tickersBySector = bySector;
	}

	public static InMemoryMarketDataStore empty() {
		return new InMemoryMarketDataStore(Map.of(), List.of());
	}

	@Override
	public Optional<List<PricePoint>> findSeries(String ticker) {
		if (ticker == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(series.get(normalize(ticker)));
	}

	@Override
	public Set<String> tickers() {
		return series.keySet();
	}

	@Override
	public String getSector(String ticker) {
		if (ticker == null) {
			return UNKNOWN_SECTOR;
		}
		CompanyProfile company = companies.get(normalize(ticker));
		if (company == null || company.sector() == null || company.sector().isBlank()) {
			return UNKNOWN_SECTOR;
		}
		return company.sector();
	}

	/**
	 * Tickers with price data, or with metadata when no prices are loaded.
	 */
	@Override
	public List<String> allTickers() {
		Set<String> tickers = new TreeSet<>(series.keySet());
		if (tickers.isEmpty()) {
			tickers.addAll(companies.keySet());
		}
		return List.copyOf(tickers);
	}

	@Override
	public List<String> tickersBySector(String sector) {
		return List.copyOf(tickersBySector.getOrDefault(sector, List.of()));
	}

	@Override
	public List<CompanyProfile> companies() {
		return List.copyOf(companies.values());
	}

	private static String normalize(String ticker) {
		return ticker.trim().toUpperCase(Locale.ROOT);
	}
}
