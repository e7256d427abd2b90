package my.portfoliooptimizer.app.config;

import my.portfoliooptimizer.app.importer.CompanyCsvParser;
import my.portfoliooptimizer.app.importer.PriceCsvParser;
import my.portfoliooptimizer.app.market.CompanyProfile;
import my.portfoliooptimizer.app.market.InMemoryMarketDataStore;
import my.portfoliooptimizer.app.model.PricePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Reads the price and company CSV files named in {@code app.market} into an in-memory store.
 */
@Component
public class MarketDataLoader {
	private static final Logger logger = LoggerFactory.getLogger(MarketDataLoader.class);

	private final ResourceLoader resourceLoader;
	private final PriceCsvParser priceParser = new PriceCsvParser();
	private final CompanyCsvParser companyParser = new CompanyCsvParser();

	public MarketDataLoader(ResourceLoader resourceLoader) {
		this.resourceLoader = resourceLoader;
	}

	public InMemoryMarketDataStore load(AppProperties.Market market) {
		byte[] prices = read(market == null ? null : market.pricesPath(), "prices");
		byte[] companies = read(market == null ? null : market.companiesPath(), "companies");
		Map<String, List<PricePoint>> series = prices == null ? Map.of() : priceParser.parse(prices);
		List<CompanyProfile> profiles = companies == null ? List.of() : companyParser.parse(companies);
		if (series.isEmpty()) {
			logger.warn("No price history loaded; analysis and optimization requests will fail.");
		}
		logger.info("Market data loaded: {} price series, {} company profiles.", series.size(), profiles.size());
		return new InMemoryMarketDataStore(series, profiles);
	}

	private byte[] read(String location, String label) {
		if (location == null || location.isBlank()) {
			logger.warn("No {} file configured.", label);
			return null;
		}
		Resource resource = resourceLoader.getResource(location.trim());
		if (!resource.exists()) {
			logger.warn("Configured {} file {} does not exist.", label, location);
			return null;
		}
		try (InputStream in = resource.getInputStream()) {
			return in.readAllBytes();
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to read " + label + " file " + location, ex);
		}
	}
}
