package my.portfoliooptimizer.app.config;

import my.portfoliooptimizer.app.market.InMemoryMarketDataStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MarketDataConfig {
	@Bean
	public InMemoryMarketDataStore marketDataStore(MarketDataLoader loader, AppProperties properties) {
		return loader.load(properties.market());
	}
}
