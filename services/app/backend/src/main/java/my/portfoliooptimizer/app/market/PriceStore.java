package my.portfoliooptimizer.app.market;

import my.portfoliooptimizer.app.model.PricePoint;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface PriceStore {
	/**
	 * Date-ascending adjusted close series of the ticker, empty when the ticker is unknown.
	 */
	Optional<List<PricePoint>> findSeries(String ticker);

	Set<String> tickers();
}
