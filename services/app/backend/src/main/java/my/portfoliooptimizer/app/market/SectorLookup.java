package my.portfoliooptimizer.app.market;

import java.util.List;

public interface SectorLookup {
	String UNKNOWN_SECTOR = "Unknown";

	/**
	 * Sector of the ticker, {@link #UNKNOWN_SECTOR} when no metadata exists.
	 */
	String getSector(String ticker);

	List<String> allTickers();

	List<String> tickersBySector(String sector);

	/**
	 * Company metadata in load order, empty when none was loaded.
	 */
	List<CompanyProfile> companies();
}
