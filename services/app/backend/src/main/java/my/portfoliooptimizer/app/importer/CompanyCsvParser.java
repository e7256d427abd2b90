package my.portfoliooptimizer.app.importer;

import my.portfoliooptimizer.app.market.CompanyProfile;
import my.portfoliooptimizer.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads company metadata: {@code Ticker,Name,Sector} with an optional {@code Description} column.
 */
public class CompanyCsvParser {
	private static final String TICKER = "Ticker";
	private static final String NAME = "Name";
	private static final String SECTOR = "Sector";
	private static final String DESCRIPTION = "Description";

	public List<CompanyProfile> parse(byte[] payload) {
		String content = CsvParsing.decodeUtf8(payload);
		Map<String, CompanyProfile> companies = new LinkedHashMap<>();
		try (CSVParser parser = CSVParser.parse(
				new StringReader(content),
				CSVFormat.DEFAULT.withDelimiter(CsvParsing.sniffDelimiter(content)).withFirstRecordAsHeader().withTrim()
		)) {
			PriceCsvParser.requireColumns(parser, TICKER, SECTOR);
			boolean hasName = parser.getHeaderMap().containsKey(NAME);
			boolean hasDescription = parser.getHeaderMap().containsKey(DESCRIPTION);
			for (CSVRecord record : parser) {
				if (!record.isConsistent()) {
					continue;
				}
				String ticker = CsvParsing.normalizeTicker(record.get(TICKER));
				if (ticker.isEmpty()) {
					continue;
				}
				String name = hasName ? blankToNull(record.get(NAME)) : null;
				String sector = blankToNull(record.get(SECTOR));
				String description = hasDescription ? blankToNull(record.get(DESCRIPTION)) : null;
				companies.put(ticker, new CompanyProfile(ticker, name == null ? ticker : name, sector,
						description == null ? "" : description));
			}
		} catch (IOException ex) {
			throw new IllegalArgumentException("Failed to read company CSV: " + ex.getMessage(), ex);
		}
		List<CompanyProfile> result = new ArrayList<>(companies.values());
		result.sort(Comparator.comparing(CompanyProfile::ticker));
		return result;
	}

	private String blankToNull(String value) {
		return value == null || value.isBlank() ? null : value.trim();
	}
}
