package my.portfoliooptimizer.app.importer;

import my.portfoliooptimizer.app.model.PricePoint;
import my.portfoliooptimizer.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads long-format adjusted close prices: {@code Date,Ticker,Adj Close}.
 */
public class PriceCsvParser {
	static final String DATE = "Date";
	static final String TICKER = "Ticker";
	static final String ADJ_CLOSE = "Adj Close";

	public Map<String, List<PricePoint>> parse(byte[] payload) {
		String content = CsvParsing.decodeUtf8(payload);
		Map<String, TreeMap<LocalDate, Double>> byTicker = new LinkedHashMap<>();
		try (CSVParser parser = CSVParser.parse(
				new StringReader(content),
				CSVFormat.DEFAULT.withDelimiter(CsvParsing.sniffDelimiter(content)).withFirstRecordAsHeader().withTrim()
		)) {
			requireColumns(parser, DATE, TICKER, ADJ_CLOSE);
			for (CSVRecord record : parser) {
				if (!record.isConsistent()) {
					continue;
				}
				String ticker = CsvParsing.normalizeTicker(record.get(TICKER));
				LocalDate date = CsvParsing.parseDate(record.get(DATE));
				Double close = CsvParsing.parseDecimal(record.get(ADJ_CLOSE));
				if (ticker.isEmpty() || date == null || close == null || close <= 0) {
					continue;
				}
				byTicker.computeIfAbsent(ticker, key -> new TreeMap<>()).put(date, close);
			}
		} catch (IOException ex) {
			throw new IllegalArgumentException("Failed to read price CSV: " + ex.getMessage(), ex);
		}

		Map<String, List<PricePoint>> result = new LinkedHashMap<>();
		byTicker.forEach((ticker, prices) -> {
			List<PricePoint> points = new ArrayList<>(prices.size());
			prices.forEach((date, close) -> points.add(new PricePoint(date, close)));
			result.put(ticker, List.copyOf(points));
		});
		return result;
	}

	static void requireColumns(CSVParser parser, String... columns) {
		for (String column : columns) {
			if (!parser.getHeaderMap().containsKey(column)) {
				throw new IllegalArgumentException("CSV is missing column '" + column + "'");
			}
		}
	}
}
