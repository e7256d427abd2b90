package my.portfoliooptimizer.app.importer;

import my.portfoliooptimizer.app.model.PricePoint;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PriceCsvParserTest {
	private final PriceCsvParser parser = new PriceCsvParser();

	@Test
	void groupsRowsByTickerInDateOrder() {
		String csv = """
				Date,Ticker,Adj Close
				2024-01-03,aapl,184.25
				2024-01-02,AAPL,185.64
				2024-01-02,MSFT,370.87
				""";

		Map<String, List<PricePoint>> series = parser.parse(csv.getBytes(StandardCharsets.UTF_8));

		assertThat(series).containsOnlyKeys("AAPL", "MSFT");
		assertThat(series.get("AAPL")).containsExactly(
				new PricePoint(LocalDate.of(2024, 1, 2), 185.64),
				new PricePoint(LocalDate.of(2024, 1, 3), 184.25)
		);
	}

	@Test
	void skipsRowsWithUnusablePrices() {
		String csv = """
				Date;Ticker;Adj Close
				2024-01-02;AAPL;185.64
				2024-01-03;AAPL;
				not-a-date;AAPL;184.10
				2024-01-04;AAPL;0
				2024-01-05;AAPL;-3
				""";

		Map<String, List<PricePoint>> series = parser.parse(csv.getBytes(StandardCharsets.UTF_8));

		assertThat(series.get("AAPL")).hasSize(1);
	}

	@Test
	void keepsLastValueForDuplicateDates() {
		String csv = "\uFEFFDate,Ticker,Adj Close\n2024-01-02,AAPL,185.00\n2024-01-02,AAPL,185.64\n";

		Map<String, List<PricePoint>> series = parser.parse(csv.getBytes(StandardCharsets.UTF_8));

		assertThat(series.get("AAPL")).containsExactly(new PricePoint(LocalDate.of(2024, 1, 2), 185.64));
	}

	@Test
	void rejectsMissingColumns() {
		byte[] payload = "Date,Symbol,Close\n2024-01-02,AAPL,185.64\n".getBytes(StandardCharsets.UTF_8);

		assertThatThrownBy(() -> parser.parse(payload))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Ticker");
	}
}
