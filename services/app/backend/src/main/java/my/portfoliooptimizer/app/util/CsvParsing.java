package my.portfoliooptimizer.app.util;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

public final class CsvParsing {
	private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
			DateTimeFormatter.ISO_LOCAL_DATE,
			DateTimeFormatter.ofPattern("yyyy/MM/dd"),
			DateTimeFormatter.ofPattern("M/d/yyyy")
	);

	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		return value.charAt(0) == '\uFEFF' ? value.substring(1) : value;
	}

	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		int lineEnd = sample.indexOf('\n');
		String header = lineEnd < 0 ? sample : sample.substring(0, lineEnd);
		return header.indexOf(';') >= 0 && header.indexOf(',') < 0 ? ';' : ',';
	}

	public static String decodeUtf8(byte[] payload) {
		return stripBom(new String(payload, StandardCharsets.UTF_8));
	}

	public static String normalizeTicker(String raw) {
		return raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
	}

	/**
	 * Parses ISO dates and a few common spreadsheet exports; datetime values keep the date part.
	 */
	public static LocalDate parseDate(String raw) {
		if (raw == null || raw.isBlank()) {
			return null;
		}
		String value = raw.trim();
		int timeSeparator = value.indexOf('T');
		if (timeSeparator < 0) {
			timeSeparator = value.indexOf(' ');
		}
		if (timeSeparator > 0) {
			value = value.substring(0, timeSeparator);
		}
		for (DateTimeFormatter format : DATE_FORMATS) {
			try {
				return LocalDate.parse(value, format);
			} catch (DateTimeParseException ignored) {
				// try the next format
			}
		}
		return null;
	}

	public static Double parseDecimal(String raw) {
		if (raw == null) {
			return null;
		}
		String value = raw.trim().replace(" ", "");
		if (value.isEmpty()) {
			return null;
		}
		try {
			double parsed = Double.parseDouble(value);
			return Double.isFinite(parsed) ? parsed : null;
		} catch (NumberFormatException ex) {
			return null;
		}
	}
}
