package my.portfoliooptimizer.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskTolerance {
	CONSERVATIVE("conservative"),
	MODERATE("moderate"),
	AGGRESSIVE("aggressive");

	private final String id;

	RiskTolerance(String id) {
		this.id = id;
	}

	@JsonValue
	public String id() {
		return id;
	}

	@JsonCreator
	public static RiskTolerance from(String raw) {
		if (raw == null || raw.isBlank()) {
			throw new IllegalArgumentException("Risk tolerance is required");
		}
		String normalized = raw.trim().toLowerCase(Locale.ROOT);
		for (RiskTolerance value : values()) {
			if (value.id.equals(normalized)) {
				return value;
			}
		}
		throw new IllegalArgumentException("Unknown risk tolerance: " + raw);
	}
}
