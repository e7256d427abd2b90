package my.portfoliooptimizer.app.model;

import java.util.Locale;

public enum AdjustmentPriority {
	HIGH,
	MEDIUM,
	LOW;

	public static AdjustmentPriority of(BalanceStatus status) {
		if (status == BalanceStatus.HARD_VIOLATION) {
			return HIGH;
		}
		if (status == BalanceStatus.SOFT_WARNING) {
			return MEDIUM;
		}
		return LOW;
	}

	public AdjustmentPriority max(AdjustmentPriority other) {
		return other != null && other.ordinal() < ordinal() ? other : this;
	}

	@Override
	public String toString() {
		return name().toLowerCase(Locale.ROOT);
	}
}
