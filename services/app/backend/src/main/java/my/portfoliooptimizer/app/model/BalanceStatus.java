package my.portfoliooptimizer.app.model;

public enum BalanceStatus {
	OK,
	ADVISORY,
	SOFT_WARNING,
	HARD_VIOLATION;

	public boolean isFlagged() {
		return this != OK;
	}
}
