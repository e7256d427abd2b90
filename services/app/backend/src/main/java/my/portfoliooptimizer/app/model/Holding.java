package my.portfoliooptimizer.app.model;

public record Holding(String ticker, double allocation) {
	public Holding {
		if (ticker == null || ticker.isBlank()) {
			throw new IllegalArgumentException("ticker is required");
		}
		if (!Double.isFinite(allocation) || allocation < 0) {
			allocation = 0;
		}
	}

	public Holding withAllocation(double value) {
		return new Holding(ticker, value);
	}
}
