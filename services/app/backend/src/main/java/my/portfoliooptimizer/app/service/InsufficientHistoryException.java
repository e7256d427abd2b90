package my.portfoliooptimizer.app.service;

public class InsufficientHistoryException extends RuntimeException {
	private final double years;

	public InsufficientHistoryException(String message, double years) {
		super(message);
		this.years = years;
	}

	public double getYears() {
		return years;
	}
}
