package my.portfoliooptimizer.app.model;

public record Recommendation(String action,
							 String ticker,
							 double currentAllocation,
							 double recommendedAllocation,
							 double change,
							 String rationale) {
}
