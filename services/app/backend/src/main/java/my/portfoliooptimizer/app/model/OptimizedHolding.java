package my.portfoliooptimizer.app.model;

public record OptimizedHolding(String ticker, double allocation, double change) {
}
