package my.portfoliooptimizer.app.model;

public record SectorAllocation(String sector, double allocation) {
}
