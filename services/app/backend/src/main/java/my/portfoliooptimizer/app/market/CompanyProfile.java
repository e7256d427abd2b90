package my.portfoliooptimizer.app.market;

public record CompanyProfile(String ticker, String name, String sector, String description) {
}
