package my.portfoliooptimizer.app.dto;

public record CompanyDto(String ticker, String name, String sector, String description) {
}
