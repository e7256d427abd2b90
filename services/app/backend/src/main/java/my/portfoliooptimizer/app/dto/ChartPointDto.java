package my.portfoliooptimizer.app.dto;

import java.time.LocalDate;

public record ChartPointDto(LocalDate date, double portfolio, Double benchmark) {
}
