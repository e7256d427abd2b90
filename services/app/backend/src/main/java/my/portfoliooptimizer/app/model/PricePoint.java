package my.portfoliooptimizer.app.model;

import java.time.LocalDate;

public record PricePoint(LocalDate date, double adjustedClose) {
}
