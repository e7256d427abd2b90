package my.portfoliooptimizer.app.model;

import java.time.LocalDate;

public record ValuePoint(LocalDate date, double value) {
}
