package my.portfoliooptimizer.app.model;

import java.time.LocalDate;

public record DrawdownPoint(LocalDate date, double drawdown) {
}
