package my.portfoliooptimizer.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import my.portfoliooptimizer.app.model.Holding;

import java.util.Locale;

public record HoldingDto(@NotBlank(message = "Ticker is required") String ticker,
						 @NotNull @PositiveOrZero(message = "Allocation must be positive") Double allocation) {
	public Holding toHolding() {
		return new Holding(ticker.trim().toUpperCase(Locale.ROOT), allocation);
	}
}
