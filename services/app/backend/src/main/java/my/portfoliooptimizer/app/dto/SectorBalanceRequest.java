package my.portfoliooptimizer.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import my.portfoliooptimizer.app.model.Holding;

import java.util.List;

public record SectorBalanceRequest(
		@NotEmpty(message = "At least one holding is required") List<@Valid HoldingDto> holdings
) {
	public List<Holding> toHoldings() {
		return holdings.stream().map(HoldingDto::toHolding).toList();
	}
}
