package my.portfoliooptimizer.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import my.portfoliooptimizer.app.model.Holding;
import my.portfoliooptimizer.app.model.RiskTolerance;

import java.util.ArrayList;
import java.util.List;

public record PortfolioInputRequest(
		@NotEmpty(message = "At least one holding is required") List<@Valid HoldingDto> holdings,
		@DecimalMin("1") @DecimalMax("100") Double targetReturn,
		@NotBlank @Pattern(regexp = "(?i)conservative|moderate|aggressive") String riskTolerance,
		Boolean rebalanceSectors,
		Long seed
) {
	public List<Holding> toHoldings() {
		List<Holding> result = new ArrayList<>(holdings.size());
		for (HoldingDto holding : holdings) {
			result.add(holding.toHolding());
		}
		return result;
	}

	public RiskTolerance tolerance() {
		return RiskTolerance.from(riskTolerance);
	}

	public boolean rebalance() {
		return Boolean.TRUE.equals(rebalanceSectors);
	}
}
