package my.portfoliooptimizer.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Market market,
		@Valid Optimizer optimizer,
		SectorBalance sectorBalance
) {
	public record Market(
			String pricesPath,
			String companiesPath,
			@NotBlank String benchmarkTicker,
			@NotBlank String riskFreeTicker,
			Double defaultRiskFreeRate
	) {
	}

	public record Optimizer(
			@Min(1) Integer maxRetries,
			Duration timeout,
			@Min(1) Integer localBatchSize,
			@Min(1) Integer globalBatchSize,
			@DecimalMin("0.0") @DecimalMax("1.0") Double mutationRate,
			@DecimalMin("0.0") @DecimalMax("1.0") Double rebalancingStrength,
			@Min(1) Integer parallelism,
			Long seed,
			@Min(1) Integer maxConcurrentJobs
	) {
	}

	public record SectorBalance(
			Double singleSectorHard,
			Double singleSectorSoft,
			Double correlatedGroupHard,
			Double correlatedGroupSoft,
			Double defensiveHard,
			Double defensiveSoft,
			Double reitHard,
			Double reitSoft,
			Double energyMaterialsHard,
			Double energyMaterialsSoft,
			Double energyMaterialsAdvisory,
			Integer hardPenalty,
			Integer softPenalty,
			Integer advisoryPenalty
	) {
	}
}
