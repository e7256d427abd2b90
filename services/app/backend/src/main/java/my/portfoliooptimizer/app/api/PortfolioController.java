package my.portfoliooptimizer.app.api;

import jakarta.validation.Valid;
import my.portfoliooptimizer.app.dto.AnalysisResponseDto;
import my.portfoliooptimizer.app.dto.CompanyDto;
import my.portfoliooptimizer.app.dto.PortfolioInputRequest;
import my.portfoliooptimizer.app.dto.SectorBalanceRequest;
import my.portfoliooptimizer.app.market.CompanyProfile;
import my.portfoliooptimizer.app.market.SectorLookup;
import my.portfoliooptimizer.app.model.OptimizationResult;
import my.portfoliooptimizer.app.model.SectorBalanceReport;
import my.portfoliooptimizer.app.service.PortfolioAnalyticsService;
import my.portfoliooptimizer.app.service.PortfolioOptimizationService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api")
public class PortfolioController {
	private final PortfolioAnalyticsService analyticsService;
	private final PortfolioOptimizationService optimizationService;
	private final SectorLookup sectorLookup;

	public PortfolioController(PortfolioAnalyticsService analyticsService,
							   PortfolioOptimizationService optimizationService,
							   SectorLookup sectorLookup) {
		this.analyticsService = analyticsService;
		this.optimizationService = optimizationService;
		this.sectorLookup = sectorLookup;
	}

	@GetMapping("/tickers")
	public List<CompanyDto> tickers() {
		List<CompanyProfile> companies = sectorLookup.companies();
		List<CompanyDto> result = new ArrayList<>();
		if (companies.isEmpty()) {
			for (String ticker : sectorLookup.allTickers()) {
				result.add(new CompanyDto(ticker, ticker, null, null));
			}
			return result;
		}
		for (CompanyProfile company : companies) {
			result.add(new CompanyDto(company.ticker(), company.name(), company.sector(), company.description()));
		}
		return result;
	}

	@PostMapping("/analyze")
	public AnalysisResponseDto analyze(@Valid @RequestBody PortfolioInputRequest request) {
		return analyticsService.analyze(request.toHoldings(), request.rebalance());
	}

	@PostMapping("/optimize")
	public OptimizationResult optimize(@Valid @RequestBody PortfolioInputRequest request) {
		return optimizationService.optimize(request);
	}

	@PostMapping("/sector-balance")
	public SectorBalanceReport sectorBalance(@Valid @RequestBody SectorBalanceRequest request) {
		return analyticsService.checkSectorBalance(request.toHoldings());
	}
}
