package my.portfoliooptimizer.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SectorBalanceCheck(int rule,
								 BalanceStatus status,
								 double value,
								 String sector,
								 List<String> members,
								 String message) {
	public SectorBalanceCheck {
		members = members == null ? null : List.copyOf(members);
	}
}
