package my.portfoliooptimizer.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record YearlyReturn(int year, @JsonProperty("return") double returnPct) {
}
