package my.portfoliooptimizer.app.service;

import java.util.List;

public class MissingInstrumentException extends RuntimeException {
	private final List<String> missingTickers;

	public MissingInstrumentException(List<String> missingTickers) {
		super("Some tickers could not be found: " + String.join(", ", missingTickers));
		this.missingTickers = List.copyOf(missingTickers);
	}

	public List<String> getMissingTickers() {
		return missingTickers;
	}
}
