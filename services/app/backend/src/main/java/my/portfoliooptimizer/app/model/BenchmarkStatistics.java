package my.portfoliooptimizer.app.model;

public record BenchmarkStatistics(double beta,
								  double alpha,
								  double informationRatio,
								  double trackingError,
								  double rSquare) {
	private static final BenchmarkStatistics NONE = new BenchmarkStatistics(0, 0, 0, 0, 0);

	public BenchmarkStatistics {
		beta = Double.isFinite(beta) ? beta : 0;
		alpha = Double.isFinite(alpha) ? alpha : 0;
		informationRatio = Double.isFinite(informationRatio) ? informationRatio : 0;
		trackingError = Double.isFinite(trackingError) ? trackingError : 0;
		rSquare = Double.isFinite(rSquare) ? rSquare : 0;
	}

	public static BenchmarkStatistics none() {
		return NONE;
	}
}
