package my.portfoliooptimizer.app.model;

public record TargetAdjustment(double current,
							   double target,
							   double delta,
							   AdjustmentPriority priority) {
	public static TargetAdjustment of(double current, double target, AdjustmentPriority priority) {
		return new TargetAdjustment(current, target, target - current, priority);
	}

	public boolean isReduction() {
		return delta < 0;
	}

	public boolean isIncrease() {
		return delta > 0;
	}
}
