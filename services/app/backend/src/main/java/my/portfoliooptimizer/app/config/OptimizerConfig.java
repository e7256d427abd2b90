package my.portfoliooptimizer.app.config;

import my.portfoliooptimizer.app.service.BatchEvaluator;
import my.portfoliooptimizer.app.service.SearchSettings;
import my.portfoliooptimizer.app.service.SectorBalanceThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class OptimizerConfig {
	private static final Logger logger = LoggerFactory.getLogger(OptimizerConfig.class);

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public SectorBalanceThresholds sectorBalanceThresholds(AppProperties properties) {
		return SectorBalanceThresholds.from(properties.sectorBalance());
	}

	@Bean
	public SearchSettings searchSettings(AppProperties properties) {
		SearchSettings settings = SearchSettings.from(properties.optimizer());
		logger.info("Optimizer settings: maxRetries={}, timeout={}s, batches={}/{}",
				settings.maxRetries(), settings.timeout().toSeconds(),
				settings.localBatchSize(), settings.globalBatchSize());
		return settings;
	}

	@Bean(destroyMethod = "close")
	public BatchEvaluator batchEvaluator(AppProperties properties) {
		Integer parallelism = properties.optimizer() == null ? null : properties.optimizer().parallelism();
		int workers = parallelism == null ? 1 : parallelism;
		if (workers > 1) {
			logger.info("Candidate evaluation runs on {} worker threads.", workers);
		}
		return BatchEvaluator.withParallelism(workers);
	}
}
