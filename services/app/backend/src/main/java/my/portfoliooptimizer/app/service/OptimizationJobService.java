package my.portfoliooptimizer.app.service;

import jakarta.annotation.PreDestroy;
import my.portfoliooptimizer.app.config.AppProperties;
import my.portfoliooptimizer.app.dto.OptimizationJobResponseDto;
import my.portfoliooptimizer.app.dto.OptimizationJobStatus;
import my.portfoliooptimizer.app.dto.PortfolioInputRequest;
import my.portfoliooptimizer.app.model.OptimizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class OptimizationJobService {
	private static final Logger logger = LoggerFactory.getLogger(OptimizationJobService.class);
	private static final Duration JOB_TTL = Duration.ofMinutes(30);
	private static final int DEFAULT_MAX_CONCURRENT_JOBS = 2;

	private final PortfolioOptimizationService optimizationService;
	private final Clock clock;
	private final Map<String, JobState> jobs = new ConcurrentHashMap<>();
	private final ExecutorService executor;
	private final Semaphore concurrency;

	public OptimizationJobService(PortfolioOptimizationService optimizationService,
								  AppProperties properties,
								  Clock clock) {
		this.optimizationService = optimizationService;
		this.clock = clock;
		Integer configured = properties == null || properties.optimizer() == null
				? null
				: properties.optimizer().maxConcurrentJobs();
		this.concurrency = new Semaphore(configured == null || configured < 1 ? DEFAULT_MAX_CONCURRENT_JOBS : configured);
		AtomicInteger counter = new AtomicInteger();
		this.executor = Executors.newCachedThreadPool(runnable -> {
			Thread thread = new Thread(runnable, "optimization-job-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
	}

	public OptimizationJobResponseDto start(PortfolioInputRequest request) {
		cleanupExpired();
		String jobId = UUID.randomUUID().toString();
		JobState job = new JobState(jobId, request, clock.instant());
		jobs.put(jobId, job);
		executor.submit(() -> runJob(jobId));
		return toDto(job);
	}

	public OptimizationJobResponseDto get(String jobId) {
		cleanupExpired();
		JobState job = jobs.get(jobId);
		if (job == null) {
			throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Optimization job not found");
		}
		return toDto(job);
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private void runJob(String jobId) {
		JobState job = jobs.get(jobId);
		if (job == null) {
			return;
		}
		try {
			concurrency.acquire();
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			job.status = OptimizationJobStatus.FAILED;
			job.error = failWithReference(job, ex);
			job.finishedAt = clock.instant();
			return;
		}
		try {
			job.status = OptimizationJobStatus.RUNNING;
			job.result = optimizationService.optimize(job.request);
			job.status = OptimizationJobStatus.DONE;
		} catch (Exception ex) {
			job.status = OptimizationJobStatus.FAILED;
			job.error = failWithReference(job, ex);
		} finally {
			job.finishedAt = clock.instant();
			concurrency.release();
		}
	}

	private OptimizationJobResponseDto toDto(JobState job) {
		return new OptimizationJobResponseDto(
				job.jobId,
				job.status,
				job.result,
				job.error
		);
	}

	private void cleanupExpired() {
		Instant now = clock.instant();
		jobs.entrySet().removeIf(entry -> {
			JobState job = entry.getValue();
			Instant base = job.finishedAt == null ? job.createdAt : job.finishedAt;
			return base.plus(JOB_TTL).isBefore(now);
		});
	}

	private String failWithReference(JobState job, Exception ex) {
		String message = ex == null ? null : ex.getMessage();
		String reference = "OP-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
		logger.error("Optimization job failed (ref={}, jobId={}, error={})", reference, job.jobId, message, ex);
		return "Error ref " + reference;
	}

	private static final class JobState {
		private final String jobId;
		private final PortfolioInputRequest request;
		private final Instant createdAt;

		private volatile Instant finishedAt;
		private volatile OptimizationJobStatus status;
		private volatile OptimizationResult result;
		private volatile String error;

		private JobState(String jobId, PortfolioInputRequest request, Instant createdAt) {
			this.jobId = jobId;
			this.request = request;
			this.createdAt = createdAt;
			this.status = OptimizationJobStatus.PENDING;
		}
	}
}
