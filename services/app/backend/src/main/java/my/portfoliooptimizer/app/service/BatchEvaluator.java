package my.portfoliooptimizer.app.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Maps a batch through a pure function, optionally on a fixed worker pool. Results always come
 * back in input order, so parallel and sequential runs produce the same list.
 */
public class BatchEvaluator implements AutoCloseable {
	private final ExecutorService executor;

	private BatchEvaluator(ExecutorService executor) {
		this.executor = executor;
	}

	public static BatchEvaluator sequential() {
		return new BatchEvaluator(null);
	}

	public static BatchEvaluator withParallelism(int parallelism) {
		if (parallelism <= 1) {
			return sequential();
		}
		AtomicInteger counter = new AtomicInteger();
		return new BatchEvaluator(Executors.newFixedThreadPool(parallelism, runnable -> {
			Thread thread = new Thread(runnable, "candidate-eval-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}));
	}

	public boolean isParallel() {
		return executor != null;
	}

	public <T, R> List<R> map(List<T> inputs, Function<T, R> function) {
		List<R> results = new ArrayList<>(inputs.size());
		if (executor == null || inputs.size() < 2) {
			for (T input : inputs) {
				results.add(function.apply(input));
			}
			return results;
		}
		List<Future<R>> futures = new ArrayList<>(inputs.size());
		for (T input : inputs) {
			futures.add(executor.submit(() -> function.apply(input)));
		}
		try {
			for (Future<R> future : futures) {
				results.add(future.get());
			}
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			futures.forEach(future -> future.cancel(true));
			throw new IllegalStateException("Candidate evaluation interrupted", ex);
		} catch (ExecutionException ex) {
			futures.forEach(future -> future.cancel(true));
			Throwable cause = ex.getCause();
			if (cause instanceof RuntimeException runtime) {
				throw runtime;
			}
			throw new IllegalStateException("Candidate evaluation failed", cause);
		}
		return results;
	}

	@Override
	public void close() {
		if (executor != null) {
			executor.shutdownNow();
		}
	}
}
