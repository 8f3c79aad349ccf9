package com.hybridchat.ai.memory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a delegate summarizer on a dedicated executor and gives up after a fixed timeout.
 * The timeout applies twice: once to the wait for a free worker and once to the call itself,
 * so a busy pool does not eat into the time a running call gets.
 * Every failure, the timeout included, surfaces as {@link SummarizerException}.
 * Closing shuts the executor down.
 */
public class TimeLimitedSummarizer implements Summarizer, AutoCloseable {

  private final Summarizer delegate;
  private final ExecutorService executor;
  private final Duration timeout;

  public TimeLimitedSummarizer(Summarizer delegate, ExecutorService executor, Duration timeout) {
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("Summarizer timeout must be positive, was " + timeout);
    }
    this.delegate = delegate;
    this.executor = executor;
    this.timeout = timeout;
  }

  @Override
  public String summarize(String priorSummary, List<Turn> evictedTurns) {
    return callWithTimeout(() -> delegate.summarize(priorSummary, evictedTurns));
  }

  @Override
  public String condense(String summary) {
    return callWithTimeout(() -> delegate.condense(summary));
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  private String callWithTimeout(Callable<String> task) {
    CountDownLatch started = new CountDownLatch(1);
    Future<String> future;
    try {
      future = executor.submit(() -> {
        started.countDown();
        return task.call();
      });
    } catch (RejectedExecutionException e) {
      throw new SummarizerException("Summarizer executor rejected the task", e);
    }

    try {
      if (!started.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        future.cancel(true);
        throw new SummarizerException("Summarizer task still queued after " + timeout);
      }
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new SummarizerException("Summarizer timed out after " + timeout, e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new SummarizerException("Interrupted while waiting for summarizer", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof SummarizerException) {
        throw (SummarizerException) cause;
      }
      throw new SummarizerException("Summarizer failed", cause);
    }
  }
}
