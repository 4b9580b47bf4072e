// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core.algorithm.bmc;

import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Streams;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.stream.Stream;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.ShutdownManager;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.java_smt.api.SolverException;
import org.sosy_lab.tscheck.core.SearchOutcome;
import org.sosy_lab.tscheck.core.SearchResult;
import org.sosy_lab.tscheck.core.SearchStats;
import org.sosy_lab.tscheck.core.algorithm.bmc.SolverSession.DepthResult;
import org.sosy_lab.tscheck.exceptions.ModelCheckingException;
import org.sosy_lab.tscheck.exceptions.SolverFailedException;

/**
 * A lazily evaluated model checking run: one {@link SearchResult} per depth, starting at depth 1.
 *
 * <p>The queries of a depth are only built and solved when the next result is requested. The
 * solver work runs on a thread owned by the run, so that the consumer can stop waiting when the
 * time budget is exhausted. The run ends after a counterexample, a safety proof, a timeout, or the
 * result of the maximal depth. The solver is released when the run ends or is closed, so consumers
 * that stop early should close the run, e.g., by closing the {@link #stream()}.
 *
 * <p>Solver failures and configuration errors are raised as unchecked {@link
 * ModelCheckingException}s from {@link #hasNext()}.
 */
public final class BmcRun<S> extends AbstractIterator<SearchResult<S>> implements AutoCloseable {

  /** Creates the solver session of a run on the solver thread. */
  @FunctionalInterface
  interface SessionFactory<S> {
    SolverSession<S> create(ShutdownNotifier pShutdownNotifier)
        throws InvalidConfigurationException;
  }

  private final SessionFactory<S> sessionFactory;
  private final OptionalInt maxDepth;
  private final OptionalLong timeoutMs;
  private final boolean shutdownOnTimeout;
  private final LogManager logger;
  private final BmcStatistics stats;

  private final ShutdownManager shutdownManager = ShutdownManager.create();
  private final ExecutorService executor;
  private final Stopwatch stopwatch;

  // only accessed on the solver thread
  private @Nullable SolverSession<S> session = null;

  private int depth = 0;
  private boolean finished = false;
  private boolean closed = false;

  BmcRun(
      SessionFactory<S> pSessionFactory,
      OptionalInt pMaxDepth,
      OptionalLong pTimeoutMs,
      boolean pShutdownOnTimeout,
      LogManager pLogger,
      BmcStatistics pStats,
      Stopwatch pStopwatch) {
    sessionFactory = pSessionFactory;
    maxDepth = pMaxDepth;
    timeoutMs = pTimeoutMs;
    shutdownOnTimeout = pShutdownOnTimeout;
    logger = pLogger;
    stats = pStats;
    stopwatch = pStopwatch;
    executor =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat("bmc-solver-%d").setDaemon(true).build());
  }

  @Override
  protected @Nullable SearchResult<S> computeNext() {
    if (finished) {
      close();
      return endOfData();
    }
    depth++;

    if (isTimeExhausted()) {
      logger.log(Level.FINE, "Time budget exhausted before depth", depth);
      return finish(SearchResult.of(depth, SearchOutcome.TIMEOUT, currentStats()));
    }

    logger.log(Level.FINE, "Checking depth", depth);
    DepthResult<S> depthResult;
    try {
      depthResult = awaitDepth(depth);
    } catch (RuntimeException e) {
      finished = true;
      close();
      throw e;
    }
    if (depthResult == null) {
      return finish(SearchResult.of(depth, SearchOutcome.TIMEOUT, currentStats()));
    }

    SearchResult<S> result;
    switch (depthResult.getOutcome()) {
      case COUNTEREXAMPLE:
        logger.log(Level.FINE, "Found counterexample at depth", depth);
        return finish(
            SearchResult.ofCounterexample(
                depth, depthResult.getCounterexample(), currentStats()));
      case SAFETY_PROOF:
        logger.log(Level.FINE, "Proved safety property by induction at depth", depth);
        return finish(SearchResult.of(depth, SearchOutcome.SAFETY_PROOF, currentStats()));
      case NO_COUNTEREXAMPLE:
        result = SearchResult.of(depth, SearchOutcome.NO_COUNTEREXAMPLE, currentStats());
        break;
      default:
        throw new AssertionError("unexpected outcome " + depthResult.getOutcome());
    }

    if (maxDepth.isPresent() && depth >= maxDepth.getAsInt()) {
      logger.log(Level.FINE, "Reached maximal depth", depth);
      return finish(result);
    }
    return result;
  }

  private SearchResult<S> finish(SearchResult<S> pResult) {
    finished = true;
    close();
    return pResult;
  }

  /**
   * Solve the queries of a depth and wait for them, at most for the remaining time budget.
   *
   * @return The result of the depth, or null if the time budget was exhausted.
   */
  private @Nullable DepthResult<S> awaitDepth(int pDepth) {
    Future<DepthResult<S>> future = executor.submit(() -> checkDepth(pDepth));
    try {
      if (timeoutMs.isPresent()) {
        long remaining = timeoutMs.getAsLong() - stopwatch.elapsed(TimeUnit.MILLISECONDS);
        return future.get(Math.max(remaining, 0), TimeUnit.MILLISECONDS);
      }
      return future.get();

    } catch (TimeoutException e) {
      logger.log(Level.FINE, "Time budget exhausted while solving depth", pDepth);
      if (shutdownOnTimeout) {
        shutdownManager.requestShutdown(
            "time budget of " + timeoutMs.getAsLong() + "ms exhausted");
      }
      return null;

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ModelCheckingException("Interrupted while waiting for the solver", e);

    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof SolverException) {
        throw new SolverFailedException(pDepth, cause.getMessage(), cause);
      } else if (cause instanceof InterruptedException) {
        throw new ModelCheckingException("Solver was interrupted at depth " + pDepth, cause);
      } else if (cause instanceof InvalidConfigurationException) {
        throw new ModelCheckingException(
            "Invalid solver configuration: " + cause.getMessage(), cause);
      }
      Throwables.throwIfUnchecked(cause);
      throw new ModelCheckingException("Unexpected failure at depth " + pDepth, cause);
    }
  }

  /** Runs on the solver thread. */
  private DepthResult<S> checkDepth(int pDepth)
      throws InvalidConfigurationException, SolverException, InterruptedException {
    shutdownManager.getNotifier().shutdownIfNecessary();
    if (session == null) {
      session = sessionFactory.create(shutdownManager.getNotifier());
    }
    return session.checkDepth(pDepth);
  }

  /** Runs on the solver thread. */
  private void closeSession() {
    if (session != null) {
      session.close();
      session = null;
    }
    if (logger.wouldBeLogged(Level.FINE)) {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      try (PrintStream printer = new PrintStream(out, true, StandardCharsets.UTF_8)) {
        stats.printStatistics(printer);
      }
      logger.log(Level.FINE, "Statistics of the run:\n" + out.toString(StandardCharsets.UTF_8));
    }
  }

  private boolean isTimeExhausted() {
    return timeoutMs.isPresent()
        && stopwatch.elapsed(TimeUnit.MILLISECONDS) >= timeoutMs.getAsLong();
  }

  private SearchStats currentStats() {
    return new SearchStats(stopwatch.elapsed(TimeUnit.MILLISECONDS));
  }

  public BmcStatistics getStatistics() {
    return stats;
  }

  /** The results of this run as a sequential stream. Closing the stream closes the run. */
  public Stream<SearchResult<S>> stream() {
    return Streams.stream(this).onClose(this::close);
  }

  /**
   * Stop the run and release the solver. A solver call that is still running is finished first,
   * unless the time budget was exhausted and a shutdown was requested.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    finished = true;
    executor.execute(this::closeSession);
    executor.shutdown();
  }
}
