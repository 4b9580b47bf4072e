// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core.algorithm.bmc;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Stopwatch;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.tscheck.core.TransitionSystem;
import org.sosy_lab.tscheck.ltl.LtlFormula;

/**
 * Bounded model checking of transition systems by iterative deepening.
 *
 * <p>Each call of {@code modelCheck} starts an independent {@link BmcRun} with its own solver, so
 * one checker can be used for several systems and several runs at the same time. The solver
 * backend is selected with the options of java-smt (e.g., {@code solver.solver}) in the same
 * configuration.
 */
@Options(prefix = "bmc")
public class ModelChecker {

  @Option(secure = true, description = "Log the formula of every query with level FINEST.")
  private boolean dumpQueries = false;

  @Option(
      secure = true,
      description =
          "Report a finite prefix instead of a lasso when a model of a depth violates the property"
              + " on both.")
  private boolean preferLoopFreeCounterexamples = true;

  @Option(
      secure = true,
      description =
          "Request a shutdown of the solver when the time budget of a run is exhausted during a"
              + " query.")
  private boolean shutdownOnTimeout = true;

  private final Configuration config;
  private final LogManager logger;

  public ModelChecker(Configuration pConfig, LogManager pLogger)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    config = pConfig;
    logger = pLogger;
  }

  /** Check without a depth limit and without a time budget. */
  public <S> BmcRun<S> modelCheck(TransitionSystem<S> pSystem) {
    return modelCheck(pSystem, OptionalInt.empty(), OptionalLong.empty(), false);
  }

  /** Check without a depth limit until the time budget in milliseconds is exhausted. */
  public <S> BmcRun<S> modelCheck(TransitionSystem<S> pSystem, long pTimeoutMs) {
    return modelCheck(pSystem, OptionalInt.empty(), OptionalLong.of(pTimeoutMs), false);
  }

  /**
   * Start a model checking run. Nothing is solved before the first result is requested.
   *
   * <p>The run holds a solver and a thread until it ends. Callers that may stop before the last
   * result must close it, with try-with-resources on the run or on its {@link BmcRun#stream()}:
   *
   * <pre>
   * try (Stream&lt;SearchResult&lt;S&gt;&gt; results = checker.modelCheck(ts).stream()) {
   *   results.limit(10).forEach(...);
   * }
   * </pre>
   *
   * @param pSystem The system and its property.
   * @param pMaxDepth The last depth to check, unbounded if empty.
   * @param pTimeoutMs The time budget in milliseconds, measured from this call, unbounded if
   *     empty.
   * @param pUseKInduction Whether to try to prove the property with k-induction at every depth.
   * @throws IllegalArgumentException if the depth is not positive, the time budget is negative, or
   *     k-induction is requested for a property that is not a safety property.
   */
  public <S> BmcRun<S> modelCheck(
      TransitionSystem<S> pSystem,
      OptionalInt pMaxDepth,
      OptionalLong pTimeoutMs,
      boolean pUseKInduction) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    checkNotNull(pSystem);
    checkArgument(
        !pMaxDepth.isPresent() || pMaxDepth.getAsInt() >= 1,
        "maximal depth %s is not positive",
        pMaxDepth);
    checkArgument(
        !pTimeoutMs.isPresent() || pTimeoutMs.getAsLong() >= 0,
        "time budget %s is negative",
        pTimeoutMs);

    @Nullable LtlFormula<S> inductionProperty = null;
    if (pUseKInduction) {
      Optional<LtlFormula<S>> safetyProperty = pSystem.getSafetyProperty();
      checkArgument(
          safetyProperty.isPresent(),
          "k-induction needs a safety property, but the property is %s",
          pSystem.getProperty());
      inductionProperty = safetyProperty.get();
    }

    logger.log(
        Level.FINE,
        "Starting model checking of",
        pSystem.getProperty(),
        pUseKInduction ? "with k-induction" : "");

    BmcStatistics stats = new BmcStatistics();
    LtlFormula<S> property = inductionProperty;
    return new BmcRun<>(
        notifier ->
            BmcSession.create(
                pSystem,
                property,
                dumpQueries,
                preferLoopFreeCounterexamples,
                config,
                logger,
                notifier,
                stats),
        pMaxDepth,
        pTimeoutMs,
        shutdownOnTimeout,
        logger,
        stats,
        stopwatch);
  }
}
