// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core.algorithm.bmc;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.java_smt.SolverContextFactory;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.FormulaManager;
import org.sosy_lab.java_smt.api.Model;
import org.sosy_lab.java_smt.api.ProverEnvironment;
import org.sosy_lab.java_smt.api.SolverContext;
import org.sosy_lab.java_smt.api.SolverContext.ProverOptions;
import org.sosy_lab.java_smt.api.SolverException;
import org.sosy_lab.tscheck.core.Counterexample;
import org.sosy_lab.tscheck.core.SearchOutcome;
import org.sosy_lab.tscheck.core.TransitionSystem;
import org.sosy_lab.tscheck.exceptions.SolverFailedException;
import org.sosy_lab.tscheck.ltl.LtlFormula;
import org.sosy_lab.tscheck.state.StateType;
import org.sosy_lab.tscheck.state.SymbolicState;

/**
 * The solver state of one model checking run.
 *
 * <p>A session owns a solver context with one prover for the paths from the initial states and,
 * for k-induction, one prover for the inductive step. The path constraints are asserted
 * incrementally, each depth only adds the frames of its new states. The query of a depth is pushed
 * on top and popped again after the check.
 *
 * <p>A session is not thread-safe, it is used by the solver thread of its run only.
 */
final class BmcSession<S> implements SolverSession<S> {

  private final TransitionSystem<S> system;
  private final LtlFormula<S> property;
  private final LogManager logger;
  private final BmcStatistics stats;
  private final boolean dumpQueries;
  private final boolean preferLoopFree;

  private final SolverContext context;
  private final ProverEnvironment pathProver;
  private final @Nullable ProverEnvironment stepProver;

  private final PathUnroller<S> pathUnroller;
  private final ViolationEncoder<S> violationEncoder;
  private final @Nullable InductionEncoder<S> inductionEncoder;

  // number of frames asserted on the provers
  private int pathFrames = 0;
  private int stepFrames = 0;

  private BmcSession(
      TransitionSystem<S> pSystem,
      @Nullable LtlFormula<S> pInductionProperty,
      boolean pDumpQueries,
      boolean pPreferLoopFree,
      LogManager pLogger,
      BmcStatistics pStats,
      SolverContext pContext) {
    system = pSystem;
    property = pSystem.getProperty();
    logger = pLogger;
    stats = pStats;
    dumpQueries = pDumpQueries;
    preferLoopFree = pPreferLoopFree;
    context = pContext;

    FormulaManager fmgr = context.getFormulaManager();
    pathUnroller = PathUnroller.forInitialPaths(pSystem, fmgr);
    violationEncoder = new ViolationEncoder<>(pSystem.getStateType(), fmgr);
    pathProver = context.newProverEnvironment(ProverOptions.GENERATE_MODELS);
    if (pInductionProperty != null) {
      inductionEncoder =
          new InductionEncoder<>(pSystem, pInductionProperty, violationEncoder, fmgr);
      stepProver = context.newProverEnvironment();
    } else {
      inductionEncoder = null;
      stepProver = null;
    }
  }

  /**
   * Create the solver context and the provers of a session.
   *
   * @param pInductionProperty The state formula to prove with k-induction, or null for plain
   *     bounded model checking.
   * @throws InvalidConfigurationException if the solver options are invalid.
   */
  static <S> BmcSession<S> create(
      TransitionSystem<S> pSystem,
      @Nullable LtlFormula<S> pInductionProperty,
      boolean pDumpQueries,
      boolean pPreferLoopFree,
      Configuration pConfig,
      LogManager pLogger,
      ShutdownNotifier pShutdownNotifier,
      BmcStatistics pStats)
      throws InvalidConfigurationException {
    SolverContext context;
    pStats.solverCreationTimer.start();
    try {
      context = SolverContextFactory.createSolverContext(pConfig, pLogger, pShutdownNotifier);
    } finally {
      pStats.solverCreationTimer.stop();
    }
    pLogger.log(Level.FINE, "Using solver", context.getSolverName(), context.getVersion());

    try {
      return new BmcSession<>(
          pSystem,
          pInductionProperty,
          pDumpQueries,
          pPreferLoopFree,
          pLogger,
          pStats,
          context);
    } catch (RuntimeException e) {
      context.close();
      throw e;
    }
  }

  /**
   * Run the violation query and, if it is unsatisfiable and k-induction is enabled, the inductive
   * step.
   */
  @Override
  public DepthResult<S> checkDepth(int pDepth) throws SolverException, InterruptedException {
    checkState(pathFrames <= pDepth, "depth %s was already checked", pDepth);
    stats.depths.incrementAndGet();

    ImmutableList<SymbolicState<S>> states;
    ViolationEncoding violation;
    stats.encodingTimer.start();
    try {
      while (pathFrames <= pDepth) {
        pathProver.addConstraint(pathUnroller.makeFrame(pathFrames));
        pathFrames++;
      }
      states = pathUnroller.getStates(pDepth);
      violation =
          inductionEncoder == null
              ? violationEncoder.encodeViolation(property, states)
              : inductionEncoder.encodeBaseCase(states);
    } finally {
      stats.encodingTimer.stop();
    }
    if (dumpQueries) {
      logger.log(Level.FINEST, "Violation query of depth", pDepth, ":", violation.getFormula());
    }

    Counterexample<S> counterexample = solveViolation(pDepth, states, violation);
    if (counterexample != null) {
      return DepthResult.ofCounterexample(counterexample);
    }
    if (inductionEncoder != null && proveStep(pDepth)) {
      return DepthResult.of(SearchOutcome.SAFETY_PROOF);
    }
    return DepthResult.of(SearchOutcome.NO_COUNTEREXAMPLE);
  }

  private @Nullable Counterexample<S> solveViolation(
      int pDepth, List<SymbolicState<S>> pStates, ViolationEncoding pViolation)
      throws SolverException, InterruptedException {
    stats.baseQueries.incrementAndGet();
    pathProver.push(pViolation.getFormula());
    try {
      boolean unsat;
      stats.solvingTimer.start();
      try {
        unsat = pathProver.isUnsat();
      } finally {
        stats.solvingTimer.stop();
      }
      logger.log(
          Level.FINER,
          "Violation query of depth",
          pDepth,
          unsat ? "is unsatisfiable" : "is satisfiable");
      if (unsat) {
        return null;
      }

      stats.satisfiableBaseQueries.incrementAndGet();
      stats.modelTimer.start();
      try (Model model = pathProver.getModel()) {
        return extractCounterexample(pDepth, pStates, pViolation, model);
      } finally {
        stats.modelTimer.stop();
      }
    } finally {
      pathProver.pop();
    }
  }

  /**
   * Decide which case of the violation the model satisfies and decode the corresponding states. A
   * finite prefix consists of the states {@code s0..s(k-1)}, a lasso of {@code s0..sk} where
   * {@code sk} equals the state at the smallest possible loop start.
   */
  private Counterexample<S> extractCounterexample(
      int pDepth, List<SymbolicState<S>> pStates, ViolationEncoding pViolation, Model pModel) {
    boolean loopFree = isTrue(pModel, pViolation.getLoopFreeCase());
    if (loopFree && preferLoopFree) {
      return Counterexample.ofPrefix(decode(pStates.subList(0, pDepth), pModel));
    }

    ImmutableList<BooleanFormula> loopCases = pViolation.getLoopCases();
    for (int loopStart = 0; loopStart < loopCases.size(); loopStart++) {
      if (isTrue(pModel, loopCases.get(loopStart))) {
        logger.log(Level.FINER, "Counterexample of depth", pDepth, "loops back to", loopStart);
        return Counterexample.ofLasso(decode(pStates, pModel), loopStart);
      }
    }

    if (loopFree) {
      return Counterexample.ofPrefix(decode(pStates.subList(0, pDepth), pModel));
    }
    throw new SolverFailedException(pDepth, "the model satisfies no case of the violation", null);
  }

  private List<S> decode(List<SymbolicState<S>> pStates, Model pModel) {
    StateType<S> stateType = system.getStateType();
    List<S> result = new ArrayList<>(pStates.size());
    for (SymbolicState<S> state : pStates) {
      result.add(stateType.decode(state, pModel));
    }
    return result;
  }

  private static boolean isTrue(Model pModel, BooleanFormula pFormula) {
    return Boolean.TRUE.equals(pModel.evaluate(pFormula));
  }

  /** Check the inductive step of the given depth, returns true if it is unsatisfiable. */
  private boolean proveStep(int pDepth) throws SolverException, InterruptedException {
    BooleanFormula stepViolation;
    stats.encodingTimer.start();
    try {
      while (stepFrames < pDepth) {
        stepProver.addConstraint(inductionEncoder.makeStepFrame(stepFrames));
        stepFrames++;
      }
      stepViolation = inductionEncoder.makeStepViolation(pDepth - 1);
    } finally {
      stats.encodingTimer.stop();
    }
    if (dumpQueries) {
      logger.log(Level.FINEST, "Inductive step of depth", pDepth, ":", stepViolation);
    }

    stats.stepQueries.incrementAndGet();
    stepProver.push(stepViolation);
    try {
      boolean unsat;
      stats.solvingTimer.start();
      try {
        unsat = stepProver.isUnsat();
      } finally {
        stats.solvingTimer.stop();
      }
      logger.log(
          Level.FINER,
          "Inductive step of depth",
          pDepth,
          unsat ? "is unsatisfiable" : "is satisfiable");
      if (!unsat) {
        stats.satisfiableStepQueries.incrementAndGet();
      }
      return unsat;
    } finally {
      stepProver.pop();
    }
  }

  @Override
  public void close() {
    pathProver.close();
    if (stepProver != null) {
      stepProver.close();
    }
    context.close();
  }
}
