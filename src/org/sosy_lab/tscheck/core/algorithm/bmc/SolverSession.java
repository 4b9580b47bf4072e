// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core.algorithm.bmc;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.java_smt.api.SolverException;
import org.sosy_lab.tscheck.core.Counterexample;
import org.sosy_lab.tscheck.core.SearchOutcome;

/** The solver work of a {@link BmcRun}, called on the solver thread of the run only. */
interface SolverSession<S> extends AutoCloseable {

  /** The result of the queries of one depth. */
  final class DepthResult<S> {

    private final SearchOutcome outcome;
    private final @Nullable Counterexample<S> counterexample;

    private DepthResult(SearchOutcome pOutcome, @Nullable Counterexample<S> pCounterexample) {
      outcome = pOutcome;
      counterexample = pCounterexample;
    }

    static <S> DepthResult<S> of(SearchOutcome pOutcome) {
      checkArgument(
          pOutcome == SearchOutcome.NO_COUNTEREXAMPLE || pOutcome == SearchOutcome.SAFETY_PROOF,
          "outcome %s is not the result of a solver query",
          pOutcome);
      return new DepthResult<>(pOutcome, null);
    }

    static <S> DepthResult<S> ofCounterexample(Counterexample<S> pCounterexample) {
      return new DepthResult<>(SearchOutcome.COUNTEREXAMPLE, checkNotNull(pCounterexample));
    }

    SearchOutcome getOutcome() {
      return outcome;
    }

    @Nullable Counterexample<S> getCounterexample() {
      return counterexample;
    }
  }

  /**
   * Run the queries of one depth.
   *
   * @throws SolverException if the solver failed or did not give an answer.
   * @throws InterruptedException if the run requested a shutdown of the solver.
   */
  DepthResult<S> checkDepth(int pDepth) throws SolverException, InterruptedException;

  /** Release the solver. */
  @Override
  void close();
}
