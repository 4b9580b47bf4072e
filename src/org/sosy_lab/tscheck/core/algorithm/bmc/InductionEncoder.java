// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core.algorithm.bmc;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.BooleanFormulaManager;
import org.sosy_lab.java_smt.api.FormulaManager;
import org.sosy_lab.tscheck.core.TransitionSystem;
import org.sosy_lab.tscheck.ltl.LtlFormula;
import org.sosy_lab.tscheck.state.SymbolicState;

/**
 * Builds the two queries of k-induction for a state formula {@code P}.
 *
 * <p>The base case of depth {@code k} is the bounded violation query of {@code G(P)} on the
 * initial path {@code s0..sk}, so it covers the {@code k} states {@code s0..s(k-1)}. The inductive
 * step of depth {@code k} uses a chain {@code t0..t(k-1)} of {@code k} arbitrary states linked by
 * the transition relation and asks whether {@code P} can fail at {@code t(k-1)} although it holds
 * at {@code t0..t(k-2)}. If the base case and the step are both unsatisfiable, {@code P} holds on
 * every reachable state.
 *
 * <p>The step is built from frames so that it can be extended position by position: frame {@code
 * i} adds {@code t(i)} to the chain and assumes {@code P} at {@code t(i-1)}.
 */
public final class InductionEncoder<S> {

  private final LtlFormula<S> safetyProperty;
  private final LtlFormula<S> globalProperty;
  private final ViolationEncoder<S> violationEncoder;
  private final PathUnroller<S> chainUnroller;
  private final BooleanFormulaManager bfmgr;

  /**
   * @param pSafetyProperty The state formula to prove invariant.
   * @throws IllegalArgumentException if the formula contains a temporal operator.
   */
  public InductionEncoder(
      TransitionSystem<S> pSystem,
      LtlFormula<S> pSafetyProperty,
      ViolationEncoder<S> pViolationEncoder,
      FormulaManager pFmgr) {
    checkArgument(
        pSafetyProperty.isPropositional(),
        "k-induction needs a state formula, but got %s",
        pSafetyProperty);
    safetyProperty = pSafetyProperty;
    globalProperty = LtlFormula.always(pSafetyProperty);
    violationEncoder = pViolationEncoder;
    chainUnroller = PathUnroller.forChains(pSystem, pFmgr);
    bfmgr = pFmgr.getBooleanFormulaManager();
  }

  /** The base case on the initial path {@code s0..sk}. */
  public ViolationEncoding encodeBaseCase(List<SymbolicState<S>> pPath) {
    return violationEncoder.encodeViolation(globalProperty, pPath);
  }

  /** Frame {@code pIndex} of the step chain. */
  public BooleanFormula makeStepFrame(int pIndex) {
    BooleanFormula frame = chainUnroller.makeFrame(pIndex);
    if (pIndex == 0) {
      return frame;
    }
    return bfmgr.and(
        frame, violationEncoder.encodeState(safetyProperty, chainUnroller.getState(pIndex - 1)));
  }

  /** The failure of the property at chain position {@code pIndex}. */
  public BooleanFormula makeStepViolation(int pIndex) {
    return bfmgr.not(violationEncoder.encodeState(safetyProperty, chainUnroller.getState(pIndex)));
  }

  /** The complete inductive step of depth {@code pDepth}, over the chain {@code t0..t(k-1)}. */
  public BooleanFormula encodeStep(int pDepth) {
    checkArgument(pDepth >= 1, "depth %s is not positive", pDepth);
    List<BooleanFormula> parts = new ArrayList<>(pDepth + 1);
    for (int i = 0; i < pDepth; i++) {
      parts.add(makeStepFrame(i));
    }
    parts.add(makeStepViolation(pDepth - 1));
    return bfmgr.and(parts);
  }

  public PathUnroller<S> getChainUnroller() {
    return chainUnroller;
  }
}
