// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core.algorithm.bmc;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.BooleanFormulaManager;
import org.sosy_lab.java_smt.api.FormulaManager;
import org.sosy_lab.tscheck.core.TransitionSystem;
import org.sosy_lab.tscheck.state.SymbolicState;

/**
 * Unrolls the transition relation of a system into a sequence of symbolic states.
 *
 * <p>The states are kept in a list that only grows, so a path of length {@code k + 1} reuses the
 * states of the path of length {@code k}. Each position contributes one <i>frame</i>: the
 * invariants and domain constraints of its state, the transition from its predecessor, and for
 * position 0 of an initial path the initial state predicate. The conjunction of the frames
 * {@code 0..k} is the path constraint of depth {@code k}.
 *
 * <p>No solver is called here.
 */
public final class PathUnroller<S> {

  /** Variable prefix for paths that start in an initial state. */
  public static final String PATH_PREFIX = "s";

  /** Variable prefix for the arbitrary chains of the inductive step. */
  public static final String CHAIN_PREFIX = "t";

  private final TransitionSystem<S> system;
  private final FormulaManager fmgr;
  private final BooleanFormulaManager bfmgr;
  private final String prefix;
  private final boolean fromInitialState;

  private final List<SymbolicState<S>> states = new ArrayList<>();

  private PathUnroller(
      TransitionSystem<S> pSystem,
      FormulaManager pFmgr,
      String pPrefix,
      boolean pFromInitialState) {
    system = pSystem;
    fmgr = pFmgr;
    bfmgr = pFmgr.getBooleanFormulaManager();
    prefix = pPrefix;
    fromInitialState = pFromInitialState;
  }

  /** An unroller for paths {@code s0..sk} that start in an initial state. */
  public static <S> PathUnroller<S> forInitialPaths(
      TransitionSystem<S> pSystem, FormulaManager pFmgr) {
    return new PathUnroller<>(pSystem, pFmgr, PATH_PREFIX, true);
  }

  /** An unroller for chains {@code t0..tn} that may start in any state. */
  public static <S> PathUnroller<S> forChains(TransitionSystem<S> pSystem, FormulaManager pFmgr) {
    return new PathUnroller<>(pSystem, pFmgr, CHAIN_PREFIX, false);
  }

  public SymbolicState<S> getState(int pIndex) {
    checkArgument(pIndex >= 0, "negative state index %s", pIndex);
    while (states.size() <= pIndex) {
      states.add(system.getStateType().makeState(prefix, states.size(), fmgr));
    }
    return states.get(pIndex);
  }

  /** The states {@code 0..pLast}. */
  public ImmutableList<SymbolicState<S>> getStates(int pLast) {
    getState(pLast);
    return ImmutableList.copyOf(states.subList(0, pLast + 1));
  }

  /** The constraint that position {@code pIndex} adds to a path. */
  public BooleanFormula makeFrame(int pIndex) {
    SymbolicState<S> state = getState(pIndex);
    List<BooleanFormula> constraints = new ArrayList<>(4);
    if (pIndex == 0) {
      if (fromInitialState) {
        constraints.add(system.getInitialStates().encode(state, fmgr));
      }
    } else {
      constraints.add(system.getNextRelation().encode(getState(pIndex - 1), state, fmgr));
    }
    constraints.add(system.getInvariants().encode(state, fmgr));
    constraints.add(system.getStateType().makeDomainConstraint(state, fmgr));
    return bfmgr.and(constraints);
  }

  /**
   * Build the path of length {@code pLength}, i.e., the states {@code 0..pLength} and the
   * conjunction of their frames.
   */
  public UnrolledPath<S> unroll(int pLength) {
    checkArgument(pLength >= 0, "negative path length %s", pLength);
    List<BooleanFormula> frames = new ArrayList<>(pLength + 1);
    for (int i = 0; i <= pLength; i++) {
      frames.add(makeFrame(i));
    }
    return new UnrolledPath<>(getStates(pLength), bfmgr.and(frames));
  }
}
