// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core.algorithm.bmc;

import com.google.common.collect.ImmutableList;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.tscheck.state.SymbolicState;

/** The symbolic states of a path together with the constraint that links them. */
public final class UnrolledPath<S> {

  private final ImmutableList<SymbolicState<S>> states;
  private final BooleanFormula constraint;

  UnrolledPath(ImmutableList<SymbolicState<S>> pStates, BooleanFormula pConstraint) {
    states = pStates;
    constraint = pConstraint;
  }

  public ImmutableList<SymbolicState<S>> getStates() {
    return states;
  }

  public SymbolicState<S> getState(int pIndex) {
    return states.get(pIndex);
  }

  /** The number of transitions of the path. */
  public int getLength() {
    return states.size() - 1;
  }

  public BooleanFormula getConstraint() {
    return constraint;
  }
}
