// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core.algorithm.bmc;

import com.google.common.collect.ImmutableList;
import org.sosy_lab.java_smt.api.BooleanFormula;

/**
 * The violation condition of a property at one depth {@code k}, split into the loop-free case and
 * one case per possible loop start {@code l} in {@code 0..k-1}.
 */
public final class ViolationEncoding {

  private final BooleanFormula loopFreeCase;
  private final ImmutableList<BooleanFormula> loopCases;
  private final BooleanFormula formula;

  ViolationEncoding(
      BooleanFormula pLoopFreeCase,
      ImmutableList<BooleanFormula> pLoopCases,
      BooleanFormula pFormula) {
    loopFreeCase = pLoopFreeCase;
    loopCases = pLoopCases;
    formula = pFormula;
  }

  /** The property is violated on the finite prefix {@code s0..s(k-1)}. */
  public BooleanFormula getLoopFreeCase() {
    return loopFreeCase;
  }

  /**
   * Entry {@code l} states that {@code sk} equals {@code sl} and the property is violated on the
   * infinite path that repeats {@code sl..s(k-1)}.
   */
  public ImmutableList<BooleanFormula> getLoopCases() {
    return loopCases;
  }

  /** The disjunction of all cases. */
  public BooleanFormula getFormula() {
    return formula;
  }
}
