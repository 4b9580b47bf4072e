// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.ltl;

/** A formula that must hold on the current or some future state. */
public final class LtlEventually<S> extends LtlFormula<S> {

  private final LtlFormula<S> formula;

  LtlEventually(LtlFormula<S> pFormula) {
    formula = pFormula;
  }

  public LtlFormula<S> getFormula() {
    return formula;
  }

  @Override
  public LtlFormula<S> nnf() {
    return new LtlEventually<>(formula.nnf());
  }

  @Override
  LtlFormula<S> negatedNnf() {
    // not(eventually(x)) == always(not(x))
    return new LtlAlways<>(formula.negatedNnf());
  }

  @Override
  public boolean isPropositional() {
    return false;
  }

  @Override
  public <R, X extends Exception> R accept(LtlFormulaVisitor<S, R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return 31 * formula.hashCode() + 3;
  }

  @Override
  public boolean equals(Object pObj) {
    if (pObj == this) {
      return true;
    }
    if (pObj instanceof LtlEventually) {
      return formula.equals(((LtlEventually<?>) pObj).formula);
    }
    return false;
  }

  @Override
  public String toString() {
    return "F(" + formula + ")";
  }
}
