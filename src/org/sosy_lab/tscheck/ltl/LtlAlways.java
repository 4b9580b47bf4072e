// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.ltl;

/** A formula that must hold on every state from the current one on. */
public final class LtlAlways<S> extends LtlFormula<S> {

  private final LtlFormula<S> formula;

  LtlAlways(LtlFormula<S> pFormula) {
    formula = pFormula;
  }

  public LtlFormula<S> getFormula() {
    return formula;
  }

  @Override
  public LtlFormula<S> nnf() {
    return new LtlAlways<>(formula.nnf());
  }

  @Override
  LtlFormula<S> negatedNnf() {
    // not(always(x)) == eventually(not(x))
    return new LtlEventually<>(formula.negatedNnf());
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
    return 31 * formula.hashCode() + 2;
  }

  @Override
  public boolean equals(Object pObj) {
    if (pObj == this) {
      return true;
    }
    if (pObj instanceof LtlAlways) {
      return formula.equals(((LtlAlways<?>) pObj).formula);
    }
    return false;
  }

  @Override
  public String toString() {
    return "G(" + formula + ")";
  }
}
