// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.ltl;

public final class LtlNot<S> extends LtlFormula<S> {

  private final LtlFormula<S> formula;

  LtlNot(LtlFormula<S> pFormula) {
    formula = pFormula;
  }

  public LtlFormula<S> getFormula() {
    return formula;
  }

  @Override
  public LtlFormula<S> nnf() {
    return formula.negatedNnf();
  }

  @Override
  LtlFormula<S> negatedNnf() {
    // not(not(x)) == x
    return formula.nnf();
  }

  @Override
  public boolean isPropositional() {
    return formula.isPropositional();
  }

  @Override
  public <R, X extends Exception> R accept(LtlFormulaVisitor<S, R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return 31 * formula.hashCode() + 1;
  }

  @Override
  public boolean equals(Object pObj) {
    if (pObj == this) {
      return true;
    }
    if (pObj instanceof LtlNot) {
      return formula.equals(((LtlNot<?>) pObj).formula);
    }
    return false;
  }

  @Override
  public String toString() {
    return "!(" + formula + ")";
  }
}
