// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.ltl;

import java.util.Objects;

public final class LtlOr<S> extends LtlFormula<S> {

  private final LtlFormula<S> formula1;
  private final LtlFormula<S> formula2;

  LtlOr(LtlFormula<S> pFormula1, LtlFormula<S> pFormula2) {
    formula1 = pFormula1;
    formula2 = pFormula2;
  }

  public LtlFormula<S> getFormula1() {
    return formula1;
  }

  public LtlFormula<S> getFormula2() {
    return formula2;
  }

  @Override
  public LtlFormula<S> nnf() {
    return new LtlOr<>(formula1.nnf(), formula2.nnf());
  }

  @Override
  LtlFormula<S> negatedNnf() {
    // not(or(x, y)) == and(not(x), not(y))
    return new LtlAnd<>(formula1.negatedNnf(), formula2.negatedNnf());
  }

  @Override
  public boolean isPropositional() {
    return formula1.isPropositional() && formula2.isPropositional();
  }

  @Override
  public <R, X extends Exception> R accept(LtlFormulaVisitor<S, R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash("or", formula1, formula2);
  }

  @Override
  public boolean equals(Object pObj) {
    if (pObj == this) {
      return true;
    }
    if (pObj instanceof LtlOr) {
      LtlOr<?> other = (LtlOr<?>) pObj;
      return formula1.equals(other.formula1) && formula2.equals(other.formula2);
    }
    return false;
  }

  @Override
  public String toString() {
    return "(" + formula1 + " || " + formula2 + ")";
  }
}
