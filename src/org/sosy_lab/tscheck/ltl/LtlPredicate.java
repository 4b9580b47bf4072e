// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.ltl;

import org.sosy_lab.tscheck.state.StatePredicate;

/** An atomic formula that holds on a state iff the wrapped predicate holds. */
public final class LtlPredicate<S> extends LtlFormula<S> {

  private final StatePredicate<S> predicate;

  LtlPredicate(StatePredicate<S> pPredicate) {
    predicate = pPredicate;
  }

  public StatePredicate<S> getPredicate() {
    return predicate;
  }

  @Override
  public LtlFormula<S> nnf() {
    return this;
  }

  @Override
  LtlFormula<S> negatedNnf() {
    return new LtlPredicate<>(predicate.negate());
  }

  @Override
  public boolean isPropositional() {
    return true;
  }

  @Override
  public <R, X extends Exception> R accept(LtlFormulaVisitor<S, R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return predicate.hashCode();
  }

  @Override
  public boolean equals(Object pObj) {
    if (pObj == this) {
      return true;
    }
    if (pObj instanceof LtlPredicate) {
      return predicate.equals(((LtlPredicate<?>) pObj).predicate);
    }
    return false;
  }

  @Override
  public String toString() {
    return predicate.getName();
  }
}
