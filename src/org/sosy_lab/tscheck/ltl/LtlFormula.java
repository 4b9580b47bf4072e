// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.ltl;

import static com.google.common.base.Preconditions.checkNotNull;

import org.sosy_lab.tscheck.state.StatePredicate;

/**
 * An immutable linear temporal logic formula over the states of type {@code S}.
 *
 * <p>The set of operators is closed: {@link LtlPredicate}, {@link LtlNot}, {@link LtlAnd}, {@link
 * LtlOr}, {@link LtlAlways} and {@link LtlEventually}. Use the static factories of this class to
 * build formulas.
 *
 * @param <S> The type of the system states.
 */
public abstract class LtlFormula<S> {

  LtlFormula() {}

  /**
   * Convert this formula to negation normal form.
   *
   * @return A formula without {@link LtlNot} nodes, negation is pushed into the predicates.
   */
  public abstract LtlFormula<S> nnf();

  /** The negation normal form of the negation of this formula. */
  abstract LtlFormula<S> negatedNnf();

  /**
   * Whether this formula contains no temporal operator, i.e., it can be evaluated on a single
   * state.
   */
  public abstract boolean isPropositional();

  public abstract <R, X extends Exception> R accept(LtlFormulaVisitor<S, R, X> pVisitor) throws X;

  public static <S> LtlFormula<S> predicate(StatePredicate<S> pPredicate) {
    return new LtlPredicate<>(checkNotNull(pPredicate));
  }

  public static <S> LtlFormula<S> not(LtlFormula<S> pFormula) {
    return new LtlNot<>(checkNotNull(pFormula));
  }

  public static <S> LtlFormula<S> and(LtlFormula<S> pFormula1, LtlFormula<S> pFormula2) {
    return new LtlAnd<>(checkNotNull(pFormula1), checkNotNull(pFormula2));
  }

  public static <S> LtlFormula<S> or(LtlFormula<S> pFormula1, LtlFormula<S> pFormula2) {
    return new LtlOr<>(checkNotNull(pFormula1), checkNotNull(pFormula2));
  }

  public static <S> LtlFormula<S> always(LtlFormula<S> pFormula) {
    return new LtlAlways<>(checkNotNull(pFormula));
  }

  public static <S> LtlFormula<S> eventually(LtlFormula<S> pFormula) {
    return new LtlEventually<>(checkNotNull(pFormula));
  }
}
