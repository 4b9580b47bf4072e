// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.state;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.FormulaManager;

/**
 * A named test on a single state.
 *
 * <p>The test is described by an {@link Encoder} that is applied to symbolic state handles, so the
 * same predicate can be used for every position of an unrolled path. Negation is kept as data
 * instead of wrapping the encoder, hence {@code p.negate().negate()} is equal to {@code p}.
 *
 * @param <S> The type of the system states.
 */
public final class StatePredicate<S> {

  @FunctionalInterface
  public interface Encoder<S> {
    BooleanFormula encode(SymbolicState<S> pState, FormulaManager pFmgr);
  }

  private static final StatePredicate<?> TRUE =
      new StatePredicate<>(
          "true", (s, fmgr) -> fmgr.getBooleanFormulaManager().makeTrue(), false);

  private final String name;
  private final Encoder<S> encoder;
  private final boolean negated;

  private StatePredicate(String pName, Encoder<S> pEncoder, boolean pNegated) {
    name = pName;
    encoder = pEncoder;
    negated = pNegated;
  }

  public static <S> StatePredicate<S> of(String pName, Encoder<S> pEncoder) {
    return new StatePredicate<>(checkNotNull(pName), checkNotNull(pEncoder), false);
  }

  /** The predicate that holds on every state. */
  @SuppressWarnings("unchecked")
  public static <S> StatePredicate<S> alwaysTrue() {
    return (StatePredicate<S>) TRUE;
  }

  public String getName() {
    return negated ? "!(" + name + ")" : name;
  }

  public boolean isNegated() {
    return negated;
  }

  public StatePredicate<S> negate() {
    return new StatePredicate<>(name, encoder, !negated);
  }

  public BooleanFormula encode(SymbolicState<S> pState, FormulaManager pFmgr) {
    BooleanFormula test = encoder.encode(pState, pFmgr);
    return negated ? pFmgr.getBooleanFormulaManager().not(test) : test;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, encoder, negated);
  }

  @Override
  public boolean equals(Object pObj) {
    if (pObj == this) {
      return true;
    }
    if (pObj instanceof StatePredicate) {
      StatePredicate<?> other = (StatePredicate<?>) pObj;
      // encoders are compared by identity, two lambdas are never considered equal
      return name.equals(other.name) && encoder == other.encoder && negated == other.negated;
    }
    return false;
  }

  @Override
  public String toString() {
    return getName();
  }
}
