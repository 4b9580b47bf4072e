// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.state;

import static com.google.common.base.Preconditions.checkNotNull;

import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.FormulaManager;

/** A named relation between a state and its successor. */
public final class TransitionRelation<S> {

  @FunctionalInterface
  public interface Encoder<S> {
    BooleanFormula encode(SymbolicState<S> pPre, SymbolicState<S> pPost, FormulaManager pFmgr);
  }

  private final String name;
  private final Encoder<S> encoder;

  private TransitionRelation(String pName, Encoder<S> pEncoder) {
    name = pName;
    encoder = pEncoder;
  }

  public static <S> TransitionRelation<S> of(String pName, Encoder<S> pEncoder) {
    return new TransitionRelation<>(checkNotNull(pName), checkNotNull(pEncoder));
  }

  public String getName() {
    return name;
  }

  public BooleanFormula encode(
      SymbolicState<S> pPre, SymbolicState<S> pPost, FormulaManager pFmgr) {
    return encoder.encode(pPre, pPost, pFmgr);
  }

  @Override
  public String toString() {
    return name;
  }
}
