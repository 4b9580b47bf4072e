// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.ltl;

public interface LtlFormulaVisitor<S, R, X extends Exception> {

  R visit(LtlPredicate<S> pFormula) throws X;

  R visit(LtlNot<S> pFormula) throws X;

  R visit(LtlAnd<S> pFormula) throws X;

  R visit(LtlOr<S> pFormula) throws X;

  R visit(LtlAlways<S> pFormula) throws X;

  R visit(LtlEventually<S> pFormula) throws X;
}
