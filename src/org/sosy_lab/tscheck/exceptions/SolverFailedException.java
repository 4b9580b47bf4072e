// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.exceptions;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The solver neither proved nor refuted a query, e.g., because of an internal error or an unknown
 * answer. This is never reported as the absence of a counterexample.
 */
public class SolverFailedException extends ModelCheckingException {

  private static final long serialVersionUID = -3120473651940838215L;

  private final int depth;

  public SolverFailedException(int pDepth, String pMessage, @Nullable Throwable pCause) {
    super("Solver failed at depth " + pDepth + ": " + pMessage, pCause);
    depth = pDepth;
  }

  /** The depth whose query failed. */
  public int getDepth() {
    return depth;
  }
}
