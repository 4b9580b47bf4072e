// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core;

public enum SearchOutcome {
  /** No violation up to the current depth, the search continues. */
  NO_COUNTEREXAMPLE,
  /** A violation was found. */
  COUNTEREXAMPLE,
  /** k-induction proved that the safety property holds on all reachable states. */
  SAFETY_PROOF,
  /** The time budget is exhausted. */
  TIMEOUT
}
