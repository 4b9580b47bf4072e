// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The result of the search at one depth.
 *
 * <p>A counterexample is present iff the outcome is {@link SearchOutcome#COUNTEREXAMPLE}.
 */
public final class SearchResult<S> {

  private final int depth;
  private final SearchOutcome outcome;
  private final @Nullable Counterexample<S> counterExample;
  private final SearchStats stats;

  private SearchResult(
      int pDepth,
      SearchOutcome pOutcome,
      @Nullable Counterexample<S> pCounterExample,
      SearchStats pStats) {
    checkArgument(pDepth >= 1, "depth %s is not positive", pDepth);
    checkArgument(
        (pOutcome == SearchOutcome.COUNTEREXAMPLE) == (pCounterExample != null),
        "counterexample must be given exactly for outcome %s",
        SearchOutcome.COUNTEREXAMPLE);
    depth = pDepth;
    outcome = checkNotNull(pOutcome);
    counterExample = pCounterExample;
    stats = checkNotNull(pStats);
  }

  public static <S> SearchResult<S> of(int pDepth, SearchOutcome pOutcome, SearchStats pStats) {
    return new SearchResult<>(pDepth, pOutcome, null, pStats);
  }

  public static <S> SearchResult<S> ofCounterexample(
      int pDepth, Counterexample<S> pCounterExample, SearchStats pStats) {
    return new SearchResult<>(
        pDepth, SearchOutcome.COUNTEREXAMPLE, checkNotNull(pCounterExample), pStats);
  }

  /** The number of transitions of the explored paths, starting at 1. */
  public int getDepth() {
    return depth;
  }

  public SearchOutcome getSearchOutcome() {
    return outcome;
  }

  public Optional<Counterexample<S>> getCounterExample() {
    return Optional.ofNullable(counterExample);
  }

  public SearchStats getStats() {
    return stats;
  }

  @Override
  public String toString() {
    return "depth "
        + depth
        + ": "
        + outcome
        + (counterExample == null ? "" : " " + counterExample)
        + " after "
        + stats;
  }
}
