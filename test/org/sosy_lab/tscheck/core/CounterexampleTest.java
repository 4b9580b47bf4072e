// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

public class CounterexampleTest {

  @Test
  public void testPrefix() {
    Counterexample<Long> counterexample = Counterexample.ofPrefix(ImmutableList.of(1L, 2L));

    assertFalse(counterexample.isLasso());
    assertFalse(counterexample.getLoopStart().isPresent());
    assertEquals(2, counterexample.size());
    assertEquals(Long.valueOf(2), counterexample.get(1));
  }

  @Test
  public void testLasso() {
    Counterexample<Long> counterexample = Counterexample.ofLasso(ImmutableList.of(0L, 1L, 0L), 0);

    assertTrue(counterexample.isLasso());
    assertEquals(0, counterexample.getLoopStart().getAsInt());
    assertEquals("[0, 1, 0] (loops back to 0)", counterexample.toString());
    assertNotEquals(counterexample, Counterexample.ofPrefix(ImmutableList.of(0L, 1L, 0L)));
    assertEquals(counterexample, Counterexample.ofLasso(ImmutableList.of(0L, 1L, 0L), 0));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyPrefix() {
    Counterexample.ofPrefix(ImmutableList.of());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLoopStartAtClosingState() {
    Counterexample.ofLasso(ImmutableList.of(0L, 1L, 0L), 2);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeLoopStart() {
    Counterexample.ofLasso(ImmutableList.of(0L, 1L, 0L), -1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCounterexampleOutcomeNeedsCounterexample() {
    SearchResult.of(1, SearchOutcome.COUNTEREXAMPLE, new SearchStats(0));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDepthZero() {
    SearchResult.of(0, SearchOutcome.NO_COUNTEREXAMPLE, new SearchStats(0));
  }

  @Test
  public void testSearchResult() {
    SearchResult<Long> result =
        SearchResult.ofCounterexample(
            1, Counterexample.ofPrefix(ImmutableList.of(5L)), new SearchStats(12));

    assertEquals(SearchOutcome.COUNTEREXAMPLE, result.getSearchOutcome());
    assertEquals(1, result.getDepth());
    assertEquals(12, result.getStats().getTime());
    assertEquals("depth 1: COUNTEREXAMPLE [5] after 12ms", result.toString());
  }
}
