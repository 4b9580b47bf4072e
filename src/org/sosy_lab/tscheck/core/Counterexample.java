// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.OptionalInt;

/**
 * A concrete path that violates the property.
 *
 * <p>A lasso is reported with its closing state: the last state equals the state at the loop
 * start, so the infinite behavior repeats the states from the loop start up to the second-to-last
 * state forever.
 */
public final class Counterexample<S> {

  private static final int NO_LOOP = -1;

  private final ImmutableList<S> states;
  private final int loopStart;

  private Counterexample(ImmutableList<S> pStates, int pLoopStart) {
    states = pStates;
    loopStart = pLoopStart;
  }

  public static <S> Counterexample<S> ofPrefix(List<S> pStates) {
    checkArgument(!pStates.isEmpty(), "empty counterexample");
    return new Counterexample<>(ImmutableList.copyOf(pStates), NO_LOOP);
  }

  public static <S> Counterexample<S> ofLasso(List<S> pStates, int pLoopStart) {
    checkArgument(
        pLoopStart >= 0 && pLoopStart < pStates.size() - 1,
        "loop start %s out of range for %s states",
        pLoopStart,
        pStates.size());
    return new Counterexample<>(ImmutableList.copyOf(pStates), pLoopStart);
  }

  public ImmutableList<S> getStates() {
    return states;
  }

  public S get(int pIndex) {
    return states.get(pIndex);
  }

  public int size() {
    return states.size();
  }

  public boolean isLasso() {
    return loopStart != NO_LOOP;
  }

  /** The index of the state the last state loops back to, empty for a finite prefix. */
  public OptionalInt getLoopStart() {
    return isLasso() ? OptionalInt.of(loopStart) : OptionalInt.empty();
  }

  @Override
  public int hashCode() {
    return 31 * states.hashCode() + loopStart;
  }

  @Override
  public boolean equals(Object pObj) {
    if (pObj == this) {
      return true;
    }
    if (pObj instanceof Counterexample) {
      Counterexample<?> other = (Counterexample<?>) pObj;
      return loopStart == other.loopStart && states.equals(other.states);
    }
    return false;
  }

  @Override
  public String toString() {
    return states + (isLasso() ? " (loops back to " + loopStart + ")" : "");
  }
}
