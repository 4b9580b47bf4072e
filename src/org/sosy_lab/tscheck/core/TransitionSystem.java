// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.tscheck.ltl.LtlAlways;
import org.sosy_lab.tscheck.ltl.LtlFormula;
import org.sosy_lab.tscheck.state.StatePredicate;
import org.sosy_lab.tscheck.state.StateType;
import org.sosy_lab.tscheck.state.TransitionRelation;

/**
 * A symbolic transition system together with the property to check.
 *
 * <p>The property is either a temporal {@link #getSpecification() specification} or a plain
 * {@link #getSafetyChecks() safety predicate}, never both. Instances are immutable and can be
 * checked by several runs at the same time.
 *
 * @param <S> The type of the system states.
 */
public final class TransitionSystem<S> {

  private final StateType<S> stateType;
  private final StatePredicate<S> initialStates;
  private final StatePredicate<S> invariants;
  private final TransitionRelation<S> nextRelation;
  private final @Nullable LtlFormula<S> specification;
  private final @Nullable StatePredicate<S> safetyChecks;

  private TransitionSystem(Builder<S> pBuilder) {
    stateType = pBuilder.stateType;
    initialStates = pBuilder.initialStates;
    invariants = pBuilder.invariants;
    nextRelation = pBuilder.nextRelation;
    specification = pBuilder.specification;
    safetyChecks = pBuilder.safetyChecks;
  }

  public static <S> Builder<S> builder(StateType<S> pStateType) {
    return new Builder<>(pStateType);
  }

  public StateType<S> getStateType() {
    return stateType;
  }

  public StatePredicate<S> getInitialStates() {
    return initialStates;
  }

  public StatePredicate<S> getInvariants() {
    return invariants;
  }

  public TransitionRelation<S> getNextRelation() {
    return nextRelation;
  }

  public Optional<LtlFormula<S>> getSpecification() {
    return Optional.ofNullable(specification);
  }

  public Optional<StatePredicate<S>> getSafetyChecks() {
    return Optional.ofNullable(safetyChecks);
  }

  /**
   * The property as a temporal formula. A safety check {@code q} is the formula {@code G(q)}.
   */
  public LtlFormula<S> getProperty() {
    if (specification != null) {
      return specification;
    }
    return LtlFormula.always(LtlFormula.predicate(safetyChecks));
  }

  /**
   * The state formula that must hold on all reachable states, if the property is a safety
   * property. This is the case for safety checks and for specifications of the form {@code G(f)}
   * where {@code f} contains no temporal operator.
   */
  public Optional<LtlFormula<S>> getSafetyProperty() {
    if (safetyChecks != null) {
      return Optional.of(LtlFormula.predicate(safetyChecks));
    }
    LtlFormula<S> normalized = specification.nnf();
    if (normalized instanceof LtlAlways) {
      LtlFormula<S> body = ((LtlAlways<S>) normalized).getFormula();
      if (body.isPropositional()) {
        return Optional.of(body);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return "TransitionSystem("
        + stateType
        + ", init: "
        + initialStates
        + ", next: "
        + nextRelation
        + ", property: "
        + getProperty()
        + ")";
  }

  public static final class Builder<S> {

    private final StateType<S> stateType;
    private @Nullable StatePredicate<S> initialStates;
    private StatePredicate<S> invariants = StatePredicate.alwaysTrue();
    private @Nullable TransitionRelation<S> nextRelation;
    private @Nullable LtlFormula<S> specification;
    private @Nullable StatePredicate<S> safetyChecks;

    private Builder(StateType<S> pStateType) {
      stateType = checkNotNull(pStateType);
    }

    public Builder<S> setInitialStates(StatePredicate<S> pInitialStates) {
      initialStates = checkNotNull(pInitialStates);
      return this;
    }

    public Builder<S> setInvariants(StatePredicate<S> pInvariants) {
      invariants = checkNotNull(pInvariants);
      return this;
    }

    public Builder<S> setNextRelation(TransitionRelation<S> pNextRelation) {
      nextRelation = checkNotNull(pNextRelation);
      return this;
    }

    public Builder<S> setSpecification(LtlFormula<S> pSpecification) {
      specification = checkNotNull(pSpecification);
      return this;
    }

    public Builder<S> setSafetyChecks(StatePredicate<S> pSafetyChecks) {
      safetyChecks = checkNotNull(pSafetyChecks);
      return this;
    }

    /**
     * @throws IllegalStateException if the initial states or the transition relation are missing,
     *     or if not exactly one of specification and safety checks is set.
     */
    public TransitionSystem<S> build() {
      checkState(initialStates != null, "the initial states are not set");
      checkState(nextRelation != null, "the next state relation is not set");
      checkState(
          specification != null || safetyChecks != null,
          "neither a specification nor safety checks are set");
      checkState(
          specification == null || safetyChecks == null,
          "a specification and safety checks are both set, only one property is supported");
      return new TransitionSystem<>(this);
    }
  }
}
