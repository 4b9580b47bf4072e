// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.sosy_lab.tscheck.ltl.LtlFormula.always;
import static org.sosy_lab.tscheck.ltl.LtlFormula.and;
import static org.sosy_lab.tscheck.ltl.LtlFormula.eventually;
import static org.sosy_lab.tscheck.ltl.LtlFormula.not;
import static org.sosy_lab.tscheck.ltl.LtlFormula.predicate;

import org.junit.Test;
import org.sosy_lab.tscheck.ltl.LtlFormula;
import org.sosy_lab.tscheck.state.StatePredicate;
import org.sosy_lab.tscheck.state.StateType;
import org.sosy_lab.tscheck.state.TransitionRelation;

public class TransitionSystemTest {

  private static final StatePredicate<Boolean> P =
      StatePredicate.of("p", (s, fmgr) -> s.boolValue());
  private static final StatePredicate<Boolean> Q =
      StatePredicate.of("q", (s, fmgr) -> fmgr.getBooleanFormulaManager().not(s.boolValue()));
  private static final TransitionRelation<Boolean> FLIP =
      TransitionRelation.of(
          "flip",
          (pre, post, fmgr) ->
              fmgr.getBooleanFormulaManager().xor(pre.boolValue(), post.boolValue()));

  private static TransitionSystem.Builder<Boolean> complete() {
    return TransitionSystem.builder(StateType.bool()).setInitialStates(P).setNextRelation(FLIP);
  }

  @Test(expected = IllegalStateException.class)
  public void testMissingProperty() {
    complete().build();
  }

  @Test(expected = IllegalStateException.class)
  public void testBothProperties() {
    complete().setSafetyChecks(P).setSpecification(always(predicate(Q))).build();
  }

  @Test(expected = IllegalStateException.class)
  public void testMissingInitialStates() {
    TransitionSystem.builder(StateType.bool()).setNextRelation(FLIP).setSafetyChecks(P).build();
  }

  @Test(expected = IllegalStateException.class)
  public void testMissingNextRelation() {
    TransitionSystem.builder(StateType.bool()).setInitialStates(P).setSafetyChecks(P).build();
  }

  @Test
  public void testSafetyChecks() {
    TransitionSystem<Boolean> ts = complete().setSafetyChecks(Q).build();

    assertEquals(always(predicate(Q)), ts.getProperty());
    assertEquals(predicate(Q), ts.getSafetyProperty().get());
    assertFalse(ts.getSpecification().isPresent());
    assertEquals(StatePredicate.<Boolean>alwaysTrue(), ts.getInvariants());
  }

  @Test
  public void testGloballyStateFormula() {
    LtlFormula<Boolean> spec = always(and(predicate(P), not(predicate(Q))));
    TransitionSystem<Boolean> ts = complete().setSpecification(spec).build();

    assertEquals(spec, ts.getProperty());
    assertEquals(and(predicate(P), predicate(Q.negate())), ts.getSafetyProperty().get());
  }

  @Test
  public void testNegatedEventuallyIsSafety() {
    TransitionSystem<Boolean> ts =
        complete().setSpecification(not(eventually(predicate(P)))).build();

    assertEquals(predicate(P.negate()), ts.getSafetyProperty().get());
  }

  @Test
  public void testLivenessIsNoSafetyProperty() {
    assertFalse(
        complete()
            .setSpecification(always(eventually(predicate(P))))
            .build()
            .getSafetyProperty()
            .isPresent());
    assertFalse(
        complete()
            .setSpecification(and(always(predicate(P)), always(predicate(Q))))
            .build()
            .getSafetyProperty()
            .isPresent());
  }
}
