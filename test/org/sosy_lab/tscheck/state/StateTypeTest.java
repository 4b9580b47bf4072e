// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.state;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;
import java.math.BigInteger;
import java.util.function.Function;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.java_smt.SolverContextFactory;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.FormulaManager;
import org.sosy_lab.java_smt.api.IntegerFormulaManager;
import org.sosy_lab.java_smt.api.Model;
import org.sosy_lab.java_smt.api.ProverEnvironment;
import org.sosy_lab.java_smt.api.SolverContext;
import org.sosy_lab.java_smt.api.SolverContext.ProverOptions;
import org.sosy_lab.java_smt.api.SolverException;

public class StateTypeTest {

  private SolverContext context;
  private FormulaManager fmgr;
  private IntegerFormulaManager imgr;

  @Before
  public void setUp() throws InvalidConfigurationException {
    context =
        SolverContextFactory.createSolverContext(
            Configuration.defaultConfiguration(),
            LogManager.createTestLogManager(),
            ShutdownNotifier.createDummy());
    fmgr = context.getFormulaManager();
    imgr = fmgr.getIntegerFormulaManager();
  }

  @After
  public void tearDown() {
    context.close();
  }

  private StateType<StateValuation> pairType() {
    return StateType.builder("pair")
        .addBooleanField("done")
        .addIntegerField("count", Range.closed(BigInteger.valueOf(-3), BigInteger.valueOf(3)))
        .build(Function.identity());
  }

  private boolean isUnsat(BooleanFormula... pConstraints)
      throws SolverException, InterruptedException {
    try (ProverEnvironment prover = context.newProverEnvironment()) {
      for (BooleanFormula constraint : pConstraints) {
        prover.addConstraint(constraint);
      }
      return prover.isUnsat();
    }
  }

  @Test
  public void testVariableNames() {
    SymbolicState<StateValuation> state = pairType().makeState("s", 3, fmgr);

    assertEquals("s3", state.getName());
    assertEquals(3, state.getIndex());
    assertEquals(
        "s3_count", fmgr.extractVariables(state.getInteger("count")).keySet().iterator().next());
    assertEquals(
        "s3_done", fmgr.extractVariables(state.getBoolean("done")).keySet().iterator().next());
  }

  @Test
  public void testSameStateTwice() throws SolverException, InterruptedException {
    StateType<Long> type = StateType.unsignedInt();
    SymbolicState<Long> first = type.makeState("s", 0, fmgr);
    SymbolicState<Long> second = type.makeState("s", 0, fmgr);

    assertEquals(first.intValue(), second.intValue());
    assertTrue(
        isUnsat(fmgr.getBooleanFormulaManager().not(type.makeEqual(first, second, fmgr))));
  }

  @Test
  public void testUnsignedDomain() throws SolverException, InterruptedException {
    StateType<Long> type = StateType.unsignedInt();
    SymbolicState<Long> state = type.makeState("s", 0, fmgr);
    BooleanFormula domain = type.makeDomainConstraint(state, fmgr);

    assertTrue(isUnsat(domain, imgr.equal(state.intValue(), imgr.makeNumber(-1))));
    assertTrue(isUnsat(domain, imgr.equal(state.intValue(), imgr.makeNumber(1L << 32))));
    assertFalse(isUnsat(domain, imgr.equal(state.intValue(), imgr.makeNumber((1L << 32) - 1))));
  }

  @Test
  public void testMathematicalIntegerHasNoDomain() throws SolverException, InterruptedException {
    StateType<BigInteger> type = StateType.integer();
    SymbolicState<BigInteger> state = type.makeState("s", 0, fmgr);

    assertFalse(
        isUnsat(
            type.makeDomainConstraint(state, fmgr),
            imgr.equal(state.intValue(), imgr.makeNumber(-1))));
  }

  @Test
  public void testDecodeFromModel() throws SolverException, InterruptedException {
    StateType<StateValuation> type = pairType();
    SymbolicState<StateValuation> state = type.makeState("s", 0, fmgr);

    try (ProverEnvironment prover =
        context.newProverEnvironment(ProverOptions.GENERATE_MODELS)) {
      prover.addConstraint(state.getBoolean("done"));
      prover.addConstraint(imgr.equal(state.getInteger("count"), imgr.makeNumber(-2)));
      assertFalse(prover.isUnsat());
      try (Model model = prover.getModel()) {
        StateValuation valuation = type.decode(state, model);
        assertTrue(valuation.getBoolean("done"));
        assertEquals(BigInteger.valueOf(-2), valuation.getInteger("count"));
      }
    }
  }

  @Test
  public void testScalarDecoders() {
    assertEquals(
        Long.valueOf(7),
        StateType.unsignedInt()
            .decode(StateValuation.of(ImmutableMap.of("value", BigInteger.valueOf(7)))));
    assertEquals(
        Boolean.TRUE, StateType.bool().decode(StateValuation.of(ImmutableMap.of("value", true))));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateField() {
    StateType.builder("pair").addBooleanField("x").addUnsignedIntField("x");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidFieldName() {
    StateType.builder("pair").addBooleanField("x-1");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyDomain() {
    StateField.ofInteger("x", Range.open(BigInteger.ONE, BigInteger.ONE));
  }

  @Test(expected = IllegalStateException.class)
  public void testNoFields() {
    StateType.builder("empty").build(Function.identity());
  }

  @Test
  public void testUnknownField() {
    SymbolicState<StateValuation> state = pairType().makeState("s", 0, fmgr);
    try {
      state.getInteger("missing");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("missing"));
      return;
    }
    throw new AssertionError("unknown field was accepted");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrongSort() {
    pairType().makeState("s", 0, fmgr).getBoolean("count");
  }

  @Test(expected = IllegalStateException.class)
  public void testScalarAccessOnRecord() {
    pairType().makeState("s", 0, fmgr).intValue();
  }

  @Test
  public void testValuation() {
    StateValuation valuation =
        StateValuation.of(ImmutableMap.of("done", false, "count", BigInteger.TEN));

    assertFalse(valuation.getBoolean("done"));
    assertEquals(BigInteger.TEN, valuation.getInteger("count"));
    assertEquals("(done=false, count=10)", valuation.toString());
    assertEquals(
        valuation, StateValuation.of(ImmutableMap.of("done", false, "count", BigInteger.TEN)));
    assertNotEquals(
        valuation, StateValuation.of(ImmutableMap.of("done", true, "count", BigInteger.TEN)));
  }

  @Test
  public void testScalarValuation() {
    StateValuation scalar = StateValuation.of(ImmutableMap.of("value", BigInteger.ONE));

    assertEquals(BigInteger.ONE, scalar.getValue());
  }

  @Test(expected = IllegalStateException.class)
  public void testValueOfRecordValuation() {
    StateValuation.of(ImmutableMap.of("done", false, "count", BigInteger.TEN)).getValue();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testValuationRejectsOtherValues() {
    StateValuation.of(ImmutableMap.of("name", "x"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testValuationWrongSort() {
    StateValuation.of(ImmutableMap.of("done", false)).getInteger("done");
  }
}
