// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core.algorithm.bmc;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.BooleanFormulaManager;
import org.sosy_lab.java_smt.api.FormulaManager;
import org.sosy_lab.tscheck.ltl.LtlAlways;
import org.sosy_lab.tscheck.ltl.LtlAnd;
import org.sosy_lab.tscheck.ltl.LtlEventually;
import org.sosy_lab.tscheck.ltl.LtlFormula;
import org.sosy_lab.tscheck.ltl.LtlFormulaVisitor;
import org.sosy_lab.tscheck.ltl.LtlNot;
import org.sosy_lab.tscheck.ltl.LtlOr;
import org.sosy_lab.tscheck.ltl.LtlPredicate;
import org.sosy_lab.tscheck.state.StateType;
import org.sosy_lab.tscheck.state.SymbolicState;

/**
 * Encodes the violation of a temporal property on a path {@code s0..sk} with the bounded semantics
 * of LTL.
 *
 * <p>The negation of the property is brought into negation normal form and evaluated on the
 * prefix positions {@code 0..k-1}. The last state {@code sk} is only used to close loops:
 *
 * <ul>
 *   <li>without a loop, {@code F f} at position {@code i} holds iff {@code f} holds at some
 *       position {@code i..k-1}, and {@code G f} never holds;
 *   <li>with a loop back to {@code l}, i.e., {@code sk == sl}, both operators range over the
 *       positions {@code min(i, l)..k-1}, since the suffix of every position is contained in the
 *       prefix up to {@code k-1} and the cycle {@code l..k-1}.
 * </ul>
 *
 * <p>Predicates are evaluated at their position and boolean operators pointwise.
 */
public final class ViolationEncoder<S> {

  private static final int NO_LOOP = -1;

  private final StateType<S> stateType;
  private final FormulaManager fmgr;
  private final BooleanFormulaManager bfmgr;

  public ViolationEncoder(StateType<S> pStateType, FormulaManager pFmgr) {
    stateType = pStateType;
    fmgr = pFmgr;
    bfmgr = pFmgr.getBooleanFormulaManager();
  }

  /**
   * Encode the violation of a property on the given path.
   *
   * @param pProperty The property that should hold on all paths.
   * @param pStates The states {@code s0..sk} of a path with {@code k >= 1}.
   */
  public ViolationEncoding encodeViolation(
      LtlFormula<S> pProperty, List<SymbolicState<S>> pStates) {
    checkArgument(pStates.size() >= 2, "a path needs at least one transition");
    LtlFormula<S> violation = LtlFormula.not(pProperty).nnf();
    int last = pStates.size() - 1;

    BooleanFormula loopFreeCase = new Evaluation(pStates, NO_LOOP).at(violation, 0);

    ImmutableList.Builder<BooleanFormula> loopCases = ImmutableList.builder();
    for (int loopStart = 0; loopStart < last; loopStart++) {
      BooleanFormula loopsBack =
          stateType.makeEqual(pStates.get(last), pStates.get(loopStart), fmgr);
      BooleanFormula violated = new Evaluation(pStates, loopStart).at(violation, 0);
      loopCases.add(bfmgr.and(loopsBack, violated));
    }
    ImmutableList<BooleanFormula> loops = loopCases.build();

    return new ViolationEncoding(
        loopFreeCase, loops, bfmgr.or(loopFreeCase, bfmgr.or(loops)));
  }

  /**
   * Encode a formula without temporal operators on a single state.
   *
   * @throws IllegalArgumentException if the formula contains a temporal operator.
   */
  public BooleanFormula encodeState(LtlFormula<S> pFormula, SymbolicState<S> pState) {
    checkArgument(pFormula.isPropositional(), "%s is not a state formula", pFormula);
    return new Evaluation(ImmutableList.of(pState), NO_LOOP).at(pFormula.nnf(), 0);
  }

  /**
   * The bounded semantics for one loop case. The encodings of all positions are cached per
   * formula node.
   */
  private final class Evaluation {

    private final List<SymbolicState<S>> states;
    private final int loopStart;
    private final List<PositionVisitor> positions;

    Evaluation(List<SymbolicState<S>> pStates, int pLoopStart) {
      states = pStates;
      loopStart = pLoopStart;
      positions = new ArrayList<>(pStates.size());
      for (int i = 0; i < pStates.size(); i++) {
        positions.add(new PositionVisitor(this, i));
      }
    }

    BooleanFormula at(LtlFormula<S> pFormula, int pPosition) {
      return positions.get(pPosition).encode(pFormula);
    }

    /** The first position a temporal operator at {@code pPosition} ranges over. */
    int rangeStart(int pPosition) {
      return loopStart == NO_LOOP ? pPosition : Math.min(pPosition, loopStart);
    }

    /** Exclusive end of the range of every temporal operator, the last state closes loops. */
    int rangeEnd() {
      return states.size() - 1;
    }

    boolean hasLoop() {
      return loopStart != NO_LOOP;
    }
  }

  private final class PositionVisitor
      implements LtlFormulaVisitor<S, BooleanFormula, RuntimeException> {

    private final Evaluation evaluation;
    private final int position;
    private final Map<LtlFormula<S>, BooleanFormula> cache = new IdentityHashMap<>();

    PositionVisitor(Evaluation pEvaluation, int pPosition) {
      evaluation = pEvaluation;
      position = pPosition;
    }

    BooleanFormula encode(LtlFormula<S> pFormula) {
      BooleanFormula result = cache.get(pFormula);
      if (result == null) {
        result = pFormula.accept(this);
        cache.put(pFormula, result);
      }
      return result;
    }

    @Override
    public BooleanFormula visit(LtlPredicate<S> pFormula) {
      return pFormula.getPredicate().encode(evaluation.states.get(position), fmgr);
    }

    @Override
    public BooleanFormula visit(LtlNot<S> pFormula) {
      throw new IllegalStateException(pFormula + " is not in negation normal form");
    }

    @Override
    public BooleanFormula visit(LtlAnd<S> pFormula) {
      return bfmgr.and(encode(pFormula.getFormula1()), encode(pFormula.getFormula2()));
    }

    @Override
    public BooleanFormula visit(LtlOr<S> pFormula) {
      return bfmgr.or(encode(pFormula.getFormula1()), encode(pFormula.getFormula2()));
    }

    @Override
    public BooleanFormula visit(LtlAlways<S> pFormula) {
      if (!evaluation.hasLoop()) {
        return bfmgr.makeFalse();
      }
      List<BooleanFormula> operands = new ArrayList<>();
      for (int j = evaluation.rangeStart(position); j < evaluation.rangeEnd(); j++) {
        operands.add(evaluation.at(pFormula.getFormula(), j));
      }
      return bfmgr.and(operands);
    }

    @Override
    public BooleanFormula visit(LtlEventually<S> pFormula) {
      List<BooleanFormula> operands = new ArrayList<>();
      for (int j = evaluation.rangeStart(position); j < evaluation.rangeEnd(); j++) {
        operands.add(evaluation.at(pFormula.getFormula(), j));
      }
      return bfmgr.or(operands);
    }
  }
}
