// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.state;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.BoundType;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.BooleanFormulaManager;
import org.sosy_lab.java_smt.api.Formula;
import org.sosy_lab.java_smt.api.FormulaManager;
import org.sosy_lab.java_smt.api.IntegerFormulaManager;
import org.sosy_lab.java_smt.api.Model;
import org.sosy_lab.java_smt.api.NumeralFormula.IntegerFormula;

/**
 * Describes how states of type {@code S} are represented in the solver: an ordered list of fields
 * and a decoder that turns the values of these fields back into an {@code S}.
 *
 * <p>Scalar types have a single field named {@value #VALUE_FIELD}.
 */
public final class StateType<S> {

  public static final String VALUE_FIELD = "value";

  private final String name;
  private final ImmutableList<StateField> fields;
  private final Function<StateValuation, S> decoder;

  private StateType(
      String pName, ImmutableList<StateField> pFields, Function<StateValuation, S> pDecoder) {
    name = pName;
    fields = pFields;
    decoder = pDecoder;
  }

  /** Mathematical integers. */
  public static StateType<BigInteger> integer() {
    return new StateType<>(
        "int", ImmutableList.of(StateField.ofInteger(VALUE_FIELD)), v -> v.getInteger(VALUE_FIELD));
  }

  /** Integers in the range of a 32-bit unsigned machine integer. */
  public static StateType<Long> unsignedInt() {
    return new StateType<>(
        "uint",
        ImmutableList.of(StateField.ofUnsignedInt(VALUE_FIELD)),
        v -> v.getInteger(VALUE_FIELD).longValueExact());
  }

  public static StateType<Boolean> bool() {
    return new StateType<>(
        "bool",
        ImmutableList.of(StateField.ofBoolean(VALUE_FIELD)),
        v -> v.getBoolean(VALUE_FIELD));
  }

  public static Builder builder(String pName) {
    return new Builder(pName);
  }

  public String getName() {
    return name;
  }

  public ImmutableList<StateField> getFields() {
    return fields;
  }

  /**
   * Create the solver variables of the state at position {@code pIndex}. Calling this twice with
   * the same prefix and index returns handles for the same variables.
   */
  public SymbolicState<S> makeState(String pPrefix, int pIndex, FormulaManager pFmgr) {
    checkArgument(pIndex >= 0);
    String stateName = pPrefix + pIndex;
    ImmutableMap.Builder<String, Formula> variables = ImmutableMap.builder();
    for (StateField field : fields) {
      String varName = stateName + "_" + field.getName();
      switch (field.getSort()) {
        case BOOLEAN:
          variables.put(field.getName(), pFmgr.getBooleanFormulaManager().makeVariable(varName));
          break;
        case INTEGER:
          variables.put(field.getName(), pFmgr.getIntegerFormulaManager().makeVariable(varName));
          break;
        default:
          throw new AssertionError("unhandled sort " + field.getSort());
      }
    }
    return new SymbolicState<>(stateName, pIndex, variables.build());
  }

  /** The constraint that restricts every integer field of the state to its domain. */
  public BooleanFormula makeDomainConstraint(SymbolicState<S> pState, FormulaManager pFmgr) {
    BooleanFormulaManager bfmgr = pFmgr.getBooleanFormulaManager();
    IntegerFormulaManager imgr = pFmgr.getIntegerFormulaManager();
    List<BooleanFormula> constraints = new ArrayList<>();

    for (StateField field : fields) {
      Optional<Range<BigInteger>> domain = field.getDomain();
      if (!domain.isPresent()) {
        continue;
      }
      IntegerFormula var = pState.getInteger(field.getName());
      Range<BigInteger> range = domain.get();
      if (range.hasLowerBound()) {
        IntegerFormula bound = imgr.makeNumber(range.lowerEndpoint());
        constraints.add(
            range.lowerBoundType() == BoundType.CLOSED
                ? imgr.greaterOrEquals(var, bound)
                : imgr.greaterThan(var, bound));
      }
      if (range.hasUpperBound()) {
        IntegerFormula bound = imgr.makeNumber(range.upperEndpoint());
        constraints.add(
            range.upperBoundType() == BoundType.CLOSED
                ? imgr.lessOrEquals(var, bound)
                : imgr.lessThan(var, bound));
      }
    }
    return bfmgr.and(constraints);
  }

  /** The constraint that two states agree on every field. */
  public BooleanFormula makeEqual(
      SymbolicState<S> pState1, SymbolicState<S> pState2, FormulaManager pFmgr) {
    BooleanFormulaManager bfmgr = pFmgr.getBooleanFormulaManager();
    IntegerFormulaManager imgr = pFmgr.getIntegerFormulaManager();
    List<BooleanFormula> equalities = new ArrayList<>(fields.size());

    for (StateField field : fields) {
      String fieldName = field.getName();
      if (field.getSort() == StateField.Sort.BOOLEAN) {
        equalities.add(
            bfmgr.equivalence(pState1.getBoolean(fieldName), pState2.getBoolean(fieldName)));
      } else {
        equalities.add(imgr.equal(pState1.getInteger(fieldName), pState2.getInteger(fieldName)));
      }
    }
    return bfmgr.and(equalities);
  }

  /**
   * Read the values of the state from a model. Fields the model leaves unconstrained get the
   * smallest value of their domain ({@code false}, the lower bound, or zero).
   */
  public StateValuation evaluate(SymbolicState<S> pState, Model pModel) {
    ImmutableMap.Builder<String, Object> values = ImmutableMap.builder();
    for (StateField field : fields) {
      String fieldName = field.getName();
      if (field.getSort() == StateField.Sort.BOOLEAN) {
        Boolean value = pModel.evaluate(pState.getBoolean(fieldName));
        values.put(fieldName, value == null ? Boolean.FALSE : value);
      } else {
        BigInteger value = pModel.evaluate(pState.getInteger(fieldName));
        values.put(fieldName, value == null ? defaultValue(field) : value);
      }
    }
    return new StateValuation(values.build());
  }

  public S decode(SymbolicState<S> pState, Model pModel) {
    return decode(evaluate(pState, pModel));
  }

  public S decode(StateValuation pValuation) {
    return decoder.apply(pValuation);
  }

  private static BigInteger defaultValue(StateField pField) {
    Optional<Range<BigInteger>> domain = pField.getDomain();
    if (domain.isPresent() && domain.get().hasLowerBound()) {
      Range<BigInteger> range = domain.get();
      return range.lowerBoundType() == BoundType.CLOSED
          ? range.lowerEndpoint()
          : range.lowerEndpoint().add(BigInteger.ONE);
    }
    return BigInteger.ZERO;
  }

  @Override
  public String toString() {
    return name + fields;
  }

  /** Builder for record-like state types. */
  public static final class Builder {

    private final String name;
    private final ImmutableList.Builder<StateField> fields = ImmutableList.builder();
    private final Set<String> fieldNames = new HashSet<>();

    private Builder(String pName) {
      name = checkNotNull(pName);
    }

    public Builder addField(StateField pField) {
      checkArgument(fieldNames.add(pField.getName()), "duplicate field %s", pField.getName());
      fields.add(pField);
      return this;
    }

    public Builder addBooleanField(String pName) {
      return addField(StateField.ofBoolean(pName));
    }

    public Builder addIntegerField(String pName) {
      return addField(StateField.ofInteger(pName));
    }

    public Builder addIntegerField(String pName, Range<BigInteger> pDomain) {
      return addField(StateField.ofInteger(pName, pDomain));
    }

    public Builder addUnsignedIntField(String pName) {
      return addField(StateField.ofUnsignedInt(pName));
    }

    public <S> StateType<S> build(Function<StateValuation, S> pDecoder) {
      checkState(!fieldNames.isEmpty(), "state type %s has no fields", name);
      return new StateType<>(name, fields.build(), checkNotNull(pDecoder));
    }
  }
}
