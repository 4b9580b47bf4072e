// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.state;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.Formula;
import org.sosy_lab.java_smt.api.NumeralFormula.IntegerFormula;

/**
 * A handle for one symbolic state of an unrolled path: the solver variables of all fields of the
 * state at a fixed position.
 *
 * <p>Predicates and transition relations read the fields of a state through this handle. Asking
 * for a field the state type does not declare is a configuration error and raises an {@link
 * IllegalArgumentException}.
 */
public final class SymbolicState<S> {

  private final String name;
  private final int index;
  private final ImmutableMap<String, Formula> fields;

  SymbolicState(String pName, int pIndex, ImmutableMap<String, Formula> pFields) {
    name = pName;
    index = pIndex;
    fields = pFields;
  }

  /** The variable prefix and position, e.g. {@code s3}. */
  public String getName() {
    return name;
  }

  public int getIndex() {
    return index;
  }

  public ImmutableMap<String, Formula> getFields() {
    return fields;
  }

  public Formula get(String pField) {
    Formula field = fields.get(pField);
    checkArgument(
        field != null,
        "state %s has no field '%s', known fields: %s",
        name,
        pField,
        fields.keySet());
    return field;
  }

  public IntegerFormula getInteger(String pField) {
    Formula field = get(pField);
    checkArgument(field instanceof IntegerFormula, "field '%s' is not an integer", pField);
    return (IntegerFormula) field;
  }

  public BooleanFormula getBoolean(String pField) {
    Formula field = get(pField);
    checkArgument(field instanceof BooleanFormula, "field '%s' is not a boolean", pField);
    return (BooleanFormula) field;
  }

  /** The value of a scalar integer state. */
  public IntegerFormula intValue() {
    return getInteger(getOnlyFieldName());
  }

  /** The value of a scalar boolean state. */
  public BooleanFormula boolValue() {
    return getBoolean(getOnlyFieldName());
  }

  private String getOnlyFieldName() {
    checkState(fields.size() == 1, "state %s has %s fields", name, fields.size());
    return Iterables.getOnlyElement(fields.keySet());
  }

  @Override
  public String toString() {
    return name;
  }
}
