// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.state;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import java.math.BigInteger;

/**
 * The concrete values of all fields of one state, as read from a solver model.
 *
 * <p>Boolean fields map to {@link Boolean}, integer fields to {@link BigInteger}.
 */
public final class StateValuation {

  private final ImmutableMap<String, Object> values;

  StateValuation(ImmutableMap<String, Object> pValues) {
    values = pValues;
  }

  public static StateValuation of(ImmutableMap<String, Object> pValues) {
    for (Object value : pValues.values()) {
      checkArgument(
          value instanceof Boolean || value instanceof BigInteger,
          "unsupported value %s",
          value);
    }
    return new StateValuation(pValues);
  }

  public ImmutableMap<String, Object> toMap() {
    return values;
  }

  public boolean getBoolean(String pField) {
    Object value = get(pField);
    checkArgument(value instanceof Boolean, "field %s is not a boolean", pField);
    return (Boolean) value;
  }

  public BigInteger getInteger(String pField) {
    Object value = get(pField);
    checkArgument(value instanceof BigInteger, "field %s is not an integer", pField);
    return (BigInteger) value;
  }

  /** The value of the only field of a scalar state. */
  public Object getValue() {
    checkState(values.size() == 1, "valuation has %s fields", values.size());
    return Iterables.getOnlyElement(values.values());
  }

  private Object get(String pField) {
    Object value = values.get(pField);
    checkArgument(value != null, "unknown field %s", pField);
    return value;
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj == this
        || (pObj instanceof StateValuation && values.equals(((StateValuation) pObj).values));
  }

  @Override
  public String toString() {
    return "(" + Joiner.on(", ").withKeyValueSeparator("=").join(values) + ")";
  }
}
