// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.state;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import com.google.common.collect.Range;
import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** One component of a state: a name, a sort and, for integers, an optional domain. */
public final class StateField {

  public enum Sort {
    BOOLEAN,
    INTEGER
  }

  public static final Range<BigInteger> UNSIGNED_INT_DOMAIN =
      Range.closed(BigInteger.ZERO, BigInteger.ONE.shiftLeft(32).subtract(BigInteger.ONE));

  private static final CharMatcher NAME_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'));

  private final String name;
  private final Sort sort;
  private final @Nullable Range<BigInteger> domain;

  private StateField(String pName, Sort pSort, @Nullable Range<BigInteger> pDomain) {
    checkNotNull(pName);
    checkArgument(
        !pName.isEmpty() && NAME_CHARS.matchesAllOf(pName),
        "invalid field name '%s', only letters, digits and '_' are allowed",
        pName);
    name = pName;
    sort = checkNotNull(pSort);
    domain = pDomain;
  }

  public static StateField ofBoolean(String pName) {
    return new StateField(pName, Sort.BOOLEAN, null);
  }

  public static StateField ofInteger(String pName) {
    return new StateField(pName, Sort.INTEGER, null);
  }

  public static StateField ofInteger(String pName, Range<BigInteger> pDomain) {
    checkArgument(!pDomain.isEmpty(), "empty domain for field %s", pName);
    return new StateField(pName, Sort.INTEGER, pDomain);
  }

  public static StateField ofUnsignedInt(String pName) {
    return ofInteger(pName, UNSIGNED_INT_DOMAIN);
  }

  public String getName() {
    return name;
  }

  public Sort getSort() {
    return sort;
  }

  public Optional<Range<BigInteger>> getDomain() {
    return Optional.ofNullable(domain);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, sort, domain);
  }

  @Override
  public boolean equals(Object pObj) {
    if (pObj == this) {
      return true;
    }
    if (pObj instanceof StateField) {
      StateField other = (StateField) pObj;
      return name.equals(other.name) && sort == other.sort && Objects.equals(domain, other.domain);
    }
    return false;
  }

  @Override
  public String toString() {
    return name + ":" + sort + (domain == null ? "" : domain.toString());
  }
}
