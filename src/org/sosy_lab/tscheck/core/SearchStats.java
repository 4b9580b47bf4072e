// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core;

public final class SearchStats {

  private final long time;

  public SearchStats(long pTime) {
    time = pTime;
  }

  /** Milliseconds since the model checking run was started. */
  public long getTime() {
    return time;
  }

  @Override
  public String toString() {
    return time + "ms";
  }
}
