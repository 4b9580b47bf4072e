// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core.algorithm.bmc;

import java.io.PrintStream;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.sosy_lab.common.time.Timer;

/**
 * Statistics of one model checking run.
 *
 * <p>The timers are only touched by the solver thread of the run, the counters can be read from any
 * thread.
 */
public class BmcStatistics {

  // timer
  final Timer solverCreationTimer = new Timer();
  final Timer encodingTimer = new Timer();
  final Timer solvingTimer = new Timer();
  final Timer modelTimer = new Timer();

  // counter
  final AtomicInteger depths = new AtomicInteger();
  final AtomicInteger baseQueries = new AtomicInteger();
  final AtomicInteger satisfiableBaseQueries = new AtomicInteger();
  final AtomicInteger stepQueries = new AtomicInteger();
  final AtomicInteger satisfiableStepQueries = new AtomicInteger();

  /** The number of depths whose queries were started. */
  public int getDepthCount() {
    return depths.get();
  }

  public int getBaseQueryCount() {
    return baseQueries.get();
  }

  public int getStepQueryCount() {
    return stepQueries.get();
  }

  public void printStatistics(PrintStream pOut) {
    pOut.println("BMC depths explored:              " + depths.get());
    pOut.println("BMC solver creation time:         " + format(solverCreationTimer));
    pOut.println(
        "BMC encoding overhead:            ("
            + format(encodingTimer)
            + ", "
            + encodingTimer.getNumberOfIntervals()
            + ")");
    pOut.println(
        "BMC solving overhead:             ("
            + format(solvingTimer)
            + ", "
            + solvingTimer.getNumberOfIntervals()
            + ")");
    pOut.println("BMC counterexample decoding time: " + format(modelTimer));
    pOut.println("BMC query information: ");
    pOut.println("   Base Case Queries:             " + baseQueries.get());
    pOut.println("   Satisfiable Base Cases:        " + satisfiableBaseQueries.get());
    pOut.println("   Inductive Step Queries:        " + stepQueries.get());
    pOut.println("   Satisfiable Inductive Steps:   " + satisfiableStepQueries.get());
  }

  private static String format(Timer pTimer) {
    return pTimer.getSumTime().formatAs(TimeUnit.SECONDS);
  }
}
