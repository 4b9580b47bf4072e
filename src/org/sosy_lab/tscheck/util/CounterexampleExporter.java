// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.util;

import com.google.common.base.Joiner;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.sosy_lab.tscheck.core.Counterexample;

/** Writes counterexamples as readable traces or as DOT graphs. */
public class CounterexampleExporter {

  private CounterexampleExporter() {}

  /**
   * Write one line per state, followed by the loop-back position for a lasso:
   *
   * <pre>
   * 0: 0
   * 1: 1
   * 2: 0
   * loop back to 0
   * </pre>
   */
  public static void writeTrace(final Appendable pW, final Counterexample<?> pCounterexample)
      throws IOException {
    List<String> lines = new ArrayList<>(pCounterexample.size() + 1);
    for (int i = 0; i < pCounterexample.size(); i++) {
      lines.add(i + ": " + pCounterexample.get(i));
    }
    if (pCounterexample.isLasso()) {
      lines.add("loop back to " + pCounterexample.getLoopStart().getAsInt());
    }
    Joiner.on("\n").appendTo(pW, lines);
    pW.append("\n");
  }

  /**
   * Write the counterexample as a chain of nodes. The closing state of a lasso is not drawn,
   * instead the last transition points back to the loop start.
   */
  public static void generateDOT(final Appendable pW, final Counterexample<?> pCounterexample)
      throws IOException {
    List<String> nodes = new ArrayList<>();
    List<String> edges = new ArrayList<>();
    int drawn = pCounterexample.isLasso() ? pCounterexample.size() - 1 : pCounterexample.size();

    for (int i = 0; i < drawn; i++) {
      String shape = i == 0 ? "doublecircle" : "circle";
      nodes.add(formatNode(i, pCounterexample.get(i), shape));
    }
    for (int i = 1; i < drawn; i++) {
      edges.add(getNodeRepresentation(i - 1) + " -> " + getNodeRepresentation(i));
    }
    if (pCounterexample.isLasso()) {
      edges.add(
          getNodeRepresentation(drawn - 1)
              + " -> "
              + getNodeRepresentation(pCounterexample.getLoopStart().getAsInt())
              + " [style=\"dashed\" label=\"loop\"]");
    }

    pW.append("digraph Counterexample {\n");
    Joiner.on("\n").appendTo(pW, nodes);
    pW.append("\n");
    Joiner.on("\n").appendTo(pW, edges);
    pW.append("\n}");
  }

  private static String getNodeRepresentation(final int pIndex) {
    return "S" + pIndex;
  }

  private static String formatNode(final int pIndex, final Object pState, final String pShape) {
    String label = String.valueOf(pState).replaceAll("\\\"", "\\\\\"");
    return getNodeRepresentation(pIndex) + " [shape=\"" + pShape + "\", label=\"" + label + "\"]";
  }
}
