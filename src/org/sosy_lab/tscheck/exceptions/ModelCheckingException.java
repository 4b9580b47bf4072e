// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.exceptions;

/**
 * Raised from a running model checking sequence when the run cannot continue, e.g., because the
 * solver could not be created or the consuming thread was interrupted.
 */
public class ModelCheckingException extends RuntimeException {

  private static final long serialVersionUID = 4726185803417620991L;

  public ModelCheckingException(String pMessage) {
    super(pMessage);
  }

  public ModelCheckingException(String pMessage, Throwable pCause) {
    super(pMessage, pCause);
  }
}
