// This file is part of TSCheck,
// a bounded model checker for symbolic transition systems.
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.tscheck.core.algorithm.bmc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.base.Stopwatch;
import java.util.List;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.Test;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.java_smt.api.SolverException;
import org.sosy_lab.tscheck.core.SearchOutcome;
import org.sosy_lab.tscheck.core.SearchResult;
import org.sosy_lab.tscheck.core.algorithm.bmc.SolverSession.DepthResult;
import org.sosy_lab.tscheck.exceptions.ModelCheckingException;
import org.sosy_lab.tscheck.exceptions.SolverFailedException;

/** Runs driven by scripted sessions instead of a solver. */
public class BmcRunTest {

  /** Answers NO_COUNTEREXAMPLE up to a depth and fails with the given exception after that. */
  private static class ScriptedSession implements SolverSession<Long> {

    private final int lastAnsweredDepth;
    private final Exception failure;
    private final CountDownLatch closed = new CountDownLatch(1);

    ScriptedSession(int pLastAnsweredDepth, Exception pFailure) {
      lastAnsweredDepth = pLastAnsweredDepth;
      failure = pFailure;
    }

    @Override
    public DepthResult<Long> checkDepth(int pDepth) throws SolverException, InterruptedException {
      if (pDepth <= lastAnsweredDepth) {
        return DepthResult.of(SearchOutcome.NO_COUNTEREXAMPLE);
      }
      if (failure instanceof SolverException) {
        throw (SolverException) failure;
      }
      if (failure instanceof InterruptedException) {
        throw (InterruptedException) failure;
      }
      throw (RuntimeException) failure;
    }

    @Override
    public void close() {
      closed.countDown();
    }

    boolean awaitClose() throws InterruptedException {
      return closed.await(10, TimeUnit.SECONDS);
    }
  }

  private static BmcRun<Long> newRun(
      BmcRun.SessionFactory<Long> pFactory, OptionalLong pTimeoutMs) {
    return new BmcRun<>(
        pFactory,
        OptionalInt.empty(),
        pTimeoutMs,
        true,
        LogManager.createTestLogManager(),
        new BmcStatistics(),
        Stopwatch.createStarted());
  }

  @Test
  public void testSolverFailureIsRaisedWithDepth() throws InterruptedException {
    ScriptedSession session = new ScriptedSession(1, new SolverException("unknown result"));

    try (BmcRun<Long> run = newRun(notifier -> session, OptionalLong.of(60_000))) {
      assertEquals(SearchOutcome.NO_COUNTEREXAMPLE, run.next().getSearchOutcome());
      try {
        run.hasNext();
        fail("solver failure was not raised");
      } catch (SolverFailedException e) {
        assertEquals(2, e.getDepth());
        assertTrue(e.getCause() instanceof SolverException);
      }
    }
    assertTrue(session.awaitClose());
  }

  @Test
  public void testFailureFromSessionIsRaisedUnchanged() {
    SolverFailedException failure = new SolverFailedException(1, "no case holds", null);
    ScriptedSession session = new ScriptedSession(0, failure);

    try (BmcRun<Long> run = newRun(notifier -> session, OptionalLong.empty())) {
      run.hasNext();
      fail("solver failure was not raised");
    } catch (SolverFailedException e) {
      assertEquals(failure, e);
    }
  }

  @Test
  public void testInterruptedSolverIsNoTimeout() {
    ScriptedSession session = new ScriptedSession(0, new InterruptedException());

    try (BmcRun<Long> run = newRun(notifier -> session, OptionalLong.of(60_000))) {
      run.hasNext();
      fail("interrupted solver was not raised");
    } catch (ModelCheckingException e) {
      assertFalse(e instanceof SolverFailedException);
      assertTrue(e.getCause() instanceof InterruptedException);
    }
  }

  @Test
  public void testInvalidSolverConfiguration() {
    BmcRun.SessionFactory<Long> factory =
        notifier -> {
          throw new InvalidConfigurationException("unknown solver");
        };

    try (BmcRun<Long> run = newRun(factory, OptionalLong.empty())) {
      run.hasNext();
      fail("invalid configuration was not raised");
    } catch (ModelCheckingException e) {
      assertFalse(e instanceof SolverFailedException);
      assertTrue(e.getCause() instanceof InvalidConfigurationException);
      assertTrue(e.getMessage(), e.getMessage().contains("unknown solver"));
    }
  }

  @Test
  public void testInterruptedConsumer() throws InterruptedException {
    CountDownLatch release = new CountDownLatch(1);
    SolverSession<Long> blocking =
        new ScriptedSession(0, new IllegalStateException()) {
          @Override
          public DepthResult<Long> checkDepth(int pDepth) throws InterruptedException {
            release.await();
            return DepthResult.of(SearchOutcome.NO_COUNTEREXAMPLE);
          }
        };

    BmcRun<Long> run = newRun(notifier -> blocking, OptionalLong.empty());
    try {
      Thread.currentThread().interrupt();
      run.hasNext();
      fail("interruption was not raised");
    } catch (ModelCheckingException e) {
      assertTrue(Thread.interrupted());
      assertTrue(e.getCause() instanceof InterruptedException);
    } finally {
      Thread.interrupted();
      release.countDown();
      run.close();
    }
  }

  @Test
  public void testClosingStreamEarlyReleasesSession() throws InterruptedException {
    ScriptedSession session = new ScriptedSession(100, new IllegalStateException());
    BmcRun<Long> run = newRun(notifier -> session, OptionalLong.empty());

    List<Integer> depths;
    try (Stream<SearchResult<Long>> results = run.stream()) {
      depths = results.limit(2).map(SearchResult::getDepth).collect(Collectors.toList());
    }

    assertEquals(List.of(1, 2), depths);
    assertFalse(run.hasNext());
    assertTrue(session.awaitClose());
  }
}
