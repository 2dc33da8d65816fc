// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown;

import com.github.pushdown.action.Outcome;
import org.jetbrains.annotations.TestOnly;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;
import java.util.logging.Level;

import static com.github.pushdown.PushdownLogger.LOGGER;

/// The AutomatonEngine is the host loop that a [PushdownAutomaton] leaves to its caller. It wraps one automaton and:
///
/// - Drives it until it resolves or a step budget runs out so that a transition function that never resolves
///   cannot spin forever.
/// - Serializes all calls with a mutex so that one engine can be shared between threads.
/// - Marks itself as crashed if the transition function throws.
///
/// The automaton itself is untouched by this class other than through its public methods. Callers that want to
/// pace the automaton themselves, for example to visualise each step, can use [#step()].
///
/// @param <K> The stack alphabet.
/// @param <S> The state alphabet.
/// @param <I> The input alphabet.
public class AutomatonEngine<K, S, I> {

  static final String CRASHED = AutomatonEngine.class.getCanonicalName()
      + " CRASHED the transition function threw. Call recover() to reset the automaton before using this engine again.";

  /// The automaton guarded by this class.
  final protected PushdownAutomaton<K, S, I> automaton;

  /// The maximum number of steps [#run(List)] will take.
  final long maxSteps;

  /// We log at this level when a run resolves or runs out of steps.
  private final Level logAtLevel;

  /// Is {@link #isCrashed()}
  volatile private boolean crashed = false;

  /// We want to be friendly to Virtual Threads so we use a semaphore with a single permit to ensure that we only
  /// step one automaton at a time. This is recommended over using a synchronized blocks.
  private final Semaphore mutex = new Semaphore(1);

  /// Create a new engine which wraps an automaton.
  ///
  /// @param automaton  The automaton to drive. The engine assumes nothing else steps it.
  /// @param maxSteps   The step budget for [#run(List)]. Must be positive.
  /// @param logAtLevel The level to log outcomes at.
  public AutomatonEngine(PushdownAutomaton<K, S, I> automaton, long maxSteps, Level logAtLevel) {
    if (maxSteps <= 0) {
      throw new IllegalArgumentException("maxSteps must be positive: " + maxSteps);
    }
    this.automaton = Objects.requireNonNull(automaton, "automaton");
    this.maxSteps = maxSteps;
    this.logAtLevel = Objects.requireNonNull(logAtLevel, "logAtLevel");
  }

  public AutomatonEngine(PushdownAutomaton<K, S, I> automaton, long maxSteps) {
    this(automaton, maxSteps, Level.FINE);
  }

  /// Reset the automaton, load the input and step until the automaton resolves or the step budget is used up.
  ///
  /// @param input The symbols to recognise in the order they are consumed.
  /// @return The outcome, if any, along with how many steps were taken.
  /// @throws IllegalStateException if the engine has crashed. See [#isCrashed()].
  public RunResult<S> run(List<I> input) {
    return withMutex(() -> {
      automaton.reset().setInput(input);
      long steps = 0;
      while (!automaton.isResolved() && steps < maxSteps) {
        stepNotThreadSafe();
        steps++;
      }
      final var result = new RunResult<>(automaton.result(), steps, automaton.state(), !automaton.isResolved());
      if (result.budgetExhausted()) {
        LOGGER.log(logAtLevel, () -> "BUDGET exhausted after " + result.steps() + " steps in state " + result.finalState());
      } else {
        LOGGER.log(logAtLevel, () -> "RESOLVED " + result.outcome().orElseThrow() + " after " + result.steps() + " steps");
      }
      return result;
    });
  }

  /// @return true only if [#run(List)] resolves to [Outcome#ACCEPT] within the step budget.
  public boolean accepts(List<I> input) {
    return run(input).accepted();
  }

  /// Take a single step of the automaton with whatever input it currently holds.
  ///
  /// @return the outcome of the automaton after the step.
  public Optional<Outcome> step() {
    return withMutex(() -> {
      stepNotThreadSafe();
      return automaton.result();
    });
  }

  /// Reset the automaton and clear the crashed flag. Use this once the cause of a crash, usually a bug in the
  /// transition function, has been dealt with, for example by [PushdownAutomaton#overrideTransitionFunction].
  public void recover() {
    withMutex(() -> {
      automaton.reset();
      crashed = false;
      LOGGER.info(() -> "recovered " + automaton);
      return null;
    });
  }

  /// An engine is marked as crashed if the transition function threw. The automaton may then have consumed input
  /// without applying an action so its state is unknown. Every later call will throw until [#recover()] is called.
  public boolean isCrashed() {
    return crashed;
  }

  /// Not thread safe. Only called while holding the mutex.
  void stepNotThreadSafe() {
    if (crashed) {
      LOGGER.severe(CRASHED);
      throw new IllegalStateException(CRASHED);
    }
    try {
      automaton.step();
    } catch (Throwable e) {
      crashed = true;
      LOGGER.log(Level.SEVERE, CRASHED + " " + e, e);
      throw e;
    }
  }

  private <T> T withMutex(Supplier<T> action) {
    try {
      mutex.acquire();
      try {
        return action.get();
      } finally {
        mutex.release();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      crashed = true;
      throw new IllegalStateException("AutomatonEngine was interrupted awaiting the mutex probably to shutdown while under load.", e);
    }
  }

  @TestOnly
  protected PushdownAutomaton<K, S, I> automaton() {
    return automaton;
  }

  public long maxSteps() {
    return maxSteps;
  }
}
