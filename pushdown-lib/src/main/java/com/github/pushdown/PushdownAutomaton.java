// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown;

import com.github.pushdown.action.AutomatonAction;
import com.github.pushdown.action.Outcome;
import com.github.pushdown.action.StackAction;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.github.pushdown.PushdownLogger.LOGGER;

/// A pushdown automaton that is driven one transition at a time by its caller. It holds:
///
/// - A control stack that starts as `[initialStackSymbol]`.
/// - The current state that starts as `initialState`.
/// - The remaining input which is a [Stack] whose top is the next symbol to consume.
/// - The [TransitionFunction] which is the only source of domain semantics.
/// - The outcome once the transition function has resolved.
///
/// Each call to [#step()] queries the transition function exactly once and applies at most one stack command. The
/// automaton never runs itself to completion. A host loop such as [AutomatonEngine] decides when to stop:
///
/// ```java
/// automaton.setInput(List.of('(', ')'));
/// while (!automaton.isResolved() && steps++ < budget) {
///   automaton.step();
/// }
///```
///
/// An empty control stack or an empty input is never an error here. The transition function is given
/// `Optional.empty()` and must itself decide to resolve.
///
/// Calling [#step()] again after the automaton has resolved is not guarded. The transition function is queried
/// again and may change the stack and state or resolve again. Transition functions that must be idempotent after
/// resolving have to guard on their own states.
///
/// The methods named `raw*`, `replace*`, `run*Action`, `override*` and [#appendInput(List)] bypass the step protocol.
/// They exist so that a caller can splice automata together or instrument a run, and they can leave the automaton in
/// a state its transition function does not expect. The ones that touch a stack throw [IllegalStateException] when
/// called from inside the transition function while a step is in progress.
///
/// This class is not thread safe. See [AutomatonEngine] for a wrapper that serializes access.
///
/// @param <K> The stack alphabet.
/// @param <S> The state alphabet.
/// @param <I> The input alphabet.
public class PushdownAutomaton<K, S, I> {

  private final S initialState;

  private final K initialStackSymbol;

  private Stack<K> stack;

  private S state;

  private Stack<I> input;

  private TransitionFunction<K, S, I> transition;

  /// Null until the transition function resolves.
  private Outcome result;

  /// True only while the transition function and its continuation are running.
  private boolean stepping = false;

  /// Create an automaton with the control stack holding only `initialStackSymbol`, no input and no outcome.
  ///
  /// @param initialState       The state to start in and to return to on [#reset()].
  /// @param initialStackSymbol The bottom marker placed on the control stack at the start and on [#reset()].
  /// @param transition         The transition function.
  public PushdownAutomaton(@NotNull S initialState,
                           @NotNull K initialStackSymbol,
                           @NotNull TransitionFunction<K, S, I> transition) {
    this.initialState = Objects.requireNonNull(initialState, "initialState");
    this.initialStackSymbol = Objects.requireNonNull(initialStackSymbol, "initialStackSymbol");
    this.transition = Objects.requireNonNull(transition, "transition");
    this.stack = Stack.of(initialStackSymbol);
    this.state = initialState;
    this.input = new Stack<>();
    this.result = null;
  }

  /// Replace the remaining input. The first symbol of the list is consumed first. Any input still pending is
  /// discarded.
  public PushdownAutomaton<K, S, I> setInput(List<I> symbols) {
    checkNotStepping("setInput");
    this.input = Stack.fromInput(symbols);
    return this;
  }

  /// Run exactly one transition:
  ///
  /// 1. Read the top of the control stack which may be empty.
  /// 2. Query the transition function with the current state and that top.
  /// 3. If it answers `Pop` then pop one input symbol, which may be empty, and pass it to the continuation.
  ///    If it answers `Ignore` use the action it carries.
  /// 4. If the action is `Resolve` record the outcome and leave the stack and state as they are.
  /// 5. If the action is `Continue` apply its stack command to the control stack and move to its state.
  ///
  /// @return this automaton so that calls can be chained.
  /// @throws NullPointerException if the transition function or its continuation returns null.
  /// @throws IllegalStateException if called from within the transition function during a step.
  public PushdownAutomaton<K, S, I> step() {
    checkNotStepping("step");
    final var top = stack.peek();
    final var from = state;
    final AutomatonAction<K, S> action;
    stepping = true;
    try {
      final var decision = Objects.requireNonNull(transition.transition(from, top),
          () -> "transition function returned null for state=" + from + " top=" + top);
      action = Objects.requireNonNull(decision.decide(input),
          () -> "transition function gave a null action for state=" + from + " top=" + top);
    } finally {
      stepping = false;
    }

    if (action instanceof AutomatonAction.Resolve<K, S> resolve) {
      if (result != null && result != resolve.outcome()) {
        LOGGER.fine(() -> "resolved again with a different outcome: " + result + " -> " + resolve.outcome());
      }
      result = resolve.outcome();
      LOGGER.finest(() -> "step state=" + from + " top=" + top + " resolved " + resolve.outcome());
    } else {
      final var next = (AutomatonAction.Continue<K, S>) action;
      if (result != null) {
        LOGGER.fine(() -> "stepping an automaton that has already resolved " + result + " state=" + from);
      }
      stack.applyAction(next.stackAction());
      state = next.newState();
      LOGGER.finest(() -> "step state=" + from + " top=" + top + " -> " + next.stackAction() + " state=" + next.newState());
    }
    return this;
  }

  /// Put the automaton back to how it was when constructed. The transition function is kept even if it has been
  /// overridden.
  public PushdownAutomaton<K, S, I> reset() {
    checkNotStepping("reset");
    this.stack = Stack.of(initialStackSymbol);
    this.state = initialState;
    this.result = null;
    this.input = new Stack<>();
    return this;
  }

  public Optional<Outcome> result() {
    return Optional.ofNullable(result);
  }

  public boolean isResolved() {
    return result != null;
  }

  public S state() {
    return state;
  }

  public TransitionFunction<K, S, I> transitionFunction() {
    return transition;
  }

  public S initialState() {
    return initialState;
  }

  public K initialStackSymbol() {
    return initialStackSymbol;
  }

  /// @return an independent copy of the input not yet consumed. The top is the next symbol.
  public Stack<I> copyRemainingInput() {
    return input.copy();
  }

  /// @return an independent copy of the control stack.
  public Stack<K> copyStack() {
    return stack.copy();
  }

  public Optional<K> stackTop() {
    return stack.peek();
  }

  public Optional<I> inputTop() {
    return input.peek();
  }

  /// The live control stack. Changes made through it are seen by the next step.
  public Stack<K> rawStack() {
    checkNotStepping("rawStack");
    return stack;
  }

  /// The live input queue. Changes made through it are seen by the next step.
  public Stack<I> rawRemainingInput() {
    checkNotStepping("rawRemainingInput");
    return input;
  }

  /// Jump to a state without running the transition function.
  public PushdownAutomaton<K, S, I> overrideState(@NotNull S state) {
    this.state = Objects.requireNonNull(state, "state");
    return this;
  }

  /// Swap the transition function. Only later steps see the new one. [#reset()] does not undo this.
  public PushdownAutomaton<K, S, I> overrideTransitionFunction(@NotNull TransitionFunction<K, S, I> transition) {
    this.transition = Objects.requireNonNull(transition, "transition");
    return this;
  }

  /// Hand a new control stack to the automaton which now owns it.
  ///
  /// @return the control stack that was owned until now which the caller now owns.
  public Stack<K> replaceStack(@NotNull Stack<K> stack) {
    checkNotStepping("replaceStack");
    final var old = this.stack;
    this.stack = Objects.requireNonNull(stack, "stack");
    return old;
  }

  /// Hand a new input queue to the automaton which now owns it.
  ///
  /// @return the input queue that was owned until now which the caller now owns.
  public Stack<I> replaceInput(@NotNull Stack<I> input) {
    checkNotStepping("replaceInput");
    final var old = this.input;
    this.input = Objects.requireNonNull(input, "input");
    return old;
  }

  /// Apply a stack command to the control stack outside of a step.
  public <R> R runStackAction(StackAction<K, R> action) {
    checkNotStepping("runStackAction");
    return stack.applyAction(action);
  }

  /// Apply a stack command to the input queue outside of a step. Pushing puts a symbol in front of the pending input.
  public <R> R runInputAction(StackAction<I, R> action) {
    checkNotStepping("runInputAction");
    return input.applyAction(action);
  }

  /// Add symbols to the end of the input without discarding what is pending. They are consumed in list order after
  /// the pending input. The live input queue is updated in place.
  public PushdownAutomaton<K, S, I> appendInput(List<I> symbols) {
    checkNotStepping("appendInput");
    // build the appended queue first so that a null symbol leaves the pending input untouched
    final var appended = Stack.fromInput(symbols);
    final var pending = input.toList();
    input.clear();
    input.appendStack(appended);
    input.appendMany(pending);
    return this;
  }

  private void checkNotStepping(String operation) {
    if (stepping) {
      throw new IllegalStateException(operation + " called from within the transition function during a step");
    }
  }

  @Override
  public String toString() {
    return "PushdownAutomaton[state=" + state + ", stack=" + stack + ", input=" + input + ", result=" + result + "]";
  }
}
