// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown.action;

import com.github.pushdown.Stack;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/// Whether a step consumes an input symbol before the action is known. A transition function that needs to look at
/// the next input answers [Pop] with a continuation. One that does not answers [Ignore] with the action itself.
///
/// @param <I> The input alphabet.
/// @param <A> The type of the action, which for an automaton is an [AutomatonAction].
public sealed interface InputDecision<I, A> permits InputDecision.Pop, InputDecision.Ignore {

  /// Resolve this decision against the input queue. Only [Pop] touches the queue.
  ///
  /// @param input The remaining input.
  /// @return The action to perform.
  A decide(Stack<I> input);

  /// Pop one symbol from the input and hand it to the continuation. The continuation is given `Optional.empty()`
  /// when there is no input left.
  record Pop<I, A>(Function<Optional<I>, A> continuation) implements InputDecision<I, A> {
    public Pop {
      Objects.requireNonNull(continuation, "continuation");
    }

    @Override
    public A decide(Stack<I> input) {
      return continuation.apply(input.pop());
    }
  }

  /// Leave the input queue alone.
  record Ignore<I, A>(A action) implements InputDecision<I, A> {
    public Ignore {
      Objects.requireNonNull(action, "action");
    }

    @Override
    public A decide(Stack<I> input) {
      return action;
    }
  }

  static <I, A> Pop<I, A> read(Function<Optional<I>, A> continuation) {
    return new Pop<>(continuation);
  }

  static <I, A> Ignore<I, A> skip(A action) {
    return new Ignore<>(action);
  }
}
