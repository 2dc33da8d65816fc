// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown.action;

import java.util.Objects;

/// What the automaton does once the transition function has decided on the input. Either it carries on with a stack
/// command and a next state, or it halts with an [Outcome].
///
/// @param <K> The stack alphabet.
/// @param <S> The state alphabet.
public sealed interface AutomatonAction<K, S> permits AutomatonAction.Continue, AutomatonAction.Resolve {

  /// Apply `stackAction` to the control stack and adopt `newState`.
  ///
  /// @param stackAction Any stack command. The value a [StackAction.Pop] yields is discarded.
  /// @param newState    The next state.
  record Continue<K, S>(StackAction<K, ?> stackAction, S newState) implements AutomatonAction<K, S> {
    public Continue {
      Objects.requireNonNull(stackAction, "stackAction");
      Objects.requireNonNull(newState, "newState");
    }
  }

  /// Halt with the given outcome. The control stack and state are left as they were.
  record Resolve<K, S>(Outcome outcome) implements AutomatonAction<K, S> {
    public Resolve {
      Objects.requireNonNull(outcome, "outcome");
    }
  }

  static <K, S> Continue<K, S> next(StackAction<K, ?> stackAction, S newState) {
    return new Continue<>(stackAction, newState);
  }

  static <K, S> Resolve<K, S> accept() {
    return new Resolve<>(Outcome.ACCEPT);
  }

  static <K, S> Resolve<K, S> reject() {
    return new Resolve<>(Outcome.REJECT);
  }
}
