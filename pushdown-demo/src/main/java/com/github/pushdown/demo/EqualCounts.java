// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown.demo;

import com.github.pushdown.PushdownAutomaton;
import com.github.pushdown.TransitionFunction;
import com.github.pushdown.action.AutomatonAction;
import com.github.pushdown.action.InputDecision;
import com.github.pushdown.action.StackAction;

import java.util.Optional;

/// Recognises `a^n b^n` for `n >= 0`. While pushing each `a` pushes a marker. The first `b` moves to popping where
/// each `b` deletes a marker and any `a` rejects.
public class EqualCounts implements Recognizer {

  public enum State {PUSHING, POPPING}

  public enum Symbol {Z0, A}

  public static final TransitionFunction<Symbol, State, Character> TRANSITION =
      (state, top) -> InputDecision.read(next -> onInput(state, top, next));

  private static AutomatonAction<Symbol, State> onInput(State state, Optional<Symbol> top, Optional<Character> next) {
    final var counted = top.filter(Symbol.A::equals).isPresent();
    if (next.isEmpty()) {
      return counted ? AutomatonAction.reject() : AutomatonAction.accept();
    }
    final char c = next.get();
    if (c == 'a' && state == State.PUSHING) {
      return AutomatonAction.next(StackAction.push(Symbol.A), State.PUSHING);
    }
    if (c == 'b' && counted) {
      return AutomatonAction.next(StackAction.delete(), State.POPPING);
    }
    return AutomatonAction.reject();
  }

  @Override
  public String name() {
    return "anbn";
  }

  @Override
  public PushdownAutomaton<Symbol, State, Character> newAutomaton() {
    return new PushdownAutomaton<>(State.PUSHING, Symbol.Z0, TRANSITION);
  }
}
