// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown.demo;

import com.github.pushdown.PushdownAutomaton;
import com.github.pushdown.TransitionFunction;
import com.github.pushdown.action.AutomatonAction;
import com.github.pushdown.action.InputDecision;
import com.github.pushdown.action.StackAction;

import java.util.Optional;

/// Recognises balanced parentheses such as `(()())`. There is one state. Every `(` pushes a marker and every `)`
/// deletes one. The input is accepted when it runs out with only the bottom marker left on the stack.
public class BalancedParentheses implements Recognizer {

  public enum State {Q}

  public enum Symbol {
    /// bottom marker
    Z0,
    /// an open parenthesis not yet closed
    P
  }

  public static final TransitionFunction<Symbol, State, Character> TRANSITION =
      (state, top) -> InputDecision.read(next -> onInput(top, next));

  private static AutomatonAction<Symbol, State> onInput(Optional<Symbol> top, Optional<Character> next) {
    if (next.isEmpty()) {
      return top.filter(Symbol.Z0::equals).isPresent() ? AutomatonAction.accept() : AutomatonAction.reject();
    }
    final char c = next.get();
    if (c == '(') {
      return AutomatonAction.next(StackAction.push(Symbol.P), State.Q);
    }
    if (c == ')' && top.filter(Symbol.P::equals).isPresent()) {
      return AutomatonAction.next(StackAction.delete(), State.Q);
    }
    // a close with nothing open or a symbol outside the alphabet
    return AutomatonAction.reject();
  }

  @Override
  public String name() {
    return "parens";
  }

  @Override
  public PushdownAutomaton<Symbol, State, Character> newAutomaton() {
    return new PushdownAutomaton<>(State.Q, Symbol.Z0, TRANSITION);
  }
}
