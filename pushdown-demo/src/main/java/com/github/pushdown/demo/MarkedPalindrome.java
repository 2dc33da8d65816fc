// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown.demo;

import com.github.pushdown.PushdownAutomaton;
import com.github.pushdown.TransitionFunction;
import com.github.pushdown.action.AutomatonAction;
import com.github.pushdown.action.InputDecision;
import com.github.pushdown.action.StackAction;

import java.util.Optional;

/// Recognises `w c reverse(w)` where `w` is over `{a, b}`, for example `abcba`. The stack alphabet is the input
/// alphabet plus the bottom marker `$`.
public class MarkedPalindrome implements Recognizer {

  public enum State {READING, MATCHING}

  public static final char BOTTOM = '$';

  public static final TransitionFunction<Character, State, Character> TRANSITION =
      (state, top) -> InputDecision.read(next -> switch (state) {
        case READING -> reading(next);
        case MATCHING -> matching(top, next);
      });

  private static AutomatonAction<Character, State> reading(Optional<Character> next) {
    if (next.isEmpty()) {
      // never saw the centre marker
      return AutomatonAction.reject();
    }
    final char c = next.get();
    if (c == 'a' || c == 'b') {
      return AutomatonAction.next(StackAction.push(c), State.READING);
    }
    if (c == 'c') {
      return AutomatonAction.next(StackAction.ignore(), State.MATCHING);
    }
    return AutomatonAction.reject();
  }

  private static AutomatonAction<Character, State> matching(Optional<Character> top, Optional<Character> next) {
    if (next.isEmpty()) {
      return top.filter(t -> t == BOTTOM).isPresent() ? AutomatonAction.accept() : AutomatonAction.reject();
    }
    final char c = next.get();
    if ((c == 'a' || c == 'b') && top.filter(t -> t == c).isPresent()) {
      return AutomatonAction.next(StackAction.delete(), State.MATCHING);
    }
    return AutomatonAction.reject();
  }

  @Override
  public String name() {
    return "palindrome";
  }

  @Override
  public PushdownAutomaton<Character, State, Character> newAutomaton() {
    return new PushdownAutomaton<>(State.READING, BOTTOM, TRANSITION);
  }
}
