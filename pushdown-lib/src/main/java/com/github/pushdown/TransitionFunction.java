// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown;

import com.github.pushdown.action.AutomatonAction;
import com.github.pushdown.action.InputDecision;

import java.util.Optional;

/// The only source of domain semantics for a [PushdownAutomaton]. It is queried exactly once per
/// [PushdownAutomaton#step()] with the current state and the top of the control stack.
///
/// It must be total over the `(state, top)` pairs a caller intends to reach, including an empty top, and it must
/// decide itself when to resolve. The automaton does not check determinism or totality. Returning null is a
/// programming error.
///
/// @param <K> The stack alphabet.
/// @param <S> The state alphabet.
/// @param <I> The input alphabet.
@FunctionalInterface
public interface TransitionFunction<K, S, I> {
  InputDecision<I, AutomatonAction<K, S>> transition(S state, Optional<K> topOfStack);
}
