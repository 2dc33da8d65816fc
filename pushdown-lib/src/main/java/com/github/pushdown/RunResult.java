// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown;

import com.github.pushdown.action.Outcome;

import java.util.Objects;
import java.util.Optional;

/// The result of driving an automaton with [AutomatonEngine#run(java.util.List)].
///
/// @param outcome         The outcome if the transition function resolved, else empty.
/// @param steps           The number of steps taken including the one that resolved.
/// @param finalState      The state the automaton was in when the run stopped.
/// @param budgetExhausted True if the run stopped because it hit the step budget without resolving.
public record RunResult<S>(Optional<Outcome> outcome, long steps, S finalState, boolean budgetExhausted) {
  public RunResult {
    Objects.requireNonNull(outcome, "outcome");
  }

  public boolean accepted() {
    return outcome.map(Outcome::accepted).orElse(false);
  }
}
