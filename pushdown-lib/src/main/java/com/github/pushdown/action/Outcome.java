// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown.action;

/// The terminal result of a run. An automaton that has not resolved has no outcome at all which is modelled as an
/// empty `Optional<Outcome>` rather than a third constant.
public enum Outcome {
  ACCEPT,
  REJECT;

  public boolean accepted() {
    return this == ACCEPT;
  }
}
