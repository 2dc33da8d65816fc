// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown.demo;

import com.github.pushdown.AutomatonEngine;
import com.github.pushdown.PushdownAutomaton;
import com.github.pushdown.RunResult;

import java.util.List;

/// A language over characters recognised by a pushdown automaton. Each call to [#newAutomaton()] gives a fresh
/// automaton so recognizers can be used from many threads.
public interface Recognizer {

  /// The name used on the command line.
  String name();

  PushdownAutomaton<?, ?, Character> newAutomaton();

  default RunResult<?> run(String word) {
    return run(newAutomaton(), word);
  }

  default boolean accepts(String word) {
    return run(word).accepted();
  }

  static <K, S> RunResult<S> run(PushdownAutomaton<K, S, Character> automaton, String word) {
    final var symbols = symbols(word);
    // all the recognizers here consume a symbol on every step plus one more step to see the end of input
    return new AutomatonEngine<>(automaton, 2L * symbols.size() + 2).run(symbols);
  }

  static List<Character> symbols(String word) {
    return word.chars().mapToObj(c -> (char) c).toList();
  }
}
