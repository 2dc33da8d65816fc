// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown.demo;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MarkedPalindromeTests {

  final MarkedPalindrome recognizer = new MarkedPalindrome();

  @Test
  public void testAcceptsMarkedPalindromes() {
    assertTrue(recognizer.accepts("c"));
    assertTrue(recognizer.accepts("aca"));
    assertTrue(recognizer.accepts("abbcbba"));
  }

  @Test
  public void testRejects() {
    assertFalse(recognizer.accepts(""));
    assertFalse(recognizer.accepts("aba"));
    assertFalse(recognizer.accepts("abcab"));
    assertFalse(recognizer.accepts("abcb"));
    assertFalse(recognizer.accepts("acaa"));
    assertFalse(recognizer.accepts("acca"));
  }

  @Test
  public void testCentreMarkerLeavesTheStackAlone() {
    final var automaton = recognizer.newAutomaton();
    automaton.setInput(java.util.List.of('a', 'c', 'a'));
    automaton.step();
    final var afterA = automaton.copyStack();
    automaton.step();
    assertEquals(afterA, automaton.copyStack());
    assertEquals(MarkedPalindrome.State.MATCHING, automaton.state());
  }
}
