// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown.demo;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EqualCountsTests {

  final EqualCounts recognizer = new EqualCounts();

  @Test
  public void testAcceptsEqualCounts() {
    assertTrue(recognizer.accepts(""));
    assertTrue(recognizer.accepts("ab"));
    assertTrue(recognizer.accepts("aaabbb"));
  }

  @Test
  public void testRejectsUnequalCounts() {
    assertFalse(recognizer.accepts("a"));
    assertFalse(recognizer.accepts("b"));
    assertFalse(recognizer.accepts("aab"));
    assertFalse(recognizer.accepts("abb"));
  }

  @Test
  public void testRejectsInterleaving() {
    assertFalse(recognizer.accepts("abab"));
    assertFalse(recognizer.accepts("ba"));
    assertFalse(recognizer.accepts("aabbab"));
  }

  @Test
  public void testRejectsSymbolsOutsideTheAlphabet() {
    assertFalse(recognizer.accepts("acb"));
  }
}
