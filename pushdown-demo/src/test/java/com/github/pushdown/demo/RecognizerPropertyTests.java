// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown.demo;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

/// Property tests that compare each recognizer with a direct check of the language it recognises.
public class RecognizerPropertyTests {

  final BalancedParentheses parens = new BalancedParentheses();
  final EqualCounts anbn = new EqualCounts();
  final MarkedPalindrome palindrome = new MarkedPalindrome();

  @Property
  void parensMatchesACounter(@ForAll("parenWords") String word) {
    int depth = 0;
    boolean balanced = true;
    for (char c : word.toCharArray()) {
      depth += c == '(' ? 1 : -1;
      if (depth < 0) {
        balanced = false;
        break;
      }
    }
    balanced = balanced && depth == 0;
    assert parens.accepts(word) == balanced : word;
  }

  @Property
  void anbnAcceptsEqualBlocks(@ForAll @IntRange(max = 30) int n) {
    assert anbn.accepts("a".repeat(n) + "b".repeat(n));
  }

  @Property
  void anbnRejectsUnequalBlocks(@ForAll @IntRange(max = 30) int n, @ForAll @IntRange(max = 30) int m) {
    Assume.that(n != m);
    assert !anbn.accepts("a".repeat(n) + "b".repeat(m));
  }

  @Property
  void palindromeAcceptsMirroredWords(@ForAll("abWords") String w) {
    assert palindrome.accepts(w + "c" + new StringBuilder(w).reverse());
  }

  @Property
  void palindromeMatchesADirectCheck(@ForAll("abWords") String left, @ForAll("abWords") String right) {
    final var expected = new StringBuilder(left).reverse().toString().equals(right);
    assert palindrome.accepts(left + "c" + right) == expected;
  }

  @Provide
  @SuppressWarnings("unused")
  Arbitrary<String> parenWords() {
    return Arbitraries.strings().withChars('(', ')').ofMaxLength(20);
  }

  @Provide
  @SuppressWarnings("unused")
  Arbitrary<String> abWords() {
    return Arbitraries.strings().withChars('a', 'b').ofMaxLength(12);
  }
}
