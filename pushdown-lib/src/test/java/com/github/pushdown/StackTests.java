// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown;

import com.github.pushdown.action.StackAction;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StackTests {

  @Test
  public void testEmptyStackGivesAbsentRatherThanThrowing() {
    final var stack = new Stack<String>();
    assertEquals(Optional.empty(), stack.pop());
    assertEquals(Optional.empty(), stack.peek());
    stack.delete();
    assertTrue(stack.isEmpty());
  }

  @Test
  public void testLastElementOfListIsTheTop() {
    final var stack = Stack.fromList(List.of("bottom", "middle", "top"));
    assertEquals(Optional.of("top"), stack.peek());
    assertEquals(Optional.of("top"), stack.pop());
    assertEquals(Optional.of("middle"), stack.pop());
    assertEquals(Optional.of("bottom"), stack.pop());
    assertEquals(Optional.empty(), stack.pop());
  }

  @Test
  public void testFromInputPopsInListOrder() {
    final var input = Stack.fromInput(List.of('(', ')', ')'));
    assertEquals(Optional.of('('), input.pop());
    assertEquals(Optional.of(')'), input.pop());
    assertEquals(Optional.of(')'), input.pop());
    assertTrue(input.isEmpty());
  }

  @Test
  public void testPeekDoesNotRemove() {
    final var stack = Stack.of(1, 2);
    assertEquals(Optional.of(2), stack.peek());
    assertEquals(Optional.of(2), stack.peek());
    assertEquals(2, stack.size());
  }

  @Test
  public void testAppendManyIsRepeatedPush() {
    final var appended = Stack.of(0);
    appended.appendMany(List.of(1, 2, 3));

    final var pushed = Stack.of(0);
    pushed.push(1);
    pushed.push(2);
    pushed.push(3);

    assertEquals(pushed, appended);
    assertThat(appended.toList()).containsExactly(0, 1, 2, 3);
  }

  @Test
  public void testAppendStackKeepsTheOtherStack() {
    final var stack = Stack.of("a");
    final var other = Stack.of("b", "c");
    stack.appendStack(other);
    assertThat(stack.toList()).containsExactly("a", "b", "c");
    assertThat(other.toList()).containsExactly("b", "c");
  }

  @Test
  public void testAppendStackToItself() {
    final var stack = Stack.of("a", "b");
    stack.appendStack(stack);
    assertThat(stack.toList()).containsExactly("a", "b", "a", "b");
  }

  @Test
  public void testCopyIsIndependent() {
    final var original = Stack.of("x", "y");
    final var copy = original.copy();
    assertEquals(original, copy);

    copy.push("z");
    original.delete();

    assertThat(original.toList()).containsExactly("x");
    assertThat(copy.toList()).containsExactly("x", "y", "z");
  }

  @Test
  public void testSwapExchangesTopTwo() {
    final var stack = Stack.of(1, 2, 3);
    assertTrue(stack.swap());
    assertThat(stack.toList()).containsExactly(1, 3, 2);
  }

  @Test
  public void testSwapNeedsTwoSymbols() {
    final var single = Stack.of(1);
    assertFalse(single.swap());
    assertThat(single.toList()).containsExactly(1);

    final var empty = new Stack<Integer>();
    assertFalse(empty.swap());
    assertTrue(empty.isEmpty());
  }

  @Test
  public void testPopActionOnEmptyGivesDefault() {
    final var stack = new Stack<String>();
    final String popped = stack.applyAction(StackAction.pop("default"));
    assertEquals("default", popped);
    assertTrue(stack.isEmpty());
  }

  @Test
  public void testPopActionRemovesTop() {
    final var stack = Stack.of("a", "b");
    final String popped = stack.applyAction(StackAction.pop("default"));
    assertEquals("b", popped);
    assertThat(stack.toList()).containsExactly("a");
  }

  @Test
  public void testCommandsOtherThanPopYieldNothing() {
    final var stack = Stack.of("a", "b");
    assertNull(stack.applyAction(StackAction.push("c")));
    assertThat(stack.toList()).containsExactly("a", "b", "c");
    assertNull(stack.applyAction(StackAction.delete()));
    assertThat(stack.toList()).containsExactly("a", "b");
    assertNull(stack.applyAction(StackAction.ignore()));
    assertThat(stack.toList()).containsExactly("a", "b");
    assertNull(stack.applyAction(StackAction.clear()));
    assertTrue(stack.isEmpty());
  }

  @Test
  public void testNullSymbolsAreRejected() {
    final var stack = new Stack<String>();
    assertThrows(NullPointerException.class, () -> stack.push(null));
    assertThrows(NullPointerException.class, () -> StackAction.push(null));
    assertThrows(NullPointerException.class, () -> Stack.fromList(java.util.Arrays.asList("a", null)));
  }
}
