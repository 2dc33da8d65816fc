// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown;

import com.github.pushdown.action.StackAction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// A last-in-first-out container of symbols. Only the top is ever read or written. An empty stack is never an error:
/// reading from one gives `Optional.empty()` which is the "absent" symbol that transition functions are given.
///
/// The same class is used for the control stack of a [PushdownAutomaton] and for its remaining input. For the input
/// the next symbol to be consumed is the top. See [#fromInput(List)].
///
/// Symbols must not be null. This class is not thread safe.
///
/// @param <T> The alphabet of the symbols held.
public final class Stack<T> {
  /// Bottom of the stack is index zero. The top is the last element.
  private final ArrayList<T> items;

  public Stack() {
    this.items = new ArrayList<>();
  }

  private Stack(ArrayList<T> items) {
    this.items = items;
  }

  /// Create a stack from a sequence where the last element is the top.
  public static <T> Stack<T> fromList(List<T> bottomToTop) {
    final var copy = new ArrayList<T>(bottomToTop.size());
    bottomToTop.forEach(item -> copy.add(Objects.requireNonNull(item, "item")));
    return new Stack<>(copy);
  }

  /// Create a stack from a sequence where the last element is the top.
  @SafeVarargs
  public static <T> Stack<T> of(T... bottomToTop) {
    return fromList(Arrays.asList(bottomToTop));
  }

  /// Create an input queue. The first element of `inOrder` is the top so it is the first one popped.
  public static <T> Stack<T> fromInput(List<T> inOrder) {
    final var reversed = new ArrayList<>(inOrder);
    Collections.reverse(reversed);
    return fromList(reversed);
  }

  public void push(T item) {
    items.add(Objects.requireNonNull(item, "item"));
  }

  /// @return the top symbol after removing it else empty if the stack is empty.
  public Optional<T> pop() {
    if (items.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(items.remove(items.size() - 1));
  }

  /// @return the top symbol without removing it else empty if the stack is empty.
  public Optional<T> peek() {
    if (items.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(items.get(items.size() - 1));
  }

  /// Pop and discard. A no-op on an empty stack.
  public void delete() {
    if (!items.isEmpty()) {
      items.remove(items.size() - 1);
    }
  }

  public void clear() {
    items.clear();
  }

  /// Push each symbol in order so the last one ends up on top. Same as calling [#push(Object)] repeatedly.
  public void appendMany(List<T> symbols) {
    symbols.forEach(this::push);
  }

  /// Push the contents of another stack bottom first so that its top becomes our top. The other stack is not changed.
  public void appendStack(Stack<T> other) {
    // copy first in case other == this
    appendMany(List.copyOf(other.items));
  }

  /// Exchange the top two symbols using only push and pop.
  ///
  /// @return false if there were fewer than two symbols in which case the stack is unchanged.
  public boolean swap() {
    final var first = pop();
    if (first.isEmpty()) {
      return false;
    }
    final var second = pop();
    if (second.isEmpty()) {
      push(first.get());
      return false;
    }
    push(first.get());
    push(second.get());
    return true;
  }

  /// @return an independent copy. Changes to the copy are not seen by this stack and vice versa.
  public Stack<T> copy() {
    return new Stack<>(new ArrayList<>(items));
  }

  /// Run one of the closed set of stack commands. This is the only way to run a command chosen at runtime.
  ///
  /// @return the popped symbol (or the default) for [StackAction.Pop] else null.
  public <R> R applyAction(StackAction<T, R> action) {
    return Objects.requireNonNull(action, "action").applyTo(this);
  }

  public int size() {
    return items.size();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  /// @return an immutable snapshot ordered bottom to top.
  public List<T> toList() {
    return List.copyOf(items);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Stack<?> other)) return false;
    return items.equals(other.items);
  }

  @Override
  public int hashCode() {
    return items.hashCode();
  }

  @Override
  public String toString() {
    return "Stack" + items;
  }
}
