// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown.action;

import com.github.pushdown.Stack;

import java.util.Objects;

/// The closed set of commands that may be applied to a [Stack]. The second type parameter is the type of the value
/// that applying the command yields. Only [Pop] yields a symbol, every other command yields `Void`, so the compiler
/// tracks which commands return a value:
///
/// ```java
/// String top = stack.applyAction(StackAction.pop("Z0"));
/// stack.applyAction(StackAction.push("P"));
///```
///
/// @param <T> The stack alphabet.
/// @param <R> The type of the value produced by applying the command.
public sealed interface StackAction<T, R> permits
    StackAction.Delete,
    StackAction.Push,
    StackAction.Pop,
    StackAction.Ignore,
    StackAction.Clear {

  /// Apply this command to the given stack. Callers normally go through [Stack#applyAction(StackAction)].
  R applyTo(Stack<T> stack);

  /// Discard the top symbol if there is one.
  record Delete<T>() implements StackAction<T, Void> {
    @Override
    public Void applyTo(Stack<T> stack) {
      stack.delete();
      return null;
    }
  }

  /// Push one symbol.
  ///
  /// @param item The symbol to push which must not be null.
  record Push<T>(T item) implements StackAction<T, Void> {
    public Push {
      Objects.requireNonNull(item, "item");
    }

    @Override
    public Void applyTo(Stack<T> stack) {
      stack.push(item);
      return null;
    }
  }

  /// Remove and return the top symbol else return the default when the stack is empty.
  ///
  /// @param defaultItem The value returned when the stack is empty.
  record Pop<T>(T defaultItem) implements StackAction<T, T> {
    @Override
    public T applyTo(Stack<T> stack) {
      return stack.pop().orElse(defaultItem);
    }
  }

  /// Leave the stack untouched.
  record Ignore<T>() implements StackAction<T, Void> {
    @Override
    public Void applyTo(Stack<T> stack) {
      return null;
    }
  }

  /// Remove every symbol.
  record Clear<T>() implements StackAction<T, Void> {
    @Override
    public Void applyTo(Stack<T> stack) {
      stack.clear();
      return null;
    }
  }

  static <T> Delete<T> delete() {
    return new Delete<>();
  }

  static <T> Push<T> push(T item) {
    return new Push<>(item);
  }

  static <T> Pop<T> pop(T defaultItem) {
    return new Pop<>(defaultItem);
  }

  static <T> Ignore<T> ignore() {
    return new Ignore<>();
  }

  static <T> Clear<T> clear() {
    return new Clear<>();
  }
}
