/// This package contains a generic pushdown automaton that is stepped one transition at a time by its caller.
///
/// Key classes and interfaces in this package:
/// - `Stack`: A last-in-first-out container of symbols used both as the control stack and as the remaining input.
///   An empty stack yields `Optional.empty()` rather than throwing.
/// - `TransitionFunction`: Supplied by the caller. It maps the current state and the top of the control stack to an
///   `InputDecision`. It is the only place that knows anything about a concrete language.
/// - `PushdownAutomaton`: Owns the two stacks, the state, the transition function and the outcome. Each `step()`
///   queries the transition function once and applies at most one stack command.
/// - `AutomatonEngine`: A host loop that resets, loads input and steps an automaton until it resolves or a step
///   budget runs out. It serializes access with a mutex and marks itself crashed if the transition function throws.
///
/// The closed set of commands a transition function can return live in [com.github.pushdown.action].
///
/// Logging is to JUL through `PushdownLogger`. You can configure JUL logging to bridge to your chosen logging framework.
package com.github.pushdown;
