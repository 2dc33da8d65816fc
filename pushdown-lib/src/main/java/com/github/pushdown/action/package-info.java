/// The action algebra of the automaton. Each type is a sealed interface of records so that the set of commands is
/// closed:
///
/// ```
/// InputDecision<I, A>
/// ├── Pop       pop one input symbol, which may be absent, and pass it to a continuation
/// └── Ignore    leave the input alone and use the action given
///
/// AutomatonAction<K, S>
/// ├── Continue  apply a StackAction to the control stack and move to a new state
/// └── Resolve   halt with an Outcome of ACCEPT or REJECT
///
/// StackAction<T, R>
/// ├── Delete    discard the top
/// ├── Push      push one symbol
/// ├── Pop       remove and return the top else a default (R = T)
/// ├── Ignore    do nothing
/// └── Clear     remove everything
///```
package com.github.pushdown.action;
