package com.github.hdlfsm;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A set that can only hold states. States do not have to be uniquely named, nor do they have to
 * carry the same outputs as one another; {@link #isValid()} reports whether they do.
 */
public final class StateSet extends FilteredSet<State> {

  public StateSet() {
    this(null);
  }

  public StateSet(final Iterable<? extends State> states) {
    super(State.class, states);
  }

  /**
   * The state(s) named stateName. Empty when there is none, more than one when names clash.
   */
  public StateSet get(final String stateName) {
    final StateSet matches = new StateSet();
    for (final State state : this) {
      if (state.getName().equals(stateName)) {
        matches.add(state);
      }
    }
    return matches;
  }

  /**
   * Remove every state named stateName, returning whether anything was removed.
   */
  public boolean removeNamed(final String stateName) {
    boolean removed = false;
    final Iterator<State> iterator = iterator();
    while (iterator.hasNext()) {
      if (iterator.next().getName().equals(stateName)) {
        iterator.remove();
        removed = true;
      }
    }
    return removed;
  }

  /**
   * Members of this set that are not members of other.
   */
  public StateSet minus(final StateSet other) {
    final StateSet difference = new StateSet();
    for (final State state : this) {
      if (!other.contains(state)) {
        difference.add(state);
      }
    }
    return difference;
  }

  /**
   * State name to the number of member states carrying it.
   */
  public Map<String, Integer> getNames() {
    final Map<String, Integer> names = new LinkedHashMap<>();
    for (final State state : this) {
      increment(names, state.getName());
    }
    return Collections.unmodifiableMap(names);
  }

  /**
   * Output name to the number of member states carrying it.
   */
  public Map<String, Integer> getOutputs() {
    final Map<String, Integer> outputs = new LinkedHashMap<>();
    for (final State state : this) {
      for (final String outputName : state.getOutputIdentifiers()) {
        increment(outputs, outputName);
      }
    }
    return Collections.unmodifiableMap(outputs);
  }

  /**
   * Whether every state is uniquely named and every output name appears on every state.
   */
  public boolean isValid() {
    return describeProblems().isEmpty();
  }

  /**
   * The reasons {@link #isValid()} fails, empty when valid.
   */
  String describeProblems() {
    final StringBuilder problems = new StringBuilder();
    for (final Map.Entry<String, Integer> name : getNames().entrySet()) {
      if (name.getValue() > 1) {
        problems.append(String.format("%d states are named %s. ", name.getValue(), name.getKey()));
      }
    }
    for (final Map.Entry<String, Integer> output : getOutputs().entrySet()) {
      if (output.getValue() != size()) {
        problems.append(String.format("Output %s is set on %d of %d states. ", output.getKey(),
            output.getValue(), size()));
      }
    }
    return problems.toString().trim();
  }

  private static void increment(final Map<String, Integer> counts, final String key) {
    final Integer count = counts.get(key);
    counts.put(key, count == null ? 1 : count + 1);
  }
}
