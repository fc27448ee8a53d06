package com.github.hdlfsm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.github.hdlfsm.FsmException.Code;

/**
 * A Moore machine state: a name plus the boolean outputs driven while the machine is in it.
 *
 * States are entities. Each instance gets its own id and equality is by that id, so two states with
 * the same name and outputs are still different states. Name uniqueness is only checked at the set
 * level, see {@link StateSet#isValid()}.
 *
 * Outputs are never edited in place: {@link #setOutputs(Map)} and {@link #setOutput(String, Object)}
 * validate and then swap in a new map.
 */
public final class State {
  // auto-generated
  private final String id = UUID.randomUUID().toString();

  private String name;
  private Map<String, Integer> outputs = Collections.emptyMap();
  private boolean defaultState;

  public State(final String name) throws FsmException {
    setName(name);
  }

  public State(final String name, final Map<String, ?> outputs) throws FsmException {
    setName(name);
    setOutputs(outputs);
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public void setName(final String name) throws FsmException {
    if (name == null || name.trim().isEmpty()) {
      throw new FsmException(Code.INVALID_STATE_NAME);
    }
    this.name = name;
  }

  /**
   * Output name to 0 or 1, in insertion order. The returned map is read-only.
   */
  public Map<String, Integer> getOutputs() {
    return outputs;
  }

  public Set<String> getOutputIdentifiers() {
    return outputs.keySet();
  }

  public Integer getOutput(final String outputName) {
    return outputs.get(outputName);
  }

  /**
   * Replace all outputs. Values must be one of 0, "0", false, 1, "1", true. Nothing changes if any
   * entry is rejected.
   */
  public void setOutputs(final Map<String, ?> newOutputs) throws FsmException {
    final Map<String, Integer> validated = new LinkedHashMap<>();
    if (newOutputs != null) {
      for (final Map.Entry<String, ?> output : newOutputs.entrySet()) {
        validated.put(checkOutputName(output.getKey()), BitValues.coerce(output.getValue()));
      }
    }
    this.outputs = Collections.unmodifiableMap(validated);
  }

  public void setOutput(final String outputName, final Object value) throws FsmException {
    final Map<String, Integer> updated = new LinkedHashMap<>(outputs);
    updated.put(checkOutputName(outputName), BitValues.coerce(value));
    this.outputs = Collections.unmodifiableMap(updated);
  }

  public boolean isDefault() {
    return defaultState;
  }

  public void setDefault(final boolean defaultState) {
    this.defaultState = defaultState;
  }

  private static String checkOutputName(final String outputName) throws FsmException {
    if (outputName == null || outputName.trim().isEmpty()) {
      throw new FsmException(Code.INVALID_OUTPUT_NAME);
    }
    return outputName;
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return id.equals(((State) obj).id);
  }

  @Override
  public String toString() {
    return "State [name=" + name + ", outputs=" + outputs + ", default=" + defaultState + "]";
  }
}
