package com.github.hdlfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import com.github.hdlfsm.FsmException.Code;
import com.github.hdlfsm.expression.Symbol;

/**
 * Immutable snapshot of a machine, ready for the template that assembles the hdl source file. It
 * carries names and lowered condition text only, never references back into the live model, so
 * later edits to states or transitions don't leak into a generation in progress.
 *
 * Build it through {@link FiniteStateMachine#toHdlModel(GenerationConfiguration)}.
 */
public final class HdlModel {
  private final String entityName;
  private final boolean testbench;
  private final List<String> stateNames;
  private final String defaultStateName;
  private final List<String> inputs;
  private final List<String> outputs;
  private final Map<String, Map<String, Integer>> stateOutputs;
  private final List<HdlTransition> transitions;

  private HdlModel(final GenerationConfiguration config, final List<String> stateNames,
      final String defaultStateName, final List<String> inputs, final List<String> outputs,
      final Map<String, Map<String, Integer>> stateOutputs, final List<HdlTransition> transitions) {
    this.entityName = config.getEntityName();
    this.testbench = config.isTestbench();
    this.stateNames = Collections.unmodifiableList(stateNames);
    this.defaultStateName = defaultStateName;
    this.inputs = Collections.unmodifiableList(inputs);
    this.outputs = Collections.unmodifiableList(outputs);
    this.stateOutputs = Collections.unmodifiableMap(stateOutputs);
    this.transitions = Collections.unmodifiableList(transitions);
  }

  /**
   * Validate the machine against the configuration and snapshot it. Names must be valid
   * identifiers, transitions may only connect registered states and every condition must lower.
   * State names must be unique even when the state set check is off, the template addresses states
   * by name only.
   */
  static HdlModel assemble(final FiniteStateMachine machine, final GenerationConfiguration config)
      throws FsmException {
    final StateSet states = machine.getStates();
    final State defaultState = machine.getDefaultState().orElse(null);

    if (config.isRequireValidStates() && !states.isValid()) {
      throw new FsmException(Code.INVALID_STATES, states.describeProblems());
    }
    if (config.isRequireDefaultState() && defaultState == null) {
      throw new FsmException(Code.MISSING_DEFAULT_STATE);
    }
    if (defaultState != null && !states.contains(defaultState)) {
      throw new FsmException(Code.INVALID_STATE,
          "Default state " + defaultState.getName() + " is not registered with the machine");
    }
    if (config.isRequireReachability()) {
      machine.getTransitions().checkReachability();
    }

    for (final Map.Entry<String, Integer> name : states.getNames().entrySet()) {
      if (name.getValue() > 1) {
        throw new FsmException(Code.INVALID_STATES,
            String.format("%d states are named %s, hdl state names must be unique",
                name.getValue(), name.getKey()));
      }
    }

    final List<String> stateNames = new ArrayList<>(states.size());
    final Map<String, Map<String, Integer>> stateOutputs = new LinkedHashMap<>();
    for (final State state : states) {
      stateNames.add(HdlIdentifier.check(state.getName(), "State name"));
      stateOutputs.put(state.getName(), state.getOutputs());
    }

    final List<String> outputs = new ArrayList<>();
    for (final String output : new TreeSet<>(machine.getOutputs().keySet())) {
      outputs.add(HdlIdentifier.check(output, "Output name"));
    }

    final List<String> inputs = new ArrayList<>();
    for (final Symbol input : machine.getInputs()) {
      inputs.add(input.getName());
    }

    final List<HdlTransition> transitions = new ArrayList<>(machine.getTransitions().size());
    for (final Transition transition : machine.getTransitions()) {
      if (!states.contains(transition.getSource())
          || !states.contains(transition.getDestination())) {
        throw new FsmException(Code.INVALID_STATE,
            transition + " references a state that is not registered with the machine");
      }
      transitions.add(new HdlTransition(transition.getSource().getName(),
          transition.getDestination().getName(), transition.getVhdl()));
    }

    return new HdlModel(config, stateNames,
        defaultState == null ? null : defaultState.getName(), inputs, outputs, stateOutputs,
        transitions);
  }

  public String getEntityName() {
    return entityName;
  }

  public boolean isTestbench() {
    return testbench;
  }

  public List<String> getStateNames() {
    return stateNames;
  }

  /**
   * Null when the machine has no default state.
   */
  public String getDefaultStateName() {
    return defaultStateName;
  }

  public List<String> getInputs() {
    return inputs;
  }

  public List<String> getOutputs() {
    return outputs;
  }

  public Map<String, Map<String, Integer>> getStateOutputs() {
    return stateOutputs;
  }

  public List<HdlTransition> getTransitions() {
    return transitions;
  }

  @Override
  public String toString() {
    return "HdlModel [entityName=" + entityName + ", testbench=" + testbench + ", stateNames="
        + stateNames + ", defaultStateName=" + defaultStateName + ", inputs=" + inputs
        + ", outputs=" + outputs + ", transitions=" + transitions + "]";
  }

  /**
   * One transition of the snapshot: endpoint names plus the lowered condition.
   */
  public static final class HdlTransition {
    private final String source;
    private final String destination;
    private final String condition;

    HdlTransition(final String source, final String destination, final String condition) {
      this.source = source;
      this.destination = destination;
      this.condition = condition;
    }

    public String getSource() {
      return source;
    }

    public String getDestination() {
      return destination;
    }

    public String getCondition() {
      return condition;
    }

    @Override
    public String toString() {
      return source + " -> " + destination + " when " + condition;
    }
  }
}
