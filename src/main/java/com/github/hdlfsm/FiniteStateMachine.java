package com.github.hdlfsm;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.hdlfsm.FsmException.Code;
import com.github.hdlfsm.expression.Symbol;

/**
 * A Moore finite state machine: states carrying outputs, transitions guarded by conditions and one
 * optional default state. Outputs depend on the current state only.
 *
 * Notes for users:<br>
 * 1. this is a static model, it is never stepped or clocked. It exists to be analysed and handed to
 * an hdl template through {@link #toHdlModel(GenerationConfiguration)}.<br>
 *
 * 2. states and transitions are created by the caller and registered by reference. The machine
 * never copies them, so later edits to a state's outputs or a transition's condition show up
 * here.<br>
 *
 * 3. this instance is not thread-safe. Callers sharing a machine across threads have to serialize
 * access themselves.<br>
 *
 * 4. uniqueness of state names and of the default state is the caller's business. Use
 * {@link StateSet#isValid()} or let {@link #toHdlModel(GenerationConfiguration)} enforce it.<br>
 */
public final class FiniteStateMachine {
  private static final Logger logger =
      LogManager.getLogger(FiniteStateMachine.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();

  private final StateSet states;
  private final TransitionSet transitions;
  private State defaultState;

  public FiniteStateMachine() {
    this(null, null);
  }

  public FiniteStateMachine(final Iterable<? extends State> states,
      final Iterable<? extends Transition> transitions) {
    this.states = new StateSet(states);
    this.transitions = new TransitionSet(transitions);
    logDebug(machineId, "Created machine with " + this.states.size() + " states and "
        + this.transitions.size() + " transitions");
  }

  public String getId() {
    return machineId;
  }

  public StateSet getStates() {
    return states;
  }

  public TransitionSet getTransitions() {
    return transitions;
  }

  public Optional<State> getDefaultState() {
    return Optional.ofNullable(defaultState);
  }

  /**
   * Every symbol used by any transition condition.
   */
  public Set<Symbol> getInputs() {
    return transitions.getConditions().getInputs();
  }

  /**
   * Output name to the number of states carrying it.
   */
  public Map<String, Integer> getOutputs() {
    return states.getOutputs();
  }

  public void addState(final State state) throws FsmException {
    addState(state, false);
  }

  /**
   * Register a state. When default is set the state becomes the machine's default state and gets
   * its own default flag raised. A previous default is replaced but keeps its flag.
   */
  public void addState(final State state, final boolean isDefault) throws FsmException {
    if (state == null) {
      throw new FsmException(Code.INVALID_STATE);
    }
    states.add(state);
    if (isDefault) {
      if (defaultState != null && defaultState != state) {
        logWarning(machineId, "Default state " + defaultState.getName() + " replaced by "
            + state.getName());
      }
      defaultState = state;
      state.setDefault(true);
    }
    logDebug(machineId, "Added " + state);
  }

  /**
   * The state(s) named name. Names are not guaranteed unique, so the result may hold zero, one or
   * several states.
   */
  public StateSet getState(final String name) {
    return states.get(name);
  }

  /**
   * Register a transition. Transitions with the same endpoints and condition are all kept as long as
   * they are different instances.
   */
  public void addTransition(final Transition transition) throws FsmException {
    if (transition == null) {
      throw new FsmException(Code.INVALID_STATE, "Null transition is invalid");
    }
    transitions.add(transition);
    logDebug(machineId, "Added " + transition);
  }

  /**
   * Validate this machine against the configuration and snapshot it for the hdl template.
   */
  public HdlModel toHdlModel(final GenerationConfiguration config) throws FsmException {
    try {
      final HdlModel model = HdlModel.assemble(this, config);
      logInfo(machineId, String.format("Built hdl model for entity %s: %d states, %d transitions",
          model.getEntityName(), model.getStateNames().size(), model.getTransitions().size()));
      return model;
    } catch (FsmException problem) {
      logWarning(machineId, "Failed to build hdl model: " + problem.getMessage());
      throw problem;
    }
  }

  @Override
  public String toString() {
    return "FiniteStateMachine [machineId=" + machineId + ", states=" + states.getNames().keySet()
        + ", transitions=" + transitions.size() + ", defaultState="
        + (defaultState == null ? null : defaultState.getName()) + "]";
  }

  private static void logWarning(final String machineId, final String message) {
    logger.warn(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logInfo(final String machineId, final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String machineId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("] ")
          .append(message).toString());
    }
  }
}
