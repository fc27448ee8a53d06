package com.github.hdlfsm;

import java.util.UUID;

import com.github.hdlfsm.FsmException.Code;

/**
 * A directed edge between two states, taken when its condition holds. The transition references
 * its states, it does not own them. Like states, transitions are entities with their own id, so two
 * transitions with the same endpoints and condition are still distinct.
 */
public final class Transition {
  // auto-generated
  private final String id = UUID.randomUUID().toString();

  private final State source;
  private final State destination;
  private Condition condition;

  public Transition(final State source, final State destination, final Condition condition)
      throws FsmException {
    if (source == null || destination == null) {
      throw new FsmException(Code.INVALID_STATE);
    }
    this.source = source;
    this.destination = destination;
    setCondition(condition);
  }

  public Transition(final State source, final State destination, final String condition)
      throws FsmException {
    this(source, destination, new Condition(condition));
  }

  public String getId() {
    return id;
  }

  public State getSource() {
    return source;
  }

  public State getDestination() {
    return destination;
  }

  public Condition getCondition() {
    return condition;
  }

  public void setCondition(final Condition condition) throws FsmException {
    if (condition == null) {
      throw new FsmException(Code.INVALID_STATE, "Transition condition cannot be null");
    }
    this.condition = condition;
  }

  /**
   * The lowered condition text, as consumed by the hdl template.
   */
  public String getVhdl() throws FsmException {
    return condition.getVhdl();
  }

  /**
   * Whether both transitions share source and destination, whatever their conditions.
   */
  public boolean parallels(final Transition other) {
    return source.equals(other.source) && destination.equals(other.destination);
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
    return id.equals(((Transition) obj).id);
  }

  @Override
  public String toString() {
    return "Transition [source=" + source.getName() + ", destination=" + destination.getName()
        + ", condition=" + condition + "]";
  }
}
