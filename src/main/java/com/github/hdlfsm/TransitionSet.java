package com.github.hdlfsm;

import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.hdlfsm.FsmException.Code;
import com.github.hdlfsm.expression.Literal;

/**
 * A set that can only hold transitions. Two members may share source and destination, see
 * {@link Transition#parallels(Transition)}.
 */
public final class TransitionSet extends FilteredSet<Transition> {
  private static final Logger logger = LogManager.getLogger(TransitionSet.class.getSimpleName());

  public TransitionSet() {
    this(null);
  }

  public TransitionSet(final Iterable<? extends Transition> transitions) {
    super(Transition.class, transitions);
  }

  public StateSet getSources() {
    final StateSet sources = new StateSet();
    for (final Transition transition : this) {
      sources.add(transition.getSource());
    }
    return sources;
  }

  public StateSet getDestinations() {
    final StateSet destinations = new StateSet();
    for (final Transition transition : this) {
      destinations.add(transition.getDestination());
    }
    return destinations;
  }

  public ConditionSet getConditions() {
    final ConditionSet conditions = new ConditionSet();
    for (final Transition transition : this) {
      conditions.add(transition.getCondition());
    }
    return conditions;
  }

  public TransitionSet fromStates(final State source, final State destination) {
    return fromStates(source, destination, FilterMode.AND);
  }

  public TransitionSet fromStates(final State source, final State destination, final String mode)
      throws FsmException {
    return fromStates(source, destination, FilterMode.of(mode));
  }

  /**
   * The members leaving source and/or entering destination. Either filter may be null.
   *
   * With both filters given, {@link FilterMode#AND} keeps the transitions matching both and
   * {@link FilterMode#OR} those matching either. When a filter is missing the call always falls
   * back to OR, so fromStates(s, null, AND) returns every transition leaving s.
   */
  public TransitionSet fromStates(final State source, final State destination,
      final FilterMode mode) {
    if (mode == null) {
      throw new IllegalArgumentException("Filter mode cannot be null");
    }
    final TransitionSet matches = new TransitionSet();
    final boolean both = source != null && destination != null && mode == FilterMode.AND;
    for (final Transition transition : this) {
      final boolean sourceMatches = source != null && transition.getSource().equals(source);
      final boolean destinationMatches =
          destination != null && transition.getDestination().equals(destination);
      if (both ? sourceMatches && destinationMatches : sourceMatches || destinationMatches) {
        matches.add(transition);
      }
    }
    return matches;
  }

  /**
   * Other members sharing source and destination with the given transition.
   */
  public TransitionSet parallelTo(final Transition transition) {
    final TransitionSet parallels = new TransitionSet();
    for (final Transition member : this) {
      if (member != transition && member.parallels(transition)) {
        parallels.add(member);
      }
    }
    return parallels;
  }

  /**
   * The members whose condition is settled to true by the bindings.
   */
  public TransitionSet evaluate(final Map<String, ?> bindings) throws FsmException {
    final TransitionSet taken = new TransitionSet();
    for (final Transition transition : this) {
      if (Literal.TRUE.equals(transition.getCondition().evaluate(bindings))) {
        taken.add(transition);
      }
    }
    return taken;
  }

  /**
   * Pairwise mutual exclusivity over all member conditions, regardless of source state. Filter with
   * {@link #fromStates(State, State)} first for a per-state check.
   */
  public boolean isExclusive() {
    return getConditions().isExclusive();
  }

  /**
   * Collective exhaustiveness over all member conditions, regardless of source state.
   */
  public boolean isExhaustive() {
    return getConditions().isExhaustive();
  }

  /**
   * Checks every endpoint is both the source and the destination of some member. A self loop
   * satisfies both for its state. The states may still fall into disconnected groups.
   *
   * @throws FsmException {@link Code#UNREACHABLE_STATE} when a state only ever appears as a source,
   *         {@link Code#UNEXITABLE_STATE} when a state only ever appears as a destination
   */
  public boolean checkReachability() throws FsmException {
    final StateSet sources = getSources();
    final StateSet destinations = getDestinations();

    final StateSet unreachable = sources.minus(destinations);
    if (!unreachable.isEmpty()) {
      logger.warn("Unreachable states: " + unreachable.getNames().keySet());
      throw new FsmException(Code.UNREACHABLE_STATE,
          "States " + unreachable.getNames().keySet() + " are not reachable");
    }

    final StateSet unexitable = destinations.minus(sources);
    if (!unexitable.isEmpty()) {
      logger.warn("Unexitable states: " + unexitable.getNames().keySet());
      throw new FsmException(Code.UNEXITABLE_STATE,
          "States " + unexitable.getNames().keySet() + " are not exitable");
    }
    return true;
  }
}
