package com.github.hdlfsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

import com.github.hdlfsm.FsmException.Code;
import com.github.hdlfsm.GenerationConfiguration.GenerationConfigurationBuilder;
import com.github.hdlfsm.HdlModel.HdlTransition;

/**
 * Tests to maintain the sanity and correctness of FiniteStateMachine and the hdl model it hands
 * over.
 */
public class FiniteStateMachineTest {

  private static Map<String, Object> outputs(final int u, final int v) {
    final Map<String, Object> outputs = new LinkedHashMap<>();
    outputs.put("u", u);
    outputs.put("v", v);
    return outputs;
  }

  /**
   * Two states, each with a transition to itself and to the other.
   */
  private static FiniteStateMachine completeMachine() throws FsmException {
    final FiniteStateMachine machine = new FiniteStateMachine();
    final State s0 = new State("s0", outputs(0, 0));
    final State s1 = new State("s1", outputs(1, 0));
    machine.addState(s0, true);
    machine.addState(s1);
    machine.addTransition(new Transition(s0, s0, "x"));
    machine.addTransition(new Transition(s0, s1, "~x"));
    machine.addTransition(new Transition(s1, s0, "x&~y"));
    machine.addTransition(new Transition(s1, s1, "~x|y"));
    return machine;
  }

  @Test
  public void testSimpleMachine() throws FsmException {
    final FiniteStateMachine machine = new FiniteStateMachine();
    final State s0 = new State("s0");
    final State s1 = new State("s1");
    machine.addState(s0, true);
    machine.addState(s1);
    machine.addTransition(new Transition(s0, s1, "x"));
    machine.addTransition(new Transition(s1, s0, "~x"));

    assertSame(s0, machine.getDefaultState().get());
    assertTrue(s0.isDefault());
    assertFalse(s1.isDefault());
    assertEquals(2, machine.getStates().size());
    assertEquals(2, machine.getTransitions().size());
    assertEquals("[x]", machine.getInputs().toString());
    assertTrue(machine.getOutputs().isEmpty());
    assertTrue(machine.getTransitions().checkReachability());
    assertTrue(machine.getStates().isValid());
  }

  @Test
  public void testCompleteMachine() throws FsmException {
    final FiniteStateMachine machine = completeMachine();
    assertEquals("[x, y]", machine.getInputs().toString());
    assertEquals("{u=2, v=2}", machine.getOutputs().toString());
    assertTrue(machine.getTransitions().checkReachability());

    final State s1 = machine.getState("s1").iterator().next();
    final TransitionSet fromS1 = machine.getTransitions().fromStates(s1, null);
    assertEquals(2, fromS1.size());
    assertTrue(fromS1.isExclusive());
    assertTrue(fromS1.isExhaustive());
  }

  @Test
  public void testConstructFromCollections() throws FsmException {
    final State s0 = new State("s0");
    final State s1 = new State("s1");
    final Transition toS1 = new Transition(s0, s1, "go");
    final FiniteStateMachine machine =
        new FiniteStateMachine(Arrays.asList(s0, s1), Arrays.asList(toS1));
    assertEquals(2, machine.getStates().size());
    assertTrue(machine.getTransitions().contains(toS1));
    assertFalse(machine.getDefaultState().isPresent());
    assertFalse(machine.getId().equals(new FiniteStateMachine().getId()));
  }

  @Test
  public void testReplacingDefaultState() throws FsmException {
    final FiniteStateMachine machine = new FiniteStateMachine();
    final State s0 = new State("s0");
    final State s1 = new State("s1");
    machine.addState(s0, true);
    machine.addState(s1, true);
    assertSame(s1, machine.getDefaultState().get());
    assertTrue(s1.isDefault());
    // the previous default keeps its flag
    assertTrue(s0.isDefault());
  }

  @Test
  public void testNullsRejected() {
    final FiniteStateMachine machine = new FiniteStateMachine();
    try {
      machine.addState(null);
      fail("Expected an invalid state");
    } catch (FsmException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
    try {
      machine.addTransition(null);
      fail("Expected an invalid transition");
    } catch (FsmException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
  }

  @Test
  public void testHdlModel() throws FsmException {
    final FiniteStateMachine machine = completeMachine();
    final GenerationConfiguration config = GenerationConfigurationBuilder.newBuilder()
        .entityName("Blinker").requireReachability(true).requireDefaultState(true).build();
    final HdlModel model = machine.toHdlModel(config);

    assertEquals("Blinker", model.getEntityName());
    assertFalse(model.isTestbench());
    assertEquals(Arrays.asList("s0", "s1"), model.getStateNames());
    assertEquals("s0", model.getDefaultStateName());
    assertEquals(Arrays.asList("x", "y"), model.getInputs());
    assertEquals(Arrays.asList("u", "v"), model.getOutputs());
    assertEquals("{u=1, v=0}", model.getStateOutputs().get("s1").toString());

    assertEquals(4, model.getTransitions().size());
    final HdlTransition first = model.getTransitions().get(0);
    assertEquals("s0", first.getSource());
    assertEquals("s0", first.getDestination());
    assertEquals("x='1'", first.getCondition());
    assertEquals("x='0'", model.getTransitions().get(1).getCondition());
    assertEquals("x='1' and y='0'", model.getTransitions().get(2).getCondition());
    assertEquals("x='0' or y='1'", model.getTransitions().get(3).getCondition());
  }

  @Test
  public void testHdlModelIsSnapshot() throws FsmException {
    final FiniteStateMachine machine = completeMachine();
    final HdlModel model =
        machine.toHdlModel(GenerationConfigurationBuilder.newBuilder().build());
    final Transition first = machine.getTransitions().iterator().next();
    first.setCondition(new Condition("y"));
    machine.getState("s0").iterator().next().setOutput("u", 1);

    assertEquals("x='1'", model.getTransitions().get(0).getCondition());
    assertEquals("{u=0, v=0}", model.getStateOutputs().get("s0").toString());
    assertEquals("MooreFSM", model.getEntityName());
  }

  @Test
  public void testHdlModelWithoutDefaultState() throws FsmException {
    final FiniteStateMachine machine = new FiniteStateMachine();
    machine.addState(new State("s0"));
    final HdlModel model = machine.toHdlModel(GenerationConfigurationBuilder.newBuilder().build());
    assertNull(model.getDefaultStateName());

    try {
      machine.toHdlModel(
          GenerationConfigurationBuilder.newBuilder().requireDefaultState(true).build());
      fail("Expected a missing default state");
    } catch (FsmException expected) {
      assertEquals(Code.MISSING_DEFAULT_STATE, expected.getCode());
    }
  }

  @Test
  public void testHdlModelRejectsInvalidStates() throws FsmException {
    final FiniteStateMachine machine = completeMachine();
    machine.addState(new State("s1", outputs(0, 1)));
    try {
      machine.toHdlModel(GenerationConfigurationBuilder.newBuilder().build());
      fail("Expected invalid states");
    } catch (FsmException expected) {
      assertEquals(Code.INVALID_STATES, expected.getCode());
      assertTrue(expected.getMessage().contains("2 states are named s1"));
    }
  }

  @Test
  public void testHdlModelAllowsMismatchedOutputsWhenUnchecked() throws FsmException {
    final FiniteStateMachine machine = completeMachine();
    final State s2 = new State("s2");
    s2.setOutput("u", 1);
    machine.addState(s2);
    final HdlModel model = machine.toHdlModel(
        GenerationConfigurationBuilder.newBuilder().requireValidStates(false).build());
    assertEquals(Arrays.asList("s0", "s1", "s2"), model.getStateNames());
    assertEquals(3, model.getStateOutputs().size());
    assertEquals("{u=1}", model.getStateOutputs().get("s2").toString());
    assertEquals(Arrays.asList("u", "v"), model.getOutputs());
  }

  @Test
  public void testHdlModelRejectsDuplicateNamesWhenUnchecked() throws FsmException {
    final FiniteStateMachine machine = new FiniteStateMachine();
    final State first = new State("s1");
    first.setOutput("u", 0);
    final State second = new State("s1");
    second.setOutput("u", 1);
    machine.addState(first);
    machine.addState(second);
    try {
      machine.toHdlModel(
          GenerationConfigurationBuilder.newBuilder().requireValidStates(false).build());
      fail("Expected duplicate state names to be rejected");
    } catch (FsmException expected) {
      assertEquals(Code.INVALID_STATES, expected.getCode());
      assertTrue(expected.getMessage().contains("2 states are named s1"));
    }
  }

  @Test
  public void testHdlModelRejectsBadNames() throws FsmException {
    final FiniteStateMachine machine = new FiniteStateMachine();
    machine.addState(new State("idle state"));
    try {
      machine.toHdlModel(GenerationConfigurationBuilder.newBuilder().build());
      fail("Expected an invalid identifier");
    } catch (FsmException expected) {
      assertEquals(Code.INVALID_IDENTIFIER, expected.getCode());
    }

    final FiniteStateMachine outputs = new FiniteStateMachine();
    final State s0 = new State("s0");
    s0.setOutput("led-1", 1);
    outputs.addState(s0);
    try {
      outputs.toHdlModel(GenerationConfigurationBuilder.newBuilder().build());
      fail("Expected an invalid identifier");
    } catch (FsmException expected) {
      assertEquals(Code.INVALID_IDENTIFIER, expected.getCode());
    }
  }

  @Test
  public void testHdlModelRejectsForeignStates() throws FsmException {
    final FiniteStateMachine machine = completeMachine();
    final State s0 = machine.getState("s0").iterator().next();
    machine.addTransition(new Transition(s0, new State("s9"), "y"));
    try {
      machine.toHdlModel(GenerationConfigurationBuilder.newBuilder().build());
      fail("Expected an unregistered state");
    } catch (FsmException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
  }

  @Test
  public void testHdlModelReachability() throws FsmException {
    final FiniteStateMachine machine = completeMachine();
    final State s0 = machine.getState("s0").iterator().next();
    final State s2 = new State("s2", outputs(1, 1));
    machine.addState(s2);
    machine.addTransition(new Transition(s0, s2, "y"));

    final GenerationConfiguration strict =
        GenerationConfigurationBuilder.newBuilder().requireReachability(true).build();
    try {
      machine.toHdlModel(strict);
      fail("Expected an unexitable state");
    } catch (FsmException expected) {
      assertEquals(Code.UNEXITABLE_STATE, expected.getCode());
    }
    assertEquals(5, machine.toHdlModel(GenerationConfigurationBuilder.newBuilder().build())
        .getTransitions().size());
  }

}
