package com.github.hdlfsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.hdlfsm.FsmException.Code;

/**
 * Tests to maintain the sanity and correctness of Transition.
 */
public class TransitionTest {

  @Test
  public void testTransition() throws FsmException {
    final State s0 = new State("s0");
    final State s1 = new State("s1");
    final Transition transition = new Transition(s0, s1, "x & ~y");
    assertSame(s0, transition.getSource());
    assertSame(s1, transition.getDestination());
    assertEquals(new Condition("x & !y"), transition.getCondition());
    assertEquals("x='1' and y='0'", transition.getVhdl());

    transition.setCondition(new Condition("~x | y"));
    assertEquals("x='0' or y='1'", transition.getVhdl());
    assertEquals("Transition [source=s0, destination=s1, condition=Condition('!x | y')]",
        transition.toString());
  }

  @Test
  public void testEntityIdentity() throws FsmException {
    final State s0 = new State("s0");
    final State s1 = new State("s1");
    final Transition first = new Transition(s0, s1, "x");
    final Transition second = new Transition(s0, s1, "x");
    assertNotEquals(first, second);
    assertTrue(first.parallels(second));
    assertFalse(first.parallels(new Transition(s1, s0, "x")));
    assertFalse(first.parallels(new Transition(s0, new State("s1"), "x")));
  }

  @Test
  public void testInvalidTransitions() throws FsmException {
    final State s0 = new State("s0");
    try {
      new Transition(s0, null, "x");
      fail("Expected an invalid state");
    } catch (FsmException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
    try {
      new Transition(s0, s0, (Condition) null);
      fail("Expected an invalid condition");
    } catch (FsmException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
    try {
      new Transition(s0, s0, "x &");
      fail("Expected an invalid condition expression");
    } catch (FsmException expected) {
      assertEquals(Code.CONDITION_EXPRESSION, expected.getCode());
    }
  }

}
