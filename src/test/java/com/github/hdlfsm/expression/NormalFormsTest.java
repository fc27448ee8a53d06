package com.github.hdlfsm.expression;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import org.junit.Test;

import com.github.hdlfsm.FsmException;

/**
 * Tests for DNF and CNF conversion.
 */
public class NormalFormsTest {

  private static Expression parse(final String text) throws FsmException {
    return ExpressionParser.parse(text);
  }

  @Test
  public void testDnfDistributes() throws FsmException {
    assertEquals(parse("x & y | x & z"), NormalForms.toDnf(parse("x & (y | z)")));
    assertEquals(parse("x & !y | x & !z"), NormalForms.toDnf(parse("x & !(y & z)")));
    assertEquals(parse("x | y"), NormalForms.toDnf(parse("x | y")));
  }

  @Test
  public void testCnfDistributes() throws FsmException {
    assertEquals(parse("(x | y) & (x | z)"), NormalForms.toCnf(parse("x | y & z")));
    assertEquals(parse("(!x | !y) & z"), NormalForms.toCnf(parse("!(x & y) & z")));
    assertEquals(parse("x & y"), NormalForms.toCnf(parse("x & y")));
  }

  @Test
  public void testDnfDecidesUnsatisfiability() throws FsmException {
    assertEquals(Literal.FALSE, NormalForms.toDnf(parse("x & !x & y")));
    assertEquals(Literal.FALSE, NormalForms.toDnf(parse("x & (!x & y)")));
    assertEquals(Literal.FALSE, NormalForms.toDnf(parse("(x | y) & !x & !y")));
    assertEquals(Literal.FALSE, NormalForms.toDnf(parse("false")));
    assertNotEquals(Literal.FALSE, NormalForms.toDnf(parse("(x | y) & !x")));
  }

  @Test
  public void testCnfDecidesTautology() throws FsmException {
    assertEquals(Literal.TRUE, NormalForms.toCnf(parse("x | !x")));
    assertEquals(Literal.TRUE, NormalForms.toCnf(parse("false | false | (x | y) | !x | !y")));
    assertEquals(Literal.TRUE, NormalForms.toCnf(parse("(x | !y) | (!x & y)")));
    assertEquals(Literal.TRUE, NormalForms.toCnf(parse("true")));
    assertNotEquals(Literal.TRUE, NormalForms.toCnf(parse("x | !x & y")));
  }

  @Test
  public void testConstants() throws FsmException {
    assertEquals(Literal.TRUE, NormalForms.toDnf(parse("true")));
    assertEquals(Literal.TRUE, NormalForms.toDnf(parse("x | true")));
    assertEquals(Literal.FALSE, NormalForms.toCnf(parse("false")));
    assertEquals(Literal.FALSE, NormalForms.toCnf(parse("x & false")));
    assertEquals(parse("x"), NormalForms.toCnf(parse("x | false")));
  }

  @Test
  public void testAbsorption() throws FsmException {
    assertEquals(parse("x"), NormalForms.toDnf(parse("x | x & y")));
    assertEquals(parse("x"), NormalForms.toCnf(parse("x & (x | y)")));
    assertEquals(parse("x"), NormalForms.toDnf(parse("x | x")));
  }

  @Test
  public void testInputIsNotModified() throws FsmException {
    final Expression expression = parse("x & (y | z)");
    NormalForms.toDnf(expression);
    NormalForms.toCnf(expression);
    assertEquals(parse("x & (y | z)"), expression);
  }

}
