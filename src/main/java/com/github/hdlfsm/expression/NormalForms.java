package com.github.hdlfsm.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Disjunctive and conjunctive normal form conversion.
 *
 * Both conversions push negations down to the variables and distribute, so their cost is
 * exponential in the number of distinct symbols in the worst case. No truncation is applied, callers
 * are expected to bound the size of what they hand in.
 *
 * Results come back simplified: a product term holding a variable and its negation is dropped from
 * a DNF, a clause holding a variable and its negation is dropped from a CNF, and terms absorbed by a
 * smaller term are removed. Consequently an unsatisfiable expression converts to
 * {@link Literal#FALSE} in DNF and a tautology converts to {@link Literal#TRUE} in CNF.
 */
public final class NormalForms {

  private NormalForms() {}

  public static Expression toDnf(final Expression expression) {
    final List<Map<Symbol, Boolean>> terms = absorb(products(expression, false));
    return build(terms, Expression.Kind.OR, Expression.Kind.AND);
  }

  public static Expression toCnf(final Expression expression) {
    // !e in DNF, negated back through De Morgan, is e in CNF
    final List<Map<Symbol, Boolean>> clauses = new ArrayList<>();
    for (final Map<Symbol, Boolean> term : products(expression, true)) {
      final Map<Symbol, Boolean> clause = new LinkedHashMap<>();
      for (final Map.Entry<Symbol, Boolean> literal : term.entrySet()) {
        clause.put(literal.getKey(), !literal.getValue());
      }
      clauses.add(clause);
    }
    return build(absorb(clauses), Expression.Kind.AND, Expression.Kind.OR);
  }

  /**
   * The DNF of the expression, or of its negation when negated is set, as a list of product terms.
   * Each term maps a symbol to its polarity. An empty term stands for true, an empty list for false.
   * Contradictory terms are never produced.
   */
  private static List<Map<Symbol, Boolean>> products(final Expression expression,
      final boolean negated) {
    switch (expression.getKind()) {
      case LITERAL:
        if (((Literal) expression).getValue() != negated) {
          return Collections.singletonList(Collections.<Symbol, Boolean>emptyMap());
        }
        return Collections.emptyList();
      case VARIABLE:
        return Collections.singletonList(
            Collections.singletonMap(((Variable) expression).getSymbol(), !negated));
      case NOT:
        return products(((Not) expression).getOperand(), !negated);
      case AND:
      case OR:
        final List<Expression> operands = ((Junction) expression).getOperands();
        final boolean conjunctive = (expression.getKind() == Expression.Kind.AND) != negated;
        return conjunctive ? distribute(operands, negated) : concatenate(operands, negated);
      default:
        throw new IllegalStateException("Unknown expression kind " + expression.getKind());
    }
  }

  private static List<Map<Symbol, Boolean>> concatenate(final List<Expression> operands,
      final boolean negated) {
    final List<Map<Symbol, Boolean>> terms = new ArrayList<>();
    for (final Expression operand : operands) {
      terms.addAll(products(operand, negated));
    }
    return terms;
  }

  private static List<Map<Symbol, Boolean>> distribute(final List<Expression> operands,
      final boolean negated) {
    List<Map<Symbol, Boolean>> terms =
        Collections.singletonList(Collections.<Symbol, Boolean>emptyMap());
    for (final Expression operand : operands) {
      final List<Map<Symbol, Boolean>> operandTerms = products(operand, negated);
      final List<Map<Symbol, Boolean>> merged = new ArrayList<>();
      for (final Map<Symbol, Boolean> left : terms) {
        for (final Map<Symbol, Boolean> right : operandTerms) {
          final Map<Symbol, Boolean> term = merge(left, right);
          if (term != null) {
            merged.add(term);
          }
        }
      }
      if (merged.isEmpty()) {
        return merged;
      }
      terms = merged;
    }
    return terms;
  }

  // null when the two terms disagree on a symbol's polarity
  private static Map<Symbol, Boolean> merge(final Map<Symbol, Boolean> left,
      final Map<Symbol, Boolean> right) {
    final Map<Symbol, Boolean> term = new LinkedHashMap<>(left);
    for (final Map.Entry<Symbol, Boolean> literal : right.entrySet()) {
      final Boolean existing = term.put(literal.getKey(), literal.getValue());
      if (existing != null && !existing.equals(literal.getValue())) {
        return null;
      }
    }
    return term;
  }

  /**
   * Drops duplicate terms and every term that is a superset of another term.
   */
  private static List<Map<Symbol, Boolean>> absorb(final List<Map<Symbol, Boolean>> terms) {
    final List<Map<Symbol, Boolean>> kept = new ArrayList<>();
    for (final Map<Symbol, Boolean> candidate : terms) {
      boolean absorbed = false;
      final Iterator<Map<Symbol, Boolean>> iterator = kept.iterator();
      while (iterator.hasNext()) {
        final Map<Symbol, Boolean> existing = iterator.next();
        if (contains(candidate, existing)) {
          absorbed = true;
          break;
        }
        if (contains(existing, candidate)) {
          iterator.remove();
        }
      }
      if (!absorbed) {
        kept.add(candidate);
      }
    }
    return kept;
  }

  private static boolean contains(final Map<Symbol, Boolean> outer,
      final Map<Symbol, Boolean> inner) {
    return outer.entrySet().containsAll(inner.entrySet());
  }

  /**
   * Assemble an outer junction of inner junctions. With no terms the outer identity comes back
   * (false for OR, true for AND), an empty term collapses the whole expression to the outer
   * annihilator.
   */
  private static Expression build(final List<Map<Symbol, Boolean>> terms,
      final Expression.Kind outer, final Expression.Kind inner) {
    final Literal outerIdentity = Literal.of(outer == Expression.Kind.AND);
    if (terms.isEmpty()) {
      return outerIdentity;
    }
    final List<Expression> outerOperands = new ArrayList<>(terms.size());
    for (final Map<Symbol, Boolean> term : terms) {
      if (term.isEmpty()) {
        return outerIdentity.negate();
      }
      final List<Expression> innerOperands = new ArrayList<>(term.size());
      for (final Map.Entry<Symbol, Boolean> literal : term.entrySet()) {
        final Variable variable = new Variable(literal.getKey());
        innerOperands.add(literal.getValue() ? variable : new Not(variable));
      }
      outerOperands.add(innerOperands.size() == 1 ? innerOperands.get(0)
          : Simplifier.junction(inner, innerOperands));
    }
    return outerOperands.size() == 1 ? outerOperands.get(0)
        : Simplifier.junction(outer, outerOperands);
  }
}
