package com.github.hdlfsm.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.github.hdlfsm.FsmException;
import com.github.hdlfsm.FsmException.Code;

/**
 * Recursive descent parser for boolean condition text.
 *
 * Grammar, loosest binding first:<br>
 * or := and (('|' | '+' | ',' | "or") and)*<br>
 * and := not (('&amp;' | '*' | "and") not)*<br>
 * not := ('!' | '~' | "not") not | atom<br>
 * atom := "true" | "false" | identifier | '(' or ')'<br>
 *
 * Keywords and literals are case-insensitive, identifiers match [A-Za-z][A-Za-z0-9_]*. A chain of
 * the same binary operator becomes one n-ary node, so x|y|z is a single {@link Or} of three
 * operands.
 */
public final class ExpressionParser {

  /**
   * Every accepted operator and literal spelling, for user facing error messages.
   */
  public static final String SYNTAX_LEGEND =
      "Valid operators are: ! ~ not (negation), & * and (conjunction), | + , or (disjunction). "
          + "Valid literals are: true, false";

  /**
   * Deepest accepted nesting of parentheses and negations combined.
   */
  public static final int MAX_NESTING = 256;

  private final String text;
  private final List<Token> tokens;
  private int position;
  private int depth;

  private ExpressionParser(final String text) throws FsmException {
    this.text = text;
    this.tokens = tokenize(text);
  }

  public static Expression parse(final String text) throws FsmException {
    if (text == null || text.trim().isEmpty()) {
      throw new FsmException(Code.EXPRESSION_SYNTAX, "Expression is empty");
    }
    final ExpressionParser parser = new ExpressionParser(text);
    final Expression expression = parser.parseOr();
    final Token trailing = parser.peek();
    if (trailing.type != TokenType.END) {
      if (trailing.type == TokenType.RIGHT_PAREN) {
        throw parser.error("Unbalanced parentheses, unexpected ')'", trailing);
      }
      throw parser.error("Unexpected '" + trailing.text + "'", trailing);
    }
    return expression;
  }

  private Expression parseOr() throws FsmException {
    final List<Expression> operands = new ArrayList<>();
    operands.add(parseAnd());
    while (peek().type == TokenType.OR) {
      position++;
      operands.add(parseAnd());
    }
    return operands.size() == 1 ? operands.get(0) : new Or(operands);
  }

  private Expression parseAnd() throws FsmException {
    final List<Expression> operands = new ArrayList<>();
    operands.add(parseNot());
    while (peek().type == TokenType.AND) {
      position++;
      operands.add(parseNot());
    }
    return operands.size() == 1 ? operands.get(0) : new And(operands);
  }

  private Expression parseNot() throws FsmException {
    if (peek().type == TokenType.NOT) {
      descend(peek());
      position++;
      final Expression operand = parseNot();
      depth--;
      return new Not(operand);
    }
    return parseAtom();
  }

  private Expression parseAtom() throws FsmException {
    final Token token = peek();
    switch (token.type) {
      case LEFT_PAREN:
        descend(token);
        position++;
        final Expression inner = parseOr();
        if (peek().type != TokenType.RIGHT_PAREN) {
          throw error("Unbalanced parentheses, missing ')'", peek());
        }
        position++;
        depth--;
        return inner;
      case TRUE:
        position++;
        return Literal.TRUE;
      case FALSE:
        position++;
        return Literal.FALSE;
      case IDENTIFIER:
        position++;
        return new Variable(Symbol.of(token.text));
      case END:
        throw error("Unexpected end of expression", token);
      default:
        throw error("Unexpected '" + token.text + "'", token);
    }
  }

  private void descend(final Token token) throws FsmException {
    if (++depth > MAX_NESTING) {
      throw error("Nesting deeper than " + MAX_NESTING + " levels", token);
    }
  }

  private Token peek() {
    return tokens.get(position);
  }

  private FsmException error(final String reason, final Token token) {
    return new FsmException(Code.EXPRESSION_SYNTAX,
        String.format("%s at position %d in expression \"%s\"", reason, token.offset, text));
  }

  private static List<Token> tokenize(final String text) throws FsmException {
    final List<Token> tokens = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      final char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
        continue;
      }
      final TokenType single = singleCharacterToken(c);
      if (single != null) {
        tokens.add(new Token(single, String.valueOf(c), i));
        i++;
        continue;
      }
      if (isLetter(c)) {
        final int start = i;
        while (i < text.length() && isIdentifierPart(text.charAt(i))) {
          i++;
        }
        final String word = text.substring(start, i);
        tokens.add(new Token(wordToken(word), word, start));
        continue;
      }
      throw new FsmException(Code.EXPRESSION_SYNTAX,
          String.format("Unknown token '%c' at position %d in expression \"%s\"", c, i, text));
    }
    tokens.add(new Token(TokenType.END, "", text.length()));
    return tokens;
  }

  private static TokenType singleCharacterToken(final char c) {
    switch (c) {
      case '(':
        return TokenType.LEFT_PAREN;
      case ')':
        return TokenType.RIGHT_PAREN;
      case '&':
      case '*':
        return TokenType.AND;
      case '|':
      case '+':
      case ',':
        return TokenType.OR;
      case '!':
      case '~':
        return TokenType.NOT;
      default:
        return null;
    }
  }

  private static TokenType wordToken(final String word) {
    switch (word.toLowerCase(Locale.ROOT)) {
      case "and":
        return TokenType.AND;
      case "or":
        return TokenType.OR;
      case "not":
        return TokenType.NOT;
      case "true":
        return TokenType.TRUE;
      case "false":
        return TokenType.FALSE;
      default:
        return TokenType.IDENTIFIER;
    }
  }

  private static boolean isLetter(final char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isIdentifierPart(final char c) {
    return isLetter(c) || (c >= '0' && c <= '9') || c == '_';
  }

  private static enum TokenType {
    LEFT_PAREN, RIGHT_PAREN, AND, OR, NOT, TRUE, FALSE, IDENTIFIER, END;
  }

  private static final class Token {
    private final TokenType type;
    private final String text;
    private final int offset;

    private Token(final TokenType type, final String text, final int offset) {
      this.type = type;
      this.text = text;
      this.offset = offset;
    }
  }
}
