package hwcspec.equation;

import hwcspec.equation.BinaryNode.Operator;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Recursive descent parser for counter equations.
 *
 * <pre>
 * sum     := product (('+' | '-') product)*
 * product := atom (('*' | '/') atom)*
 * atom    := NUMBER | NAME | NAME '(' sum (',' sum)* ')' | '(' sum ')'
 * </pre>
 *
 * All binary operators are left-associative.
 */
public class EquationParser {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Functions that need at least two arguments. */
  public static final Set<String> BINARY_FUNCTIONS = Set.of("min", "max");

  private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern NUMBER = Pattern.compile("(?:[0-9]+(?:\\.[0-9]+)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");

  enum TokenKind {
    NAME("name"),
    NUMBER("number"),
    OPERATOR("operator"),
    LPAREN("'('"),
    RPAREN("')'"),
    COMMA("','"),
    END("end of equation");

    final String description;

    private TokenKind(String description) { this.description = description; }
  }

  record Token(TokenKind kind, String text, int column) {
    String describe() { return kind == TokenKind.END ? kind.description : "'" + text + "'"; }
  }

  private final String text;
  private final List<Token> tokens;
  private int pos = 0;

  private EquationParser(String text, List<Token> tokens) {
    this.text = text;
    this.tokens = tokens;
  }

  /**
   * Parses an equation.
   * @param text the equation source text
   * @return the root node
   * @throws EquationSyntaxException if the text is not a valid equation
   */
  public static EquationNode parse(String text) throws EquationSyntaxException {
    EquationParser parser = new EquationParser(text, tokenize(text));
    EquationNode root = parser.parseSum();
    Token trailing = parser.peek();
    if (trailing.kind != TokenKind.END)
      throw parser.unexpected(trailing, "operator or end of equation");
    return root;
  }

  /**
   * Parses an equation without throwing, capturing a failure as an {@link EquationError}.
   * @param text the equation source text
   * @return the parse result
   */
  public static ParsedEquation tryParse(String text) {
    try {
      return ParsedEquation.of(text, parse(text));
    } catch (EquationSyntaxException e) {
      logger.debug("Equation '{}' does not parse: {}", text, e.getMessage());
      return ParsedEquation.failed(e.toError());
    }
  }

  static List<Token> tokenize(String text) throws EquationSyntaxException {
    List<Token> ret = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        ++i;
        continue;
      }
      int column = i + 1;
      Matcher nameMatch = NAME.matcher(text).region(i, text.length());
      Matcher numberMatch = NUMBER.matcher(text).region(i, text.length());
      if (nameMatch.lookingAt()) {
        ret.add(new Token(TokenKind.NAME, nameMatch.group(), column));
        i = nameMatch.end();
      } else if (numberMatch.lookingAt()) {
        ret.add(new Token(TokenKind.NUMBER, numberMatch.group(), column));
        i = numberMatch.end();
      } else {
        TokenKind kind = switch (c) {
          case '+', '-', '*', '/' -> TokenKind.OPERATOR;
          case '(' -> TokenKind.LPAREN;
          case ')' -> TokenKind.RPAREN;
          case ',' -> TokenKind.COMMA;
          default -> throw new EquationSyntaxException(text, column, "Unexpected character '" + c + "' at column " + column);
        };
        ret.add(new Token(kind, String.valueOf(c), column));
        ++i;
      }
    }
    ret.add(new Token(TokenKind.END, "", text.length() + 1));
    return ret;
  }

  private Token peek() { return tokens.get(pos); }

  private Token next() { return tokens.get(pos++); }

  private boolean peekOperator(Operator a, Operator b) {
    Token token = peek();
    return token.kind == TokenKind.OPERATOR && (token.text.equals(a.symbol) || token.text.equals(b.symbol));
  }

  private EquationSyntaxException unexpected(Token token, String expected) {
    return new EquationSyntaxException(text, token.column,
                                       "Unexpected " + token.describe() + " at column " + token.column + ", expected " + expected);
  }

  private Token expect(TokenKind kind) throws EquationSyntaxException {
    Token token = next();
    if (token.kind != kind)
      throw unexpected(token, kind.description);
    return token;
  }

  private EquationNode parseSum() throws EquationSyntaxException {
    EquationNode left = parseProduct();
    while (peekOperator(Operator.ADD, Operator.SUB)) {
      Operator op = Operator.fromSymbol(next().text).get();
      left = new BinaryNode(left, op, parseProduct());
    }
    return left;
  }

  private EquationNode parseProduct() throws EquationSyntaxException {
    EquationNode left = parseAtom();
    while (peekOperator(Operator.MUL, Operator.DIV)) {
      Operator op = Operator.fromSymbol(next().text).get();
      left = new BinaryNode(left, op, parseAtom());
    }
    return left;
  }

  private EquationNode parseAtom() throws EquationSyntaxException {
    Token token = next();
    switch (token.kind) {
    case NUMBER:
      return new LiteralNode(token.text);
    case LPAREN: {
      EquationNode inner = parseSum();
      expect(TokenKind.RPAREN);
      return inner;
    }
    case NAME:
      if (peek().kind == TokenKind.LPAREN) {
        next();
        return parseCall(token);
      }
      return new NameNode(token.text);
    default:
      throw unexpected(token, "name, number or '('");
    }
  }

  private EquationNode parseCall(Token function) throws EquationSyntaxException {
    List<EquationNode> args = new ArrayList<>();
    args.add(parseSum());
    while (peek().kind == TokenKind.COMMA) {
      next();
      args.add(parseSum());
    }
    Token close = peek();
    if (close.kind != TokenKind.RPAREN)
      throw unexpected(close, "',' or ')'");
    next();
    if (BINARY_FUNCTIONS.contains(function.text) && args.size() < 2) {
      throw new EquationSyntaxException(text, function.column,
                                        "Function '" + function.text + "' at column " + function.column + " needs at least 2 arguments");
    }
    return new CallNode(function.text, args);
  }
}
