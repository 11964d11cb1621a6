package org.carball.rlsguard.parser;

import org.carball.rlsguard.model.ast.ColumnNode;
import org.carball.rlsguard.model.ast.ComparisonNode;
import org.carball.rlsguard.model.ast.ComparisonOperator;
import org.carball.rlsguard.model.ast.FunctionNode;
import org.carball.rlsguard.model.ast.LiteralKind;
import org.carball.rlsguard.model.ast.LiteralNode;
import org.carball.rlsguard.model.ast.LogicalNode;
import org.carball.rlsguard.model.ast.LogicalOperator;
import org.carball.rlsguard.model.ast.PolicyConditionNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parser for policy expressions.
 * Converts tokens into a {@link PolicyConditionNode} tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: NOT > AND > OR, AND/OR left-associative):
 * <pre>
 * expression := or
 * or         := and ('OR' and)*
 * and        := not ('AND' not)*
 * not        := 'NOT' comparison | comparison
 * comparison := primary (operator primary | 'IS' ['NOT'] 'NULL')?
 * primary    := '(' expression ')' | '(' literal (',' literal)+ ')' | '(' select ')'
 *             | 'ARRAY' '[' literal (',' literal)* ']' | IDENT '(' args ')' | literal | column
 * </pre>
 * {@code ::type} casts after a primary are consumed and dropped.
 * <p>
 * Parentheses, brackets and function calls may nest at most {@value #MAX_NESTING} levels and an
 * expression may hold at most {@value #MAX_LOGICAL_OPERATORS} AND/OR operators. Deeper input is
 * rejected with a {@link PolicyParseException} so the tree stays shallow enough to walk.
 */
public final class PolicyExpressionParser {

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final String CAST_PREFIX = "::";

    public static final int MAX_NESTING = 200;
    public static final int MAX_LOGICAL_OPERATORS = 500;

    private final String input;
    private final List<Token> tokens;
    private final SubqueryParser subqueryParser;
    private final int subqueryDepth;
    private int index;
    private int nesting;
    private int logicalOperators;

    /**
     * @param input          the string the tokens were produced from
     * @param tokens         tokens of {@code input}
     * @param subqueryParser handles {@code (SELECT ...)} operands
     * @param subqueryDepth  0 for a policy expression, n for the WHERE clause of a subquery nested n deep
     */
    public PolicyExpressionParser(String input, List<Token> tokens, SubqueryParser subqueryParser, int subqueryDepth) {
        this.input = input;
        this.tokens = tokens;
        this.subqueryParser = subqueryParser;
        this.subqueryDepth = subqueryDepth;
        this.index = 0;
    }

    /**
     * Tokenizes and parses a whole expression.
     */
    public static PolicyConditionNode parse(String expression, SubqueryParser subqueryParser, int subqueryDepth) {
        List<Token> tokens = new PolicyTokenizer(expression).tokenize();
        return new PolicyExpressionParser(expression, tokens, subqueryParser, subqueryDepth).parse();
    }

    /**
     * Parse the token stream into a condition tree.
     *
     * @return Root node
     */
    public PolicyConditionNode parse() {
        PolicyConditionNode result = parseExpression();
        if (!isAtEnd()) {
            Token token = peek();
            if (token.type() == TokenType.RIGHT_PAREN) {
                throw error("Unmatched closing parenthesis", token);
            }
            throw error("Unexpected token '" + token.text() + "'", token);
        }
        return result;
    }

    private PolicyConditionNode parseExpression() {
        return parseOr();
    }

    private PolicyConditionNode parseOr() {
        PolicyConditionNode left = parseAnd();

        while (matchKeyword("OR")) {
            countLogicalOperator();
            PolicyConditionNode right = parseAnd();
            left = new LogicalNode(LogicalOperator.OR, left, right);
        }

        return left;
    }

    private PolicyConditionNode parseAnd() {
        PolicyConditionNode left = parseNot();

        while (matchKeyword("AND")) {
            countLogicalOperator();
            PolicyConditionNode right = parseNot();
            left = new LogicalNode(LogicalOperator.AND, left, right);
        }

        return left;
    }

    private PolicyConditionNode parseNot() {
        if (matchKeyword("NOT")) {
            return LogicalNode.not(parseComparison());
        }
        return parseComparison();
    }

    private PolicyConditionNode parseComparison() {
        PolicyConditionNode left = parsePrimary();

        Optional<ComparisonOperator> operator = matchComparisonOperator();
        if (operator.isEmpty()) {
            return left;
        }
        if (operator.get().isUnary()) {
            return new ComparisonNode(operator.get(), left, null);
        }

        PolicyConditionNode right = parsePrimary();
        return new ComparisonNode(operator.get(), left, right);
    }

    private PolicyConditionNode parsePrimary() {
        if (isAtEnd()) {
            throw new PolicyParseException("Unexpected end of expression", input.length());
        }

        Token token = peek();
        switch (token.type()) {
            case LEFT_PAREN -> {
                advance();
                enterNesting(token);
                PolicyConditionNode inner = parseParenthesized(token);
                nesting--;
                return skipCasts(inner);
            }
            case RIGHT_PAREN -> throw error("Unmatched closing parenthesis", token);
            case COMMA, OPERATOR, LEFT_BRACKET, RIGHT_BRACKET ->
                    throw error("Unexpected '" + token.text() + "'", token);
            default -> advance();
        }

        if (token.isKeyword("ARRAY") && check(TokenType.LEFT_BRACKET)) {
            Token open = advance();
            enterNesting(open);
            PolicyConditionNode array = parseArrayConstructor(open);
            nesting--;
            return skipCasts(array);
        }

        if (token.type() == TokenType.WORD && check(TokenType.LEFT_PAREN)) {
            Token open = advance();
            enterNesting(open);
            PolicyConditionNode call = parseFunctionCall(token.text(), open);
            nesting--;
            return skipCasts(call);
        }

        return skipCasts(toOperand(token));
    }

    private PolicyConditionNode parseParenthesized(Token open) {
        if (checkKeyword("SELECT")) {
            return parseSubquery(open);
        }

        PolicyConditionNode first = parseExpression();
        if (!check(TokenType.COMMA)) {
            expectClosingParenthesis(open, "Expected closing parenthesis");
            return first;
        }

        List<Object> values = new ArrayList<>();
        values.add(literalValue(first, open, "a parenthesised list"));
        while (match(TokenType.COMMA)) {
            values.add(literalValue(parseExpression(), open, "a parenthesised list"));
        }
        expectClosingParenthesis(open, "Expected closing parenthesis after list");
        return LiteralNode.ofList(values);
    }

    /**
     * {@code ARRAY['a'::text, 'b'::text]}, the form Postgres renders {@code IN} lists in
     * stored policies, becomes a list literal.
     */
    private PolicyConditionNode parseArrayConstructor(Token open) {
        List<Object> values = new ArrayList<>();

        if (!check(TokenType.RIGHT_BRACKET)) {
            values.add(literalValue(parsePrimary(), open, "an ARRAY constructor"));
            while (match(TokenType.COMMA)) {
                values.add(literalValue(parsePrimary(), open, "an ARRAY constructor"));
            }
        }

        if (!match(TokenType.RIGHT_BRACKET)) {
            throw isAtEnd()
                    ? error("Expected closing bracket for ARRAY", open)
                    : error("Expected closing bracket for ARRAY but found '" + peek().text() + "'", peek());
        }
        return LiteralNode.ofList(values);
    }

    private PolicyConditionNode parseFunctionCall(String functionName, Token open) {
        List<PolicyConditionNode> arguments = new ArrayList<>();

        if (checkKeyword("SELECT")) {
            arguments.add(parseSubquery(open));
            return new FunctionNode(functionName, arguments);
        }

        if (!check(TokenType.RIGHT_PAREN)) {
            arguments.add(parsePrimary());
            while (match(TokenType.COMMA)) {
                arguments.add(parsePrimary());
            }
        }

        expectClosingParenthesis(open, "Expected closing parenthesis for function " + functionName);
        return new FunctionNode(functionName, arguments);
    }

    /**
     * Consumes tokens up to and including the parenthesis matching {@code open}; the SELECT
     * text between them is handed to the subquery parser verbatim.
     */
    private PolicyConditionNode parseSubquery(Token open) {
        int start = peek().position();
        int depth = 1;

        while (!isAtEnd()) {
            Token token = advance();
            if (token.type() == TokenType.LEFT_PAREN) {
                depth++;
                if (nesting + depth > MAX_NESTING) {
                    throw error("Expression nested deeper than " + MAX_NESTING + " levels", token);
                }
            } else if (token.type() == TokenType.RIGHT_PAREN && --depth == 0) {
                String sql = input.substring(start, token.position()).trim();
                return subqueryParser.parse(sql, subqueryDepth);
            }
        }

        throw error("Expected closing parenthesis for subquery", open);
    }

    private Optional<ComparisonOperator> matchComparisonOperator() {
        if (isAtEnd()) {
            return Optional.empty();
        }

        Token token = peek();
        if (token.type() == TokenType.OPERATOR) {
            return matchSymbolOperator(token);
        }
        if (token.type() != TokenType.WORD) {
            return Optional.empty();
        }

        String word = token.text().toUpperCase();
        switch (word) {
            case "LIKE", "ILIKE", "IN", "EXISTS" -> {
                advance();
                return ComparisonOperator.fromSymbol(word);
            }
            case "IS" -> {
                advance();
                boolean negated = matchKeyword("NOT");
                if (!matchKeyword("NULL")) {
                    throw error("Expected NULL after IS", token);
                }
                return Optional.of(negated ? ComparisonOperator.IS_NOT_NULL : ComparisonOperator.IS_NULL);
            }
            case "NOT" -> {
                Token next = peekAhead(1);
                if (next != null && (next.isKeyword("IN") || next.isKeyword("LIKE") || next.isKeyword("ILIKE"))) {
                    advance();
                    advance();
                    return ComparisonOperator.fromSymbol("NOT " + next.text());
                }
                return Optional.empty();
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    /**
     * Builds {@code <= >= != <>} from adjacent single-character tokens.
     */
    private Optional<ComparisonOperator> matchSymbolOperator(Token token) {
        Token next = peekAhead(1);
        char second = next != null && next.type() == TokenType.OPERATOR && token.isFollowedBy(next)
                ? next.text().charAt(0) : 0;

        String symbol = switch (token.text().charAt(0)) {
            case '<' -> second == '=' ? "<=" : second == '>' ? "<>" : "<";
            case '>' -> second == '=' ? ">=" : ">";
            case '!' -> second == '=' ? "!=" : null;
            case '=' -> "=";
            default -> null;
        };
        if (symbol == null) {
            return Optional.empty();
        }

        for (int i = 0; i < symbol.length(); i++) {
            advance();
        }
        return ComparisonOperator.fromSymbol(symbol);
    }

    private PolicyConditionNode toOperand(Token token) {
        if (token.type() == TokenType.QUOTED) {
            String text = token.text();
            // E'...' keeps its prefix in the token
            int open = text.indexOf(text.charAt(text.length() - 1));
            return LiteralNode.ofString(text.substring(open + 1, text.length() - 1));
        }

        String text = stripCast(token.text());
        if (DIGITS.matcher(text).matches()) {
            return LiteralNode.ofNumber(text.length() > 18 ? new BigInteger(text) : Long.valueOf(text));
        }
        if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
            return LiteralNode.ofBoolean(text.equalsIgnoreCase("true"));
        }
        if (text.equalsIgnoreCase("null")) {
            return LiteralNode.ofNull();
        }

        return new ColumnNode(text);
    }

    private Object literalValue(PolicyConditionNode node, Token open, String context) {
        if (node instanceof LiteralNode literal && literal.kind() != LiteralKind.LIST) {
            return literal.value();
        }
        throw error("Only literal values are supported in " + context, open);
    }

    private PolicyConditionNode skipCasts(PolicyConditionNode node) {
        while (!isAtEnd()) {
            if (peek().type() == TokenType.WORD && peek().text().startsWith(CAST_PREFIX)) {
                advance();
            } else if (isArrayTypeSuffix()) {
                // ::text[]
                advance();
                advance();
            } else {
                break;
            }
        }
        return node;
    }

    private boolean isArrayTypeSuffix() {
        Token next = peekAhead(1);
        return index > 0
                && check(TokenType.LEFT_BRACKET)
                && next != null && next.type() == TokenType.RIGHT_BRACKET
                && tokens.get(index - 1).text().contains(CAST_PREFIX);
    }

    private void enterNesting(Token open) {
        if (++nesting > MAX_NESTING) {
            throw error("Expression nested deeper than " + MAX_NESTING + " levels", open);
        }
    }

    private void countLogicalOperator() {
        if (++logicalOperators > MAX_LOGICAL_OPERATORS) {
            throw error("Expression has more than " + MAX_LOGICAL_OPERATORS + " AND/OR operators",
                    tokens.get(index - 1));
        }
    }

    private static String stripCast(String text) {
        int cast = text.indexOf(CAST_PREFIX);
        return cast > 0 ? text.substring(0, cast) : text;
    }

    private void expectClosingParenthesis(Token open, String message) {
        if (isAtEnd()) {
            throw error(message, open);
        }
        if (!check(TokenType.RIGHT_PAREN)) {
            throw error(message + " but found '" + peek().text() + "'", peek());
        }
        advance();
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            index++;
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String keyword) {
        if (checkKeyword(keyword)) {
            index++;
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return !isAtEnd() && peek().type() == type;
    }

    private boolean checkKeyword(String keyword) {
        return !isAtEnd() && peek().isKeyword(keyword);
    }

    private Token advance() {
        return tokens.get(index++);
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAhead(int offset) {
        int target = index + offset;
        return target < tokens.size() ? tokens.get(target) : null;
    }

    private boolean isAtEnd() {
        return index >= tokens.size();
    }

    private PolicyParseException error(String message, Token token) {
        return new PolicyParseException(message, token.position());
    }
}
