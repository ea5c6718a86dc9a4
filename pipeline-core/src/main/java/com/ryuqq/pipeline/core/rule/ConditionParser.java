package com.ryuqq.pipeline.core.rule;

import com.ryuqq.pipeline.core.error.ConfigurationException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * rules 조건식 파서 (재귀 하강).
 *
 * <p><strong>문법:</strong></p>
 * <pre>
 * expr     := or
 * or       := and ( '||' and )*
 * and      := unary ( '&amp;&amp;' unary )*
 * unary    := '!' unary | primary
 * primary  := '(' expr ')' | operand ( ('==' | '!=') operand | ('=~' | '!~') regex )?
 * operand  := $VAR | ${VAR} | "text" | 'text' | null
 * regex    := /pattern/flags
 * </pre>
 *
 * <p>{@code &&}가 {@code ||}보다 우선합니다. 단독 변수는 정의 여부(비어있지 않음)로 평가됩니다.</p>
 *
 * <p>잘못된 조건식은 {@link ConfigurationException}으로 실패하며,
 * 이는 항상 정의 로드 시점에 발생하고 스케줄 시점에는 발생하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConditionParser {

    private final String source;
    private int position;

    private ConditionParser(String source) {
        this.source = source;
        this.position = 0;
    }

    /**
     * 조건식 파싱.
     *
     * @param expression 조건식
     * @return 조건 AST
     * @throws ConfigurationException 조건식이 비어있거나 문법 오류인 경우
     */
    public static Condition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Rule condition cannot be empty");
        }
        ConditionParser parser = new ConditionParser(expression);
        Condition condition = parser.parseOr();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw parser.error("unexpected '" + parser.source.substring(parser.position) + "'");
        }
        return condition;
    }

    private Condition parseOr() {
        Condition left = parseAnd();
        while (consume("||")) {
            left = new Condition.Or(left, parseAnd());
        }
        return left;
    }

    private Condition parseAnd() {
        Condition left = parseUnary();
        while (consume("&&")) {
            left = new Condition.And(left, parseUnary());
        }
        return left;
    }

    private Condition parseUnary() {
        skipWhitespace();
        if (consume("!")) {
            return new Condition.Not(parseUnary());
        }
        return parsePrimary();
    }

    private Condition parsePrimary() {
        skipWhitespace();
        if (consume("(")) {
            Condition inner = parseOr();
            if (!consume(")")) {
                throw error("missing ')'");
            }
            return inner;
        }

        Operand left = parseOperand();
        if (consume("==")) {
            return new Condition.Comparison(left, false, parseOperand());
        }
        if (consume("!=")) {
            return new Condition.Comparison(left, true, parseOperand());
        }
        if (consume("=~")) {
            return new Condition.PatternMatch(left, false, parseRegex());
        }
        if (consume("!~")) {
            return new Condition.PatternMatch(left, true, parseRegex());
        }
        if (left instanceof Operand.Variable variable) {
            return new Condition.Presence(variable);
        }
        throw error("literal " + left + " cannot be used as a condition");
    }

    private Operand parseOperand() {
        skipWhitespace();
        if (atEnd()) {
            throw error("operand expected");
        }
        char c = source.charAt(position);
        if (c == '$') {
            return parseVariable();
        }
        if (c == '"' || c == '\'') {
            return new Operand.Text(parseQuoted(c));
        }
        if (source.startsWith("null", position) && !isIdentifierPart(position + 4)) {
            position += 4;
            return new Operand.Null();
        }
        throw error("operand expected but found '" + c + "'");
    }

    private Operand.Variable parseVariable() {
        position++; // '$'
        boolean braced = consumeRaw('{');
        int start = position;
        while (!atEnd() && isIdentifierPart(position)) {
            position++;
        }
        if (start == position) {
            throw error("variable name expected");
        }
        String name = source.substring(start, position);
        if (braced && !consumeRaw('}')) {
            throw error("missing '}' after ${" + name);
        }
        return new Operand.Variable(name);
    }

    private String parseQuoted(char quote) {
        position++; // 여는 따옴표
        StringBuilder text = new StringBuilder();
        while (!atEnd()) {
            char c = source.charAt(position++);
            if (c == quote) {
                return text.toString();
            }
            if (c == '\\' && !atEnd()) {
                text.append(source.charAt(position++));
            } else {
                text.append(c);
            }
        }
        throw error("unterminated string literal");
    }

    private Pattern parseRegex() {
        skipWhitespace();
        if (!consumeRaw('/')) {
            throw error("regular expression /.../ expected");
        }
        StringBuilder regex = new StringBuilder();
        boolean closed = false;
        while (!atEnd()) {
            char c = source.charAt(position++);
            if (c == '\\' && !atEnd()) {
                regex.append(c).append(source.charAt(position++));
            } else if (c == '/') {
                closed = true;
                break;
            } else {
                regex.append(c);
            }
        }
        if (!closed) {
            throw error("unterminated regular expression");
        }

        int flags = 0;
        while (!atEnd() && Character.isLetter(source.charAt(position))) {
            char flag = source.charAt(position++);
            flags |= switch (flag) {
                case 'i' -> Pattern.CASE_INSENSITIVE;
                case 'm' -> Pattern.MULTILINE;
                case 's' -> Pattern.DOTALL;
                default -> throw error("unsupported regular expression flag '" + flag + "'");
            };
        }

        try {
            return Pattern.compile(regex.toString(), flags);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException(
                "Invalid regular expression /" + regex + "/ in rule condition '" + source + "'", e);
        }
    }

    private boolean consume(String token) {
        skipWhitespace();
        if (source.startsWith(token, position)) {
            position += token.length();
            return true;
        }
        return false;
    }

    private boolean consumeRaw(char c) {
        if (!atEnd() && source.charAt(position) == c) {
            position++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(source.charAt(position))) {
            position++;
        }
    }

    private boolean isIdentifierPart(int index) {
        if (index >= source.length()) {
            return false;
        }
        char c = source.charAt(index);
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private boolean atEnd() {
        return position >= source.length();
    }

    private ConfigurationException error(String detail) {
        return new ConfigurationException(
            String.format("Malformed rule condition '%s' at position %d: %s", source, position, detail)
        );
    }
}
