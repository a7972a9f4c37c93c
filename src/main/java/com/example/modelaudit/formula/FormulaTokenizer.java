package com.example.modelaudit.formula;

import com.example.modelaudit.model.ErrorCode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class FormulaTokenizer {
    private static final Pattern NUMBER = Pattern.compile("(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern EXPONENT_PENDING = Pattern.compile("(\\d+(\\.\\d*)?|\\.\\d+)[eE]");
    private static final Pattern EXTERNAL_QUALIFIER = Pattern.compile("^'?\\[[^\\]]*\\]");
    private static final String SINGLE_CHAR_OPERATORS = "+-*/^&%@";

    public List<FormulaToken> tokenize(String formula) throws FormulaParseException {
        if (formula == null || !formula.startsWith("=")) {
            throw new FormulaParseException(formula, 0, "formula must start with '='");
        }

        List<FormulaToken> tokens = new ArrayList<>();
        Deque<Character> openGroups = new ArrayDeque<>();
        StringBuilder operand = new StringBuilder();
        int operandStart = -1;
        int len = formula.length();
        int i = 1;

        while (i < len) {
            char c = formula.charAt(i);

            if (c == '"') {
                if (operand.length() > 0) {
                    throw new FormulaParseException(formula, i, "string literal directly after operand");
                }
                int end = scanQuoted(formula, i, '"');
                tokens.add(FormulaToken.of(formula.substring(i, end), TokenType.OPERAND_LITERAL, i));
                i = end;
                continue;
            }

            if (c == '\'' || c == '[' || c == '#' || isExponentSign(c, operand)) {
                int end;
                if (c == '\'') {
                    end = scanQuoted(formula, i, '\'');
                } else if (c == '[') {
                    end = scanBrackets(formula, i);
                } else if (c == '#') {
                    end = scanErrorLiteral(formula, i);
                } else {
                    end = i + 1;
                }
                if (operand.length() == 0) {
                    operandStart = i;
                }
                operand.append(formula, i, end);
                i = end;
                continue;
            }

            if (Character.isWhitespace(c)) {
                flushOperand(formula, operand, operandStart, openGroups, tokens);
                i++;
                continue;
            }

            switch (c) {
                case '(':
                    if (operand.length() > 0) {
                        tokens.add(FormulaToken.of(operand.toString(), TokenType.FUNCTION, operandStart));
                        operand.setLength(0);
                    } else {
                        tokens.add(FormulaToken.of("(", TokenType.PAREN_OPEN, i));
                    }
                    openGroups.push('(');
                    break;
                case ')':
                    flushOperand(formula, operand, operandStart, openGroups, tokens);
                    closeGroup(formula, i, '(', openGroups);
                    tokens.add(FormulaToken.of(")", TokenType.PAREN_CLOSE, i));
                    break;
                case '{':
                    if (operand.length() > 0) {
                        throw new FormulaParseException(formula, i, "array constant directly after operand");
                    }
                    if (openGroups.contains('{')) {
                        throw new FormulaParseException(formula, i, "nested array constant");
                    }
                    openGroups.push('{');
                    tokens.add(FormulaToken.of("{", TokenType.ARRAY_OPEN, i));
                    break;
                case '}':
                    flushOperand(formula, operand, operandStart, openGroups, tokens);
                    closeGroup(formula, i, '{', openGroups);
                    tokens.add(FormulaToken.of("}", TokenType.ARRAY_CLOSE, i));
                    break;
                case ',':
                case ';':
                    flushOperand(formula, operand, operandStart, openGroups, tokens);
                    tokens.add(FormulaToken.of(String.valueOf(c), TokenType.SEPARATOR, i));
                    break;
                case '<':
                case '>':
                case '=':
                    flushOperand(formula, operand, operandStart, openGroups, tokens);
                    int opEnd = comparisonEnd(formula, i);
                    tokens.add(FormulaToken.of(formula.substring(i, opEnd), TokenType.OPERATOR, i));
                    i = opEnd;
                    continue;
                default:
                    if (SINGLE_CHAR_OPERATORS.indexOf(c) >= 0) {
                        flushOperand(formula, operand, operandStart, openGroups, tokens);
                        tokens.add(FormulaToken.of(String.valueOf(c), TokenType.OPERATOR, i));
                    } else {
                        if (operand.length() == 0) {
                            operandStart = i;
                        }
                        operand.append(c);
                    }
            }
            i++;
        }

        flushOperand(formula, operand, operandStart, openGroups, tokens);
        if (!openGroups.isEmpty()) {
            char open = openGroups.peek();
            throw new FormulaParseException(formula, len, "unclosed '" + open + "'");
        }
        return tokens;
    }

    public List<String> references(String formula) throws FormulaParseException {
        List<String> references = new ArrayList<>();
        for (FormulaToken token : tokenize(formula)) {
            if (token.isCellReference()) {
                references.add(token.value());
            }
        }
        return references;
    }

    public static ReferenceKind classifyReference(String text) {
        String rest = text;
        Matcher external = EXTERNAL_QUALIFIER.matcher(text);
        if (external.find()) {
            // '[Book.xlsx]Sheet 1'!A1 keeps its opening quote so the sheet name stays quoted
            rest = (text.startsWith("'") ? "'" : "") + text.substring(external.end());
        }
        if (rest.indexOf('[') >= 0) {
            return ReferenceKind.STRUCTURED;
        }
        int bang = lastBangOutsideQuotes(rest);
        String address = bang >= 0 ? rest.substring(bang + 1) : rest;
        if (address.indexOf('#') >= 0) {
            return ReferenceKind.INVALID;
        }
        return CellAddress.isCellOrRange(address) ? ReferenceKind.CELL_RANGE : ReferenceKind.NAMED;
    }

    static int lastBangOutsideQuotes(String text) {
        boolean quoted = false;
        int last = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (c == '!' && !quoted) {
                last = i;
            }
        }
        return last;
    }

    private void flushOperand(String formula,
                              StringBuilder operand,
                              int start,
                              Deque<Character> openGroups,
                              List<FormulaToken> tokens) throws FormulaParseException {
        if (operand.length() == 0) {
            return;
        }
        String text = operand.toString();
        operand.setLength(0);

        if (isLiteral(text)) {
            tokens.add(FormulaToken.of(text, TokenType.OPERAND_LITERAL, start));
            return;
        }
        if (!openGroups.isEmpty() && openGroups.peek() == '{') {
            throw new FormulaParseException(formula, start, "reference inside array constant");
        }
        tokens.add(FormulaToken.reference(text, classifyReference(text), start));
    }

    private boolean isLiteral(String text) {
        if (NUMBER.matcher(text).matches()) {
            return true;
        }
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.equals("TRUE") || upper.equals("FALSE")) {
            return true;
        }
        return text.startsWith("#") && ErrorCode.fromCode(text).isPresent();
    }

    private boolean isExponentSign(char c, StringBuilder operand) {
        return (c == '+' || c == '-') && EXPONENT_PENDING.matcher(operand).matches();
    }

    private void closeGroup(String formula, int position, char expected, Deque<Character> openGroups)
            throws FormulaParseException {
        if (openGroups.isEmpty() || openGroups.peek() != expected) {
            throw new FormulaParseException(formula, position, "unbalanced '" + formula.charAt(position) + "'");
        }
        openGroups.pop();
    }

    private int comparisonEnd(String formula, int position) {
        char c = formula.charAt(position);
        if (position + 1 < formula.length()) {
            char next = formula.charAt(position + 1);
            if ((c == '<' && (next == '=' || next == '>')) || (c == '>' && next == '=')) {
                return position + 2;
            }
        }
        return position + 1;
    }

    private int scanQuoted(String formula, int start, char quote) throws FormulaParseException {
        int i = start + 1;
        while (i < formula.length()) {
            if (formula.charAt(i) == quote) {
                if (i + 1 < formula.length() && formula.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        throw new FormulaParseException(formula, start, "unterminated " + (quote == '"' ? "string" : "quoted name"));
    }

    private int scanBrackets(String formula, int start) throws FormulaParseException {
        int depth = 0;
        for (int i = start; i < formula.length(); i++) {
            char c = formula.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        throw new FormulaParseException(formula, start, "unbalanced '['");
    }

    private int scanErrorLiteral(String formula, int start) throws FormulaParseException {
        String rest = formula.substring(start).toUpperCase(Locale.ROOT);
        for (ErrorCode errorCode : ErrorCode.values()) {
            if (rest.startsWith(errorCode.getCode())) {
                return start + errorCode.getCode().length();
            }
        }
        throw new FormulaParseException(formula, start, "unknown error literal");
    }
}
