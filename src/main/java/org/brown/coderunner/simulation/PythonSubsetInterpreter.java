package org.brown.coderunner.simulation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 아주 작은 Python 부분집합 인터프리터 (격리 백엔드가 없을 때의 시뮬레이션용)
 *
 * 지원:
 * - 빈 줄, # 주석
 * - 이름 대입 (name = expr)
 * - print(a, b, ...) : 공백으로 이어 붙이고 줄바꿈
 * - 문자열 리터럴 ('...', "...", 이스케이프 \n \t \\ \' \"), f-string 의 {name}
 * - 정수 리터럴, 문자열+문자열 / 정수+정수
 * - input(), input(prompt) : stdin 을 한 줄씩 소비, prompt 는 줄바꿈 없이 출력
 * - int(x), str(x)
 *
 * 그 밖의 문법은 추측하지 않고 InterpretationException(unsupportedConstruct=true) 로 거절한다.
 */
public class PythonSubsetInterpreter {

    /**
     * @return 프로그램 출력
     * @throws InterpretationException 지원하지 않는 문법 또는 Python 런타임 오류 (지금까지의 출력 포함)
     */
    public String run(String source, String stdin) {
        Execution execution = new Execution(stdin != null ? stdin : "");
        String[] lines = (source != null ? source : "").split("\n", -1);
        try {
            for (int i = 0; i < lines.length; i++) {
                execution.line = i + 1;
                execution.executeLine(stripCarriageReturn(lines[i]));
            }
        } catch (InterpretationException e) {
            throw e.withPartialOutput(execution.output.toString());
        }
        return execution.output.toString();
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private enum TokenType { NAME, INT, STRING, FSTRING, LPAREN, RPAREN, COMMA, PLUS, ASSIGN, END }

    private record Token(TokenType type, String text) {
    }

    private static final class Execution {

        private final Map<String, Object> variables = new HashMap<>();
        private final StringBuilder output = new StringBuilder();
        private final String stdin;
        private int stdinPosition;
        private int line;

        private List<Token> tokens;
        private int position;

        Execution(String stdin) {
            this.stdin = stdin;
        }

        void executeLine(String text) {
            if (text.isBlank()) {
                return;
            }
            if (Character.isWhitespace(text.charAt(0))) {
                throw InterpretationException.unsupported("indented block", line);
            }
            tokens = tokenize(text);
            position = 0;
            if (peek().type() == TokenType.END) {
                return;  // 주석만 있는 줄
            }

            if (peek().type() == TokenType.NAME && tokens.get(1).type() == TokenType.ASSIGN) {
                String name = next().text();
                next();
                Object value = expression();
                expect(TokenType.END, "statement continuation");
                variables.put(name, value);
                return;
            }

            expression();
            expect(TokenType.END, "statement continuation");
        }

        // expr := term ('+' term)*
        private Object expression() {
            Object left = term();
            while (peek().type() == TokenType.PLUS) {
                next();
                Object right = term();
                left = add(left, right);
            }
            return left;
        }

        private Object term() {
            Token token = next();
            switch (token.type()) {
                case INT:
                    try {
                        return Long.parseLong(token.text());
                    } catch (NumberFormatException e) {
                        throw InterpretationException.unsupported("integer literal " + token.text(), line);
                    }
                case STRING:
                    return token.text();
                case FSTRING:
                    return formatString(token.text());
                case NAME:
                    if (peek().type() == TokenType.LPAREN) {
                        return call(token.text());
                    }
                    if (!variables.containsKey(token.text())) {
                        throw InterpretationException.pythonError(
                                "NameError: name '" + token.text() + "' is not defined", line);
                    }
                    return variables.get(token.text());
                case LPAREN:
                    Object value = expression();
                    expect(TokenType.RPAREN, "parenthesized expression");
                    return value;
                default:
                    throw InterpretationException.unsupported("token '" + token.text() + "'", line);
            }
        }

        private Object call(String function) {
            next();  // (
            List<Object> arguments = new ArrayList<>();
            if (peek().type() != TokenType.RPAREN) {
                while (true) {
                    if (peek().type() == TokenType.NAME && tokens.get(position + 1).type() == TokenType.ASSIGN) {
                        throw InterpretationException.unsupported("keyword argument " + peek().text() + "=", line);
                    }
                    arguments.add(expression());
                    if (peek().type() != TokenType.COMMA) {
                        break;
                    }
                    next();
                }
            }
            expect(TokenType.RPAREN, "call to " + function + "()");

            switch (function) {
                case "print":
                    List<String> parts = new ArrayList<>();
                    arguments.forEach(argument -> parts.add(render(argument)));
                    output.append(String.join(" ", parts)).append('\n');
                    return null;
                case "input":
                    if (arguments.size() > 1) {
                        throw InterpretationException.pythonError(
                                "TypeError: input expected at most 1 argument, got " + arguments.size(), line);
                    }
                    if (arguments.size() == 1) {
                        output.append(arguments.get(0));
                    }
                    return readLine();
                case "int":
                    return toInt(single(function, arguments));
                case "str":
                    if (arguments.size() != 1) {
                        throw InterpretationException.unsupported(function + "() with " + arguments.size() + " arguments", line);
                    }
                    return render(arguments.get(0));
                default:
                    throw InterpretationException.unsupported("function call " + function + "()", line);
            }
        }

        private Object single(String function, List<Object> arguments) {
            if (arguments.size() != 1) {
                throw InterpretationException.unsupported(function + "() with " + arguments.size() + " arguments", line);
            }
            Object argument = arguments.get(0);
            if (argument == null) {
                throw InterpretationException.unsupported("None value", line);
            }
            return argument;
        }

        private Long toInt(Object value) {
            if (value instanceof Long) {
                return (Long) value;
            }
            String text = ((String) value).trim();
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw InterpretationException.pythonError(
                        "ValueError: invalid literal for int() with base 10: '" + value + "'", line);
            }
        }

        private Object add(Object left, Object right) {
            if (left instanceof String && right instanceof String) {
                return (String) left + right;
            }
            if (left instanceof Long && right instanceof Long) {
                try {
                    return Math.addExact((Long) left, (Long) right);
                } catch (ArithmeticException e) {
                    throw InterpretationException.unsupported("integer larger than 64 bits", line);
                }
            }
            throw InterpretationException.pythonError("TypeError: unsupported operand type(s) for +: '"
                    + typeName(left) + "' and '" + typeName(right) + "'", line);
        }

        private String render(Object value) {
            return value == null ? "None" : value.toString();
        }

        private String typeName(Object value) {
            if (value == null) {
                return "NoneType";
            }
            return value instanceof Long ? "int" : "str";
        }

        private String readLine() {
            if (stdinPosition >= stdin.length()) {
                throw InterpretationException.pythonError("EOFError: EOF when reading a line", line);
            }
            int newline = stdin.indexOf('\n', stdinPosition);
            String value;
            if (newline < 0) {
                value = stdin.substring(stdinPosition);
                stdinPosition = stdin.length();
            } else {
                value = stdin.substring(stdinPosition, newline);
                stdinPosition = newline + 1;
            }
            return stripCarriageReturn(value);
        }

        private String formatString(String template) {
            StringBuilder result = new StringBuilder();
            int i = 0;
            while (i < template.length()) {
                char c = template.charAt(i);
                if (c == '{' && i + 1 < template.length() && template.charAt(i + 1) == '{') {
                    result.append('{');
                    i += 2;
                } else if (c == '}' && i + 1 < template.length() && template.charAt(i + 1) == '}') {
                    result.append('}');
                    i += 2;
                } else if (c == '{') {
                    int close = template.indexOf('}', i);
                    if (close < 0) {
                        throw InterpretationException.unsupported("unterminated f-string placeholder", line);
                    }
                    String name = template.substring(i + 1, close).trim();
                    if (!isIdentifier(name)) {
                        throw InterpretationException.unsupported("f-string expression {" + name + "}", line);
                    }
                    if (!variables.containsKey(name)) {
                        throw InterpretationException.pythonError(
                                "NameError: name '" + name + "' is not defined", line);
                    }
                    result.append(render(variables.get(name)));
                    i = close + 1;
                } else if (c == '}') {
                    throw InterpretationException.pythonError(
                            "SyntaxError: f-string: single '}' is not allowed", line);
                } else {
                    result.append(c);
                    i++;
                }
            }
            return result.toString();
        }

        private Token peek() {
            return tokens.get(position);
        }

        private Token next() {
            Token token = tokens.get(position);
            if (token.type() != TokenType.END) {
                position++;
            }
            return token;
        }

        private void expect(TokenType type, String context) {
            Token token = next();
            if (token.type() != type) {
                throw InterpretationException.unsupported(
                        "'" + token.text() + "' in " + context, line);
            }
        }

        private List<Token> tokenize(String text) {
            List<Token> result = new ArrayList<>();
            int i = 0;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == '#') {
                    break;
                }
                if (Character.isWhitespace(c)) {
                    i++;
                } else if (c == '(') {
                    result.add(new Token(TokenType.LPAREN, "("));
                    i++;
                } else if (c == ')') {
                    result.add(new Token(TokenType.RPAREN, ")"));
                    i++;
                } else if (c == ',') {
                    result.add(new Token(TokenType.COMMA, ","));
                    i++;
                } else if (c == '+') {
                    result.add(new Token(TokenType.PLUS, "+"));
                    i++;
                } else if (c == '=') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '=') {
                        throw InterpretationException.unsupported("operator ==", line);
                    }
                    result.add(new Token(TokenType.ASSIGN, "="));
                    i++;
                } else if (c == '"' || c == '\'') {
                    i = readString(text, i, false, result);
                } else if (Character.isDigit(c)) {
                    int start = i;
                    while (i < text.length() && Character.isDigit(text.charAt(i))) {
                        i++;
                    }
                    result.add(new Token(TokenType.INT, text.substring(start, i)));
                } else if (Character.isLetter(c) || c == '_') {
                    int start = i;
                    while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                        i++;
                    }
                    String word = text.substring(start, i);
                    if (i < text.length() && (text.charAt(i) == '"' || text.charAt(i) == '\'')) {
                        if (!word.equals("f") && !word.equals("F")) {
                            throw InterpretationException.unsupported("string prefix " + word, line);
                        }
                        i = readString(text, i, true, result);
                    } else {
                        if (isKeyword(word)) {
                            throw InterpretationException.unsupported("keyword '" + word + "'", line);
                        }
                        result.add(new Token(TokenType.NAME, word));
                    }
                } else {
                    throw InterpretationException.unsupported("character '" + c + "'", line);
                }
            }
            result.add(new Token(TokenType.END, "end of line"));
            return result;
        }

        private int readString(String text, int start, boolean formatted, List<Token> result) {
            char quote = text.charAt(start);
            if (text.startsWith(String.valueOf(quote).repeat(3), start)) {
                throw InterpretationException.unsupported("triple-quoted string", line);
            }
            StringBuilder value = new StringBuilder();
            int i = start + 1;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == quote) {
                    result.add(new Token(formatted ? TokenType.FSTRING : TokenType.STRING, value.toString()));
                    return i + 1;
                }
                if (c == '\\' && i + 1 < text.length()) {
                    char escaped = text.charAt(i + 1);
                    switch (escaped) {
                        case 'n':
                            value.append('\n');
                            break;
                        case 't':
                            value.append('\t');
                            break;
                        case '\\':
                            value.append('\\');
                            break;
                        case '\'':
                            value.append('\'');
                            break;
                        case '"':
                            value.append('"');
                            break;
                        default:
                            throw InterpretationException.unsupported("escape sequence \\" + escaped, line);
                    }
                    i += 2;
                } else {
                    value.append(c);
                    i++;
                }
            }
            throw InterpretationException.pythonError("SyntaxError: unterminated string literal", line);
        }

        private static boolean isIdentifier(String name) {
            if (name.isEmpty() || !(Character.isLetter(name.charAt(0)) || name.charAt(0) == '_')) {
                return false;
            }
            for (int i = 1; i < name.length(); i++) {
                if (!Character.isLetterOrDigit(name.charAt(i)) && name.charAt(i) != '_') {
                    return false;
                }
            }
            return !isKeyword(name);
        }

        private static boolean isKeyword(String word) {
            switch (word) {
                case "if": case "elif": case "else": case "for": case "while": case "def": case "class":
                case "return": case "import": case "from": case "try": case "except": case "finally":
                case "with": case "lambda": case "and": case "or": case "not": case "in": case "is":
                case "True": case "False": case "None": case "pass": case "break": case "continue":
                case "global": case "nonlocal": case "raise": case "yield": case "del": case "assert":
                case "async": case "await":
                    return true;
                default:
                    return false;
            }
        }
    }
}
