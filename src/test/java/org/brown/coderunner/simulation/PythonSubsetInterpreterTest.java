package org.brown.coderunner.simulation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class PythonSubsetInterpreterTest {

    private final PythonSubsetInterpreter interpreter = new PythonSubsetInterpreter();

    @Test
    void helloWorld() {
        assertThat(interpreter.run("print(\"Hello, World!\")", null)).isEqualTo("Hello, World!\n");
    }

    @Test
    void inputAndFormattedString() {
        String source = "name = input()\nprint(f\"Hello, {name}!\")\n";

        assertThat(interpreter.run(source, "Ada")).isEqualTo("Hello, Ada!\n");
    }

    @Test
    void promptIsEchoedWithoutNewline() {
        String source = "age = input('Age? ')\nprint('next year', int(age) + 1)";

        assertThat(interpreter.run(source, "41\n")).isEqualTo("Age? next year 42\n");
    }

    @Test
    void multipleInputsConsumeLinesInOrder() {
        String source = String.join("\n",
                "# add two numbers",
                "a = int(input())",
                "b = int(input())",
                "",
                "print(a + b)  # sum",
                "print(str(a) + '+' + str(b))");

        assertThat(interpreter.run(source, "2\r\n3\n")).isEqualTo("5\n2+3\n");
    }

    @Test
    void escapesAndBraces() {
        assertThat(interpreter.run("print('a\\tb\\n', \"it\\'s\")", null)).isEqualTo("a\tb\n it's\n");
        assertThat(interpreter.run("x = 1\nprint(f'{{x}} = {x}')", null)).isEqualTo("{x} = 1\n");
        assertThat(interpreter.run("print()", null)).isEqualTo("\n");
    }

    @Test
    void noneValueIsRenderedLikePython() {
        String source = "x = print('side effect')\nprint(x)\nprint(f'value={x}')\nprint(str(x) + '!')";

        assertThat(interpreter.run(source, null)).isEqualTo("side effect\nNone\nvalue=None\nNone!\n");
    }

    @Test
    void unsupportedConstructsAreNamed() {
        InterpretationException loop = catchThrowableOfType(
                () -> interpreter.run("print('start')\nfor i in range(3):\n    print(i)", null),
                InterpretationException.class);

        assertThat(loop.isUnsupportedConstruct()).isTrue();
        assertThat(loop.getLine()).isEqualTo(2);
        assertThat(loop.getMessage()).contains("keyword 'for'");
        assertThat(loop.getPartialOutput()).isEqualTo("start\n");

        InterpretationException call = catchThrowableOfType(
                () -> interpreter.run("print(len('abc'))", null), InterpretationException.class);
        assertThat(call.getMessage()).contains("len()");

        InterpretationException keyword = catchThrowableOfType(
                () -> interpreter.run("print('a', sep='-')", null), InterpretationException.class);
        assertThat(keyword.getMessage()).contains("keyword argument sep=");

        InterpretationException expression = catchThrowableOfType(
                () -> interpreter.run("x = 1\nprint(f'{x + 1}')", null), InterpretationException.class);
        assertThat(expression.isUnsupportedConstruct()).isTrue();
    }

    @Test
    void pythonErrorsAreReported() {
        InterpretationException nameError = catchThrowableOfType(
                () -> interpreter.run("print(missing)", null), InterpretationException.class);
        assertThat(nameError.isUnsupportedConstruct()).isFalse();
        assertThat(nameError.getMessage()).isEqualTo("NameError: name 'missing' is not defined");

        InterpretationException eof = catchThrowableOfType(
                () -> interpreter.run("a = input()\nb = input()", "only one"), InterpretationException.class);
        assertThat(eof.getMessage()).startsWith("EOFError");
        assertThat(eof.getLine()).isEqualTo(2);

        InterpretationException typeError = catchThrowableOfType(
                () -> interpreter.run("print('a' + 1)", null), InterpretationException.class);
        assertThat(typeError.getMessage()).contains("'str' and 'int'");

        InterpretationException valueError = catchThrowableOfType(
                () -> interpreter.run("int('abc')", null), InterpretationException.class);
        assertThat(valueError.getMessage()).startsWith("ValueError");
    }
}
