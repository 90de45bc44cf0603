package org.brown.coderunner.simulation;

import lombok.Getter;

/**
 * 시뮬레이션 실행 실패
 *
 * unsupportedConstruct=true 면 인터프리터가 지원하지 않는 문법을 만난 것이고,
 * false 면 지원 범위 안에서 Python 런타임 오류(NameError 등)가 난 것이다.
 */
@Getter
public class InterpretationException extends RuntimeException {

    private final boolean unsupportedConstruct;
    private final int line;
    private String partialOutput = "";

    public InterpretationException(String message, boolean unsupportedConstruct, int line) {
        super(message);
        this.unsupportedConstruct = unsupportedConstruct;
        this.line = line;
    }

    static InterpretationException unsupported(String construct, int line) {
        return new InterpretationException("unsupported construct: " + construct, true, line);
    }

    static InterpretationException pythonError(String message, int line) {
        return new InterpretationException(message, false, line);
    }

    InterpretationException withPartialOutput(String output) {
        this.partialOutput = output;
        return this;
    }
}
