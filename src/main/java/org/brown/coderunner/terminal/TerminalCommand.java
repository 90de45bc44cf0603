package org.brown.coderunner.terminal;

/**
 * 세션 actor 의 mailbox 로 들어가는 명령
 */
public sealed interface TerminalCommand {

    record Input(String data) implements TerminalCommand {
    }

    record Resize(int cols, int rows) implements TerminalCommand {
    }

    record Close(String reason) implements TerminalCommand {
    }
}
