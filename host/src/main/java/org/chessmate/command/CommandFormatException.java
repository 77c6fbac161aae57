package org.chessmate.command;

public class CommandFormatException extends Exception {
    public CommandFormatException(String message) {
        super(message);
    }
}
