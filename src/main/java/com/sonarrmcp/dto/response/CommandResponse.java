package com.sonarrmcp.dto.response;

/**
 * The outcome of a shell command: a success flag and the message to show.
 *
 * @param success Whether the command did what was asked.
 * @param message The confirmation or the error explanation.
 */
public record CommandResponse(boolean success, String message) {

    public static CommandResponse ok(String message) {
        return new CommandResponse(true, message);
    }

    public static CommandResponse error(String message) {
        return new CommandResponse(false, message);
    }

    /**
     * Formats the message for the terminal: green for success, red for failure.
     *
     * @return The message wrapped in ANSI color codes.
     */
    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        return color + message + "\u001B[0m";
    }
}
