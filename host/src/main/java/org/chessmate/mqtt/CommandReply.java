package org.chessmate.mqtt;

public record CommandReply(String command, String response) {
}
