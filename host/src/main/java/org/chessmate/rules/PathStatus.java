package org.chessmate.rules;

public enum PathStatus {
    CLEAR,
    BLOCKED,
    DESTINATION_OCCUPIED
}
