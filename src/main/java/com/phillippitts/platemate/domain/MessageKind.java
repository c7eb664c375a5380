package com.phillippitts.platemate.domain;

/**
 * Presentation hint for a chat message.
 */
public enum MessageKind {
    TEXT,
    RESTAURANT_LIST,
    LOCATION_REQUEST,
    ERROR,
    WELCOME
}
