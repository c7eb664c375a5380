package com.phillippitts.platemate.exception;

/**
 * Thrown when a message is sent while another request of the same session is still in flight.
 * The remote conversation is a strictly ordered single thread, so the call is rejected rather than queued.
 */
public class ConversationBusyException extends PlateMateException {

    public ConversationBusyException() {
        super("A conversation request is already in flight");
    }
}
