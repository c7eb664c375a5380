package com.phillippitts.platemate.service.speech;

import java.util.Objects;

/**
 * Event emitted by a {@link RecognitionTask}.
 *
 * @param type  event kind
 * @param text  transcript so far (PARTIAL) or complete transcript (FINAL); empty for ERROR
 * @param error failure cause for ERROR, otherwise {@code null}
 */
public record RecognitionEvent(Type type, String text, Throwable error) {

    public enum Type { PARTIAL, FINAL, ERROR }

    public RecognitionEvent {
        Objects.requireNonNull(type, "type");
        text = text == null ? "" : text;
    }

    public static RecognitionEvent partial(String text) {
        return new RecognitionEvent(Type.PARTIAL, text, null);
    }

    public static RecognitionEvent finalResult(String text) {
        return new RecognitionEvent(Type.FINAL, text, null);
    }

    public static RecognitionEvent error(Throwable error) {
        return new RecognitionEvent(Type.ERROR, "", error);
    }
}
