package com.phillippitts.coordsim.util;

/** Keeps collaborator-supplied text short before it reaches logs or session error lists. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Message of a throwable, falling back to its simple class name when the message is empty.
     */
    public static String describe(Throwable t, int max) {
        if (t == null) {
            return "";
        }
        String msg = t.getMessage();
        if (msg == null || msg.isBlank()) {
            msg = t.getClass().getSimpleName();
        }
        return truncate(msg, max);
    }
}
