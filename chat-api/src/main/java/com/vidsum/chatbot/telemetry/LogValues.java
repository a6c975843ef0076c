package com.vidsum.chatbot.telemetry;

/**
 * Makes user supplied text safe to put on a single log line.
 */
public final class LogValues {

    private LogValues() {
    }

    public static String abbreviate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        String flattened = value.replaceAll("[\\p{Cntrl}\\u2028\\u2029]+", " ").trim();
        if (maxLength <= 3 || flattened.length() <= maxLength) {
            return flattened;
        }
        return flattened.substring(0, maxLength - 3) + "...";
    }
}
