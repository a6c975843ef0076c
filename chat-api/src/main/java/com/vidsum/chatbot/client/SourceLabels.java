package com.vidsum.chatbot.client;

import java.util.Locale;

public final class SourceLabels {

    private SourceLabels() {
    }

    /** {@code s3://bucket/summaries/Deep_Dive_Agents.md} becomes {@code Deep Dive Agents}. */
    public static String displayName(String uri) {
        if (uri == null || uri.isEmpty()) {
            return uri;
        }
        String fileName = uri.substring(uri.lastIndexOf('/') + 1);
        if (fileName.endsWith(".md")) {
            fileName = fileName.substring(0, fileName.length() - 3);
        }
        return fileName.replace('_', ' ');
    }

    public static String percentage(double score) {
        return String.format(Locale.ROOT, "%.0f%%", score * 100d);
    }
}
