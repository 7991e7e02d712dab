package com.capsulo.cms.core.codec;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Converts document text to and from the base64 transport form used by the GitHub contents
 * and blob APIs. Text is always treated as UTF-8, so multibyte characters survive the round trip.
 */
public final class ContentCodec {
    private ContentCodec() {}

    public static String encode(String text) {
        if (text == null) throw new IllegalArgumentException("text is required");
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * GitHub wraps base64 payloads at 60 or 76 columns, so line breaks are stripped before decoding.
     */
    public static String decode(String transport) {
        if (transport == null) throw new IllegalArgumentException("transport is required");
        String compact = transport.replace("\n", "").replace("\r", "");
        byte[] bytes = Base64.getDecoder().decode(compact);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
