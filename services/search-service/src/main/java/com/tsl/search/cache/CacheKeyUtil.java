package com.tsl.search.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class CacheKeyUtil {
    private CacheKeyUtil() {
    }

    /**
     * SHA-256 of the JSON form of {@code value}; {@code null} when it cannot be serialized. Callers
     * pass sorted maps so the JSON is canonical.
     */
    public static String hashJson(ObjectMapper mapper, Object value) {
        try {
            String json = mapper.writeValueAsString(value);
            return sha256(json);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public static String sha256(String value) {
        if (value == null) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Translates a Redis-style glob ({@code *}, {@code ?}, {@code [abc]}, backslash escapes) to a
     * Java regex.
     */
    public static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        boolean inClass = false;
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                regex.append(escape(glob.charAt(++i)));
                continue;
            }
            if (inClass) {
                if (c == ']') {
                    inClass = false;
                    regex.append(']');
                } else if (c == '^' && glob.charAt(i - 1) == '[') {
                    regex.append('^');
                } else {
                    regex.append(c == '-' ? "-" : escape(c));
                }
                continue;
            }
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    inClass = true;
                    regex.append('[');
                }
                default -> regex.append(escape(c));
            }
        }
        if (inClass) {
            regex.append(']');
        }
        return regex.toString();
    }

    private static String escape(char c) {
        return Character.isLetterOrDigit(c) ? String.valueOf(c) : "\\" + c;
    }
}
