package io.artifactmesh.util;

import java.nio.charset.StandardCharsets;

public final class Names {
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private Names() {
    }

    /**
     * Turns a node or unit name into a single path segment, e.g. {@code concourse-ci/1} into
     * {@code concourse-ci%2F1}. Case is kept and every other byte is percent-encoded, so distinct
     * names never share a segment.
     */
    public static String pathSegment(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        byte[] bytes = raw.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            boolean ok = (b >= 'a' && b <= 'z')
                    || (b >= 'A' && b <= 'Z')
                    || (b >= '0' && b <= '9')
                    || b == '_' || b == '-'
                    || (b == '.' && i > 0);
            if (ok) {
                sb.append((char) b);
            } else {
                sb.append('%').append(HEX[b >> 4]).append(HEX[b & 0x0F]);
            }
        }
        return sb.toString();
    }
}
