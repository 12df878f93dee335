package org.netpreserve.pdfharvest;

import org.apache.commons.lang3.StringUtils;
import org.netpreserve.pdfharvest.util.Url;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Deterministic PDF file names: {@code {title prefix}_{sha1 of url}.pdf}.
 */
final class ArtifactNames {
    static final int MAX_PREFIX_LENGTH = 50;
    private static final Pattern UNSAFE = Pattern.compile("[:/\\\\?%*|\"<>\n\r]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ArtifactNames() {
    }

    static String sanitize(String title) {
        if (title == null) return "page";
        String s = UNSAFE.matcher(title).replaceAll("_");
        s = WHITESPACE.matcher(s).replaceAll("_");
        int codePoints = s.codePointCount(0, s.length());
        s = s.substring(0, s.offsetByCodePoints(0, Math.min(MAX_PREFIX_LENGTH, codePoints)));
        s = StringUtils.strip(s, "_");
        return s.isEmpty() ? "page" : s;
    }

    static String fingerprint(Url url) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(url.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    static String filenameFor(String title, String fingerprint) {
        return sanitize(title) + "_" + fingerprint + ".pdf";
    }
}
