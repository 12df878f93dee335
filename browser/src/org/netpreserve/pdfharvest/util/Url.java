package org.netpreserve.pdfharvest.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * URL type which caches parsing.
 */
public class Url {
    private final String url;
    private URI uri;
    private boolean unparseable;

    @JsonCreator
    public Url(String url) {
        this.url = url;
    }

    public synchronized URI toURI() throws URISyntaxException {
        if (uri == null) {
            uri = new URI(url);
        }
        return uri;
    }

    public @Nullable String scheme() {
        URI parsed = parse();
        return parsed == null ? null : parsed.getScheme();
    }

    public @Nullable String host() {
        URI parsed = parse();
        return parsed == null ? null : parsed.getHost();
    }

    /**
     * Host and optional port, without any userinfo. This is the key used for per-host politeness.
     */
    public @Nullable String hostAndPort() {
        URI parsed = parse();
        if (parsed == null || parsed.getHost() == null) return null;
        String host = parsed.getHost().toLowerCase(Locale.ROOT);
        return parsed.getPort() == -1 ? host : host + ":" + parsed.getPort();
    }

    /**
     * The scheme, host and port, e.g. "https://example.org:8080".
     */
    public @Nullable String origin() {
        String hostAndPort = hostAndPort();
        if (hostAndPort == null) return null;
        return scheme().toLowerCase(Locale.ROOT) + "://" + hostAndPort;
    }

    public String path() {
        URI parsed = parse();
        if (parsed == null || parsed.getRawPath() == null) return "";
        return parsed.getRawPath();
    }

    public Url withPath(String path) {
        String origin = origin();
        if (origin == null) throw new IllegalArgumentException("URL has no host: " + url);
        return new Url(origin + path);
    }

    @JsonValue
    public String toString() {
        return url;
    }

    private static boolean startsWithIgnoreCase(String str, String prefix) {
        return str.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    public boolean isHttp() {
        return startsWithIgnoreCase(url, "http:") ||
               startsWithIgnoreCase(url, "https:");
    }

    public Url withoutFragment() {
        int i = url.indexOf('#');
        if (i == -1) {
            return this;
        }
        return new Url(url.substring(0, i));
    }

    public boolean startsWith(String prefix) {
        return url.startsWith(prefix);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Url url1 = (Url) o;
        return url.equals(url1.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }

    private synchronized URI parse() {
        if (uri == null && !unparseable) {
            try {
                uri = new URI(url);
            } catch (URISyntaxException e) {
                unparseable = true;
            }
        }
        return uri;
    }
}
