package org.netpreserve.trawler.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.netpreserve.urlcanon.Canonicalizer;
import org.netpreserve.urlcanon.ParsedUrl;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * URL type which caches parsing.
 */
public class Url {
    private static final String UNRESERVED = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-._~";
    private final String url;
    private URI uri;
    private ParsedUrl parsedUrl;

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

    public String host() {
        return parse().getHost();
    }

    public String scheme() {
        return parse().getScheme();
    }

    @JsonValue
    public String toString() {
        return url;
    }

    public boolean isHttp() {
        String scheme = scheme();
        return scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https");
    }

    public Url withoutFragment() {
        int i = url.indexOf('#');
        if (i == -1) {
            return this;
        }
        return new Url(url.substring(0, i));
    }

    /**
     * Resolves a possibly relative reference against this URL.
     */
    public Url resolve(String reference) throws URISyntaxException {
        return new Url(toURI().resolve(reference).toString());
    }

    /**
     * Normalised form used to detect duplicate work items. HTTP URLs are WHATWG canonicalized, then percent-encoded
     * unreserved characters are decoded, a trailing slash and utm_* tracking parameters are dropped and the
     * remaining query parameters are sorted. Other URLs are only stripped of their fragment.
     */
    public String uniqueKey() {
        Url base = withoutFragment();
        if (!base.isHttp()) return base.url.trim();

        ParsedUrl parsed = new ParsedUrl(base.parse());
        Canonicalizer.WHATWG.canonicalize(parsed);

        var builder = new StringBuilder();
        builder.append(parsed.getScheme()).append(parsed.getColonAfterScheme()).append(parsed.getSlashes());
        builder.append(parsed.getUsername()).append(parsed.getColonBeforePassword()).append(parsed.getPassword())
                .append(parsed.getAtSign());
        builder.append(parsed.getHost()).append(parsed.getColonBeforePort()).append(parsed.getPort());

        String path = decodeUnreserved(parsed.getPath());
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        builder.append(path);

        String query = parsed.getQuery();
        if (!query.isEmpty()) {
            List<String> params = new ArrayList<>(Arrays.asList(query.split("&")));
            params.removeIf(param -> param.isEmpty() || param.regionMatches(true, 0, "utm_", 0, 4));
            params.sort(null);
            if (!params.isEmpty()) {
                builder.append('?').append(String.join("&", params));
            }
        }
        return builder.toString();
    }

    /**
     * Decodes %XX escapes of unreserved characters and upper-cases the hex digits of the rest.
     */
    private static String decodeUnreserved(String path) {
        if (path.indexOf('%') == -1) return path;
        var builder = new StringBuilder(path.length());
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '%' && i + 2 < path.length() && isHex(path.charAt(i + 1)) && isHex(path.charAt(i + 2))) {
                char decoded = (char) Integer.parseInt(path.substring(i + 1, i + 3), 16);
                if (UNRESERVED.indexOf(decoded) != -1) {
                    builder.append(decoded);
                } else {
                    builder.append('%').append(path.substring(i + 1, i + 3).toUpperCase(Locale.ROOT));
                }
                i += 2;
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    private static boolean isHex(char c) {
        return Character.digit(c, 16) != -1;
    }

    private ParsedUrl parse() {
        if (parsedUrl == null) {
            parsedUrl = ParsedUrl.parseUrl(url);
        }
        return parsedUrl;
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
}
