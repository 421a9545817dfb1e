package com.z254.magi.live;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalizes user- or model-supplied site addresses.
 * Bare hosts get {@code https://}; only http and https are accepted; fragments are dropped.
 */
public final class LiveUrlNormalizer {

    private static final Pattern HTTP_SCHEME = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);

    private LiveUrlNormalizer() {
    }

    public static Optional<String> normalize(String raw) {
        return parse(raw).map(URI::toString);
    }

    /**
     * Parse and normalize into a URI with lowercase scheme and host, default port removed
     * and an empty path replaced by {@code /}.
     */
    public static Optional<URI> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String candidate = raw.trim();
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        if (!HTTP_SCHEME.matcher(candidate).find()) {
            candidate = "https://" + candidate;
        }
        try {
            URI uri = new URI(candidate);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
                return Optional.empty();
            }
            StringBuilder normalized = new StringBuilder(scheme).append("://");
            if (uri.getRawUserInfo() != null) {
                normalized.append(uri.getRawUserInfo()).append('@');
            }
            normalized.append(uri.getHost().toLowerCase(Locale.ROOT));
            int port = uri.getPort();
            if (port != -1 && !isDefaultPort(scheme, port)) {
                normalized.append(':').append(port);
            }
            String path = uri.getRawPath();
            normalized.append(path == null || path.isEmpty() ? "/" : path);
            if (uri.getRawQuery() != null) {
                normalized.append('?').append(uri.getRawQuery());
            }
            return Optional.of(new URI(normalized.toString()));
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return (scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443);
    }
}
