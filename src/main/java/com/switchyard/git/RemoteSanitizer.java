package com.switchyard.git;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

/**
 * Derives credential-free forms of a remote URL for display and history.
 * The URL passed to git is never altered.
 */
public final class RemoteSanitizer {

    private static final Pattern URL_WITH_SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.\\-]*://.*");

    /**
     * @param display      short label, e.g. {@code github.com/org/repo}
     * @param historyEntry credential-free remote suitable for storing
     */
    public record RemoteMetadata(String display, String historyEntry) {
    }

    private RemoteSanitizer() {}

    public static RemoteMetadata sanitize(String remoteUrl) {
        if (URL_WITH_SCHEME.matcher(remoteUrl).matches()) {
            try {
                return sanitizeUrl(new URI(remoteUrl));
            } catch (URISyntaxException e) {
                String fallback = stripGitSuffix(remoteUrl);
                return new RemoteMetadata(fallback, fallback);
            }
        }

        RemoteMetadata scpLike = sanitizeScpLike(remoteUrl);
        if (scpLike != null) {
            return scpLike;
        }

        String fallback = stripGitSuffix(remoteUrl);
        return new RemoteMetadata(fallback, fallback);
    }

    private static RemoteMetadata sanitizeUrl(URI uri) throws URISyntaxException {
        URI cleaned = new URI(uri.getScheme(), null, uri.getHost(), uri.getPort(),
                uri.getPath(), uri.getQuery(), uri.getFragment());
        String historyEntry = cleaned.toString();
        if (uri.getHost() == null) {
            return new RemoteMetadata(stripGitSuffix(historyEntry), historyEntry);
        }
        String path = uri.getPath() == null ? "" : stripGitSuffix(uri.getPath());
        return new RemoteMetadata(uri.getHost() + path, historyEntry);
    }

    private static RemoteMetadata sanitizeScpLike(String remoteUrl) {
        int colon = remoteUrl.indexOf(':');
        if (colon < 0) {
            return null;
        }
        String userHost = remoteUrl.substring(0, colon);
        String path = remoteUrl.substring(colon + 1);
        int at = userHost.lastIndexOf('@');
        String host = at >= 0 ? userHost.substring(at + 1) : userHost;
        String normalizedPath = stripGitSuffix(path);
        String display = normalizedPath.isEmpty()
                ? host
                : host + "/" + stripLeadingSlashes(normalizedPath);
        return new RemoteMetadata(display, "git@" + host + ":" + normalizedPath);
    }

    static String stripGitSuffix(String path) {
        String result = path;
        while (result.endsWith(".git")) {
            result = result.substring(0, result.length() - 4);
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String stripLeadingSlashes(String path) {
        int i = 0;
        while (i < path.length() && path.charAt(i) == '/') {
            i++;
        }
        return path.substring(i);
    }
}
