package com.eainde.slopstopper.ingest;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the canonical video id from the URL forms that appear in watch history.
 */
public class VideoIdExtractor {

    private static final Pattern VIDEO_ID = Pattern.compile("[A-Za-z0-9_-]{11}");
    private static final Pattern CHANNEL_ID = Pattern.compile("/channel/(UC[A-Za-z0-9_-]{22})");
    private static final String CANONICAL_URL = "https://www.youtube.com/watch?v=";

    public Optional<String> extract(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase();
        String path = uri.getPath() == null ? "" : uri.getPath();

        String candidate = null;
        if (host.equals("youtu.be")) {
            candidate = firstSegment(path);
        } else if (host.equals("youtube.com") || host.endsWith(".youtube.com")) {
            if (path.equals("/watch")) {
                candidate = queryParam(uri.getRawQuery(), "v");
            } else if (path.startsWith("/shorts/") || path.startsWith("/live/") || path.startsWith("/embed/")) {
                candidate = firstSegment(path.substring(path.indexOf('/', 1)));
            }
        }
        if (candidate != null && VIDEO_ID.matcher(candidate).matches()) {
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    public String canonicalUrl(String videoId) {
        return CANONICAL_URL + videoId;
    }

    public Optional<String> extractChannelId(String channelUrl) {
        if (channelUrl == null) {
            return Optional.empty();
        }
        Matcher m = CHANNEL_ID.matcher(channelUrl);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private static String firstSegment(String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        int slash = trimmed.indexOf('/');
        return slash >= 0 ? trimmed.substring(0, slash) : trimmed;
    }

    private static String queryParam(String rawQuery, String name) {
        if (rawQuery == null) {
            return null;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && pair.substring(0, eq).equals(name)) {
                return pair.substring(eq + 1);
            }
        }
        return null;
    }
}
