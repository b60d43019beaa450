package me.golemcore.scraper.crawl;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Canonical URL form used as the crawl dedup key and the plan cache key:
 * lowercase scheme and host, leading {@code www.} removed, default port
 * dropped, no trailing slash, no query, no fragment.
 *
 * <p>
 * {@code normalize(normalize(u)).equals(normalize(u))} holds for every http(s)
 * URL.
 */
public final class UrlNormalizer {

    private static final String WWW_PREFIX = "www.";

    private UrlNormalizer() {
    }

    public static String normalize(String url) {
        return normalize(url, null);
    }

    /**
     * Normalizes {@code url}, resolving it against {@code baseUrl} first when it
     * is relative.
     */
    public static String normalize(String url, String baseUrl) {
        if (url == null || url.isBlank()) {
            return "";
        }
        try {
            URI uri = new URI(escape(url));
            if (!uri.isAbsolute() && baseUrl != null && !baseUrl.isBlank()) {
                uri = new URI(escape(baseUrl)).resolve(uri);
            }
            if (uri.getScheme() == null || uri.getHost() == null) {
                return stripQueryAndFragment(url.trim());
            }
            uri = uri.normalize();
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            StringBuilder normalized = new StringBuilder(scheme)
                    .append("://")
                    .append(stripWww(uri.getHost().toLowerCase(Locale.ROOT)));
            int port = uri.getPort();
            if (port != -1 && !isDefaultPort(scheme, port)) {
                normalized.append(':').append(port);
            }
            normalized.append(stripTrailingSlashes(uri.getRawPath()));
            return normalized.toString();
        } catch (URISyntaxException e) {
            return stripQueryAndFragment(url.trim());
        }
    }

    /**
     * Returns the normalized authority ({@code host[:port]}) of a URL, or an empty
     * string when it has none.
     */
    public static String authority(String url) {
        String normalized = normalize(url);
        int schemeEnd = normalized.indexOf("://");
        if (schemeEnd < 0) {
            return "";
        }
        String rest = normalized.substring(schemeEnd + 3);
        int slash = rest.indexOf('/');
        return slash < 0 ? rest : rest.substring(0, slash);
    }

    /**
     * Returns the normalized path of a URL; empty for the site root.
     */
    public static String path(String url) {
        String normalized = normalize(url);
        int schemeEnd = normalized.indexOf("://");
        if (schemeEnd < 0) {
            return normalized;
        }
        int slash = normalized.indexOf('/', schemeEnd + 3);
        return slash < 0 ? "" : normalized.substring(slash);
    }

    /**
     * Lowercased host without any leading {@code www.}, or null when the URL has
     * no host.
     */
    public static String host(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String host = new URI(escape(url)).getHost();
            return host == null ? null : stripWww(host.toLowerCase(Locale.ROOT));
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static boolean isHttp(String url) {
        if (url == null) {
            return false;
        }
        String lower = url.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private static String escape(String url) {
        return url.trim().replace(" ", "%20");
    }

    private static String stripWww(String host) {
        if (host.startsWith(WWW_PREFIX) && host.length() > WWW_PREFIX.length()) {
            return host.substring(WWW_PREFIX.length());
        }
        return host;
    }

    private static String stripTrailingSlashes(String path) {
        if (path == null) {
            return "";
        }
        String result = path;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String stripQueryAndFragment(String url) {
        int cut = url.length();
        int query = url.indexOf('?');
        int fragment = url.indexOf('#');
        if (query >= 0) {
            cut = Math.min(cut, query);
        }
        if (fragment >= 0) {
            cut = Math.min(cut, fragment);
        }
        return url.substring(0, cut);
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }
}
