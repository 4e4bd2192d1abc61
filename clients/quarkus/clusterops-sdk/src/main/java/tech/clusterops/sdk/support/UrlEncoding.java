package tech.clusterops.sdk.support;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Percent-encoding for form values and path segments.
 */
public final class UrlEncoding {

    private UrlEncoding() {}

    public static String formValue(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Encode a resource name for use as a single path segment. Spaces become {@code %20},
     * slashes {@code %2F}.
     */
    public static String pathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
