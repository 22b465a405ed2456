package com.example.fileorganizer.backend;

/**
 * One configured chat endpoint. Lower {@code priority} values are tried first.
 */
public record BackendEndpoint(
        String id,
        String name,
        BackendKind kind,
        String baseUrl,
        String model,
        String apiKey,
        int priority,
        boolean enabled
) {
    /**
     * Returns the base URL without trailing slashes and with a scheme.
     */
    public String normalizedBaseUrl() {
        String url = baseUrl.trim().replaceAll("/+$", "");
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            url = "http://" + url;
        }
        return url;
    }
}
