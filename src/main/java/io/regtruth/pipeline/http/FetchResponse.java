package io.regtruth.pipeline.http;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

public record FetchResponse(
        String url,
        int statusCode,
        String contentType,
        byte[] body
) {
    public String bodyAsString() {
        return new String(body, charset());
    }

    private Charset charset() {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        int idx = lower.indexOf("charset=");
        if (idx < 0) {
            return StandardCharsets.UTF_8;
        }
        String name = contentType.substring(idx + "charset=".length()).replace("\"", "").split(";")[0].trim();
        try {
            return Charset.forName(name);
        } catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
    }
}
