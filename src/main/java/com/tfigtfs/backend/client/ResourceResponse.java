package com.tfigtfs.backend.client;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

@Value
@Builder
public class ResourceResponse {

    public static final int TOO_MANY_REQUESTS = 429;

    int status;

    @Builder.Default
    HttpHeaders headers = HttpHeaders.EMPTY;

    // shared, treat as read-only
    @Builder.Default
    byte[] body = new byte[0];

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public boolean isRateLimited() {
        return status == TOO_MANY_REQUESTS;
    }

    public String getETag() {
        return headers.getETag();
    }

    public String bodyAsText() {
        Charset charset = StandardCharsets.UTF_8;
        MediaType contentType = headers.getContentType();
        if (contentType != null && contentType.getCharset() != null) {
            charset = contentType.getCharset();
        }
        return new String(body, charset);
    }
}
