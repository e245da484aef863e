package com.tfigtfs.backend.client;

import com.tfigtfs.backend.config.GtfsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;

@Component
@Slf4j
public class WebClientResourceClient implements ResourceClient {

        private static final int MEGABYTE = 1024 * 1024;

        private final WebClient webClient;
        private final Duration timeout;

        public WebClientResourceClient(WebClient.Builder webClientBuilder, GtfsProperties properties) {
                this.timeout = Duration.ofSeconds(properties.http().timeoutSeconds());
                this.webClient = webClientBuilder
                                .codecs(configurer -> configurer
                                                .defaultCodecs()
                                                .maxInMemorySize(properties.http().maxBodySizeMb() * MEGABYTE))
                                .build();
        }

        @Override
        public ResourceResponse get(String url, HttpHeaders headers) {
                log.debug("📡 GET {}", url);
                ResourceResponse response;
                try {
                        response = webClient.get()
                                        .uri(URI.create(url))
                                        .headers(h -> h.addAll(headers))
                                        .exchangeToMono(clientResponse -> clientResponse.bodyToMono(byte[].class)
                                                        .defaultIfEmpty(new byte[0])
                                                        .map(body -> ResourceResponse.builder()
                                                                        .status(clientResponse.statusCode().value())
                                                                        .headers(clientResponse.headers().asHttpHeaders())
                                                                        .body(body)
                                                                        .build()))
                                        .timeout(timeout)
                                        .block();
                } catch (RuntimeException e) {
                        throw new ResourceFetchException("GET " + url + " failed: " + e.getMessage(), e);
                }
                if (response == null) {
                        throw new ResourceFetchException("GET " + url + " returned no response", null);
                }
                return response;
        }

        @Override
        public HttpHeaders head(String url, HttpHeaders headers) {
                log.debug("📡 HEAD {}", url);
                HttpHeaders responseHeaders;
                try {
                        responseHeaders = webClient.head()
                                        .uri(URI.create(url))
                                        .headers(h -> h.addAll(headers))
                                        .exchangeToMono(clientResponse -> clientResponse.releaseBody()
                                                        .thenReturn(clientResponse.headers().asHttpHeaders()))
                                        .timeout(timeout)
                                        .block();
                } catch (RuntimeException e) {
                        throw new ResourceFetchException("HEAD " + url + " failed: " + e.getMessage(), e);
                }
                return responseHeaders != null ? responseHeaders : HttpHeaders.EMPTY;
        }
}
