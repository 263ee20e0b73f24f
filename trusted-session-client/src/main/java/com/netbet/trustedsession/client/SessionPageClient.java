package com.netbet.trustedsession.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Downloads the page that embeds the visitorData session identifier.
 * Sends a browser User-Agent; the page omits the identifier for unknown clients.
 */
@Component
public class SessionPageClient {

    private static final Logger log = LoggerFactory.getLogger(SessionPageClient.class);
    private static final int DEFAULT_TIMEOUT_MS = 10_000;

    private final RestClient restClient;
    private final String pageUrl;
    private final String userAgent;

    public SessionPageClient(
            RestClient.Builder restClientBuilder,
            @Value("${trusted-session.session-page.url:https://www.youtube.com/}") String pageUrl,
            @Value("${trusted-session.session-page.user-agent:Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36}") String userAgent,
            @Value("${trusted-session.session-page.timeout-ms:10000}") int timeoutMs) {
        this.pageUrl = pageUrl;
        this.userAgent = userAgent;
        // a page that accepts the connection but never answers fails after the read timeout
        int timeout = timeoutMs > 0 ? timeoutMs : DEFAULT_TIMEOUT_MS;
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        this.restClient = restClientBuilder.clone()
                .requestFactory(factory)
                .build();
    }

    /**
     * Fetch the page body once. No retries here; the refresh cycle retries as a whole.
     *
     * @return page body, never null (empty when the server sent no body)
     * @throws RestClientException on transport errors or non-2xx responses
     */
    public String fetchPage() {
        String body = restClient.get()
                .uri(pageUrl)
                .header(HttpHeaders.USER_AGENT, userAgent)
                .header(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9")
                .retrieve()
                .body(String.class);
        log.debug("Session page fetched from {} ({} chars)", pageUrl, body != null ? body.length() : 0);
        return body != null ? body : "";
    }

    public String getPageUrl() {
        return pageUrl;
    }
}
