package com.netbet.trustedsession.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netbet.trustedsession.cache.TokenCache;
import com.netbet.trustedsession.generation.GenerationCoordinator;
import com.netbet.trustedsession.model.CacheEntry;
import com.netbet.trustedsession.worker.WorkerPool;
import com.netbet.trustedsession.worker.WorkerState;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Human-readable status page for GET /. Not used by any client; informational only.
 */
@Component
public class StatusPageRenderer {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final TokenCache tokenCache;
    private final GenerationCoordinator coordinator;
    private final WorkerPool workerPool;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public StatusPageRenderer(TokenCache tokenCache,
                              GenerationCoordinator coordinator,
                              WorkerPool workerPool,
                              ObjectMapper objectMapper,
                              Clock clock) {
        this.tokenCache = tokenCache;
        this.coordinator = coordinator;
        this.workerPool = workerPool;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public String render() {
        CacheEntry entry = tokenCache.snapshot();
        Duration interval = tokenCache.refreshInterval();
        boolean generating = coordinator.isBusy() || tokenCache.isRefreshing();
        List<WorkerState> workers = workerPool.currentWorkers();

        String lastUpdate = entry.lastUpdated() == null ? "Never"
                : TIME_FORMAT.format(entry.lastUpdated().atZone(ZoneId.systemDefault()));
        String nextUpdate = entry.isEmpty() ? "?" : String.valueOf(secondsUntilNextRefresh(entry, interval));

        StringBuilder html = new StringBuilder(2048);
        html.append("<!DOCTYPE html>\n<html>\n<head>\n<title>Trusted Session Generator</title>\n")
                .append("<style>")
                .append("body{font-family:Arial,sans-serif;max-width:800px;margin:0 auto;padding:20px}")
                .append("pre{background:#f0f0f0;padding:15px;border-radius:5px;overflow:auto}")
                .append(".button{display:inline-block;background:#c00;color:#fff;padding:10px 15px;text-decoration:none;border-radius:4px;margin:10px 0}")
                .append(".generating{color:#f60;font-weight:bold}.idle{color:#060;font-weight:bold}")
                .append("</style>\n</head>\n<body>\n")
                .append("<h1>Trusted Session Generator</h1>\n")
                .append("<p>Current status: <span class=\"").append(generating ? "generating" : "idle").append("\">")
                .append(generating ? "Generating tokens..." : "Idle").append("</span></p>\n")
                .append("<p>Last update: ").append(HtmlUtils.htmlEscape(lastUpdate)).append("</p>\n")
                .append("<p>Next update in: <span id=\"countdown\">").append(nextUpdate).append("</span> seconds</p>\n")
                .append("<p>Refresh interval: ").append(interval.toSeconds()).append(" seconds</p>\n")
                .append("<p>Generation mode: ").append(coordinator.getMode()).append("</p>\n");
        if (!workers.isEmpty()) {
            html.append("<ul>\n");
            for (WorkerState w : workers) {
                html.append("<li>Worker ").append(w.id()).append(": ").append(w.status()).append("</li>\n");
            }
            html.append("</ul>\n");
        }
        html.append("<a href=\"/update\" class=\"button\">Force Update</a>\n")
                .append("<a href=\"/token\" class=\"button\">Get Tokens</a>\n")
                .append("<h2>Latest Tokens:</h2>\n<pre>")
                .append(HtmlUtils.htmlEscape(latestTokensJson(entry)))
                .append("</pre>\n</body>\n</html>\n");
        return html.toString();
    }

    long secondsUntilNextRefresh(CacheEntry entry, Duration interval) {
        if (entry.lastUpdated() == null) return 0;
        Duration age = Duration.between(entry.lastUpdated(), clock.instant());
        return Math.max(0, interval.minus(age).toSeconds());
    }

    private String latestTokensJson(CacheEntry entry) {
        if (entry.isEmpty()) return "No tokens generated yet";
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(entry.credentials());
        } catch (JsonProcessingException e) {
            return "Unavailable: " + e.getOriginalMessage();
        }
    }
}
