package com.netbet.trustedsession.controller;

import com.netbet.trustedsession.cache.TokenCache;
import com.netbet.trustedsession.model.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pass-through HTTP surface over the TokenCache.
 */
@RestController
public class TokenController {

    private static final Logger log = LoggerFactory.getLogger(TokenController.class);

    private final TokenCache tokenCache;
    private final StatusPageRenderer statusPageRenderer;

    public TokenController(TokenCache tokenCache, StatusPageRenderer statusPageRenderer) {
        this.tokenCache = tokenCache;
        this.statusPageRenderer = statusPageRenderer;
    }

    @GetMapping("/token")
    public ResponseEntity<Credentials> token() {
        return ResponseEntity.ok(tokenCache.get(false));
    }

    @GetMapping("/update")
    public ResponseEntity<Map<String, Object>> update() {
        log.info("Received force update request from /update endpoint");
        tokenCache.get(true);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "success");
        result.put("code", 200);
        result.put("message", "Tokens have been successfully updated");
        result.put("instructions", "Please get the updated tokens from the /token endpoint");
        return ResponseEntity.ok(result);
    }

    @GetMapping("/")
    public ResponseEntity<String> status() {
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_HTML)
                .body(statusPageRenderer.render());
    }
}
