package com.netbet.trustedsession.session;

import com.netbet.trustedsession.client.SessionPageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SessionIdProvider that extracts visitorData from the embedded page config.
 */
@Component
public class PageSessionIdProvider implements SessionIdProvider {

    private static final Logger log = LoggerFactory.getLogger(PageSessionIdProvider.class);
    private static final Pattern VISITOR_DATA = Pattern.compile("\"visitorData\":\"([^\"]+)");

    private final SessionPageClient pageClient;

    public PageSessionIdProvider(SessionPageClient pageClient) {
        this.pageClient = pageClient;
    }

    @Override
    public String fetchSessionId() throws SessionIdException {
        String page;
        try {
            page = pageClient.fetchPage();
        } catch (RestClientException e) {
            throw new SessionIdException("Failed to download " + pageClient.getPageUrl() + ": " + e.getMessage(), e);
        }
        String visitorData = extract(page);
        if (visitorData == null) {
            throw new SessionIdException("Failed to find visitorData");
        }
        log.debug("visitorData obtained ({} chars)", visitorData.length());
        return visitorData;
    }

    static String extract(String page) {
        if (page == null || page.isEmpty()) return null;
        Matcher m = VISITOR_DATA.matcher(page);
        return m.find() ? m.group(1) : null;
    }
}
