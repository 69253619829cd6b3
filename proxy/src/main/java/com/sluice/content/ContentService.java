package com.sluice.content;

import com.sluice.config.SluiceProperties;
import com.sluice.dispatch.DispatchEngine;
import com.sluice.model.DispatchResult;
import com.sluice.model.ProxyEndpoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

@Slf4j
@Service
public class ContentService {

    static final String SEARCH_SOURCE = "jina_search";
    static final String READER_SOURCE = "jina_reader";

    private final DispatchEngine dispatchEngine;
    private final SluiceProperties.ContentProperties properties;

    public ContentService(DispatchEngine dispatchEngine, SluiceProperties properties) {
        this.dispatchEngine = dispatchEngine;
        this.properties = properties.getContent();
    }

    public ContentResponse search(String query) {
        String target = searchUrl(query);
        DispatchResult result = dispatchEngine.fetch(target);

        if (!result.isSuccess()) {
            log.error("Search failed for query '{}': {}", query, result.getErrorMessage());
        }
        return toResponse(result, SEARCH_SOURCE).query(query).build();
    }

    public ContentResponse read(String url) {
        String target = readerUrl(url);
        DispatchResult result = dispatchEngine.fetch(target);

        if (!result.isSuccess()) {
            log.error("URL reading failed for '{}': {}", url, result.getErrorMessage());
        }
        return toResponse(result, READER_SOURCE).url(url).build();
    }

    String searchUrl(String query) {
        return properties.getSearchUrl() + "?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8);
    }

    String readerUrl(String url) {
        return properties.getReaderUrl() + url;
    }

    private ContentResponse.ContentResponseBuilder toResponse(DispatchResult result, String source) {
        ContentResponse.ContentResponseBuilder builder = ContentResponse.builder()
                .success(result.isSuccess())
                .attempts(result.getAttempts())
                .timestamp(Instant.now());

        if (result.isSuccess()) {
            return builder
                    .content(result.bodyAsString())
                    .statusCode(result.getStatusCode())
                    .source(source)
                    .servedBy(result.getServedByOptional().map(ProxyEndpoint::address).orElse("direct"));
        }

        return builder
                .error(result.getErrorMessage())
                .errorKind(result.getErrorKind())
                .statusCode(result.getStatusCode() > 0 ? result.getStatusCode() : null);
    }
}
