package com.sluice.api;

import com.sluice.content.ContentResponse;
import com.sluice.content.ContentService;
import com.sluice.model.DispatchErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class ContentController {

    private final ContentService contentService;

    @PostMapping("/search")
    public ResponseEntity<?> search(@RequestBody(required = false) SearchRequest request) {
        if (request == null) {
            return badRequest("No JSON data provided");
        }
        if (request.query() == null || request.query().isBlank()) {
            return badRequest("Missing or empty 'query' field");
        }

        String query = request.query().strip();
        log.info("Search request for: {}", query);

        return toEntity(contentService.search(query));
    }

    @PostMapping("/read")
    public ResponseEntity<?> read(@RequestBody(required = false) ReadRequest request) {
        if (request == null) {
            return badRequest("No JSON data provided");
        }
        if (request.url() == null || request.url().isBlank()) {
            return badRequest("Missing or empty 'url' field");
        }

        String url = request.url().strip();
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            return badRequest("URL must start with http:// or https://");
        }
        if (!isParseable(url)) {
            return badRequest("URL is not valid");
        }
        log.info("Read request for: {}", url);

        return toEntity(contentService.read(url));
    }

    private ResponseEntity<ContentResponse> toEntity(ContentResponse response) {
        if (response.isSuccess()) {
            return ResponseEntity.ok(response);
        }
        return ResponseEntity.status(statusFor(response.getErrorKind())).body(response);
    }

    private static HttpStatus statusFor(DispatchErrorKind kind) {
        if (kind == DispatchErrorKind.INVALID_REQUEST) {
            return HttpStatus.BAD_REQUEST;
        }
        if (kind == DispatchErrorKind.ALL_ATTEMPTS_EXHAUSTED) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.GATEWAY_TIMEOUT;
    }

    private static boolean isParseable(String url) {
        try {
            URI uri = new URI(url);
            return uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private ResponseEntity<Map<String, Object>> badRequest(String error) {
        return ResponseEntity.badRequest().body(Map.of("success", false, "error", error));
    }

    public record SearchRequest(String query) {}

    public record ReadRequest(String url) {}
}
