package org.smileyface.articleextractor.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.articleextractor.cache.ResultCache;
import org.smileyface.articleextractor.model.ArticleResult;
import org.smileyface.articleextractor.service.ExtractionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON surface over {@link ExtractionService}. The service never fetches: the request carries
 * the HTML and {@code url} only names its source.
 */
@RestController
class ExtractionController {

    private static final Logger log = LoggerFactory.getLogger(ExtractionController.class);

    private final ExtractionService service;

    ExtractionController(ExtractionService service) {
        this.service = service;
    }

    /**
     * Returns 200 with the result on success and 422 with the same body when extraction failed.
     */
    @PostMapping(path = "/extract", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ArticleResult> extract(@RequestBody ExtractionRequest request) {
        ArticleResult result = service.extract(request.html(), request.url(),
                request.resolveOptions(service.getDefaultOptions()));
        if (!result.isSuccess()) {
            log.info("Extraction failed for {}: {}", request.url(), result.getError());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> health() {
        ResultCache cache = service.getCache();
        Map<String, Object> cacheInfo = new LinkedHashMap<>();
        cacheInfo.put("size", cache.size());
        cacheInfo.put("max_size", cache.maximumSize());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("cache", cacheInfo);
        return body;
    }
}
