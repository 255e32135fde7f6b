package io.firefeed.pipeline.api;

import io.firefeed.pipeline.api.dto.PassReport;
import io.firefeed.pipeline.api.service.RssManager;
import io.firefeed.pipeline.api.service.feed.HttpFeedValidator;
import io.firefeed.pipeline.api.service.translation.ModelManager;
import io.firefeed.pipeline.api.service.translation.TranslationCache;
import io.firefeed.pipeline.api.service.translation.TranslationTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineController.class);

    private final RssManager rssManager;
    private final TranslationTaskQueue taskQueue;
    private final ModelManager modelManager;
    private final TranslationCache translationCache;
    private final HttpFeedValidator feedValidator;

    public PipelineController(RssManager rssManager,
                              TranslationTaskQueue taskQueue,
                              ModelManager modelManager,
                              TranslationCache translationCache,
                              HttpFeedValidator feedValidator) {
        this.rssManager = rssManager;
        this.taskQueue = taskQueue;
        this.modelManager = modelManager;
        this.translationCache = translationCache;
        this.feedValidator = feedValidator;
    }

    @PostMapping("/run")
    public ResponseEntity<PassReport> run() {
        try {
            logger.info("Manual pass requested");
            return ResponseEntity.ok(rssManager.runOnce());
        } catch (IllegalStateException e) {
            logger.info("Manual pass rejected: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", rssManager.isRunning());
        status.put("timestamp", LocalDateTime.now());
        status.put("queue", taskQueue.stats());
        status.put("models", modelManager.stats());
        status.put("caches", Map.of(
                "translation", translationCache.stats(),
                "feedValidation", feedValidator.cacheStats()
        ));
        rssManager.lastReport().ifPresent(report -> status.put("lastPass", report));
        return ResponseEntity.ok(status);
    }
}
