package io.firefeed.pipeline.api;

import io.firefeed.pipeline.api.dto.ValidationResult;
import io.firefeed.pipeline.api.service.feed.FeedValidator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/feeds")
public class FeedController {

    private final FeedValidator feedValidator;

    public FeedController(FeedValidator feedValidator) {
        this.feedValidator = feedValidator;
    }

    @GetMapping("/validate")
    public ResponseEntity<ValidationResult> validate(@RequestParam String url) {
        if (url.isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(feedValidator.validate(url));
    }
}
