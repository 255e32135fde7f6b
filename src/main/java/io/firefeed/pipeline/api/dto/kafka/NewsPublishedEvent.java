package io.firefeed.pipeline.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record NewsPublishedEvent(
        @JsonProperty("newsId") String newsId,
        @JsonProperty("translationId") Long translationId,
        @JsonProperty("recipientType") String recipientType,
        @JsonProperty("recipientId") long recipientId,
        @JsonProperty("language") String language,
        @JsonProperty("title") String title,
        @JsonProperty("content") String content,
        @JsonProperty("category") String category,
        @JsonProperty("sourceUrl") String sourceUrl,
        @JsonProperty("imageUrl") String imageUrl,
        @JsonProperty("videoUrl") String videoUrl,
        @JsonProperty("publishedAt")
        @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime publishedAt
) {}
