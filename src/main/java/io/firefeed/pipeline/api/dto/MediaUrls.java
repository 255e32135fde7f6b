package io.firefeed.pipeline.api.dto;

public record MediaUrls(String imageUrl, String videoUrl) {

    private static final MediaUrls NONE = new MediaUrls(null, null);

    public static MediaUrls none() {
        return NONE;
    }

    public boolean hasImage() {
        return imageUrl != null && !imageUrl.isBlank();
    }

    public boolean hasVideo() {
        return videoUrl != null && !videoUrl.isBlank();
    }
}
