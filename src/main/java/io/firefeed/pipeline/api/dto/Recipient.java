package io.firefeed.pipeline.api.dto;

public record Recipient(RecipientType type, long id, String language) {

    public static Recipient channel(long channelId, String language) {
        return new Recipient(RecipientType.CHANNEL, channelId, language);
    }
}
