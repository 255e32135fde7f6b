package io.firefeed.pipeline.api.service.publication;

import io.firefeed.pipeline.api.dto.NewsItem;
import io.firefeed.pipeline.api.dto.Recipient;
import io.firefeed.pipeline.api.dto.Translation;

public interface PublicationChannel {

    /**
     * Deliver an item to a recipient, translated when {@code translation} is not null.
     *
     * @return reference of the delivered message
     * @throws io.firefeed.pipeline.api.exception.PublicationException when delivery fails
     */
    long publish(NewsItem item, Translation translation, Recipient recipient);
}
