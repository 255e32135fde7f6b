package io.firefeed.pipeline.api.service.dedup;

import io.firefeed.pipeline.api.dto.DuplicateVerdict;
import io.firefeed.pipeline.api.dto.RawEntry;

public interface DuplicateDetector {

    /**
     * Reload the set of recent items that candidates are compared against.
     */
    void refreshIndex();

    /**
     * Classify an entry against already accepted items. A unique entry is reserved
     * until it is remembered or released; repeating the call for the same entry gives
     * the same verdict.
     */
    DuplicateVerdict check(RawEntry entry);

    /**
     * Record an item that was accepted and stored.
     */
    void remember(String newsId, String link, float[] embedding);

    /**
     * Drop the reservation of an entry that passed {@link #check} but was not stored.
     */
    void release(String newsId);
}
