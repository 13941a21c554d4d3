package com.crisisrelay.protocol;

import java.util.List;

/**
 * One page of the counselor's record listing, newest first.
 * nextBefore: cursor for the following page, null once the oldest record was listed.
 */
public record RecordPage(List<RecordStatus> records, Long nextBefore) {

    static RecordPage of(List<RecordStatus> records) {
        if (records.isEmpty()) {
            return new RecordPage(records, null);
        }
        long oldest = records.get(records.size() - 1).id();
        return new RecordPage(records, oldest > 1 ? oldest : null);
    }
}
