package com.tradecopier.observability;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One structured copy log entry. Kept in {@link CopyLogger}'s ring buffer for the status API.
 * {@code masterPositionId} and {@code instrumentId} are null for entries not tied to a position.
 */
@Value
@Builder
public class CopyLogRecord {

    Instant timestamp;
    CopyLogTag tag;
    Long masterPositionId;
    Long instrumentId;
    String message;
    Map<String, Object> values;
}
