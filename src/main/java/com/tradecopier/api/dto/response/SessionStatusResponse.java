package com.tradecopier.api.dto.response;

import com.tradecopier.session.SessionState;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Connection state plus the depth of every queue between the transport and the dispatcher. */
@Value
@Builder
public class SessionStatusResponse {

    SessionState state;
    long masterAccountId;
    long slaveAccountId;
    long sequenceEpoch;
    int bufferedEvents;
    int inboundQueueDepth;
    List<Integer> laneQueueDepths;
    int ledgerSize;
}
