package com.tradecopier.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradecopier.domain.enums.CopyAction;
import com.tradecopier.domain.enums.DecisionReason;
import com.tradecopier.domain.enums.PositionSide;
import com.tradecopier.domain.model.CopyDecision;
import com.tradecopier.observability.CopyLogRecord;
import com.tradecopier.observability.CopyLogTag;
import com.tradecopier.observability.CopyLogger;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CopyLoggerTest {

    private CopyLogger copyLogger;

    @BeforeEach
    void setUp() {
        copyLogger = new CopyLogger();
    }

    @Test
    @DisplayName("Open records carry the tag, ids and computed volumes")
    void openRecord() {
        CopyDecision decision = CopyDecision.builder()
                .action(CopyAction.OPEN)
                .instrumentId(1L)
                .masterPositionId(10L)
                .side(PositionSide.LONG)
                .masterVolume(new BigDecimal("0.10"))
                .reason(DecisionReason.NEW_POSITION)
                .build();

        copyLogger.logOpen(decision, 5001L, new BigDecimal("0.05"));

        CopyLogRecord copyLogRecord = copyLogger.recent(1).get(0);
        assertThat(copyLogRecord.getTag()).isEqualTo(CopyLogTag.OPEN);
        assertThat(copyLogRecord.getMasterPositionId()).isEqualTo(10L);
        assertThat(copyLogRecord.getInstrumentId()).isEqualTo(1L);
        assertThat(copyLogRecord.getValues())
                .containsEntry("slavePositionId", 5001L)
                .containsEntry("slaveVolume", new BigDecimal("0.05"));
        assertThat(copyLogRecord.getTimestamp()).isNotNull();
    }

    @Test
    @DisplayName("Records come back newest first, capped at the requested limit")
    void newestFirstWithLimit() {
        copyLogger.logReconcile("first", Map.of());
        copyLogger.logVolume(1L, "second", Map.of());
        copyLogger.logError("third");

        List<CopyLogRecord> records = copyLogger.recent(2);

        assertThat(records).extracting(CopyLogRecord::getMessage).containsExactly("third", "second");
        assertThat(records).extracting(CopyLogRecord::getTag).containsExactly(CopyLogTag.ERROR, CopyLogTag.VOLUME);
        assertThat(records.get(0).getMasterPositionId()).isNull();
    }

    @Test
    @DisplayName("The ring buffer keeps only the most recent 500 records")
    void ringBufferBounded() {
        for (int i = 0; i < 520; i++) {
            copyLogger.logReconcile("run " + i, Map.of());
        }

        List<CopyLogRecord> records = copyLogger.recent(1_000);

        assertThat(records).hasSize(500);
        assertThat(records.get(0).getMessage()).isEqualTo("run 519");
        assertThat(records.get(499).getMessage()).isEqualTo("run 20");
    }

    @Test
    @DisplayName("An empty logger returns no records")
    void emptyLogger() {
        assertThat(copyLogger.recent(10)).isEmpty();
    }
}
