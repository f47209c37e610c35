package com.tradecopier.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradecopier.broker.CTraderJsonTransport;
import com.tradecopier.broker.OpenApiMessageMapper;
import com.tradecopier.broker.TransportListener;
import com.tradecopier.domain.enums.ExecutionEventKind;
import com.tradecopier.domain.model.ExecutionEvent;
import com.tradecopier.domain.model.OrderRequest;
import com.tradecopier.domain.model.SpotQuote;
import com.tradecopier.exception.TransportException;
import com.tradecopier.support.CopierTestContext;
import java.math.BigDecimal;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for CTraderJsonTransport's receive side: unsolicited execution events, spots,
 * fragmented frames, malformed input, and requests made while disconnected.
 */
class CTraderJsonTransportTest {

    private static final String EXECUTION_EVENT = """
            {"payloadType": 2126, "payload": {"ctidTraderAccountId": 1001, "executionType": "ORDER_FILLED",
             "position": {"positionId": 100, "tradeData": {"symbolId": 1, "volume": 1000000, "tradeSide": "BUY"}},
             "deal": {"dealId": 555, "positionId": 100, "filledVolume": 1000000}}}
            """;

    private CTraderJsonTransport transport;
    private TransportListener transportListener;
    private WebSocket webSocket;

    @BeforeEach
    void setUp() {
        transport = new CTraderJsonTransport(
                new OpenApiMessageMapper(new ObjectMapper()), CopierTestContext.defaultProperties());
        transportListener = mock(TransportListener.class);
        webSocket = mock(WebSocket.class);
        transport.subscribeExecutionEvents(transportListener);
    }

    @AfterEach
    void tearDown() {
        transport.disconnect();
    }

    @Nested
    @DisplayName("Unsolicited messages")
    class Unsolicited {

        @Test
        @DisplayName("Execution event without a pending request goes to the listener")
        void executionEventToListener() {
            transport.onText(webSocket, EXECUTION_EVENT, true);

            ArgumentCaptor<ExecutionEvent> captor = ArgumentCaptor.forClass(ExecutionEvent.class);
            verify(transportListener).onExecutionEvent(eq(1001L), captor.capture());
            ExecutionEvent event = captor.getValue();
            assertThat(event.getKind()).isEqualTo(ExecutionEventKind.ORDER_FILLED);
            assertThat(event.getMasterPositionId()).isEqualTo(100L);
            assertThat(event.getSequenceNo()).isEqualTo(555L);
            assertThat(event.getResultingMasterVolume()).isEqualByComparingTo("0.10");
            verify(webSocket).request(1);
        }

        @Test
        @DisplayName("Spot event goes to the listener with its account id")
        void spotToListener() {
            transport.onText(
                    webSocket,
                    """
                    {"payloadType": 2131, "payload": {"ctidTraderAccountId": 2002, "symbolId": 41,
                     "bid": 108512, "ask": 108515}}
                    """,
                    true);

            ArgumentCaptor<SpotQuote> captor = ArgumentCaptor.forClass(SpotQuote.class);
            verify(transportListener).onSpot(eq(2002L), captor.capture());
            assertThat(captor.getValue().getInstrumentId()).isEqualTo(41L);
            assertThat(captor.getValue().getAsk()).isEqualByComparingTo("1.08515");
        }

        @Test
        @DisplayName("Fragmented frame is delivered once, after the last fragment")
        void fragmentedFrame() {
            int split = EXECUTION_EVENT.length() / 2;

            transport.onText(webSocket, EXECUTION_EVENT.substring(0, split), false);
            verify(transportListener, never()).onExecutionEvent(anyLong(), any());

            transport.onText(webSocket, EXECUTION_EVENT.substring(split), true);
            verify(transportListener, times(1)).onExecutionEvent(eq(1001L), any());
            verify(webSocket, times(2)).request(1);
        }

        @Test
        @DisplayName("Execution events without a deal get increasing arrival sequence numbers")
        void arrivalSequence() {
            String accepted = """
                    {"payloadType": 2126, "payload": {"ctidTraderAccountId": 1001, "executionType": "ORDER_ACCEPTED",
                     "order": {"positionId": 100, "tradeData": {"symbolId": 1, "volume": 1000000, "tradeSide": "BUY"}}}}
                    """;

            transport.onText(webSocket, accepted, true);
            transport.onText(webSocket, accepted, true);

            ArgumentCaptor<ExecutionEvent> captor = ArgumentCaptor.forClass(ExecutionEvent.class);
            verify(transportListener, times(2)).onExecutionEvent(eq(1001L), captor.capture());
            List<ExecutionEvent> events = captor.getAllValues();
            assertThat(events.get(1).getSequenceNo()).isGreaterThan(events.get(0).getSequenceNo());
        }

        @Test
        @DisplayName("Malformed and unknown messages are logged, not thrown")
        void malformedIgnored() {
            assertThatCode(() -> {
                        transport.onText(webSocket, "{broken", true);
                        transport.onText(webSocket, "{\"payloadType\": 9999, \"payload\": {}}", true);
                        transport.onText(webSocket, "{\"payloadType\": 51}", true);
                    })
                    .doesNotThrowAnyException();

            verify(transportListener, never()).onExecutionEvent(anyLong(), any());
            verify(webSocket, times(3)).request(1);
        }
    }

    @Nested
    @DisplayName("Disconnected")
    class Disconnected {

        @Test
        @DisplayName("Requests fail with TransportException when not connected")
        void requestsFailWhenNotConnected() {
            CompletableFuture<Void> auth = transport.authenticateApplication("id", "secret");
            CompletableFuture<?> order = transport.sendOrder(2002L, OrderRequest.builder()
                    .instrumentId(41L)
                    .volume(BigDecimal.ONE)
                    .build());

            assertThat(auth).isCompletedExceptionally();
            assertThat(order).isCompletedExceptionally();
            assertThatCode(auth::join).hasCauseInstanceOf(TransportException.class);
            assertThat(transport.isConnected()).isFalse();
        }

        @Test
        @DisplayName("Close from the venue while not connected does not notify the listener")
        void closeWhileDisconnected() {
            transport.onClose(webSocket, 1006, "abnormal");

            verify(transportListener, never()).onDisconnected(any());
        }

        @Test
        @DisplayName("Disconnect is idempotent")
        void disconnectIdempotent() {
            assertThatCode(() -> {
                        transport.disconnect();
                        transport.disconnect();
                    })
                    .doesNotThrowAnyException();
        }
    }

    @Test
    @DisplayName("Balance query fails when not connected")
    void balanceQueryFailsWhenDisconnected() {
        assertThat(transport.queryBalance(2002L)).failsWithin(Duration.ofSeconds(1))
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(TransportException.class);
    }
}
