package com.tradecopier.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tradecopier.broker.OpenApiMessageMapper;
import com.tradecopier.broker.OpenApiPayloadType;
import com.tradecopier.broker.TraderInfo;
import com.tradecopier.domain.enums.ExecutionEventKind;
import com.tradecopier.domain.enums.OrderKind;
import com.tradecopier.domain.enums.PositionSide;
import com.tradecopier.domain.model.BrokerPosition;
import com.tradecopier.domain.model.ExecutionEvent;
import com.tradecopier.domain.model.InstrumentSpec;
import com.tradecopier.domain.model.OrderRequest;
import com.tradecopier.domain.model.SpotQuote;
import com.tradecopier.exception.AuthException;
import com.tradecopier.exception.RejectedOrderException;
import com.tradecopier.exception.VenueRateLimitException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.function.LongUnaryOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for OpenApiMessageMapper covering envelopes, order payloads, execution event
 * normalization, reconcile and symbol responses, and venue error classification.
 */
class OpenApiMessageMapperTest {

    private static final LongUnaryOperator DEFAULT_LOT_SIZES = instrumentId -> OpenApiMessageMapper.DEFAULT_LOT_SIZE;

    private OpenApiMessageMapper openApiMessageMapper;

    @BeforeEach
    void setUp() {
        openApiMessageMapper = new OpenApiMessageMapper(new ObjectMapper());
    }

    private JsonNode payload(String json) {
        return openApiMessageMapper.parse(json);
    }

    // ==============================
    // OUTBOUND
    // ==============================

    @Nested
    @DisplayName("Outbound")
    class Outbound {

        @Test
        @DisplayName("Envelope carries clientMsgId, payload type code and payload")
        void envelope() {
            String text = openApiMessageMapper.envelope(
                    "cm-1", OpenApiPayloadType.APPLICATION_AUTH_REQ, openApiMessageMapper.applicationAuth("id", "secret"));

            JsonNode envelope = payload(text);
            assertThat(envelope.path("clientMsgId").asText()).isEqualTo("cm-1");
            assertThat(envelope.path("payloadType").asInt()).isEqualTo(2100);
            assertThat(envelope.path("payload").path("clientSecret").asText()).isEqualTo("secret");
        }

        @Test
        @DisplayName("Heartbeat envelope has no clientMsgId and an empty payload")
        void heartbeatEnvelope() {
            JsonNode envelope = payload(openApiMessageMapper.envelope(null, OpenApiPayloadType.HEARTBEAT_EVENT, null));

            assertThat(envelope.has("clientMsgId")).isFalse();
            assertThat(envelope.path("payload").isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Market order converts lots to protocol volume and carries the copy label")
        void newMarketOrder() {
            OrderRequest orderRequest = OrderRequest.builder()
                    .accountId(2002L)
                    .instrumentId(41L)
                    .side(PositionSide.SHORT)
                    .volume(new BigDecimal("0.05"))
                    .linkedPositionId(100L)
                    .label(OrderRequest.labelFor(100L))
                    .kind(OrderKind.MARKET_OPEN)
                    .build();

            ObjectNode order = openApiMessageMapper.newMarketOrder(orderRequest, OpenApiMessageMapper.DEFAULT_LOT_SIZE);

            assertThat(order.path("ctidTraderAccountId").asLong()).isEqualTo(2002L);
            assertThat(order.path("symbolId").asLong()).isEqualTo(41L);
            assertThat(order.path("tradeSide").asInt()).isEqualTo(2);
            assertThat(order.path("volume").asLong()).isEqualTo(500_000L);
            assertThat(order.path("label").asText()).isEqualTo("copy:100");
            assertThat(order.path("comment").asText()).isEqualTo(OpenApiMessageMapper.COPY_COMMENT);
        }

        @Test
        @DisplayName("Close request targets the slave position with the close volume")
        void closePosition() {
            OrderRequest orderRequest = OrderRequest.builder()
                    .accountId(2002L)
                    .instrumentId(41L)
                    .side(PositionSide.LONG)
                    .volume(new BigDecimal("0.02"))
                    .linkedPositionId(7001L)
                    .kind(OrderKind.CLOSE_POSITION)
                    .build();

            ObjectNode close = openApiMessageMapper.closePosition(orderRequest, 100_000L);

            assertThat(close.path("positionId").asLong()).isEqualTo(7001L);
            assertThat(close.path("volume").asLong()).isEqualTo(2_000L);
        }

        @Test
        @DisplayName("Volume conversion round-trips through the lot size")
        void volumeUnits() {
            assertThat(OpenApiMessageMapper.toProtocolVolume(new BigDecimal("1.5"), 10_000_000L)).isEqualTo(15_000_000L);
            assertThat(OpenApiMessageMapper.toLots(15_000_000L, 10_000_000L)).isEqualByComparingTo("1.5");
            assertThat(OpenApiMessageMapper.toLots(100_000L, 0L)).isEqualByComparingTo("0.01");
        }
    }

    // ==============================
    // EXECUTION EVENTS
    // ==============================

    @Nested
    @DisplayName("Execution events")
    class ExecutionEvents {

        @Test
        @DisplayName("Fill leaving volume on the position is ORDER_FILLED with the deal id as sequence")
        void openingFill() {
            JsonNode json = payload("""
                    {"ctidTraderAccountId": 1001, "executionType": "ORDER_FILLED",
                     "position": {"positionId": 100, "positionStatus": "POSITION_STATUS_OPEN",
                                  "tradeData": {"symbolId": 1, "volume": 1000000, "tradeSide": "BUY"}},
                     "deal": {"dealId": 555, "positionId": 100, "filledVolume": 1000000,
                              "executionTimestamp": 1700000000000}}
                    """);

            ExecutionEvent event = openApiMessageMapper.toExecutionEvent(json, 9L, DEFAULT_LOT_SIZES);

            assertThat(event.getKind()).isEqualTo(ExecutionEventKind.ORDER_FILLED);
            assertThat(event.getMasterPositionId()).isEqualTo(100L);
            assertThat(event.getInstrumentId()).isEqualTo(1L);
            assertThat(event.getSide()).isEqualTo(PositionSide.LONG);
            assertThat(event.getVolumeDelta()).isEqualByComparingTo("0.10");
            assertThat(event.getResultingMasterVolume()).isEqualByComparingTo("0.10");
            assertThat(event.getSequenceNo()).isEqualTo(555L);
            assertThat(event.isDealSequenced()).isTrue();
            assertThat(event.getTimestamp().toEpochMilli()).isEqualTo(1700000000000L);
        }

        @Test
        @DisplayName("Fill closing the position becomes POSITION_CLOSED with zero resulting volume")
        void closingFill() {
            JsonNode json = payload("""
                    {"ctidTraderAccountId": 1001, "executionType": 3,
                     "position": {"positionId": 100, "positionStatus": "POSITION_STATUS_CLOSED",
                                  "tradeData": {"symbolId": 1, "volume": 1000000, "tradeSide": 1}},
                     "deal": {"dealId": 556, "positionId": 100, "filledVolume": 1000000}}
                    """);

            ExecutionEvent event = openApiMessageMapper.toExecutionEvent(json, 9L, DEFAULT_LOT_SIZES);

            assertThat(event.getKind()).isEqualTo(ExecutionEventKind.POSITION_CLOSED);
            assertThat(event.getResultingMasterVolume()).isEqualByComparingTo("0");
            assertThat(event.getSide()).isEqualTo(PositionSide.LONG);
        }

        @Test
        @DisplayName("Partial fill name is normalized")
        void partialFill() {
            JsonNode json = payload("""
                    {"executionType": "ORDER_PARTIAL_FILL",
                     "position": {"positionId": 100, "tradeData": {"symbolId": 1, "volume": 600000, "tradeSide": "SELL"}},
                     "deal": {"dealId": 557, "filledVolume": 400000}}
                    """);

            ExecutionEvent event = openApiMessageMapper.toExecutionEvent(json, 9L, DEFAULT_LOT_SIZES);

            assertThat(event.getKind()).isEqualTo(ExecutionEventKind.ORDER_PARTIALLY_FILLED);
            assertThat(event.getResultingMasterVolume()).isEqualByComparingTo("0.06");
            assertThat(event.getVolumeDelta()).isEqualByComparingTo("0.04");
            assertThat(event.getSide()).isEqualTo(PositionSide.SHORT);
        }

        @Test
        @DisplayName("Event without a deal uses the fallback sequence")
        void noDealUsesFallback() {
            JsonNode json = payload("""
                    {"executionType": "ORDER_ACCEPTED",
                     "order": {"positionId": 100, "tradeData": {"symbolId": 1, "volume": 1000000, "tradeSide": "BUY"}}}
                    """);

            ExecutionEvent event = openApiMessageMapper.toExecutionEvent(json, 42L, DEFAULT_LOT_SIZES);

            assertThat(event.getKind()).isEqualTo(ExecutionEventKind.ORDER_ACCEPTED);
            assertThat(event.getSequenceNo()).isEqualTo(42L);
            assertThat(event.isDealSequenced()).isFalse();
            assertThat(event.getMasterPositionId()).isEqualTo(100L);
        }

        @Test
        @DisplayName("Instrument lot size is used for volumes")
        void instrumentLotSize() {
            JsonNode json = payload("""
                    {"executionType": "ORDER_FILLED",
                     "position": {"positionId": 7, "tradeData": {"symbolId": 41, "volume": 200, "tradeSide": "BUY"}},
                     "deal": {"dealId": 1, "filledVolume": 200}}
                    """);

            ExecutionEvent event = openApiMessageMapper.toExecutionEvent(json, 1L, instrumentId -> 10_000L);

            assertThat(event.getResultingMasterVolume()).isEqualByComparingTo("0.02");
        }
    }

    // ==============================
    // RESPONSES
    // ==============================

    @Nested
    @DisplayName("Responses")
    class Responses {

        @Test
        @DisplayName("Reconcile response becomes broker positions with labels")
        void brokerPositions() {
            JsonNode json = payload("""
                    {"ctidTraderAccountId": 2002, "position": [
                      {"positionId": 7001, "tradeData": {"symbolId": 41, "volume": 500000, "tradeSide": "BUY",
                                                         "openTimestamp": 1700000000000, "label": "copy:100"}},
                      {"positionId": 7002, "tradeData": {"symbolId": 42, "volume": 300000, "tradeSide": "SELL"}}]}
                    """);

            List<BrokerPosition> positions = openApiMessageMapper.toBrokerPositions(json, DEFAULT_LOT_SIZES);

            assertThat(positions).hasSize(2);
            assertThat(positions.get(0).getLabel()).isEqualTo("copy:100");
            assertThat(positions.get(0).getVolume()).isEqualByComparingTo("0.05");
            assertThat(positions.get(0).getOpenedAt()).isNotNull();
            assertThat(positions.get(1).getLabel()).isNull();
            assertThat(positions.get(1).getOpenedAt()).isNull();
            assertThat(positions.get(1).getSide()).isEqualTo(PositionSide.SHORT);
        }

        @Test
        @DisplayName("Symbol responses join into instrument specs in lots")
        void instrumentSpecs() {
            JsonNode byId = payload("""
                    {"symbol": [{"symbolId": 1, "lotSize": 10000000, "stepVolume": 100000, "minVolume": 100000,
                                 "pipPosition": 4, "digits": 5}]}
                    """);
            JsonNode list = payload("""
                    {"symbol": [{"symbolId": 1, "symbolName": "EURUSD", "baseAssetId": 3, "quoteAssetId": 15}]}
                    """);

            List<InstrumentSpec> specs = openApiMessageMapper.toInstrumentSpecs(byId, list, Map.of(3L, "EUR", 15L, "USD"));

            assertThat(specs).hasSize(1);
            InstrumentSpec spec = specs.get(0);
            assertThat(spec.getName()).isEqualTo("EURUSD");
            assertThat(spec.getStepVolume()).isEqualByComparingTo("0.01");
            assertThat(spec.getMinVolume()).isEqualByComparingTo("0.01");
            assertThat(spec.getPipPosition()).isEqualTo(4);
            assertThat(spec.getBaseAsset()).isEqualTo("EUR");
            assertThat(spec.getQuoteAsset()).isEqualTo("USD");
        }

        @Test
        @DisplayName("Trader balance is scaled by money digits and the deposit asset resolved")
        void traderInfo() {
            JsonNode json = payload("""
                    {"ctidTraderAccountId": 2002,
                     "trader": {"ctidTraderAccountId": 2002, "balance": 123456, "moneyDigits": 2, "depositAssetId": 15}}
                    """);

            TraderInfo traderInfo = openApiMessageMapper.toTraderInfo(json, Map.of(15L, "USD"));

            assertThat(traderInfo.getAccountId()).isEqualTo(2002L);
            assertThat(traderInfo.getBalance()).isEqualByComparingTo("1234.56");
            assertThat(traderInfo.getDepositAsset()).isEqualTo("USD");
        }

        @Test
        @DisplayName("Account list yields the token's account ids")
        void accountIds() {
            JsonNode json = payload("""
                    {"ctidTraderAccount": [{"ctidTraderAccountId": 1001}, {"ctidTraderAccountId": 2002}]}
                    """);

            assertThat(openApiMessageMapper.toAccountIds(json)).containsExactly(1001L, 2002L);
        }

        @Test
        @DisplayName("Spot prices are scaled by 10^5 and may carry one side")
        void spotQuote() {
            SpotQuote quote = openApiMessageMapper.toSpotQuote(payload("""
                    {"ctidTraderAccountId": 1001, "symbolId": 1, "bid": 108512}
                    """));

            assertThat(quote.getInstrumentId()).isEqualTo(1L);
            assertThat(quote.getBid()).isEqualByComparingTo("1.08512");
            assertThat(quote.getAsk()).isNull();
        }

        @Test
        @DisplayName("Malformed text is rejected")
        void malformed() {
            assertThatThrownBy(() -> openApiMessageMapper.parse("{not json"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Malformed");
        }
    }

    // ==============================
    // ERRORS
    // ==============================

    @Nested
    @DisplayName("Venue errors")
    class VenueErrors {

        @Test
        @DisplayName("Token and account errors are auth failures")
        void authErrors() {
            assertThat(openApiMessageMapper.toVenueException(payload("""
                            {"errorCode": "CH_ACCESS_TOKEN_INVALID", "description": "Invalid access token"}
                            """)))
                    .isInstanceOf(AuthException.class)
                    .hasMessageContaining("Invalid access token");
        }

        @Test
        @DisplayName("Throttling is a venue rate limit")
        void rateLimitErrors() {
            assertThat(openApiMessageMapper.toVenueException(payload("""
                            {"errorCode": "REQUEST_FREQUENCY_EXCEEDED"}
                            """)))
                    .isInstanceOf(VenueRateLimitException.class);
        }

        @Test
        @DisplayName("Everything else is a rejection carrying the venue code")
        void rejections() {
            assertThat(openApiMessageMapper.toVenueException(payload("""
                            {"errorCode": "NOT_ENOUGH_MONEY", "description": "Not enough funds"}
                            """)))
                    .isInstanceOfSatisfying(RejectedOrderException.class, e -> assertThat(e.getVenueErrorCode())
                            .isEqualTo("NOT_ENOUGH_MONEY"));
        }
    }
}
