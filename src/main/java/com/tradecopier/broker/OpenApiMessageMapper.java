package com.tradecopier.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tradecopier.domain.enums.ExecutionEventKind;
import com.tradecopier.domain.enums.PositionSide;
import com.tradecopier.domain.model.BrokerPosition;
import com.tradecopier.domain.model.ExecutionEvent;
import com.tradecopier.domain.model.InstrumentSpec;
import com.tradecopier.domain.model.OrderRequest;
import com.tradecopier.domain.model.SpotQuote;
import com.tradecopier.exception.AuthException;
import com.tradecopier.exception.BaseException;
import com.tradecopier.exception.RejectedOrderException;
import com.tradecopier.exception.VenueRateLimitException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.LongUnaryOperator;
import org.springframework.stereotype.Component;

/**
 * Converts between copier domain objects and Open API JSON messages.
 *
 * <p>Every message is an envelope {@code {"clientMsgId": .., "payloadType": .., "payload": {..}}}.
 * Protocol volumes are hundredths of a base unit; a symbol's {@code lotSize} is in the same unit,
 * so {@code protocolVolume = lots * lotSize}. Spot prices are integers scaled by 10^5. Balances
 * are integers scaled by 10^moneyDigits.
 *
 * <p>Enum fields are accepted both as numbers and as names, since the venue's JSON encoding has
 * used both.
 */
@Component
public class OpenApiMessageMapper {

    public static final String COPY_COMMENT = "Copied from master";

    /** EURUSD-style lot of 100,000 units, in protocol units. Used when a symbol's spec is unknown. */
    public static final long DEFAULT_LOT_SIZE = 10_000_000L;

    private static final int PRICE_SCALE = 5;
    private static final int MARKET_ORDER_TYPE = 1;
    private static final int POSITION_STATUS_CLOSED = 2;

    private static final Set<String> AUTH_ERROR_CODES = Set.of(
            "CH_CLIENT_AUTH_FAILURE",
            "CH_CLIENT_NOT_AUTHENTICATED",
            "CH_ACCESS_TOKEN_INVALID",
            "CH_CTID_TRADER_ACCOUNT_NOT_FOUND",
            "OA_AUTH_TOKEN_EXPIRED",
            "ACCESS_DENIED");

    private static final Set<String> RATE_LIMIT_ERROR_CODES = Set.of("REQUEST_FREQUENCY_EXCEEDED", "TOO_MANY_REQUESTS");

    private final ObjectMapper objectMapper;

    public OpenApiMessageMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ---- Outbound ----

    public String envelope(String clientMsgId, OpenApiPayloadType payloadType, ObjectNode payload) {
        ObjectNode envelope = objectMapper.createObjectNode();
        if (clientMsgId != null) {
            envelope.put("clientMsgId", clientMsgId);
        }
        envelope.put("payloadType", payloadType.getCode());
        envelope.set("payload", payload != null ? payload : objectMapper.createObjectNode());
        return envelope.toString();
    }

    public ObjectNode applicationAuth(String clientId, String clientSecret) {
        return objectMapper.createObjectNode().put("clientId", clientId).put("clientSecret", clientSecret);
    }

    public ObjectNode accessToken(String accessToken) {
        return objectMapper.createObjectNode().put("accessToken", accessToken);
    }

    public ObjectNode accountAuth(long accountId, String accessToken) {
        return account(accountId).put("accessToken", accessToken);
    }

    /** Payload carrying only the account id (trader, reconcile, asset and symbol lists). */
    public ObjectNode account(long accountId) {
        return objectMapper.createObjectNode().put("ctidTraderAccountId", accountId);
    }

    public ObjectNode symbolsById(long accountId, Collection<Long> instrumentIds) {
        ObjectNode payload = account(accountId);
        ArrayNode ids = payload.putArray("symbolId");
        instrumentIds.forEach(ids::add);
        return payload;
    }

    public ObjectNode newMarketOrder(OrderRequest orderRequest, long lotSize) {
        ObjectNode payload = account(orderRequest.getAccountId())
                .put("symbolId", orderRequest.getInstrumentId())
                .put("orderType", MARKET_ORDER_TYPE)
                .put("tradeSide", orderRequest.getSide() == PositionSide.LONG ? 1 : 2)
                .put("volume", toProtocolVolume(orderRequest.getVolume(), lotSize))
                .put("comment", COPY_COMMENT);
        if (orderRequest.getLabel() != null) {
            payload.put("label", orderRequest.getLabel());
        }
        return payload;
    }

    public ObjectNode closePosition(OrderRequest orderRequest, long lotSize) {
        return account(orderRequest.getAccountId())
                .put("positionId", orderRequest.getLinkedPositionId())
                .put("volume", toProtocolVolume(orderRequest.getVolume(), lotSize));
    }

    // ---- Inbound ----

    public JsonNode parse(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed Open API message: " + abbreviate(text), e);
        }
    }

    public OpenApiPayloadType payloadType(JsonNode envelope) {
        return OpenApiPayloadType.fromCode(envelope.path("payloadType").asInt(-1));
    }

    /**
     * Normalizes an execution event payload.
     *
     * @param fallbackSequence sequence number to use when the event carries no deal
     * @param lotSizes lot size by symbol id for the event's account
     */
    public ExecutionEvent toExecutionEvent(JsonNode payload, long fallbackSequence, LongUnaryOperator lotSizes) {
        JsonNode position = payload.path("position");
        JsonNode order = payload.path("order");
        JsonNode deal = payload.path("deal");
        JsonNode tradeData = position.has("tradeData") ? position.path("tradeData") : order.path("tradeData");

        long instrumentId = tradeData.path("symbolId").asLong();
        long lotSize = lotSizes.applyAsLong(instrumentId);

        long positionId = firstLong(position.path("positionId"), deal.path("positionId"), order.path("positionId"));
        boolean positionClosed = isClosedStatus(position.path("positionStatus"));
        BigDecimal resulting = positionClosed || !position.has("tradeData")
                ? BigDecimal.ZERO
                : toLots(tradeData.path("volume").asLong(), lotSize);
        BigDecimal delta = toLots(
                deal.has("filledVolume") ? deal.path("filledVolume").asLong() : deal.path("volume").asLong(),
                lotSize);

        ExecutionEventKind kind = toEventKind(payload.path("executionType"));
        if (kind.isFill() && (positionClosed || (position.has("tradeData") && resulting.signum() == 0))) {
            kind = ExecutionEventKind.POSITION_CLOSED;
        }

        boolean dealSequenced = deal.has("dealId");
        long sequenceNo = dealSequenced ? deal.path("dealId").asLong() : fallbackSequence;
        long timestampMillis = firstLong(
                deal.path("executionTimestamp"), position.path("utcLastUpdateTimestamp"), order.path("utcLastUpdateTimestamp"));

        return ExecutionEvent.builder()
                .masterPositionId(positionId)
                .instrumentId(instrumentId)
                .kind(kind)
                .side(toSide(tradeData.path("tradeSide")))
                .volumeDelta(delta)
                .resultingMasterVolume(resulting)
                .timestamp(timestampMillis > 0 ? Instant.ofEpochMilli(timestampMillis) : Instant.now())
                .sequenceNo(sequenceNo)
                .dealSequenced(dealSequenced)
                .build();
    }

    /** Position id touched by an execution event answering one of our orders, null when absent. */
    public Long executionPositionId(JsonNode payload) {
        long positionId = firstLong(
                payload.path("position").path("positionId"),
                payload.path("deal").path("positionId"),
                payload.path("order").path("positionId"));
        return positionId > 0 ? positionId : null;
    }

    public ExecutionEventKind executionKind(JsonNode payload) {
        return toEventKind(payload.path("executionType"));
    }

    public List<BrokerPosition> toBrokerPositions(JsonNode reconcilePayload, LongUnaryOperator lotSizes) {
        List<BrokerPosition> positions = new ArrayList<>();
        for (JsonNode position : reconcilePayload.path("position")) {
            JsonNode tradeData = position.path("tradeData");
            long instrumentId = tradeData.path("symbolId").asLong();
            long openMillis = tradeData.path("openTimestamp").asLong();
            positions.add(BrokerPosition.builder()
                    .positionId(position.path("positionId").asLong())
                    .instrumentId(instrumentId)
                    .side(toSide(tradeData.path("tradeSide")))
                    .volume(toLots(tradeData.path("volume").asLong(), lotSizes.applyAsLong(instrumentId)))
                    .openedAt(openMillis > 0 ? Instant.ofEpochMilli(openMillis) : null)
                    .label(tradeData.hasNonNull("label") ? tradeData.path("label").asText() : null)
                    .build());
        }
        return positions;
    }

    public Map<Long, String> toAssetNames(JsonNode assetListPayload) {
        Map<Long, String> names = new HashMap<>();
        for (JsonNode asset : assetListPayload.path("asset")) {
            names.put(asset.path("assetId").asLong(), asset.path("name").asText());
        }
        return names;
    }

    public TraderInfo toTraderInfo(JsonNode traderPayload, Map<Long, String> assetNames) {
        JsonNode trader = traderPayload.path("trader");
        int moneyDigits = trader.path("moneyDigits").asInt(2);
        return TraderInfo.builder()
                .accountId(trader.path("ctidTraderAccountId").asLong(traderPayload.path("ctidTraderAccountId").asLong()))
                .balance(BigDecimal.valueOf(trader.path("balance").asLong(), moneyDigits))
                .depositAsset(assetNames.get(trader.path("depositAssetId").asLong()))
                .build();
    }

    public List<Long> toAccountIds(JsonNode accountsPayload) {
        List<Long> ids = new ArrayList<>();
        for (JsonNode account : accountsPayload.path("ctidTraderAccount")) {
            ids.add(account.path("ctidTraderAccountId").asLong());
        }
        return ids;
    }

    /**
     * Joins full symbol specifications with the light symbol list (names and asset ids).
     */
    public List<InstrumentSpec> toInstrumentSpecs(
            JsonNode symbolByIdPayload, JsonNode symbolsListPayload, Map<Long, String> assetNames) {
        Map<Long, JsonNode> lightSymbols = new HashMap<>();
        for (JsonNode light : symbolsListPayload.path("symbol")) {
            lightSymbols.put(light.path("symbolId").asLong(), light);
        }

        List<InstrumentSpec> specs = new ArrayList<>();
        for (JsonNode symbol : symbolByIdPayload.path("symbol")) {
            long instrumentId = symbol.path("symbolId").asLong();
            long lotSize = symbol.path("lotSize").asLong(DEFAULT_LOT_SIZE);
            JsonNode light = lightSymbols.getOrDefault(instrumentId, objectMapper.createObjectNode());
            specs.add(InstrumentSpec.builder()
                    .instrumentId(instrumentId)
                    .name(light.path("symbolName").asText(null))
                    .lotSize(lotSize)
                    .stepVolume(toLots(symbol.path("stepVolume").asLong(), lotSize))
                    .minVolume(toLots(symbol.path("minVolume").asLong(), lotSize))
                    .pipPosition(symbol.path("pipPosition").asInt())
                    .digits(symbol.path("digits").asInt())
                    .baseAsset(assetNames.get(light.path("baseAssetId").asLong()))
                    .quoteAsset(assetNames.get(light.path("quoteAssetId").asLong()))
                    .build());
        }
        return specs;
    }

    public SpotQuote toSpotQuote(JsonNode spotPayload) {
        return new SpotQuote(
                spotPayload.path("symbolId").asLong(),
                spotPayload.has("bid") ? BigDecimal.valueOf(spotPayload.path("bid").asLong(), PRICE_SCALE) : null,
                spotPayload.has("ask") ? BigDecimal.valueOf(spotPayload.path("ask").asLong(), PRICE_SCALE) : null,
                Instant.now());
    }

    /** Exception matching a venue error payload (ERROR_RES, OA_ERROR_RES, ORDER_ERROR_EVENT). */
    public BaseException toVenueException(JsonNode errorPayload) {
        String errorCode = errorPayload.path("errorCode").asText("UNKNOWN");
        String description = errorPayload.path("description").asText(errorCode);
        if (AUTH_ERROR_CODES.contains(errorCode)) {
            return new AuthException(errorCode + ": " + description);
        }
        if (RATE_LIMIT_ERROR_CODES.contains(errorCode)) {
            return new VenueRateLimitException(errorCode + ": " + description);
        }
        return new RejectedOrderException(errorCode, description);
    }

    // ---- Units ----

    public static long toProtocolVolume(BigDecimal lots, long lotSize) {
        return lots.multiply(BigDecimal.valueOf(lotSize)).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    public static BigDecimal toLots(long protocolVolume, long lotSize) {
        if (lotSize <= 0) {
            lotSize = DEFAULT_LOT_SIZE;
        }
        return BigDecimal.valueOf(protocolVolume)
                .divide(BigDecimal.valueOf(lotSize), 8, RoundingMode.HALF_UP)
                .stripTrailingZeros();
    }

    private static ExecutionEventKind toEventKind(JsonNode executionType) {
        if (executionType.isNumber()) {
            return ExecutionEventKind.fromVenueCode(executionType.asInt());
        }
        String name = executionType.asText("");
        if ("ORDER_PARTIAL_FILL".equals(name)) {
            return ExecutionEventKind.ORDER_PARTIALLY_FILLED;
        }
        for (ExecutionEventKind kind : ExecutionEventKind.values()) {
            if (kind.name().equals(name)) {
                return kind;
            }
        }
        return ExecutionEventKind.UNKNOWN;
    }

    private static PositionSide toSide(JsonNode tradeSide) {
        if (tradeSide.isMissingNode() || tradeSide.isNull()) {
            return null;
        }
        if (tradeSide.isNumber()) {
            return tradeSide.asInt() == 1 ? PositionSide.LONG : PositionSide.SHORT;
        }
        return PositionSide.fromTradeSide(tradeSide.asText());
    }

    private static boolean isClosedStatus(JsonNode positionStatus) {
        if (positionStatus.isNumber()) {
            return positionStatus.asInt() == POSITION_STATUS_CLOSED;
        }
        return positionStatus.asText("").endsWith("CLOSED");
    }

    private static long firstLong(JsonNode... nodes) {
        for (JsonNode node : nodes) {
            if (node.canConvertToLong() && node.asLong() != 0) {
                return node.asLong();
            }
        }
        return 0L;
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
