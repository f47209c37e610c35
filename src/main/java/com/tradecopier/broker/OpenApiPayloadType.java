package com.tradecopier.broker;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Open API message payload types used by the copier, with their wire codes.
 */
@Getter
@RequiredArgsConstructor
public enum OpenApiPayloadType {
    ERROR_RES(50),
    HEARTBEAT_EVENT(51),
    APPLICATION_AUTH_REQ(2100),
    APPLICATION_AUTH_RES(2101),
    ACCOUNT_AUTH_REQ(2102),
    ACCOUNT_AUTH_RES(2103),
    NEW_ORDER_REQ(2106),
    CANCEL_ORDER_REQ(2108),
    CLOSE_POSITION_REQ(2111),
    ASSET_LIST_REQ(2112),
    ASSET_LIST_RES(2113),
    SYMBOLS_LIST_REQ(2114),
    SYMBOLS_LIST_RES(2115),
    SYMBOL_BY_ID_REQ(2116),
    SYMBOL_BY_ID_RES(2117),
    TRADER_REQ(2121),
    TRADER_RES(2122),
    RECONCILE_REQ(2124),
    RECONCILE_RES(2125),
    EXECUTION_EVENT(2126),
    SUBSCRIBE_SPOTS_REQ(2127),
    SUBSCRIBE_SPOTS_RES(2128),
    SPOT_EVENT(2131),
    ORDER_ERROR_EVENT(2132),
    OA_ERROR_RES(2142),
    GET_ACCOUNTS_BY_ACCESS_TOKEN_REQ(2149),
    GET_ACCOUNTS_BY_ACCESS_TOKEN_RES(2150),
    UNKNOWN(-1);

    private final int code;

    public static OpenApiPayloadType fromCode(int code) {
        for (OpenApiPayloadType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
