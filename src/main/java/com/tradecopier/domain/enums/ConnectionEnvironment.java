package com.tradecopier.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Open API endpoint to connect to. Master and slave must live in the same environment since they
 * share one connection.
 */
@Getter
@RequiredArgsConstructor
public enum ConnectionEnvironment {
    DEMO("demo.ctraderapi.com"),
    LIVE("live.ctraderapi.com");

    private final String host;
}
