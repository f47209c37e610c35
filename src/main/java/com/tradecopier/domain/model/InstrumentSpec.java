package com.tradecopier.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Trading specification of one instrument in one account's catalog.
 *
 * <p>{@code lotSize} is the venue's lot size in protocol volume units (hundredths of a base unit),
 * so protocol volume = lots * lotSize. {@code stepVolume} and {@code minVolume} are already
 * converted to lots.
 */
@Value
@Builder
public class InstrumentSpec {

    long instrumentId;
    String name;
    long lotSize;
    BigDecimal stepVolume;
    BigDecimal minVolume;
    int pipPosition;
    int digits;
    String baseAsset;
    String quoteAsset;
}
