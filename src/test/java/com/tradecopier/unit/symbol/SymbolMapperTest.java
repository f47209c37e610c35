package com.tradecopier.unit.symbol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradecopier.config.CopierProperties;
import com.tradecopier.domain.enums.AccountRole;
import com.tradecopier.exception.ErrorCode;
import com.tradecopier.exception.InstrumentNotMappedException;
import com.tradecopier.support.CopierTestContext;
import com.tradecopier.symbol.SymbolMapper;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SymbolMapperTest {

    private SymbolMapper symbolMapper;

    @BeforeEach
    void setUp() {
        CopierProperties copierProperties = CopierTestContext.defaultProperties();
        copierProperties.getSymbols().add(CopierTestContext.mapping("XAUUSD", 41L, 7L));
        symbolMapper = new SymbolMapper(copierProperties);
    }

    @Test
    @DisplayName("Resolves master ids to slave ids and back")
    void resolvesBothWays() {
        assertThat(symbolMapper.resolve(1L, AccountRole.MASTER, AccountRole.SLAVE)).isEqualTo(41L);
        assertThat(symbolMapper.resolve(41L, AccountRole.SLAVE, AccountRole.MASTER)).isEqualTo(1L);
        assertThat(symbolMapper.resolve(2L, AccountRole.MASTER, AccountRole.MASTER)).isEqualTo(2L);
    }

    @Test
    @DisplayName("Same id on both sides refers to different symbols")
    void idsAreScopedPerAccount() {
        // 41 is EURUSD on the slave but XAUUSD on the master
        assertThat(symbolMapper.nameOf(41L, AccountRole.SLAVE)).contains("EURUSD");
        assertThat(symbolMapper.nameOf(41L, AccountRole.MASTER)).contains("XAUUSD");
    }

    @Test
    @DisplayName("Unmapped instrument throws InstrumentNotMappedException")
    void unmappedThrows() {
        assertThatThrownBy(() -> symbolMapper.resolve(999L, AccountRole.MASTER, AccountRole.SLAVE))
                .isInstanceOf(InstrumentNotMappedException.class)
                .satisfies(e -> assertThat(((InstrumentNotMappedException) e).getErrorCode())
                        .isEqualTo(ErrorCode.NOT_FOUND));
        assertThatThrownBy(() -> symbolMapper.resolve(999L, AccountRole.SLAVE, AccountRole.SLAVE))
                .isInstanceOf(InstrumentNotMappedException.class);
    }

    @Test
    @DisplayName("Name lookup is case-insensitive")
    void idOfByName() {
        assertThat(symbolMapper.idOf("gbpusd", AccountRole.SLAVE)).contains(42L);
        assertThat(symbolMapper.idOf("USDCHF", AccountRole.MASTER)).isEmpty();
    }

    @Test
    @DisplayName("Lists configured ids per account in ascending order")
    void instrumentIds() {
        assertThat(symbolMapper.instrumentIds(AccountRole.MASTER)).containsExactly(1L, 2L, 41L);
        assertThat(symbolMapper.instrumentIds(AccountRole.SLAVE)).containsExactly(7L, 41L, 42L);
    }

    @Test
    @DisplayName("Duplicate master id is rejected at startup")
    void duplicateMasterId() {
        CopierProperties copierProperties = new CopierProperties();
        copierProperties.setSymbols(new ArrayList<>(List.of(
                CopierTestContext.mapping("EURUSD", 1L, 41L), CopierTestContext.mapping("EURUSD.m", 1L, 43L))));

        assertThatThrownBy(() -> new SymbolMapper(copierProperties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Master symbol id configured twice");
    }
}
