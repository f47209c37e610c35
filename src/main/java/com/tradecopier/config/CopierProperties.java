package com.tradecopier.config;

import com.tradecopier.domain.enums.ConnectionEnvironment;
import com.tradecopier.domain.enums.VolumePolicyType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the trade copier, bound from the {@code copier.*} prefix.
 *
 * <p>Credentials are never committed: application.yml resolves them from environment variables
 * ({@code CTRADER_CLIENT_ID}, {@code MASTER_ACCESS_TOKEN}, ...). Everything else has a default
 * that matches a conservative demo setup.
 *
 * <p>Per-instrument tables ({@code volume.per-instrument}, {@code volume.micro-lots-per-dollar},
 * {@code volume.contract-sizes}) are keyed by the symbol name from {@link #symbols}, not by venue
 * id, so one file works for both catalogs.
 */
@Configuration
@ConfigurationProperties(prefix = "copier")
@Validated
@Getter
@Setter
public class CopierProperties {

    /** DEMO or LIVE. Master and slave share this single connection. */
    @NotNull
    private ConnectionEnvironment environment = ConnectionEnvironment.DEMO;

    @Valid
    private Application application = new Application();

    @Valid
    private Account master = new Account();

    @Valid
    private Account slave = new Account();

    /** Instruments copied from master to slave. Anything else the master trades is ignored. */
    @Valid
    private List<SymbolMapping> symbols = new ArrayList<>();

    @Valid
    private Volume volume = new Volume();

    @Valid
    private Workers workers = new Workers();

    private Shutdown shutdown = new Shutdown();

    @Valid
    private Reconnect reconnect = new Reconnect();

    private Transport transport = new Transport();

    private Reconciliation reconciliation = new Reconciliation();

    @Getter
    @Setter
    public static class Application {

        /** Open API application client id. */
        private String clientId;

        /** Open API application client secret. */
        private String clientSecret;
    }

    @Getter
    @Setter
    public static class Account {

        /** cTrader trader account id (ctidTraderAccountId), not the login number. */
        private long accountId;

        /** OAuth access token authorized for this account. */
        private String accessToken;
    }

    @Getter
    @Setter
    public static class SymbolMapping {

        @NotBlank
        private String name;

        /** Symbol id in the master account's catalog. */
        private long masterId;

        /** Symbol id in the slave account's catalog. */
        private long slaveId;
    }

    @Getter
    @Setter
    public static class Volume {

        /** Explicit policy. When unset, the first configured policy in precedence order is used. */
        private VolumePolicyType policy;

        /** Multiplier applied to every instrument. Unset disables GLOBAL_MULTIPLIER. */
        private BigDecimal globalMultiplier;

        /** Multipliers by symbol name for PER_INSTRUMENT. */
        private Map<String, BigDecimal> perInstrument = new HashMap<>();

        /** Multiplier for symbols absent from {@link #perInstrument}, and the last-resort fallback. */
        private BigDecimal defaultMultiplier = new BigDecimal("0.5");

        /** Share of the slave balance put at risk per copied position. Unset disables BALANCE_PERCENTAGE. */
        private BigDecimal lotPercentage;

        /** Micro-lots per unit of risk amount, by symbol name. */
        private Map<String, BigDecimal> microLotsPerDollar = new HashMap<>();

        private BigDecimal defaultMicroLotsPerDollar = BigDecimal.TEN;

        /** Share of the pip-equalized volume to trade. Unset disables DYNAMIC_PIP. */
        private BigDecimal dynamicPipVolumeRatio;

        /**
         * Calibrated money-per-lot contract sizes by symbol name. When present they replace the
         * catalog-derived pip values in DYNAMIC_PIP.
         */
        private Map<String, ContractSize> contractSizes = new HashMap<>();

        /** Smallest slave volume in lots. Smaller results are raised to it. */
        @NotNull
        private BigDecimal minLotSize = new BigDecimal("0.01");

        /** Slave volume never exceeds this multiple of the master volume. */
        @NotNull
        private BigDecimal maxLotMultiplier = new BigDecimal("2.0");

        /** Lot step used when the slave instrument's specification has not been loaded. */
        @NotNull
        private BigDecimal defaultLotStep = new BigDecimal("0.01");
    }

    @Getter
    @Setter
    public static class ContractSize {

        private BigDecimal master;

        private BigDecimal slave;
    }

    @Getter
    @Setter
    public static class Workers {

        /** Number of single-threaded lanes. Events of one instrument always share a lane. */
        @Min(1)
        private int lanes = 8;
    }

    @Getter
    @Setter
    public static class Shutdown {

        /** How long in-flight dispatches may run after shutdown begins. */
        private Duration gracePeriod = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Reconnect {

        private Duration initialDelay = Duration.ofSeconds(1);

        private Duration maxDelay = Duration.ofSeconds(60);

        /** Consecutive failed connection attempts before the process gives up. */
        @Min(1)
        private int maxConnectAttempts = 10;
    }

    @Getter
    @Setter
    public static class Transport {

        /** Time to wait for the response to a correlated request. */
        private Duration requestTimeout = Duration.ofSeconds(10);

        private Duration heartbeatInterval = Duration.ofSeconds(10);

        /** Overrides the environment's endpoint, mainly for tests against a local stub. */
        private String endpointOverride;
    }

    @Getter
    @Setter
    public static class Reconciliation {

        /** Max difference between master and slave open times for a heuristic pair. */
        private Duration openTimeTolerance = Duration.ofSeconds(30);

        /** Relative tolerance between the observed and the expected slave/master volume ratio. */
        private BigDecimal volumeRatioTolerance = new BigDecimal("0.25");
    }
}
