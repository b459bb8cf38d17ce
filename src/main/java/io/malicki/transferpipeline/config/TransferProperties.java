package io.malicki.transferpipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Limits and collaborator settings for the external transfer pipeline ({@code transfers.*}).
 */
@Data
@ConfigurationProperties(prefix = "transfers")
public class TransferProperties {

    private BigDecimal maxAmount = new BigDecimal("10000000");

    private String defaultCurrency = "NGN";

    private List<String> supportedCurrencies = new ArrayList<>(List.of("USD", "EUR", "GBP", "NGN", "CAD"));

    private String accountNumberPattern = "^\\d{10}$";

    private String bankCodePattern = "^\\d{3}$";

    private String lifecycleTopic = "transfer-lifecycle";

    private Polling polling = new Polling();

    private Admin admin = new Admin();

    private History history = new History();

    private Settlement settlement = new Settlement();

    private Verification verification = new Verification();

    private Recovery recovery = new Recovery();

    private Push push = new Push();

    @Data
    public static class Polling {
        private int defaultLimit = 50;
        private int maxLimit = 100;
    }

    @Data
    public static class Admin {
        private int defaultPageSize = 20;
        private int maxPageSize = 100;
    }

    @Data
    public static class History {
        private int defaultPageSize = 20;
        private int maxPageSize = 100;
    }

    @Data
    public static class Settlement {
        // Simulated rail latency
        private Duration gatewayDelay = Duration.ofSeconds(2);
        // Rail-imposed limit; larger transfers are declined by the gateway
        private BigDecimal ceiling = new BigDecimal("50000");
        private Duration timeout = Duration.ofSeconds(30);
        // Simulated rail only; oldest outcomes are forgotten past this many references
        private int rememberedOutcomes = 10_000;
    }

    @Data
    public static class Verification {
        private Duration delay = Duration.ofSeconds(1);
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Push {
        // Clients reconnect after this; polling covers the gap
        private Duration emitterTimeout = Duration.ofMinutes(30);
    }

    @Data
    public static class Recovery {
        private boolean resumeProcessingOnStartup = true;
    }
}
