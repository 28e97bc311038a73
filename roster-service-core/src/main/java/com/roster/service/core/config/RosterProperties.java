package com.roster.service.core.config;

import com.roster.service.core.validation.NumericMode;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "roster")
public class RosterProperties {
    private RateLimit rateLimit = new RateLimit();
    private Validation validation = new Validation();
    private Registry registry = new Registry();
    private Gateway gateway = new Gateway();

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Gateway getGateway() {
        return gateway;
    }

    public void setGateway(Gateway gateway) {
        this.gateway = gateway;
    }

    public static class RateLimit {
        private Duration window = Duration.ofSeconds(10);
        private int maxRequests = 20;

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }
    }

    public static class Validation {
        private NumericMode numericMode = NumericMode.LENIENT;

        public NumericMode getNumericMode() {
            return numericMode;
        }

        public void setNumericMode(NumericMode numericMode) {
            this.numericMode = numericMode;
        }
    }

    public static class Registry {
        /** Entries not refreshed for this long are swept. Zero or negative keeps entries until deleted. */
        private Duration entryTtl = Duration.ZERO;

        private long sweepIntervalMillis = 60_000;

        public Duration getEntryTtl() {
            return entryTtl;
        }

        public void setEntryTtl(Duration entryTtl) {
            this.entryTtl = entryTtl;
        }

        public long getSweepIntervalMillis() {
            return sweepIntervalMillis;
        }

        public void setSweepIntervalMillis(long sweepIntervalMillis) {
            this.sweepIntervalMillis = sweepIntervalMillis;
        }
    }

    public static class Gateway {
        private boolean trustForwardedFor;
        private List<String> corsAllowedOrigins = List.of("*");

        public boolean isTrustForwardedFor() {
            return trustForwardedFor;
        }

        public void setTrustForwardedFor(boolean trustForwardedFor) {
            this.trustForwardedFor = trustForwardedFor;
        }

        public List<String> getCorsAllowedOrigins() {
            return corsAllowedOrigins;
        }

        public void setCorsAllowedOrigins(List<String> corsAllowedOrigins) {
            this.corsAllowedOrigins = corsAllowedOrigins;
        }
    }
}
