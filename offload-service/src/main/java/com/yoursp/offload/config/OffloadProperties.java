package com.yoursp.offload.config;

import com.yoursp.offload.modules.primitive.PasswordHashAlgorithm;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Binds the {@code offload.*} YAML properties into a typed bean.
 */
@Getter
@Setter
@Validated
@Configuration
@ConfigurationProperties(prefix = "offload")
public class OffloadProperties {

    @Valid
    private final Pool pool = new Pool();

    @Valid
    private final Password password = new Password();

    @Getter
    @Setter
    public static class Pool {
        /** Number of workers; fixed for the lifetime of the pool. */
        @Min(1)
        private int size = defaultPoolSize();
        /** Applied when a caller passes no timeout. */
        @NotNull
        private Duration defaultTimeout = Duration.ofSeconds(5);
        /** Tasks allowed to wait for a worker; 0 means unbounded. */
        @Min(0)
        private int maxQueueLength = 1000;
        @NotNull
        private Duration initTimeout = Duration.ofSeconds(60);
        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Password {
        @NotNull
        private PasswordHashAlgorithm algorithm = PasswordHashAlgorithm.WORKER_SALT;
        @Min(4)
        @Max(31)
        private int bcryptRounds = 10;
    }

    /** CPU count minus one, clamped to [4, 8]. */
    static int defaultPoolSize() {
        return Math.max(4, Math.min(Runtime.getRuntime().availableProcessors() - 1, 8));
    }
}
