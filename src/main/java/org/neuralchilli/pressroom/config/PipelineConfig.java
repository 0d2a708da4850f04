package org.neuralchilli.pressroom.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

/**
 * Typed view of the {@code pressroom.*} settings.
 */
@ConfigMapping(prefix = "pressroom")
public interface PipelineConfig {

    Worker worker();

    Retry retry();

    Stages stages();

    Content content();

    Publish publish();

    Retention retention();

    interface Worker {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("4")
        int threads();

        @WithDefault("worker-local")
        String id();

        @WithName("queue-capacity")
        @WithDefault("10000")
        int queueCapacity();

        @WithName("shutdown-timeout")
        @WithDefault("60s")
        Duration shutdownTimeout();
    }

    interface Retry {

        @WithName("max-attempts")
        @WithDefault("3")
        int maxAttempts();

        @WithName("initial-backoff")
        @WithDefault("500ms")
        Duration initialBackoff();

        @WithDefault("2.0")
        double multiplier();

        @WithName("max-backoff")
        @WithDefault("10s")
        Duration maxBackoff();
    }

    interface Stages {

        StageSettings extract();

        StageSettings analyze();

        StageSettings write();

        StageSettings publish();
    }

    interface StageSettings {

        Duration timeout();

        /**
         * Overrides {@code pressroom.retry.max-attempts} for this stage.
         */
        @WithName("max-attempts")
        Optional<Integer> maxAttempts();
    }

    interface Content {

        @WithName("min-word-count")
        @WithDefault("300")
        int minWordCount();

        @WithName("max-word-count")
        @WithDefault("5000")
        int maxWordCount();

        @WithName("default-word-count")
        @WithDefault("1000")
        int defaultWordCount();
    }

    interface Publish {

        @WithName("default-author")
        @WithDefault("KX Smart Creation")
        String defaultAuthor();

        @WithName("default-platform")
        @WithDefault("wechat")
        String defaultPlatform();

        @WithName("app-id")
        Optional<String> appId();

        @WithName("app-secret")
        Optional<String> appSecret();
    }

    interface Retention {

        @WithDefault("1h")
        Duration ttl();

        @WithName("sweep-interval")
        @WithDefault("5m")
        Duration sweepInterval();
    }
}
