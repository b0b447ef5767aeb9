package chatcollector.spring.boot;

import chatcollector.GatewayClient;
import chatcollector.micrometer.MicrometerCollectorMetrics;
import chatcollector.model.Channel;
import chatcollector.spi.CollectorMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatCollectorMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    ChatCollectorMicrometerAutoConfiguration.class, ChatCollectorAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerMetricsByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerCollectorMetrics"));
            assertInstanceOf(MicrometerCollectorMetrics.class, ctx.getBean(CollectorMetrics.class));
        });
    }

    @Test
    void clientReportsToRegistry() {
        runner.run(ctx -> {
            var client = ctx.getBean(GatewayClient.class);
            client.createMessageCollector(Channel.direct("dm1")).stop();

            var registry = ctx.getBean(MeterRegistry.class);
            assertEquals(1.0, registry.get("chatcollector.collector.started").counter().count());
            assertEquals(1.0, registry.get("chatcollector.collector.ended")
                    .tag("reason", "user").counter().count());
        });
    }

    @Test
    void metersRemovedWhenContextCloses() {
        var registry = new AtomicReference<MeterRegistry>();
        runner.run(ctx -> {
            registry.set(ctx.getBean(MeterRegistry.class));
            assertNotNull(registry.get().find("chatcollector.collector.started").counter());
        });
        assertNull(registry.get().find("chatcollector.collector.started").counter());
        assertNull(registry.get().find("chatcollector.collector.active").gauge());
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("chatcollector.metrics.name-prefix=support.bot").run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("support.bot.collector.started").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("chatcollector.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerCollectorMetrics"));
            assertNotNull(ctx.getBean(GatewayClient.class));
        });
    }

    @Test
    void backsOffWhenCustomMetricsPresent() {
        runner.withUserConfiguration(CustomMetricsConfig.class).run(ctx -> {
            var metrics = ctx.getBean(CollectorMetrics.class);
            assertFalse(metrics instanceof MicrometerCollectorMetrics);
        });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomMetricsConfig {
        @Bean
        CollectorMetrics customCollectorMetrics() {
            return CollectorMetrics.NOOP;
        }
    }
}
