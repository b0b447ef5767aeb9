package chatcollector.spring.boot;

import chatcollector.micrometer.MicrometerCollectorMetrics;
import chatcollector.spi.CollectorMetrics;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerCollectorMetrics} when Micrometer is on the classpath
 * and {@code chatcollector.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link ChatCollectorAutoConfiguration} so the {@link CollectorMetrics}
 * bean is available for injection into the client, which removes its meters on close.
 */
@AutoConfiguration(before = ChatCollectorAutoConfiguration.class)
@ConditionalOnClass({MicrometerCollectorMetrics.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "chatcollector.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(ChatCollectorProperties.class)
public class ChatCollectorMicrometerAutoConfiguration {

  // closed by GatewayClient
  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(CollectorMetrics.class)
  public MicrometerCollectorMetrics micrometerCollectorMetrics(
      MeterRegistry meterRegistry, ChatCollectorProperties props) {
    return new MicrometerCollectorMetrics(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
