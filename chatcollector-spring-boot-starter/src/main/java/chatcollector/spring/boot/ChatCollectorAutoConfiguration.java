package chatcollector.spring.boot;

import chatcollector.GatewayClient;
import chatcollector.collector.CollectorOptions;
import chatcollector.event.DefaultEventSource;
import chatcollector.event.EventSource;
import chatcollector.model.Message;
import chatcollector.spi.CollectorMetrics;
import chatcollector.spi.TimerScheduler;
import chatcollector.timer.ExecutorTimerScheduler;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the chat collector client.
 *
 * <p>Wires up a {@link GatewayClient} from an {@link EventSource}, a
 * {@link TimerScheduler} and, when present, a {@link CollectorMetrics} bean.
 * Default collector options come from {@link ChatCollectorProperties}.
 *
 * @see ChatCollectorProperties
 * @see ChatCollectorMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(GatewayClient.class)
@EnableConfigurationProperties(ChatCollectorProperties.class)
public class ChatCollectorAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(EventSource.class)
  public DefaultEventSource eventSource() {
    return new DefaultEventSource();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(TimerScheduler.class)
  public ExecutorTimerScheduler timerScheduler() {
    return new ExecutorTimerScheduler();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public GatewayClient gatewayClient(ChatCollectorProperties props,
      EventSource eventSource,
      TimerScheduler timerScheduler,
      ObjectProvider<CollectorMetrics> metricsProvider) {
    var builder = GatewayClient.builder()
        .eventSource(eventSource)
        .timerScheduler(timerScheduler)
        .defaultOptions(defaultOptions(props.getCollector()));
    CollectorMetrics metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  static CollectorOptions<Message> defaultOptions(ChatCollectorProperties.Collector props) {
    CollectorOptions.Builder<Message> builder = CollectorOptions.<Message>builder()
        .dispose(props.isDispose());
    if (props.getTime() != null) {
      builder.time(props.getTime());
    }
    if (props.getIdle() != null) {
      builder.idle(props.getIdle());
    }
    if (props.getMax() > 0) {
      builder.max(props.getMax());
    }
    if (props.getMaxProcessed() > 0) {
      builder.maxProcessed(props.getMaxProcessed());
    }
    return builder.build();
  }
}
