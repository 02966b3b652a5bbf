package io.statsbuffer.spring.boot;

import io.statsbuffer.NoopStatsdClient;
import io.statsbuffer.StatsdBuffer;
import io.statsbuffer.StatsdClient;
import io.statsbuffer.spi.MetricsExporter;
import io.statsbuffer.spi.Transport;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the StatsD buffer.
 *
 * <p>Creates a {@link StatsdBuffer} around the application's {@link Transport} bean,
 * configured from {@link StatsdBufferProperties}. The buffer is closed, and its final
 * flush performed, when the context shuts down. The transport stays a container-managed
 * bean: the container closes it after the buffer, since the buffer depends on it. With
 * {@code statsd.buffer.enabled=false} a {@link NoopStatsdClient} is registered instead.
 *
 * @see StatsdBufferProperties
 * @see StatsdBufferMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(StatsdBuffer.class)
@EnableConfigurationProperties(StatsdBufferProperties.class)
public class StatsdBufferAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(StatsdClient.class)
  @ConditionalOnBean(Transport.class)
  @ConditionalOnProperty(prefix = "statsd.buffer", name = "enabled", matchIfMissing = true)
  public StatsdBuffer statsdBuffer(StatsdBufferProperties props,
      Transport transport,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var builder = StatsdBuffer.builder()
        .transport(transport)
        .closeTransport(false)
        .flushInterval(props.getFlushInterval())
        .queueCapacity(props.getQueueCapacity());
    if (props.getCloseTimeout() != null) {
      builder.closeTimeout(props.getCloseTimeout());
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean(StatsdClient.class)
  @ConditionalOnProperty(prefix = "statsd.buffer", name = "enabled", havingValue = "false")
  public NoopStatsdClient noopStatsdClient() {
    return new NoopStatsdClient();
  }
}
