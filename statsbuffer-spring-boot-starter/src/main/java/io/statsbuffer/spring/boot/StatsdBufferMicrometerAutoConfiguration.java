package io.statsbuffer.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.statsbuffer.micrometer.MicrometerMetricsExporter;
import io.statsbuffer.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code statsd.buffer.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link StatsdBufferAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the buffer.
 */
@AutoConfiguration(before = StatsdBufferAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "statsd.buffer.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(StatsdBufferProperties.class)
public class StatsdBufferMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, StatsdBufferProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
