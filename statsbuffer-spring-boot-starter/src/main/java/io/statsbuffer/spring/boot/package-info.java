/**
 * Spring Boot auto-configuration for the StatsD buffer.
 *
 * <p>Add this module and declare a {@link io.statsbuffer.spi.Transport} bean; a
 * {@link io.statsbuffer.StatsdClient} is then available for injection. Tune it with
 * {@code statsd.buffer.*} properties.
 *
 * @see io.statsbuffer.spring.boot.StatsdBufferAutoConfiguration
 * @see io.statsbuffer.spring.boot.StatsdBufferProperties
 */
package io.statsbuffer.spring.boot;
