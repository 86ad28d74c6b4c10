/* (C)2026 Christian Schnapka / Macstab GmbH */
/**
 * Spring Boot 3 integration of the ring driver.
 *
 * <p>Adding the starter to the classpath and setting {@code ringdriver.contact-points} is enough
 * to get a connected {@link com.macstab.oss.ringdriver.session.Session} bean:
 *
 * <pre>{@code
 * ringdriver:
 *   contact-points: 10.0.0.1, 10.0.0.2
 *   local-datacenter: dc1
 *
 * @Service
 * class OrderRepository {
 *   private final Session session;
 *   ...
 * }
 * }</pre>
 *
 * <p>Metrics are published through Micrometer when a {@code MeterRegistry} bean exists; see
 * {@code management.metrics.ring-driver.*}.
 */
package com.macstab.oss.ringdriver.spring3;
