/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.spring3;

import com.macstab.oss.ringdriver.session.SessionConfig;

/**
 * Callback adjusting the auto-configured {@link SessionConfig} before it is built.
 *
 * <p>Customizers run after the {@code ringdriver.*} properties are applied, in {@link
 * org.springframework.core.Ordered} order, so they can override any property or set options with
 * no property counterpart (host filter, address translator, routing policy).
 *
 * <pre>{@code
 * @Bean
 * SessionConfigCustomizer natTranslator() {
 *   return builder -> builder.addressTranslator(address -> natTable.get(address));
 * }
 * }</pre>
 */
@FunctionalInterface
public interface SessionConfigCustomizer {

  void customize(SessionConfig.SessionConfigBuilder builder);
}
