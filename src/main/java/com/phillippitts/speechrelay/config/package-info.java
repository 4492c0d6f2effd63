/**
 * Spring configuration: transport wiring, CORS, configuration properties and startup reporting.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code @ConfigurationProperties} bindings</li>
 *   <li>{@code config.stt} - Speech-to-Text client and credentials</li>
 *   <li>{@code config.logging} - MDC filter</li>
 * </ul>
 */
package com.phillippitts.speechrelay.config;
