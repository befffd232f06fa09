/**
 * Rspamd integration.
 *
 * <p>The client posts content to the Rspamd /checkv2 endpoint and exposes the raw JSON response.
 * <br>{@link com.mimecast.phishguard.scanners.RspamdTextClassifier} maps the score onto a spam or ham verdict.
 *
 * <p>Configured in {@code cfg/services.json5}:
 * <pre>
 * rspamd: {
 *   enabled: true,
 *   host: "localhost",
 *   port: 11333,
 *   timeout: 30,
 *   rejectThreshold: 7.0
 * }
 * </pre>
 */
package com.mimecast.phishguard.scanners;
