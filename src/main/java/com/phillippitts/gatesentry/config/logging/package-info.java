/**
 * Logging infrastructure: request correlation through Log4j2's ThreadContext.
 *
 * <p>ThreadContext keys:
 * <ul>
 *   <li>{@code requestId} - per HTTP request, set by {@link com.phillippitts.gatesentry.config.logging.MdcFilter}</li>
 *   <li>{@code sessionId} - set for the duration of a conversation turn</li>
 * </ul>
 *
 * <p>Log format (see {@code log4j2-spring.xml}):
 * <pre>
 * 2025-10-17 15:42:32.529 [thread-name] [requestId] [sessionId] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.gatesentry.config.logging;
