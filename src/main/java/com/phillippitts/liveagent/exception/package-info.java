/**
 * Live-agent exception hierarchy.
 *
 * <p>Each exception maps to one recovery action:
 * <ul>
 *   <li>{@link com.phillippitts.liveagent.exception.ConnectionException} - retried with backoff;
 *       fatal for that service once attempts are exhausted</li>
 *   <li>{@link com.phillippitts.liveagent.exception.MediaFormatException} - fatal for one
 *       conversion or mix; the optional feature disables itself for the session</li>
 *   <li>{@link com.phillippitts.liveagent.exception.UpstreamServiceException} - avatar rendering
 *       degrades to audio-only</li>
 *   <li>{@link com.phillippitts.liveagent.exception.ConfigurationException} - the session is
 *       aborted before any stream opens</li>
 *   <li>{@link com.phillippitts.liveagent.exception.SessionNotFoundException} - admin API 404</li>
 * </ul>
 *
 * <p>All exceptions extend {@link com.phillippitts.liveagent.exception.LiveAgentException} and are
 * mapped to HTTP responses by {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.liveagent.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.liveagent.exception;
