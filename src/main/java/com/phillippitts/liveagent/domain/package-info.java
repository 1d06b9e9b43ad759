/**
 * Frame model shared by every pipeline stage.
 *
 * <p>Frames are immutable records tagged with a monotonic sequence id and a
 * {@link com.phillippitts.liveagent.domain.FrameDirection}:
 * <ul>
 *   <li>{@link com.phillippitts.liveagent.domain.AudioFrame} - PCM16LE audio</li>
 *   <li>{@link com.phillippitts.liveagent.domain.TextFrame} - transcripts and model tokens</li>
 *   <li>{@link com.phillippitts.liveagent.domain.ImageFrame} - camera and avatar video frames</li>
 *   <li>{@link com.phillippitts.liveagent.domain.ControlFrame} - lifecycle and signalling</li>
 * </ul>
 */
package com.phillippitts.liveagent.domain;
