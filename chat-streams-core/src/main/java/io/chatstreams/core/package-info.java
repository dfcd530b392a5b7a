/**
 * Protocol-centric core of the chat stream consumer.
 *
 * <p>This module is deliberately transport-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants and the typed {@link io.chatstreams.core.Chunk} model</li>
 *   <li>Incremental SSE line framing ({@link io.chatstreams.core.FrameAssembler})</li>
 *   <li>Payload classification ({@link io.chatstreams.core.EventClassifier})</li>
 *   <li>The read loop with its completion check and cancellation primitive</li>
 * </ul>
 *
 * <p>HTTP bindings, retry and stream-key bookkeeping live in the client module.
 */
package io.chatstreams.core;
