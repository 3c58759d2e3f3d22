/**
 * Session lifecycle: admission against global and per-client caps, ingestion into the chunk
 * assembler, draining on close and idle reaping.
 *
 * <pre>
 * ACTIVE --close/end_of_stream/idle--> DRAINING --drained or grace expired--> CLOSED
 * </pre>
 */
package com.phillippitts.voicebridge.service.session;
