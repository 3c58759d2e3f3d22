/**
 * Core domain records shared by every stage of the streaming pipeline.
 *
 * <p>{@link com.phillippitts.voicebridge.domain.AudioSegment} flows from the assembler to the
 * dispatcher, {@link com.phillippitts.voicebridge.domain.TranscriptionResult} flows back to the
 * broadcaster. Both are immutable and validated in their compact constructors.
 */
package com.phillippitts.voicebridge.domain;
