/**
 * Audio format constants, windowing of inbound fragments into segments, and small PCM utilities.
 */
package com.phillippitts.voicebridge.service.audio;
