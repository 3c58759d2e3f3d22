/**
 * WebSocket boundary: handshake authorization, client key resolution and the audio streaming
 * handler.
 */
package com.phillippitts.voicebridge.presentation.websocket;
