/**
 * REST controllers: liveness ping, pipeline status and session inspection.
 */
package com.phillippitts.voicebridge.presentation.controller;
