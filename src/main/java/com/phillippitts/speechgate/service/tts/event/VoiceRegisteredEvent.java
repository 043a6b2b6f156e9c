package com.phillippitts.speechgate.service.tts.event;

import java.time.Instant;

/**
 * Published after a voice was registered (or re-registered) and its sample persisted.
 */
public record VoiceRegisteredEvent(String voiceId, Instant at) { }
