/**
 * Application-specific exception hierarchy.
 *
 * <ul>
 *   <li>{@link com.phillippitts.speechgate.exception.SpeechGateException} - base for all
 *       application errors</li>
 *   <li>{@link com.phillippitts.speechgate.exception.InvalidRequestException} - malformed or
 *       incomplete client message</li>
 *   <li>{@link com.phillippitts.speechgate.exception.VoiceNotFoundException} - unknown voice id</li>
 *   <li>{@link com.phillippitts.speechgate.exception.InferenceException} - a whole recognizer or
 *       synthesizer call failed</li>
 * </ul>
 *
 * <p>None of these close a WebSocket connection: the handlers reply with one
 * {@code {"error": ...}} frame and keep serving the connection.
 */
package com.phillippitts.speechgate.exception;
