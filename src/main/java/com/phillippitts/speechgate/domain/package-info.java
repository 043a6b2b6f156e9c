/**
 * Immutable domain types shared by the recognition and synthesis services.
 */
package com.phillippitts.speechgate.domain;
