package com.purchasingpower.policyflow.extraction;

/**
 * Outcome of a generation round trip.
 *
 * @param value     accepted value, or the stage default when {@code defaulted} is true
 * @param defaulted whether every attempt failed and the default was substituted
 * @param attempts  number of generation calls made
 */
public record RoundTripResult<T>(T value, boolean defaulted, int attempts) {
}
