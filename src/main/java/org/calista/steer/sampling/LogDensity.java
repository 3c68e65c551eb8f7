package org.calista.steer.sampling;

/**
 * Unnormalized log target density. Returns -∞ outside the support.
 */
@FunctionalInterface
public interface LogDensity<T> {

    double logDensity(T x);
}
