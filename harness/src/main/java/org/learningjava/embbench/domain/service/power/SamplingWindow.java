package org.learningjava.embbench.domain.service.power;

import java.util.OptionalDouble;

/**
 * A running power measurement. {@link #stop()} ends it and returns the mean draw in watts,
 * or empty when nothing was sampled.
 */
@FunctionalInterface
public interface SamplingWindow {

    SamplingWindow NONE = OptionalDouble::empty;

    OptionalDouble stop();
}
