package io.surfworks.meshforge.codegen.config;

import java.util.Objects;

/**
 * Configuration for statement emission.
 *
 * <p>Passed to the emitters at construction instead of being read from
 * process-wide flags, so two emitters with different settings can coexist.
 *
 * @param lineTimer          whether to emit a timer probe before each instrumented statement
 * @param timerFunction      runtime function called by timer probes with a single label
 * @param reducerPrefix      prefix of reducer handles; the reducer id is appended
 * @param discardName        name bound to results nobody reads
 * @param intermediatePrefix base name of synthesized intermediate outputs
 */
public record EmitterConfig(
        boolean lineTimer,
        String timerFunction,
        String reducerPrefix,
        String discardName,
        String intermediatePrefix
) {

    /** Default timer probe function */
    public static final String DEFAULT_TIMER_FUNCTION = "nnscaler.runtime.function.print_time";

    /** Default reducer handle prefix */
    public static final String DEFAULT_REDUCER_PREFIX = "self.wreducer";

    /** Default discard name */
    public static final String DEFAULT_DISCARD_NAME = "_";

    /** Default intermediate output base name */
    public static final String DEFAULT_INTERMEDIATE_PREFIX = "im_output";

    public EmitterConfig {
        Objects.requireNonNull(timerFunction, "timerFunction cannot be null");
        Objects.requireNonNull(reducerPrefix, "reducerPrefix cannot be null");
        Objects.requireNonNull(discardName, "discardName cannot be null");
        Objects.requireNonNull(intermediatePrefix, "intermediatePrefix cannot be null");

        if (timerFunction.isBlank()) {
            throw new IllegalArgumentException("timerFunction cannot be blank");
        }
        if (discardName.isBlank()) {
            throw new IllegalArgumentException("discardName cannot be blank");
        }
        if (intermediatePrefix.isBlank()) {
            throw new IllegalArgumentException("intermediatePrefix cannot be blank");
        }
    }

    /**
     * Returns the default configuration: no timer probes.
     */
    public static EmitterConfig defaults() {
        return new EmitterConfig(
                false,
                DEFAULT_TIMER_FUNCTION,
                DEFAULT_REDUCER_PREFIX,
                DEFAULT_DISCARD_NAME,
                DEFAULT_INTERMEDIATE_PREFIX
        );
    }

    /**
     * Returns a new config with line timing switched on or off.
     */
    public EmitterConfig withLineTimer(boolean enabled) {
        return new EmitterConfig(enabled, timerFunction, reducerPrefix, discardName, intermediatePrefix);
    }

    /**
     * Returns a new config with the specified timer function.
     */
    public EmitterConfig withTimerFunction(String function) {
        return new EmitterConfig(lineTimer, function, reducerPrefix, discardName, intermediatePrefix);
    }

    /**
     * Returns a new config with the specified reducer prefix.
     */
    public EmitterConfig withReducerPrefix(String prefix) {
        return new EmitterConfig(lineTimer, timerFunction, prefix, discardName, intermediatePrefix);
    }

    /**
     * Returns a new config with the specified discard name.
     */
    public EmitterConfig withDiscardName(String name) {
        return new EmitterConfig(lineTimer, timerFunction, reducerPrefix, name, intermediatePrefix);
    }

    /**
     * Returns a new config with the specified intermediate output base name.
     */
    public EmitterConfig withIntermediatePrefix(String prefix) {
        return new EmitterConfig(lineTimer, timerFunction, reducerPrefix, discardName, prefix);
    }
}
