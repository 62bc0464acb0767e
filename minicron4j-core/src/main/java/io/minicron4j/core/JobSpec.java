package io.minicron4j.core;

/**
 * Immutable job definition produced by JobBuilder.build().
 * Everything a {@link Job} carries except the id and run state.
 */
public record JobSpec(

        // identity
        String name,
        String userId,

        // scheduling
        String cron,
        boolean enabled,
        Boolean repeat,

        // payload
        String task,
        Boolean notifyOnFire
) {
}
