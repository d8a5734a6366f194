package com.whereq.roundhouse.executor;

import com.whereq.roundhouse.model.BuildJob;
import com.whereq.roundhouse.model.BuildResult;
import reactor.core.publisher.Mono;

/**
 * Runs the build toolchain for a claimed job. The queue treats a build as opaque: it only
 * needs the result and whatever log lines the build writes.
 */
public interface BuildExecutor {
    /**
     * Build the job's image
     *
     * @param job the claimed job
     * @param logs sink for build output
     * @return Mono with the build result; an error signal is recorded as a failed build
     */
    Mono<BuildResult> execute(BuildJob job, LogWriter logs);

    /**
     * Destination for build output lines
     */
    @FunctionalInterface
    interface LogWriter {
        Mono<Void> write(String line);
    }
}
