package com.movesim.simulator;

import java.util.concurrent.Future;

/**
 * Supervisor-side handle of one running generator: the child token that stops it and the future
 * of its task. The generator itself only ever sees the token.
 */
record GenerationHandle(String entityId, CancellationToken token, Future<?> task) {}
