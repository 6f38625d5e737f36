/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.actuator.registration;

import java.io.Closeable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically registers this instance with a remote monitoring registry.
 *
 * <p>
 * The registry expires registrations it has not seen for a while, so the client
 * re-registers on every tick, not only after a failure. Failed attempts are logged,
 * counted and retried on the next tick; they never reach the embedding application.
 * </p>
 *
 * <p>
 * Every registry call runs on one dedicated daemon thread, so at most one attempt is
 * in flight and a tick can never overlap the deregistration issued by {@link #stop()}.
 * </p>
 */
public final class RegistrationClient implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(RegistrationClient.class.getName());
    private static final Duration STOP_GRACE = Duration.ofSeconds(5);

    private final RegistryTransport transport;
    private final Supplier<RegistrationRequest> requestSupplier;
    private final Duration interval;
    private final Duration requestTimeout;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile RegistrationState state = RegistrationState.initial();
    private volatile ScheduledFuture<?> tickTask;

    /**
     * @param transport       outward registry calls
     * @param requestSupplier builds the registration document on each tick
     * @param interval        time between registration attempts
     * @param requestTimeout  upper bound of a single registry call, used to size the stop wait
     */
    public RegistrationClient(RegistryTransport transport,
            Supplier<RegistrationRequest> requestSupplier,
            Duration interval,
            Duration requestTimeout) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.requestSupplier = Objects.requireNonNull(requestSupplier, "requestSupplier");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "actuator-registration");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic registration loop. The first attempt runs immediately.
     */
    public void start() {
        if (stopped.get()) {
            LOGGER.warning("Registration client already stopped, ignoring start()");
            return;
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        long periodMs = Math.max(1L, interval.toMillis());
        tickTask = scheduler.scheduleAtFixedRate(this::tick, 0L, periodMs, TimeUnit.MILLISECONDS);
        LOGGER.info(() -> "Registration started, interval " + interval);
    }

    /**
     * Stops the loop and, if a registration ever succeeded, deregisters once.
     * Idempotent. When this returns no further tick will run.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        ScheduledFuture<?> task = tickTask;
        if (task != null) {
            task.cancel(false);
            tickTask = null;
        }
        if (started.get()) {
            runDeregistration();
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warning("Registration thread did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        state = state.withPhase(RegistrationPhase.STOPPED);
    }

    @Override
    public void close() {
        stop();
    }

    public RegistrationState state() {
        return state;
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    private void runDeregistration() {
        Future<?> pending;
        try {
            // queued behind any tick still in flight
            pending = scheduler.submit(this::deregister);
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.WARNING, "Could not schedule deregistration", e);
            return;
        }
        long waitMs = requestTimeout.multipliedBy(2).plus(STOP_GRACE).toMillis();
        try {
            pending.get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            LOGGER.warning(() -> "Deregistration did not complete within " + waitMs + " ms");
        } catch (ExecutionException e) {
            LOGGER.log(Level.WARNING, "Deregistration task failed", e.getCause());
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
        }
    }

    private void tick() {
        if (stopped.get()) {
            return;
        }
        try {
            register();
        } catch (Throwable t) {
            state = state.failed();
            LOGGER.log(Level.SEVERE, "Unexpected error in registration task", t);
        }
    }

    /**
     * One registration attempt. Package-private for testing.
     */
    void register() {
        state = state.attempting(Instant.now());
        try {
            String instanceId = transport.register(requestSupplier.get());
            state = state.succeeded(instanceId, Instant.now());
            LOGGER.fine(() -> "Registered with id " + instanceId);
        } catch (RemoteRegistrationException e) {
            RegistrationState failed = state.failed();
            state = failed;
            LOGGER.warning(() -> "Registration failed (" + failed.consecutiveFailures()
                    + " consecutive): " + e.getMessage());
        }
    }

    private void deregister() {
        RegistrationState current = state;
        if (!current.everRegistered()) {
            LOGGER.fine("Never registered, skipping deregistration");
            return;
        }
        state = current.withPhase(RegistrationPhase.DEREGISTERING);
        try {
            transport.deregister(current.instanceId());
            LOGGER.info(() -> "Deregistered instance " + current.instanceId());
        } catch (RemoteRegistrationException e) {
            LOGGER.log(Level.WARNING, "Deregistration of instance " + current.instanceId() + " failed", e);
        }
    }
}
