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

import java.time.Instant;

/**
 * Immutable view of the registration progress, replaced as a whole on every transition.
 *
 * @param phase               current lifecycle phase
 * @param instanceId          id returned by the last successful registration, {@code null} before the first
 * @param lastAttemptTime     start of the last registration attempt
 * @param lastSuccessTime     end of the last successful registration
 * @param consecutiveFailures failed attempts since the last success
 * @param totalAttempts       registration attempts since start
 */
public record RegistrationState(
        RegistrationPhase phase,
        String instanceId,
        Instant lastAttemptTime,
        Instant lastSuccessTime,
        int consecutiveFailures,
        long totalAttempts) {

    static RegistrationState initial() {
        return new RegistrationState(RegistrationPhase.IDLE, null, null, null, 0, 0);
    }

    RegistrationState attempting(Instant now) {
        return new RegistrationState(RegistrationPhase.REGISTERING, instanceId, now, lastSuccessTime,
                consecutiveFailures, totalAttempts + 1);
    }

    RegistrationState succeeded(String id, Instant now) {
        return new RegistrationState(RegistrationPhase.REGISTERED, id, lastAttemptTime, now, 0, totalAttempts);
    }

    RegistrationState failed() {
        return new RegistrationState(RegistrationPhase.IDLE, instanceId, lastAttemptTime, lastSuccessTime,
                consecutiveFailures + 1, totalAttempts);
    }

    RegistrationState withPhase(RegistrationPhase next) {
        return new RegistrationState(next, instanceId, lastAttemptTime, lastSuccessTime,
                consecutiveFailures, totalAttempts);
    }

    public boolean everRegistered() {
        return instanceId != null;
    }
}
