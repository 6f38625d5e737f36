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

package dev.nishisan.actuator.threads;

import java.util.List;

/**
 * State of one live thread at dump time. Lock fields are {@code null} when the thread
 * is not blocked or waiting on a monitor.
 */
public record ThreadSnapshot(
        String threadName,
        long threadId,
        Thread.State threadState,
        boolean daemon,
        int priority,
        long blockedCount,
        long waitedCount,
        String lockName,
        long lockOwnerId,
        String lockOwnerName,
        boolean inNative,
        boolean suspended,
        List<StackFrame> stackTrace) {

    public record StackFrame(String className, String methodName, String fileName, int lineNumber,
            boolean nativeMethod) {

        static StackFrame of(StackTraceElement element) {
            return new StackFrame(element.getClassName(), element.getMethodName(), element.getFileName(),
                    element.getLineNumber(), element.isNativeMethod());
        }
    }
}
