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

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadInfo;
import java.lang.management.ThreadMXBean;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Captures every live thread through the platform {@link ThreadMXBean}.
 */
public final class ThreadDumpProvider {
    private final ThreadMXBean threadBean = ManagementFactory.getThreadMXBean();

    public ThreadDump getThreadDump() {
        ThreadInfo[] infos = threadBean.dumpAllThreads(
                threadBean.isObjectMonitorUsageSupported(),
                threadBean.isSynchronizerUsageSupported());
        List<ThreadSnapshot> threads = new ArrayList<>(infos.length);
        for (ThreadInfo info : infos) {
            if (info != null) {
                threads.add(toSnapshot(info));
            }
        }
        threads.sort(Comparator.comparing(ThreadSnapshot::threadName, String.CASE_INSENSITIVE_ORDER));
        return new ThreadDump(List.copyOf(threads));
    }

    private static ThreadSnapshot toSnapshot(ThreadInfo info) {
        List<ThreadSnapshot.StackFrame> frames = Arrays.stream(info.getStackTrace())
                .map(ThreadSnapshot.StackFrame::of)
                .toList();
        return new ThreadSnapshot(
                info.getThreadName(),
                info.getThreadId(),
                info.getThreadState(),
                info.isDaemon(),
                info.getPriority(),
                info.getBlockedCount(),
                info.getWaitedCount(),
                info.getLockName(),
                info.getLockOwnerId(),
                info.getLockOwnerName(),
                info.isInNative(),
                info.isSuspended(),
                frames);
    }
}
