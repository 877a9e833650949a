/*
* Copyright 2016 Samsung Research America. All rights reserved.
*
* Licensed under the Apache License, Version 2.0 (the "License");
* you may not use this file except in compliance with the License.
* You may obtain a copy of the License at
*
*     http://www.apache.org/licenses/LICENSE-2.0
*
* Unless required by applicable law or agreed to in writing, software
* distributed under the License is distributed on an "AS IS" BASIS,
* WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
* See the License for the specific language governing permissions and
* limitations under the License.
*/
package com.samsung.sra.tracie.replay;

import java.util.concurrent.TimeUnit;

/**
 * Fixed reference instant T0 of a replay, on the monotonic {@link System#nanoTime} scale. Shared read-only by the
 * scheduler, job runners and listeners.
 */
public final class ReplayClock {
    private final long startNanos;

    private ReplayClock(long startNanos) {
        this.startNanos = startNanos;
    }

    public static ReplayClock start() {
        return new ReplayClock(System.nanoTime());
    }

    public long getStartNanos() {
        return startNanos;
    }

    public double elapsedSeconds() {
        return (System.nanoTime() - startNanos) / 1e9;
    }

    /** Block until {@code T0 + offsetSeconds}. Returns immediately if that instant has passed. */
    public void sleepUntil(double offsetSeconds) throws InterruptedException {
        sleepUntilNanos(startNanos + toNanos(offsetSeconds));
    }

    /** Block until the given {@link System#nanoTime} value. Returns immediately if it has passed. */
    public static void sleepUntilNanos(long deadline) throws InterruptedException {
        long wait = deadline - System.nanoTime();
        if (wait > 0) {
            TimeUnit.NANOSECONDS.sleep(wait);
        }
    }

    public static long toNanos(double seconds) {
        return Math.round(seconds * 1e9);
    }
}
