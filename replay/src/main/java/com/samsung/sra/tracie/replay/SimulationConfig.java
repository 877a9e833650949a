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

/** Modeled execution times for simulated work, in seconds */
public class SimulationConfig {
    public static final double DEFAULT_INTERACTIVE_TASK_SECONDS = 0.05;
    public static final double DEFAULT_BATCH_TASK_SECONDS = 0.1;

    private final double interactiveTaskSeconds;
    private final double batchTaskSeconds;

    public SimulationConfig(double interactiveTaskSeconds, double batchTaskSeconds) {
        if (!(interactiveTaskSeconds >= 0) || Double.isInfinite(interactiveTaskSeconds)) {
            throw new IllegalArgumentException("invalid interactive task duration " + interactiveTaskSeconds);
        }
        if (!(batchTaskSeconds >= 0) || Double.isInfinite(batchTaskSeconds)) {
            throw new IllegalArgumentException("invalid batch task duration " + batchTaskSeconds);
        }
        this.interactiveTaskSeconds = interactiveTaskSeconds;
        this.batchTaskSeconds = batchTaskSeconds;
    }

    public static SimulationConfig defaults() {
        return new SimulationConfig(DEFAULT_INTERACTIVE_TASK_SECONDS, DEFAULT_BATCH_TASK_SECONDS);
    }

    /** Duration of one interactive task */
    public double getInteractiveTaskSeconds() {
        return interactiveTaskSeconds;
    }

    /** Duration of one batch task; a simulated batch job runs its tasks back to back */
    public double getBatchTaskSeconds() {
        return batchTaskSeconds;
    }

    @Override
    public String toString() {
        return "interactive task = " + interactiveTaskSeconds + "s, batch task = " + batchTaskSeconds + "s";
    }
}
