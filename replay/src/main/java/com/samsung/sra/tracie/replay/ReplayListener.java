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

import com.samsung.sra.tracie.trace.JobRecord;

import java.util.List;

/**
 * Replay events. Called concurrently from the scheduler and from job/task threads, so implementations must be
 * thread-safe. All times are seconds since T0.
 */
public interface ReplayListener {
    default void replayStarted(int numJobs) {}

    default void jobDispatched(JobRecord job, DispatchMode mode, double at) {}

    default void taskStarted(JobRecord job, int task, double at) {}

    default void taskFinished(JobRecord job, int task, double at, double took) {}

    default void engineInvoked(JobRecord job, List<String> commandLine, double at) {}

    default void jobFinished(JobOutcome outcome, double at) {}

    default void allDispatched(int numJobs, double at) {}

    default void replayFinished(ReplayReport report, double at) {}
}
