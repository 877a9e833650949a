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

import com.samsung.sra.tracie.replay.engine.EngineNotFoundException;
import com.samsung.sra.tracie.replay.engine.ExternalEngine;
import com.samsung.sra.tracie.replay.engine.JobExecutionException;
import com.samsung.sra.tracie.trace.JobClass;
import com.samsung.sra.tracie.trace.JobRecord;
import com.samsung.sra.tracie.trace.TaskArrivals;
import com.samsung.sra.tracie.trace.TraceEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Trace entries, a scriptable engine and a recording listener shared by the replay tests */
class Jobs {
    private Jobs() {}

    static TraceEntry batch(long jobID, double arrival, String app, int taskCount) {
        double[] offsets = new double[taskCount];
        return new TraceEntry(new JobRecord(jobID, arrival, JobClass.BATCH, app, taskCount),
                new TaskArrivals(jobID, offsets));
    }

    static TraceEntry interactive(long jobID, double arrival, String app, double... offsets) {
        return new TraceEntry(new JobRecord(jobID, arrival, JobClass.INTERACTIVE, app, offsets.length),
                new TaskArrivals(jobID, offsets));
    }

    /** Records operations; fails them with the configured exception, if any */
    static class FakeEngine implements ExternalEngine {
        final List<List<String>> operations = new CopyOnWriteArrayList<>();
        volatile Exception failure = null;

        @Override
        public List<String> commandLine(List<String> operation) {
            List<String> command = new ArrayList<>();
            command.add("fake");
            command.addAll(operation);
            return command;
        }

        @Override
        public void run(List<String> operation) throws EngineNotFoundException, JobExecutionException,
                InterruptedException {
            operations.add(operation);
            Exception e = failure;
            if (e instanceof JobExecutionException) throw (JobExecutionException) e;
            if (e instanceof EngineNotFoundException) throw (EngineNotFoundException) e;
            if (e instanceof RuntimeException) throw (RuntimeException) e;
        }
    }

    static class RecordingListener implements ReplayListener {
        final List<Long> dispatchedIDs = new CopyOnWriteArrayList<>();
        final List<Double> dispatchedAt = new CopyOnWriteArrayList<>();
        final List<Integer> startedTasks = new CopyOnWriteArrayList<>();
        final List<Integer> finishedTasks = new CopyOnWriteArrayList<>();
        final List<List<String>> commandLines = new CopyOnWriteArrayList<>();
        final List<JobOutcome> finishedJobs = new CopyOnWriteArrayList<>();
        volatile int numFinishedAtReport = -1;

        @Override
        public void jobDispatched(JobRecord job, DispatchMode mode, double at) {
            dispatchedIDs.add(job.getJobID());
            dispatchedAt.add(at);
        }

        @Override
        public void taskStarted(JobRecord job, int task, double at) {
            startedTasks.add(task);
        }

        @Override
        public void taskFinished(JobRecord job, int task, double at, double took) {
            finishedTasks.add(task);
        }

        @Override
        public void engineInvoked(JobRecord job, List<String> commandLine, double at) {
            commandLines.add(commandLine);
        }

        @Override
        public void jobFinished(JobOutcome outcome, double at) {
            finishedJobs.add(outcome);
        }

        @Override
        public void replayFinished(ReplayReport report, double at) {
            numFinishedAtReport = finishedJobs.size();
        }

        List<Integer> sortedStartedTasks() {
            List<Integer> tasks = new ArrayList<>(startedTasks);
            Collections.sort(tasks);
            return tasks;
        }
    }
}
