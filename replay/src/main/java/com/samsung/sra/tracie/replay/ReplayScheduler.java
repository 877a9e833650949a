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
import com.samsung.sra.tracie.trace.Trace;
import com.samsung.sra.tracie.trace.TraceEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Open-loop replay: each job is started on its own thread at {@code T0 + arrival time}, regardless of how earlier jobs
 * are doing. Late jobs are started immediately, without a catch-up burst of sleeps.
 */
public class ReplayScheduler {
    private static final Logger logger = LoggerFactory.getLogger(ReplayScheduler.class);

    private final JobRunner runner;
    private final ReplayListener listener;

    public ReplayScheduler(JobRunner runner, ReplayListener listener) {
        this.runner = runner;
        this.listener = listener;
    }

    /**
     * Dispatch every job of the trace in replay order, then wait for all of them to finish.
     *
     * @throws InterruptedException if interrupted while waiting. Jobs already started keep running and are not
     *                              waited for.
     */
    public ReplayReport replay(Trace trace) throws InterruptedException {
        ReplayClock clock = ReplayClock.start();
        listener.replayStarted(trace.size());
        List<Thread> jobThreads = new ArrayList<>(trace.size());
        List<JobOutcome> outcomes = Collections.synchronizedList(new ArrayList<>(trace.size()));
        for (TraceEntry entry : trace) {
            JobRecord job = entry.getJob();
            clock.sleepUntil(job.getArrivalTime());
            listener.jobDispatched(job, runner.dispatchMode(job), clock.elapsedSeconds());
            Thread jobThread = new Thread(new JobTask(entry, clock, outcomes), "job-" + job.getJobID());
            jobThread.start();
            jobThreads.add(jobThread);
        }
        listener.allDispatched(jobThreads.size(), clock.elapsedSeconds());
        for (Thread jobThread : jobThreads) {
            jobThread.join();
        }
        ReplayReport report;
        synchronized (outcomes) {
            report = new ReplayReport(outcomes, clock.elapsedSeconds());
        }
        listener.replayFinished(report, clock.elapsedSeconds());
        return report;
    }

    private class JobTask implements Runnable {
        private final TraceEntry entry;
        private final ReplayClock clock;
        private final List<JobOutcome> outcomes;

        private JobTask(TraceEntry entry, ReplayClock clock, List<JobOutcome> outcomes) {
            this.entry = entry;
            this.clock = clock;
            this.outcomes = outcomes;
        }

        @Override
        public void run() {
            JobRecord job = entry.getJob();
            long start = System.nanoTime();
            JobOutcome outcome;
            try {
                outcome = runner.run(entry, clock);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = new JobOutcome(job, runner.dispatchMode(job), JobOutcome.Status.INTERRUPTED,
                        (System.nanoTime() - start) / 1e9, "interrupted");
            } catch (RuntimeException e) {
                // contain to this job, siblings keep running
                logger.error("Job {} crashed", job.getJobID(), e);
                outcome = new JobOutcome(job, runner.dispatchMode(job), JobOutcome.Status.FAILED,
                        (System.nanoTime() - start) / 1e9, e.toString());
            }
            outcomes.add(outcome);
            listener.jobFinished(outcome, clock.elapsedSeconds());
        }
    }
}
