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

import com.samsung.sra.tracie.replay.engine.CommandTemplate;
import com.samsung.sra.tracie.replay.engine.CommandTemplateRegistry;
import com.samsung.sra.tracie.replay.engine.EngineNotFoundException;
import com.samsung.sra.tracie.replay.engine.ExternalEngine;
import com.samsung.sra.tracie.replay.engine.JobExecutionException;
import com.samsung.sra.tracie.trace.JobClass;
import com.samsung.sra.tracie.trace.JobRecord;
import com.samsung.sra.tracie.trace.TaskArrivals;
import com.samsung.sra.tracie.trace.TraceEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Executes one job on the calling thread. Interactive jobs fan out one thread per task, each starting at its arrival
 * offset and sleeping for the interactive task duration. Batch jobs whose application has a command template run on
 * the external engine; other batch jobs sleep for {@code taskCount * batch task duration}.
 *
 * <p>Engine failures are returned as outcomes, never thrown. Only interrupts propagate.</p>
 */
public class JobRunner {
    private static final Logger logger = LoggerFactory.getLogger(JobRunner.class);

    private final SimulationConfig simulation;
    private final CommandTemplateRegistry templates;
    private final ExternalEngine engine;
    private final ReplayListener listener;

    public JobRunner(SimulationConfig simulation, CommandTemplateRegistry templates, ExternalEngine engine,
                     ReplayListener listener) {
        this.simulation = simulation;
        this.templates = templates;
        this.engine = engine;
        this.listener = listener;
    }

    /** Depends only on job class, application and the template registry */
    public DispatchMode dispatchMode(JobRecord job) {
        if (job.getJobClass() == JobClass.INTERACTIVE) {
            return DispatchMode.SIMULATE_TASKS;
        }
        return templates.contains(job.getApp()) ? DispatchMode.INVOKE_ENGINE : DispatchMode.SIMULATE_BATCH;
    }

    public JobOutcome run(TraceEntry entry, ReplayClock clock) throws InterruptedException {
        JobRecord job = entry.getJob();
        long jobStart = System.nanoTime();
        switch (dispatchMode(job)) {
            case SIMULATE_TASKS:
                runTasks(job, entry.getTasks(), jobStart, clock);
                return JobOutcome.succeeded(job, DispatchMode.SIMULATE_TASKS, secondsSince(jobStart));
            case INVOKE_ENGINE:
                return invokeEngine(job, jobStart, clock);
            case SIMULATE_BATCH:
                Thread.sleep(toMillis(job.getTaskCount() * simulation.getBatchTaskSeconds()));
                return JobOutcome.succeeded(job, DispatchMode.SIMULATE_BATCH, secondsSince(jobStart));
            default:
                throw new AssertionError();
        }
    }

    private void runTasks(JobRecord job, TaskArrivals tasks, long jobStart, ReplayClock clock)
            throws InterruptedException {
        Thread[] taskThreads = new Thread[tasks.size()];
        for (int t = 0; t < taskThreads.length; ++t) {
            long arrival = jobStart + ReplayClock.toNanos(tasks.getOffset(t));
            final int task = t;
            taskThreads[t] = new Thread(() -> runTask(job, task, arrival, clock),
                    "job-" + job.getJobID() + "-task-" + t);
            taskThreads[t].start();
        }
        try {
            for (Thread taskThread : taskThreads) {
                taskThread.join();
            }
        } catch (InterruptedException e) {
            for (Thread taskThread : taskThreads) {
                taskThread.interrupt();
            }
            throw e;
        }
    }

    private void runTask(JobRecord job, int task, long arrival, ReplayClock clock) {
        try {
            ReplayClock.sleepUntilNanos(arrival);
            long taskStart = System.nanoTime();
            listener.taskStarted(job, task, clock.elapsedSeconds());
            Thread.sleep(toMillis(simulation.getInteractiveTaskSeconds()));
            listener.taskFinished(job, task, clock.elapsedSeconds(), secondsSince(taskStart));
        } catch (InterruptedException e) {
            logger.debug("Job {} task {} interrupted", job.getJobID(), task);
            Thread.currentThread().interrupt();
        }
    }

    private JobOutcome invokeEngine(JobRecord job, long jobStart, ReplayClock clock) throws InterruptedException {
        CommandTemplate template = templates.get(job.getApp());
        List<String> operation = template.build(job.getJobID(), job.getTaskCount());
        listener.engineInvoked(job, engine.commandLine(operation), clock.elapsedSeconds());
        try {
            engine.run(operation);
            return JobOutcome.succeeded(job, DispatchMode.INVOKE_ENGINE, secondsSince(jobStart));
        } catch (JobExecutionException e) {
            return new JobOutcome(job, DispatchMode.INVOKE_ENGINE, JobOutcome.Status.FAILED, secondsSince(jobStart),
                    e.getDiagnostics());
        } catch (EngineNotFoundException e) {
            return new JobOutcome(job, DispatchMode.INVOKE_ENGINE, JobOutcome.Status.ENGINE_NOT_FOUND,
                    secondsSince(jobStart), e.getMessage());
        }
    }

    private static double secondsSince(long nanoTime) {
        return (System.nanoTime() - nanoTime) / 1e9;
    }

    private static long toMillis(double seconds) {
        return Math.round(seconds * 1000);
    }
}
