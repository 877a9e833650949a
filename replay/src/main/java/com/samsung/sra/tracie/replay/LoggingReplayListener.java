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
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Writes replay events to the log, each line prefixed with the time since T0 */
public class LoggingReplayListener implements ReplayListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingReplayListener.class);

    private static String ts(double at) {
        return String.format("%8.2fs |", at);
    }

    @Override
    public void replayStarted(int numJobs) {
        logger.info("Replay clock started, {} jobs to dispatch", numJobs);
    }

    @Override
    public void jobDispatched(JobRecord job, DispatchMode mode, double at) {
        switch (mode) {
            case SIMULATE_TASKS:
                logger.info("{} [service] Job {} ({}, app {}) started, expecting {} tasks", ts(at), job.getJobID(),
                        job.getJobClass().getToken(), job.getApp(), job.getTaskCount());
                break;
            case INVOKE_ENGINE:
                logger.info("{} [engine] Job {} (app {}) started", ts(at), job.getJobID(), job.getApp());
                break;
            case SIMULATE_BATCH:
                logger.info("{} [simulated] Job {} ({}, app {}) started, processing {} tasks", ts(at), job.getJobID(),
                        job.getJobClass().getToken(), job.getApp(), job.getTaskCount());
                break;
        }
    }

    @Override
    public void taskStarted(JobRecord job, int task, double at) {
        logger.debug("{}   Job {} -> task {} arrived", ts(at), job.getJobID(), task);
    }

    @Override
    public void taskFinished(JobRecord job, int task, double at, double took) {
        logger.debug("{}   Job {} <- task {} done ({}s)", ts(at), job.getJobID(), task, String.format("%.3f", took));
    }

    @Override
    public void engineInvoked(JobRecord job, List<String> commandLine, double at) {
        logger.info("{}   Job {} running: {}", ts(at), job.getJobID(), StringUtils.join(commandLine, ' '));
    }

    @Override
    public void jobFinished(JobOutcome outcome, double at) {
        JobRecord job = outcome.getJob();
        String took = String.format("%.2f", outcome.getElapsedSeconds());
        switch (outcome.getStatus()) {
            case SUCCEEDED:
                logger.info("{} Job {} ({}, app {}) finished in {}s", ts(at), job.getJobID(),
                        job.getJobClass().getToken(), job.getApp(), took);
                break;
            case FAILED:
                logger.warn("{} Job {} (app {}) FAILED after {}s: {}", ts(at), job.getJobID(), job.getApp(), took,
                        StringUtils.trimToEmpty(outcome.getDiagnostics()));
                break;
            case ENGINE_NOT_FOUND:
                logger.error("{} Job {} (app {}) not run, engine configuration error: {}", ts(at), job.getJobID(),
                        job.getApp(), outcome.getDiagnostics());
                break;
            case INTERRUPTED:
                logger.warn("{} Job {} interrupted after {}s", ts(at), job.getJobID(), took);
                break;
        }
    }

    @Override
    public void allDispatched(int numJobs, double at) {
        logger.info("{} All {} jobs dispatched, waiting for completion", ts(at), numJobs);
    }

    @Override
    public void replayFinished(ReplayReport report, double at) {
        logger.info("{} Workload finished", ts(at));
        for (String line : report.summary()) {
            logger.info(line);
        }
    }
}
