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

/** How one replayed job ended */
public class JobOutcome {
    public enum Status {
        SUCCEEDED,
        /** engine exited with non-zero status */
        FAILED,
        /** engine could not be launched */
        ENGINE_NOT_FOUND,
        INTERRUPTED
    }

    private final JobRecord job;
    private final DispatchMode mode;
    private final Status status;
    private final double elapsedSeconds;
    private final String diagnostics;

    public JobOutcome(JobRecord job, DispatchMode mode, Status status, double elapsedSeconds, String diagnostics) {
        this.job = job;
        this.mode = mode;
        this.status = status;
        this.elapsedSeconds = elapsedSeconds;
        this.diagnostics = diagnostics;
    }

    public static JobOutcome succeeded(JobRecord job, DispatchMode mode, double elapsedSeconds) {
        return new JobOutcome(job, mode, Status.SUCCEEDED, elapsedSeconds, null);
    }

    public JobRecord getJob() {
        return job;
    }

    public DispatchMode getMode() {
        return mode;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    /** Wall time from job start to completion */
    public double getElapsedSeconds() {
        return elapsedSeconds;
    }

    /** Captured engine stderr or error message, null on success */
    public String getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return String.format("job %d %s after %.2fs", job.getJobID(), status, elapsedSeconds);
    }
}
