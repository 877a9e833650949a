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
package com.samsung.sra.tracie.trace;

import java.util.Objects;

/** One row of the jobs table. Arrival time is in seconds from the start of the trace. */
public class JobRecord {
    private final long jobID;
    private final double arrivalTime;
    private final JobClass jobClass;
    private final String app;
    private final int taskCount;

    public JobRecord(long jobID, double arrivalTime, JobClass jobClass, String app, int taskCount) {
        if (taskCount < 1) throw new IllegalArgumentException("job " + jobID + " has no tasks");
        this.jobID = jobID;
        this.arrivalTime = arrivalTime;
        this.jobClass = Objects.requireNonNull(jobClass);
        this.app = Objects.requireNonNull(app);
        this.taskCount = taskCount;
    }

    public long getJobID() {
        return jobID;
    }

    public double getArrivalTime() {
        return arrivalTime;
    }

    public JobClass getJobClass() {
        return jobClass;
    }

    public String getApp() {
        return app;
    }

    public int getTaskCount() {
        return taskCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobRecord)) return false;
        JobRecord that = (JobRecord) o;
        return jobID == that.jobID
                && Double.compare(arrivalTime, that.arrivalTime) == 0
                && jobClass == that.jobClass
                && app.equals(that.app)
                && taskCount == that.taskCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobID, arrivalTime, jobClass, app, taskCount);
    }

    @Override
    public String toString() {
        return String.format("Job %d (%s, %s, %d tasks @ %.6fs)", jobID, jobClass.getToken(), app, taskCount,
                arrivalTime);
    }
}
