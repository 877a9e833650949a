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

import java.util.Comparator;
import java.util.Objects;

/** A job joined with its task arrival offsets */
public class TraceEntry {
    /** Replay order: arrival time, then job id */
    public static final Comparator<TraceEntry> REPLAY_ORDER = Comparator
            .comparingDouble((TraceEntry e) -> e.getJob().getArrivalTime())
            .thenComparingLong(e -> e.getJob().getJobID());

    private final JobRecord job;
    private final TaskArrivals tasks;

    public TraceEntry(JobRecord job, TaskArrivals tasks) {
        if (job.getJobID() != tasks.getJobID()) {
            throw new IllegalArgumentException("job " + job.getJobID() + " paired with tasks of job " + tasks.getJobID());
        }
        if (job.getTaskCount() != tasks.size()) {
            throw new IllegalArgumentException(String.format("job %d declares %d tasks but has %d task arrivals",
                    job.getJobID(), job.getTaskCount(), tasks.size()));
        }
        this.job = job;
        this.tasks = tasks;
    }

    public JobRecord getJob() {
        return job;
    }

    public TaskArrivals getTasks() {
        return tasks;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceEntry)) return false;
        TraceEntry that = (TraceEntry) o;
        return job.equals(that.job) && tasks.equals(that.tasks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(job, tasks);
    }
}
