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

import java.util.Arrays;

/** Task arrival offsets of one job, in seconds relative to the job's own start. Non-decreasing. */
public class TaskArrivals {
    private final long jobID;
    private final double[] offsets;

    public TaskArrivals(long jobID, double[] offsets) {
        for (int i = 1; i < offsets.length; ++i) {
            if (offsets[i] < offsets[i - 1]) {
                throw new IllegalArgumentException("task offsets of job " + jobID + " are not sorted");
            }
        }
        this.jobID = jobID;
        this.offsets = offsets.clone();
    }

    public long getJobID() {
        return jobID;
    }

    public int size() {
        return offsets.length;
    }

    public double getOffset(int task) {
        return offsets[task];
    }

    public double[] toArray() {
        return offsets.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskArrivals)) return false;
        TaskArrivals that = (TaskArrivals) o;
        return jobID == that.jobID && Arrays.equals(offsets, that.offsets);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(jobID) + Arrays.hashCode(offsets);
    }
}
