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

import com.samsung.sra.tracie.trace.JobClass;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Summary of a finished replay: outcome counts and per-class job turnaround times */
public class ReplayReport {
    private final List<JobOutcome> outcomes;
    private final double elapsedSeconds;
    private final Map<JobOutcome.Status, Integer> counts = new EnumMap<>(JobOutcome.Status.class);
    private final Map<JobClass, DescriptiveStatistics> turnaround = new EnumMap<>(JobClass.class);

    public ReplayReport(Collection<JobOutcome> outcomes, double elapsedSeconds) {
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
        this.elapsedSeconds = elapsedSeconds;
        for (JobOutcome.Status status : JobOutcome.Status.values()) {
            counts.put(status, 0);
        }
        for (JobClass jobClass : JobClass.values()) {
            turnaround.put(jobClass, new DescriptiveStatistics());
        }
        for (JobOutcome outcome : this.outcomes) {
            counts.merge(outcome.getStatus(), 1, Integer::sum);
            turnaround.get(outcome.getJob().getJobClass()).addValue(outcome.getElapsedSeconds());
        }
    }

    public List<JobOutcome> getOutcomes() {
        return outcomes;
    }

    public int getNumJobs() {
        return outcomes.size();
    }

    public int getCount(JobOutcome.Status status) {
        return counts.get(status);
    }

    public double getElapsedSeconds() {
        return elapsedSeconds;
    }

    public DescriptiveStatistics getTurnaround(JobClass jobClass) {
        return turnaround.get(jobClass).copy();
    }

    public List<String> summary() {
        List<String> lines = new ArrayList<>();
        lines.add(String.format("%d jobs in %.2fs: %s", outcomes.size(), elapsedSeconds, counts));
        for (JobClass jobClass : JobClass.values()) {
            DescriptiveStatistics stats = turnaround.get(jobClass);
            if (stats.getN() == 0) continue;
            lines.add(String.format("%s turnaround: n = %d, mean = %.3fs, p50 = %.3fs, p95 = %.3fs, max = %.3fs",
                    jobClass.getToken(), stats.getN(), stats.getMean(), stats.getPercentile(50),
                    stats.getPercentile(95), stats.getMax()));
        }
        return lines;
    }
}
