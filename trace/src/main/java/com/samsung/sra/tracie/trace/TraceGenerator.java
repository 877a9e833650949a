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

import com.samsung.sra.tracie.trace.ParameterKey.Quantity;
import org.apache.commons.math3.util.Precision;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.SplittableRandom;

/**
 * Lazily synthesizes exactly {@code jobCount} jobs from a workload profile. Each job gets a class, an absolute arrival
 * time (running sum of job inter-arrival draws scaled by {@code arrivalScale}), an application, a task count
 * ({@code max(1, floor(JD / TD * durationScale))}) and one arrival offset per task (running sum of task inter-arrival
 * draws). Times are rounded to microseconds.
 *
 * <p>Not restartable: construct a new generator (with the same seed to reproduce a trace).</p>
 */
public class TraceGenerator implements Iterator<TraceEntry> {
    /** Lower bound on task duration draws, keeps JD / TD finite */
    static final double MIN_TASK_DURATION = 1e-6;
    private static final int TIME_DECIMALS = 6;

    private final WorkloadProfile profile;
    private final int jobCount;
    private final double arrivalScale, durationScale;
    private final SplittableRandom random;

    private int nextJobID = 0;
    private double totalTime = 0;

    public TraceGenerator(WorkloadProfile profile, int jobCount, double arrivalScale, double durationScale) {
        this(profile, jobCount, arrivalScale, durationScale, new SplittableRandom());
    }

    public TraceGenerator(WorkloadProfile profile, int jobCount, double arrivalScale, double durationScale,
                          long seed) {
        this(profile, jobCount, arrivalScale, durationScale, new SplittableRandom(seed));
    }

    private TraceGenerator(WorkloadProfile profile, int jobCount, double arrivalScale, double durationScale,
                           SplittableRandom random) {
        if (jobCount < 0) throw new IllegalArgumentException("negative job count " + jobCount);
        if (!(arrivalScale >= 0) || Double.isInfinite(arrivalScale)) {
            throw new IllegalArgumentException("arrival scale must be a non-negative number, got " + arrivalScale);
        }
        if (!(durationScale >= 0) || Double.isInfinite(durationScale)) {
            throw new IllegalArgumentException("duration scale must be a non-negative number, got " + durationScale);
        }
        this.profile = profile;
        this.jobCount = jobCount;
        this.arrivalScale = arrivalScale;
        this.durationScale = durationScale;
        this.random = random;
    }

    public int getJobCount() {
        return jobCount;
    }

    @Override
    public boolean hasNext() {
        return nextJobID < jobCount;
    }

    @Override
    public TraceEntry next() {
        if (!hasNext()) throw new NoSuchElementException();
        long jobID = nextJobID++;

        // draw order is fixed, seeded runs depend on it
        JobClass jobClass = random.nextDouble() < profile.getBatchProbability() ? JobClass.BATCH : JobClass.INTERACTIVE;
        double jobDuration = profile.getSampler(Quantity.JOB_DURATION, jobClass).sample(random);
        double taskDuration = Math.max(
                profile.getSampler(Quantity.TASK_DURATION, jobClass).sample(random), MIN_TASK_DURATION);
        double jobInterarrival = profile.getSampler(Quantity.JOB_INTERARRIVAL, jobClass).sample(random);

        totalTime += jobInterarrival * arrivalScale;
        int taskCount = scaledTaskCount(jobDuration / taskDuration, durationScale);

        List<String> appPool = profile.getAppPool();
        String app = appPool.get(random.nextInt(appPool.size()));

        DistributionSampler taskInterarrivals = profile.getSampler(Quantity.TASK_INTERARRIVAL, jobClass);
        double[] offsets = new double[taskCount];
        double taskTime = 0;
        for (int t = 0; t < taskCount; ++t) {
            taskTime += taskInterarrivals.sample(random);
            offsets[t] = roundTime(taskTime);
        }

        JobRecord job = new JobRecord(jobID, roundTime(totalTime), jobClass, app, taskCount);
        return new TraceEntry(job, new TaskArrivals(jobID, offsets));
    }

    /** Generate all remaining jobs */
    public Trace toTrace() {
        List<TraceEntry> entries = new ArrayList<>(jobCount - nextJobID);
        while (hasNext()) {
            entries.add(next());
        }
        return new Trace(entries);
    }

    public static Trace generate(WorkloadProfile profile, int jobCount, double arrivalScale, double durationScale) {
        return new TraceGenerator(profile, jobCount, arrivalScale, durationScale).toTrace();
    }

    public static Trace generate(WorkloadProfile profile, int jobCount, double arrivalScale, double durationScale,
                                 long seed) {
        return new TraceGenerator(profile, jobCount, arrivalScale, durationScale, seed).toTrace();
    }

    /** {@code max(1, floor(rawCount * durationScale))} */
    static int scaledTaskCount(double rawCount, double durationScale) {
        double scaled = Math.floor(rawCount * durationScale);
        if (scaled >= Integer.MAX_VALUE - 8) { // JVM array size limit
            throw new IllegalStateException("task count " + scaled + " too large, reduce the duration scale");
        }
        return scaled >= 1 ? (int) scaled : 1;
    }

    static double roundTime(double seconds) {
        return Precision.round(seconds, TIME_DECIMALS);
    }
}
