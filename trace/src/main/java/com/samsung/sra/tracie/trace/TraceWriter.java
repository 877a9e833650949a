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

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Streams trace entries to the jobs and tasks CSV files. Entries must be appended in replay order, which a
 * {@link TraceGenerator} produces by construction, so the jobs file always comes out sorted by arrival time.
 */
public class TraceWriter implements Closeable {
    public static final String JOBS_HEADER = "job_id,arrival_time_sec,job_type,app_type,task_count";
    public static final String TASKS_HEADER = "job_id,task_arrival_timestamps_within_job";

    private final BufferedWriter jobsWriter, tasksWriter;
    private TraceEntry last = null;
    private long numJobs = 0;

    public TraceWriter(Path jobsFile, Path tasksFile) throws IOException {
        jobsWriter = Files.newBufferedWriter(jobsFile);
        try {
            tasksWriter = Files.newBufferedWriter(tasksFile);
        } catch (IOException e) {
            jobsWriter.close();
            throw e;
        }
        jobsWriter.write(JOBS_HEADER);
        jobsWriter.newLine();
        tasksWriter.write(TASKS_HEADER);
        tasksWriter.newLine();
    }

    public void append(TraceEntry entry) throws IOException {
        if (last != null && TraceEntry.REPLAY_ORDER.compare(last, entry) > 0) {
            throw new IllegalStateException("job " + entry.getJob().getJobID() + " appended out of arrival order");
        }
        JobRecord job = entry.getJob();
        jobsWriter.write(job.getJobID() + "," + formatSeconds(job.getArrivalTime()) + ","
                + job.getJobClass().getToken() + "," + job.getApp() + "," + job.getTaskCount());
        jobsWriter.newLine();

        StringBuilder row = new StringBuilder().append(job.getJobID());
        TaskArrivals tasks = entry.getTasks();
        for (int t = 0; t < tasks.size(); ++t) {
            row.append(',').append(formatSeconds(tasks.getOffset(t)));
        }
        tasksWriter.write(row.toString());
        tasksWriter.newLine();

        last = entry;
        ++numJobs;
    }

    public void appendAll(Iterable<TraceEntry> entries) throws IOException {
        for (TraceEntry entry : entries) {
            append(entry);
        }
    }

    public long getNumJobs() {
        return numJobs;
    }

    @Override
    public void close() throws IOException {
        try {
            jobsWriter.close();
        } finally {
            tasksWriter.close();
        }
    }

    public static void write(Trace trace, Path jobsFile, Path tasksFile) throws IOException {
        try (TraceWriter writer = new TraceWriter(jobsFile, tasksFile)) {
            writer.appendAll(trace);
        }
    }

    /** Plain decimal notation (never scientific), at least one fractional digit */
    static String formatSeconds(double seconds) {
        String s = BigDecimal.valueOf(seconds).stripTrailingZeros().toPlainString();
        return s.indexOf('.') < 0 ? s + ".0" : s;
    }
}
