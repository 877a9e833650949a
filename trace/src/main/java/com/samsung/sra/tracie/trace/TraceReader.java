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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a trace from the jobs and tasks CSV files written by {@link TraceWriter}. Jobs columns are located by header
 * name; the tasks file is positional (job id, then offsets). Every job must have exactly one tasks row whose width
 * matches its task count.
 */
public class TraceReader {
    private static final String[] JOB_COLUMNS = {"job_id", "arrival_time_sec", "job_type", "app_type", "task_count"};

    private TraceReader() {}

    public static Trace read(Path jobsFile, Path tasksFile) throws TraceFileException {
        List<JobRecord> jobs = readJobs(jobsFile);
        Map<Long, TaskArrivals> tasks = readTasks(tasksFile);
        List<TraceEntry> entries = new ArrayList<>(jobs.size());
        for (JobRecord job : jobs) {
            TaskArrivals arrivals = tasks.get(job.getJobID());
            if (arrivals == null) {
                throw new TraceFileException(tasksFile + ": no task arrivals for job " + job.getJobID());
            }
            if (arrivals.size() != job.getTaskCount()) {
                throw new TraceFileException(String.format("%s: job %d declares %d tasks but %s lists %d",
                        jobsFile, job.getJobID(), job.getTaskCount(), tasksFile, arrivals.size()));
            }
            entries.add(new TraceEntry(job, arrivals));
        }
        return new Trace(entries);
    }

    static List<JobRecord> readJobs(Path jobsFile) throws TraceFileException {
        List<JobRecord> jobs = new ArrayList<>();
        Map<Long, JobRecord> seen = new HashMap<>();
        try (BufferedReader reader = open(jobsFile)) {
            String header = reader.readLine();
            if (header == null) {
                throw new TraceFileException(jobsFile + ": empty jobs file");
            }
            int[] index = locateColumns(jobsFile, header);
            String line;
            for (int lineNum = 2; (line = reader.readLine()) != null; ++lineNum) {
                if (line.trim().isEmpty()) continue;
                String[] vals = line.split(",", -1);
                JobRecord job = parseJob(jobsFile, lineNum, vals, index);
                if (seen.put(job.getJobID(), job) != null) {
                    throw new TraceFileException(jobsFile + ":" + lineNum + ": duplicate job id " + job.getJobID());
                }
                jobs.add(job);
            }
        } catch (IOException e) {
            throw new TraceFileException("could not read jobs file " + jobsFile, e);
        }
        return jobs;
    }

    static Map<Long, TaskArrivals> readTasks(Path tasksFile) throws TraceFileException {
        Map<Long, TaskArrivals> tasks = new LinkedHashMap<>();
        try (BufferedReader reader = open(tasksFile)) {
            if (reader.readLine() == null) {
                throw new TraceFileException(tasksFile + ": empty tasks file");
            }
            String line;
            for (int lineNum = 2; (line = reader.readLine()) != null; ++lineNum) {
                if (line.trim().isEmpty()) continue;
                String[] vals = line.split(",", -1);
                long jobID;
                double[] offsets = new double[vals.length - 1];
                try {
                    jobID = Long.parseLong(vals[0].trim());
                    for (int i = 1; i < vals.length; ++i) {
                        offsets[i - 1] = Double.parseDouble(vals[i].trim());
                    }
                } catch (NumberFormatException e) {
                    throw new TraceFileException(tasksFile + ":" + lineNum + ": malformed row '" + line + "'", e);
                }
                TaskArrivals arrivals;
                try {
                    arrivals = new TaskArrivals(jobID, offsets);
                } catch (IllegalArgumentException e) {
                    throw new TraceFileException(tasksFile + ":" + lineNum + ": " + e.getMessage(), e);
                }
                if (tasks.put(jobID, arrivals) != null) {
                    throw new TraceFileException(tasksFile + ":" + lineNum + ": duplicate job id " + jobID);
                }
            }
        } catch (IOException e) {
            throw new TraceFileException("could not read tasks file " + tasksFile, e);
        }
        return tasks;
    }

    private static BufferedReader open(Path file) throws TraceFileException, IOException {
        try {
            return Files.newBufferedReader(file);
        } catch (NoSuchFileException e) {
            throw new TraceFileException("trace file not found: " + file, e);
        }
    }

    private static int[] locateColumns(Path jobsFile, String header) throws TraceFileException {
        List<String> names = new ArrayList<>();
        for (String name : header.split(",", -1)) {
            names.add(name.trim());
        }
        int[] index = new int[JOB_COLUMNS.length];
        for (int c = 0; c < JOB_COLUMNS.length; ++c) {
            index[c] = names.indexOf(JOB_COLUMNS[c]);
            if (index[c] < 0) {
                throw new TraceFileException(jobsFile + ": missing column " + JOB_COLUMNS[c] + " in header " + names);
            }
        }
        return index;
    }

    private static JobRecord parseJob(Path jobsFile, int lineNum, String[] vals, int[] index)
            throws TraceFileException {
        String where = jobsFile + ":" + lineNum;
        for (int i : index) {
            if (i >= vals.length) {
                throw new TraceFileException(where + ": incomplete row " + Arrays.toString(vals));
            }
        }
        try {
            long jobID = Long.parseLong(vals[index[0]].trim());
            double arrival = Double.parseDouble(vals[index[1]].trim());
            JobClass jobClass = JobClass.fromToken(vals[index[2]].trim());
            if (jobClass == null) {
                throw new TraceFileException(where + ": unknown job type '" + vals[index[2]] + "'");
            }
            String app = vals[index[3]].trim();
            int taskCount = Integer.parseInt(vals[index[4]].trim());
            if (taskCount < 1) {
                throw new TraceFileException(where + ": task count must be positive, got " + taskCount);
            }
            if (!Double.isFinite(arrival) || arrival < 0) {
                throw new TraceFileException(where + ": invalid arrival time " + arrival);
            }
            return new JobRecord(jobID, arrival, jobClass, app, taskCount);
        } catch (NumberFormatException e) {
            throw new TraceFileException(where + ": malformed row " + Arrays.toString(vals), e);
        }
    }
}
