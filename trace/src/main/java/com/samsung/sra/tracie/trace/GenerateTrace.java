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

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/** Sample a workload profile and write the resulting jobs and tasks tables */
public class GenerateTrace {
    private static final Logger logger = LoggerFactory.getLogger(GenerateTrace.class);

    static ArgumentParser buildParser() {
        ArgumentParser parser = ArgumentParsers.newFor("GenerateTrace").build()
                .description("synthesize a job/task trace from a workload profile")
                .defaultHelp(true);
        parser.addArgument("-p", "-profile").dest("profile").required(true).type(File.class)
                .help("workload profile (toml)");
        parser.addArgument("-n", "-num-jobs").dest("num_jobs").required(true).type(Integer.class)
                .help("number of jobs to generate");
        parser.addArgument("-wSat", "-w-sat").dest("w_sat").type(Double.class).setDefault(1.0)
                .help("job arrival time scaling factor");
        parser.addArgument("-jSD", "-j-sd").dest("j_sd").type(Double.class).setDefault(1.0)
                .help("job duration (task count) scaling factor");
        parser.addArgument("-seed").type(Long.class)
                .help("RNG seed, for reproducible traces");
        parser.addArgument("-jobs-file").dest("jobs_file").setDefault("generated_jobs.csv")
                .help("output jobs table");
        parser.addArgument("-tasks-file").dest("tasks_file").setDefault("generated_tasks.csv")
                .help("output tasks table");
        return parser;
    }

    /** Returns the process exit status */
    static int run(Namespace args) {
        WorkloadProfile profile;
        try {
            profile = WorkloadProfile.load(args.get("profile"));
        } catch (ConfigurationException e) {
            logger.error("Invalid profile: {}", e.getMessage());
            return 1;
        }
        logger.info("Loaded profile {}", profile.getName());

        int numJobs = args.getInt("num_jobs");
        double wSat = args.getDouble("w_sat"), jSD = args.getDouble("j_sd");
        Long seed = args.get("seed");
        TraceGenerator generator;
        try {
            generator = seed != null
                    ? new TraceGenerator(profile, numJobs, wSat, jSD, seed)
                    : new TraceGenerator(profile, numJobs, wSat, jSD);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid arguments: {}", e.getMessage());
            return 1;
        }

        Path jobsFile = Paths.get(args.getString("jobs_file")), tasksFile = Paths.get(args.getString("tasks_file"));
        logger.info("Generating {} jobs (wSat = {}, jSD = {})", numJobs, wSat, jSD);
        try (TraceWriter writer = new TraceWriter(jobsFile, tasksFile)) {
            while (generator.hasNext()) {
                writer.append(generator.next());
            }
        } catch (IOException e) {
            logger.error("Failed to write trace", e);
            deletePartialTrace(jobsFile, tasksFile);
            return 1;
        } catch (IllegalStateException e) {
            logger.error("Could not generate trace: {}", e.getMessage());
            deletePartialTrace(jobsFile, tasksFile);
            return 1;
        }
        logger.info("Generated {} jobs. Jobs written to {}, tasks written to {}", numJobs, jobsFile, tasksFile);
        return 0;
    }

    private static void deletePartialTrace(Path... files) {
        for (Path file : files) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                logger.warn("Could not delete partial trace file {}", file, e);
            }
        }
    }

    public static void main(String[] args) {
        ArgumentParser parser = buildParser();
        Namespace parsed;
        try {
            parsed = parser.parseArgs(args);
        } catch (ArgumentParserException e) {
            parser.handleError(e);
            System.exit(2);
            return;
        }
        System.exit(run(parsed));
    }
}
