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

import com.samsung.sra.tracie.replay.engine.CommandTemplateRegistry;
import com.samsung.sra.tracie.replay.engine.EngineConfiguration;
import com.samsung.sra.tracie.replay.engine.ProcessEngine;
import com.samsung.sra.tracie.trace.ConfigurationException;
import com.samsung.sra.tracie.trace.Trace;
import com.samsung.sra.tracie.trace.TraceFileException;
import com.samsung.sra.tracie.trace.TraceReader;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicBoolean;

/** Replay a generated trace against the wall clock */
public class ExecuteTrace {
    private static final Logger logger = LoggerFactory.getLogger(ExecuteTrace.class);
    static final long ABORT_GRACE_MILLIS = 5000;

    static ArgumentParser buildParser() {
        ArgumentParser parser = ArgumentParsers.newFor("ExecuteTrace").build()
                .description("replay a job/task trace, simulating jobs or running them on Hadoop")
                .defaultHelp(true);
        parser.addArgument("-jobs-file").dest("jobs_file").setDefault("generated_jobs.csv")
                .help("input jobs table");
        parser.addArgument("-tasks-file").dest("tasks_file").setDefault("generated_tasks.csv")
                .help("input tasks table");
        parser.addArgument("-uf-task-time").dest("uf_task_time").type(Double.class)
                .setDefault(SimulationConfig.DEFAULT_INTERACTIVE_TASK_SECONDS)
                .help("simulated duration of one interactive (UF) task, in seconds");
        parser.addArgument("-batch-task-time").dest("batch_task_time").type(Double.class)
                .setDefault(SimulationConfig.DEFAULT_BATCH_TASK_SECONDS)
                .help("simulated duration of one batch task, in seconds");
        parser.addArgument("-engine-conf").dest("engine_conf").type(File.class)
                .help("engine config file (toml)");
        parser.addArgument("-hadoop-jar").dest("hadoop_jar")
                .help("hadoop mapreduce examples jar, overrides the engine config");
        parser.addArgument("-yes").action(Arguments.storeTrue())
                .help("start immediately instead of waiting for Enter");
        return parser;
    }

    /** Returns the process exit status */
    static int run(Namespace args, InputStream console) {
        Trace trace;
        SimulationConfig simulation;
        EngineConfiguration engineConf;
        try {
            logger.info("Loading workload files...");
            trace = TraceReader.read(Paths.get(args.getString("jobs_file")), Paths.get(args.getString("tasks_file")));
            simulation = new SimulationConfig(args.getDouble("uf_task_time"), args.getDouble("batch_task_time"));
            File engineConfFile = args.get("engine_conf");
            engineConf = engineConfFile != null ? EngineConfiguration.load(engineConfFile) : EngineConfiguration.defaults();
            String jar = args.getString("hadoop_jar");
            if (jar != null) {
                engineConf = engineConf.withExamplesJar(jar);
            }
        } catch (TraceFileException e) {
            logger.error("Could not load trace: {}", e.getMessage());
            return 1;
        } catch (ConfigurationException | IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }
        logger.info("Loaded {} jobs", trace.size());
        if (trace.isEmpty()) {
            logger.info("No jobs to execute");
            return 0;
        }

        logger.info("--- Tracie workload executor ---");
        logger.info("Simulation: {}", simulation);
        logger.info("Engine: {} jar {}", engineConf.getExecutable(), engineConf.getExamplesJar());
        if (!args.getBoolean("yes")) {
            awaitConfirmation(console);
        }

        JobRunner runner = new JobRunner(simulation, CommandTemplateRegistry.defaults(),
                ProcessEngine.hadoop(engineConf), new LoggingReplayListener());
        ReplayScheduler scheduler = new ReplayScheduler(runner, new LoggingReplayListener());
        try {
            scheduler.replay(trace);
        } catch (InterruptedException e) {
            logger.error("Interrupted, abandoning running jobs");
            Thread.currentThread().interrupt();
            return 1;
        }
        return 0;
    }

    /** Wait for Enter. Proceeds at once in a non-interactive environment (stdin at EOF). */
    private static void awaitConfirmation(InputStream console) {
        System.out.println("Press Enter to start...");
        try {
            new BufferedReader(new InputStreamReader(console, StandardCharsets.UTF_8)).readLine();
        } catch (IOException e) {
            logger.warn("Could not read confirmation, starting anyway", e);
        }
    }

    /**
     * Shutdown action for Ctrl-C during a replay: interrupts the replaying thread so that {@link #run} stops
     * dispatching and returns, waits for it, then halts with status 1. Jobs still running are abandoned.
     */
    static Runnable abortHook(Thread replayThread, AtomicBoolean aborting, Runnable halt) {
        return () -> {
            aborting.set(true);
            logger.error("User abort, stopping replay");
            replayThread.interrupt();
            try {
                replayThread.join(ABORT_GRACE_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            halt.run();
        };
    }

    private static void removeAbortHook(Thread abortHook) {
        try {
            Runtime.getRuntime().removeShutdownHook(abortHook);
        } catch (IllegalStateException e) {
            // shutdown began after run returned; the hook halts the JVM once this thread exits
            logger.debug("JVM already shutting down", e);
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
        AtomicBoolean aborting = new AtomicBoolean(false);
        Thread abortHook = new Thread(abortHook(Thread.currentThread(), aborting, () -> Runtime.getRuntime().halt(1)),
                "abort");
        Runtime.getRuntime().addShutdownHook(abortHook);
        int status;
        try {
            status = run(parsed, System.in);
        } finally {
            if (!aborting.get()) {
                removeAbortHook(abortHook);
            }
        }
        if (aborting.get()) {
            return; // the abort hook sets the exit status
        }
        System.exit(status);
    }
}
