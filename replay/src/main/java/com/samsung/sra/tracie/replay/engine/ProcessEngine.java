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
package com.samsung.sra.tracie.replay.engine;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs operations as {@code <executable> [prefix args] <operation...>} subprocesses, e.g.
 * {@code hadoop jar hadoop-mapreduce-examples.jar pi 5 1000}. Stdout is discarded, stderr is captured for diagnostics.
 */
public class ProcessEngine implements ExternalEngine {
    private static final Logger logger = LoggerFactory.getLogger(ProcessEngine.class);

    private final String executable;
    private final List<String> prefixArgs;

    public ProcessEngine(String executable, List<String> prefixArgs) {
        this.executable = executable;
        this.prefixArgs = new ArrayList<>(prefixArgs);
    }

    /** {@code hadoop jar <examplesJar>} */
    public static ProcessEngine hadoop(EngineConfiguration conf) {
        List<String> prefix = new ArrayList<>();
        prefix.add("jar");
        prefix.add(conf.getExamplesJar());
        return new ProcessEngine(conf.getExecutable(), prefix);
    }

    @Override
    public List<String> commandLine(List<String> operation) {
        List<String> command = new ArrayList<>(prefixArgs.size() + operation.size() + 1);
        command.add(executable);
        command.addAll(prefixArgs);
        command.addAll(operation);
        return command;
    }

    @Override
    public void run(List<String> operation) throws EngineNotFoundException, JobExecutionException,
            InterruptedException {
        List<String> command = commandLine(operation);
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new EngineNotFoundException("could not launch " + executable + ", check PATH and engine configuration", e);
        }
        // drained on a helper thread so that waitFor stays interruptible
        StderrDrain drain = new StderrDrain(process.getErrorStream());
        Thread drainThread = new Thread(drain, "stderr-" + executable);
        drainThread.setDaemon(true);
        drainThread.start();
        int status;
        try {
            status = process.waitFor();
            drainThread.join();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
        if (drain.error != null) {
            throw new JobExecutionException("lost stderr of " + StringUtils.join(command, ' '), drain.error);
        }
        String stderr = drain.output;
        logger.debug("{} exited with status {}", executable, status);
        if (status != 0) {
            throw new JobExecutionException(
                    StringUtils.join(command, ' ') + " exited with status " + status, status, stderr);
        }
    }

    private static class StderrDrain implements Runnable {
        private final InputStream stream;
        private volatile String output = "";
        private volatile IOException error = null;

        private StderrDrain(InputStream stream) {
            this.stream = stream;
        }

        @Override
        public void run() {
            try (InputStream err = stream) {
                output = IOUtils.toString(err, StandardCharsets.UTF_8);
            } catch (IOException e) {
                error = e;
            }
        }
    }
}
