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

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicReference;

import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ProcessEngineTest {
    private static final ProcessEngine shell = new ProcessEngine("sh", Collections.singletonList("-c"));

    @Test
    public void hadoopCommandLine() {
        ProcessEngine hadoop = ProcessEngine.hadoop(new EngineConfiguration("hadoop", "/opt/examples.jar"));
        assertEquals(Arrays.asList("hadoop", "jar", "/opt/examples.jar", "pi", "5", "1000"),
                hadoop.commandLine(Arrays.asList("pi", "5", "1000")));
    }

    @Test
    public void successfulRun() throws Exception {
        shell.run(Collections.singletonList("echo discarded; exit 0"));
    }

    @Test
    public void nonZeroExitCarriesStderr() throws Exception {
        try {
            shell.run(Collections.singletonList("echo 'input path does not exist' >&2; exit 3"));
            fail("expected JobExecutionException");
        } catch (JobExecutionException e) {
            assertEquals(3, e.getExitStatus());
            assertThat(e.getDiagnostics(), containsString("input path does not exist"));
            assertThat(e.getMessage(), containsString("exited with status 3"));
        }
    }

    @Test(expected = EngineNotFoundException.class)
    public void missingExecutable() throws Exception {
        new ProcessEngine("/nonexistent/tracie-hadoop", Collections.emptyList())
                .run(Arrays.asList("pi", "1", "1000"));
    }

    @Test
    public void interruptKillsRunningEngine() throws Exception {
        AtomicReference<Exception> thrown = new AtomicReference<>();
        Thread runner = new Thread(() -> {
            try {
                shell.run(Collections.singletonList("exec sleep 30"));
            } catch (Exception e) {
                thrown.set(e);
            }
        }, "engine-runner");
        long start = System.nanoTime();
        runner.start();
        Thread.sleep(300);
        runner.interrupt();
        runner.join(5000);
        assertFalse(runner.isAlive());
        assertTrue(thrown.get() instanceof InterruptedException);
        assertTrue((System.nanoTime() - start) / 1e9 < 5);
    }
}
