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
import com.samsung.sra.tracie.replay.engine.EngineNotFoundException;
import com.samsung.sra.tracie.replay.engine.JobExecutionException;
import com.samsung.sra.tracie.trace.TraceEntry;
import org.junit.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class JobRunnerTest {
    private final Jobs.FakeEngine engine = new Jobs.FakeEngine();
    private final Jobs.RecordingListener listener = new Jobs.RecordingListener();

    private JobRunner runner(double interactiveTask, double batchTask) {
        return new JobRunner(new SimulationConfig(interactiveTask, batchTask), CommandTemplateRegistry.defaults(),
                engine, listener);
    }

    @Test
    public void unmappedBatchJobIsSimulated() throws Exception {
        TraceEntry entry = Jobs.batch(7, 0, "redis", 10);
        JobOutcome outcome = runner(0.05, 0.1).run(entry, ReplayClock.start());
        assertEquals(JobOutcome.Status.SUCCEEDED, outcome.getStatus());
        assertEquals(DispatchMode.SIMULATE_BATCH, outcome.getMode());
        assertTrue("took " + outcome.getElapsedSeconds(), outcome.getElapsedSeconds() >= 0.99);
        assertTrue("took " + outcome.getElapsedSeconds(), outcome.getElapsedSeconds() < 3);
        assertTrue(engine.operations.isEmpty());
        assertNull(outcome.getDiagnostics());
    }

    @Test
    public void mappedBatchJobInvokesEngine() throws Exception {
        JobOutcome outcome = runner(0.05, 0.1).run(Jobs.batch(3, 0, "pi", 5), ReplayClock.start());
        assertEquals(JobOutcome.Status.SUCCEEDED, outcome.getStatus());
        assertEquals(DispatchMode.INVOKE_ENGINE, outcome.getMode());
        assertEquals(Collections.singletonList(Arrays.asList("pi", "5", "1000")), engine.operations);
        assertEquals(Collections.singletonList(Arrays.asList("fake", "pi", "5", "1000")), listener.commandLines);
    }

    @Test
    public void engineFailureBecomesOutcome() throws Exception {
        engine.failure = new JobExecutionException("pi exited with status 1", 1, "java.io.FileNotFoundException");
        JobOutcome outcome = runner(0.05, 0.1).run(Jobs.batch(4, 0, "pi", 2), ReplayClock.start());
        assertEquals(JobOutcome.Status.FAILED, outcome.getStatus());
        assertEquals("java.io.FileNotFoundException", outcome.getDiagnostics());
    }

    @Test
    public void missingEngineBecomesOutcome() throws Exception {
        engine.failure = new EngineNotFoundException("could not launch fake", new IOException("No such file"));
        JobOutcome outcome = runner(0.05, 0.1).run(Jobs.batch(5, 0, "wordcount", 2), ReplayClock.start());
        assertEquals(JobOutcome.Status.ENGINE_NOT_FOUND, outcome.getStatus());
        assertEquals(Collections.singletonList(Arrays.asList("wordcount", "/inputs/wordcount_data",
                "/outputs/wordcount_5")), engine.operations);
    }

    @Test
    public void interactiveJobRunsEveryTask() throws Exception {
        TraceEntry entry = Jobs.interactive(1, 0, "pi", 0, 0.1, 0.2);
        JobOutcome outcome = runner(0.05, 0.1).run(entry, ReplayClock.start());
        assertEquals(JobOutcome.Status.SUCCEEDED, outcome.getStatus());
        assertEquals(DispatchMode.SIMULATE_TASKS, outcome.getMode());
        assertEquals(Arrays.asList(0, 1, 2), listener.sortedStartedTasks());
        assertEquals(3, listener.finishedTasks.size());
        // last task starts at +0.2s and runs 0.05s
        assertTrue("took " + outcome.getElapsedSeconds(), outcome.getElapsedSeconds() >= 0.24);
        // interactive jobs never reach the engine, even for mapped applications
        assertTrue(engine.operations.isEmpty());
    }

    @Test
    public void dispatchDependsOnClassAndApplication() {
        JobRunner runner = runner(0.05, 0.1);
        assertEquals(DispatchMode.INVOKE_ENGINE, runner.dispatchMode(Jobs.batch(0, 0, "terasort", 1).getJob()));
        assertEquals(DispatchMode.SIMULATE_BATCH, runner.dispatchMode(Jobs.batch(0, 0, "nginx", 1).getJob()));
        assertEquals(DispatchMode.SIMULATE_TASKS, runner.dispatchMode(Jobs.interactive(0, 0, "grep", 0).getJob()));
        JobRunner noTemplates = new JobRunner(SimulationConfig.defaults(), CommandTemplateRegistry.empty(), engine,
                listener);
        assertEquals(DispatchMode.SIMULATE_BATCH, noTemplates.dispatchMode(Jobs.batch(0, 0, "pi", 1).getJob()));
    }

    @Test(expected = InterruptedException.class)
    public void interruptPropagates() throws Exception {
        Thread.currentThread().interrupt();
        runner(0.05, 10).run(Jobs.batch(0, 0, "redis", 10), ReplayClock.start());
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeTaskTimeIsRejected() {
        new SimulationConfig(-0.1, 0.1);
    }
}
