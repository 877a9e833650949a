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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@code <operation> <inputDir> <outputPrefix><jobID> [extra args]}. Input must already exist on the cluster; task
 * count is ignored. Output goes to a per-job directory so concurrent jobs never collide.
 */
public class PrestagedInputTemplate implements CommandTemplate {
    private final String operation, inputDir, outputPrefix;
    private final List<String> extraArgs;

    public PrestagedInputTemplate(String operation, String inputDir, String outputPrefix, String... extraArgs) {
        this.operation = operation;
        this.inputDir = inputDir;
        this.outputPrefix = outputPrefix;
        this.extraArgs = Arrays.asList(extraArgs.clone());
    }

    @Override
    public String getOperation() {
        return operation;
    }

    @Override
    public boolean usesTaskCount() {
        return false;
    }

    @Override
    public List<String> build(long jobID, int taskCount) {
        List<String> command = new ArrayList<>();
        command.add(operation);
        command.add(inputDir);
        command.add(outputPrefix + jobID);
        command.addAll(extraArgs);
        return command;
    }
}
