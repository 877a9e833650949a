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

import java.util.Arrays;
import java.util.List;

/** {@code <operation> <taskCount * rowsPerTask> <outputPrefix><jobID>}: data generators such as teragen */
public class RowCountTemplate implements CommandTemplate {
    private final String operation, outputPrefix;
    private final long rowsPerTask;

    public RowCountTemplate(String operation, long rowsPerTask, String outputPrefix) {
        this.operation = operation;
        this.rowsPerTask = rowsPerTask;
        this.outputPrefix = outputPrefix;
    }

    @Override
    public String getOperation() {
        return operation;
    }

    @Override
    public boolean usesTaskCount() {
        return true;
    }

    @Override
    public List<String> build(long jobID, int taskCount) {
        return Arrays.asList(operation, Long.toString(taskCount * rowsPerTask), outputPrefix + jobID);
    }
}
