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

import java.util.List;

/**
 * Builds the engine operation for one batch job: the operation keyword followed by its positional arguments, e.g.
 * {@code [pi, 5, 1000]}. The engine prepends its own executable and jar.
 */
public interface CommandTemplate {
    String getOperation();

    /** Whether the job's task count shapes the operation (otherwise the job runs on pre-staged input) */
    boolean usesTaskCount();

    List<String> build(long jobID, int taskCount);
}
