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

/** An external batch execution engine. Invocations block the calling thread until the engine exits. */
public interface ExternalEngine {
    /** Full command line that {@link #run} would execute for this operation */
    List<String> commandLine(List<String> operation);

    void run(List<String> operation) throws EngineNotFoundException, JobExecutionException, InterruptedException;
}
