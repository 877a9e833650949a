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

/** An engine invocation failed. Carries the exit status (-1 if the process could not be observed) and its stderr. */
public class JobExecutionException extends Exception {
    private final int exitStatus;
    private final String diagnostics;

    public JobExecutionException(String msg, int exitStatus, String diagnostics) {
        super(msg);
        this.exitStatus = exitStatus;
        this.diagnostics = diagnostics;
    }

    public JobExecutionException(String msg, Throwable t) {
        super(msg, t);
        this.exitStatus = -1;
        this.diagnostics = t.getMessage();
    }

    public int getExitStatus() {
        return exitStatus;
    }

    public String getDiagnostics() {
        return diagnostics;
    }
}
