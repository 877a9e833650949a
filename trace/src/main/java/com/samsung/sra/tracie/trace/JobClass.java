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

/** Job classes and the tokens used for them in trace files */
public enum JobClass {
    BATCH("B"),
    INTERACTIVE("UF");

    private final String token;

    JobClass(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /** Returns null if the token is not recognized */
    public static JobClass fromToken(String token) {
        for (JobClass jobClass : values()) {
            if (jobClass.token.equals(token)) {
                return jobClass;
            }
        }
        return null;
    }
}
