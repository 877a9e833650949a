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

/** The eight distributions a workload profile must declare, named as in the profile's [parameters] table */
public enum ParameterKey {
    J_D_B(Quantity.JOB_DURATION, JobClass.BATCH),
    J_D_UF(Quantity.JOB_DURATION, JobClass.INTERACTIVE),
    T_D_B(Quantity.TASK_DURATION, JobClass.BATCH),
    T_D_UF(Quantity.TASK_DURATION, JobClass.INTERACTIVE),
    J_AT_B(Quantity.JOB_INTERARRIVAL, JobClass.BATCH),
    J_AT_UF(Quantity.JOB_INTERARRIVAL, JobClass.INTERACTIVE),
    T_AT_B(Quantity.TASK_INTERARRIVAL, JobClass.BATCH),
    T_AT_UF(Quantity.TASK_INTERARRIVAL, JobClass.INTERACTIVE);

    public enum Quantity {
        JOB_DURATION,
        TASK_DURATION,
        JOB_INTERARRIVAL,
        TASK_INTERARRIVAL
    }

    private final Quantity quantity;
    private final JobClass jobClass;

    ParameterKey(Quantity quantity, JobClass jobClass) {
        this.quantity = quantity;
        this.jobClass = jobClass;
    }

    public Quantity getQuantity() {
        return quantity;
    }

    public JobClass getJobClass() {
        return jobClass;
    }

    public static ParameterKey of(Quantity quantity, JobClass jobClass) {
        for (ParameterKey key : values()) {
            if (key.quantity == quantity && key.jobClass == jobClass) {
                return key;
            }
        }
        throw new AssertionError("no key for " + quantity + "/" + jobClass);
    }
}
