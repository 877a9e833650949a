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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/** A complete trace, held in replay order */
public class Trace implements Iterable<TraceEntry> {
    private final List<TraceEntry> entries;

    public Trace(Collection<TraceEntry> entries) {
        List<TraceEntry> sorted = new ArrayList<>(entries);
        sorted.sort(TraceEntry.REPLAY_ORDER);
        Set<Long> seen = new HashSet<>();
        for (TraceEntry entry : sorted) {
            if (!seen.add(entry.getJob().getJobID())) {
                throw new IllegalArgumentException("duplicate job id " + entry.getJob().getJobID());
            }
        }
        this.entries = Collections.unmodifiableList(sorted);
    }

    public List<TraceEntry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public Iterator<TraceEntry> iterator() {
        return entries.iterator();
    }
}
