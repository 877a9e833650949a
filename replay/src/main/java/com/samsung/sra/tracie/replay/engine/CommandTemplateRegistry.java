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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Static mapping from application identifier to command template. Applications without one are simulated. */
public class CommandTemplateRegistry {
    static final long PI_SAMPLES_PER_MAP = 1000;
    static final long TERAGEN_ROWS_PER_TASK = 1000;
    static final String GREP_REGEX = "Tracie";

    private final Map<String, CommandTemplate> templates;

    public CommandTemplateRegistry(Map<String, ? extends CommandTemplate> templates) {
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
    }

    /** Hadoop MapReduce examples: pi, wordcount, grep and terasort (run as teragen) */
    public static CommandTemplateRegistry defaults() {
        Map<String, CommandTemplate> templates = new LinkedHashMap<>();
        templates.put("pi", new MapCountTemplate("pi", PI_SAMPLES_PER_MAP));
        templates.put("wordcount",
                new PrestagedInputTemplate("wordcount", "/inputs/wordcount_data", "/outputs/wordcount_"));
        templates.put("grep",
                new PrestagedInputTemplate("grep", "/inputs/grep_data", "/outputs/grep_", GREP_REGEX));
        templates.put("terasort", new RowCountTemplate("teragen", TERAGEN_ROWS_PER_TASK, "/outputs/teragen_"));
        return new CommandTemplateRegistry(templates);
    }

    public static CommandTemplateRegistry empty() {
        return new CommandTemplateRegistry(Collections.emptyMap());
    }

    /** Returns null if the application has no template */
    public CommandTemplate get(String app) {
        return templates.get(app);
    }

    public boolean contains(String app) {
        return templates.containsKey(app);
    }

    public Set<String> getApps() {
        return templates.keySet();
    }
}
