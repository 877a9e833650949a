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

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.moandjiezana.toml.Toml;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Workload profile backed by a Toml file
 *
 * <pre>
 * name = "Google 2011"
 * P_B = 0.3                               # probability that a job is batch
 * app_pool = ["pi", "wordcount", "nginx"]
 *
 * [parameters]
 * J_D_B = {type = "lognorm", params = [1.2, 0.0, 300.0]}
 * ...                                     # one entry per {@link ParameterKey}
 * </pre>
 *
 * or by the equivalent Json document ({@code "parameters": {"J_D_B": {"type": "lognorm", "params": [1.2, 0, 300]}}}).
 * Toml arrays must not mix integers and floats; Json arrays may. Read-only once loaded.
 */
public class WorkloadProfile {
    private static final Logger logger = LoggerFactory.getLogger(WorkloadProfile.class);
    private static final Gson gson = new Gson();
    private static final Type JSON_OBJECT = new TypeToken<Map<String, Object>>() {}.getType();

    private final String name;
    private final double batchProbability;
    private final List<String> appPool;
    private final Map<ParameterKey, DistributionSampler> samplers;

    public WorkloadProfile(String name, double batchProbability, List<String> appPool,
                           Map<ParameterKey, DistributionSampler> samplers) throws ConfigurationException {
        if (!(batchProbability >= 0 && batchProbability <= 1)) {
            throw new ConfigurationException("P_B must be in [0, 1], got " + batchProbability);
        }
        if (appPool == null || appPool.isEmpty()) {
            throw new ConfigurationException("app_pool must not be empty");
        }
        for (String app : appPool) {
            // app ids end up as a CSV column
            if (StringUtils.isBlank(app) || StringUtils.containsAny(app, ',', '\n', '\r')) {
                throw new ConfigurationException("invalid application identifier '" + app + "'");
            }
        }
        for (ParameterKey key : ParameterKey.values()) {
            if (!samplers.containsKey(key)) {
                throw new ConfigurationException("missing distribution for parameter " + key);
            }
        }
        this.name = name;
        this.batchProbability = batchProbability;
        this.appPool = Collections.unmodifiableList(new ArrayList<>(appPool));
        this.samplers = Collections.unmodifiableMap(new EnumMap<>(samplers));
    }

    /** Loads a {@code .json} profile with Gson, anything else as Toml */
    public static WorkloadProfile load(File file) throws ConfigurationException {
        if (file == null || !file.isFile()) {
            throw new ConfigurationException("invalid or non-existent profile " + file);
        }
        Map<String, Object> root;
        if (file.getName().toLowerCase(Locale.ROOT).endsWith(".json")) {
            root = readJson(file);
        } else {
            try {
                root = new Toml().read(file).toMap();
            } catch (RuntimeException e) { // toml4j reports syntax errors as IllegalStateException
                throw new ConfigurationException("could not parse profile " + file, e);
            }
        }
        return fromMap(root);
    }

    private static Map<String, Object> readJson(File file) throws ConfigurationException {
        Map<String, Object> root;
        try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            root = gson.fromJson(reader, JSON_OBJECT);
        } catch (JsonParseException e) {
            throw new ConfigurationException("could not parse profile " + file, e);
        } catch (IOException e) {
            throw new ConfigurationException("could not read profile " + file, e);
        }
        if (root == null) {
            throw new ConfigurationException("empty profile " + file);
        }
        return root;
    }

    public static WorkloadProfile fromToml(Toml toml) throws ConfigurationException {
        return fromMap(toml.toMap());
    }

    /**
     * Builds a profile from its parsed document tree: nested tables as maps, arrays as lists. Numbers may be any
     * {@link Number} subtype (Toml integers arrive as Long, Json numbers as Double).
     */
    public static WorkloadProfile fromMap(Map<String, Object> root) throws ConfigurationException {
        Object nameValue = root.get("name");
        String name = nameValue instanceof String ? (String) nameValue : "unnamed";

        Object pb = root.get("P_B");
        if (pb == null) {
            throw new ConfigurationException("missing required key P_B");
        } else if (!(pb instanceof Number)) {
            throw new ConfigurationException("P_B must be a number, got " + pb);
        }

        Object pool = root.get("app_pool");
        if (!(pool instanceof List)) {
            throw new ConfigurationException("missing or malformed app_pool");
        }
        List<String> appPool = new ArrayList<>();
        for (Object app : (List<?>) pool) {
            if (!(app instanceof String)) {
                throw new ConfigurationException("app_pool entries must be strings, got " + app);
            }
            appPool.add((String) app);
        }

        Object paramsValue = root.get("parameters");
        if (!(paramsValue instanceof Map)) {
            throw new ConfigurationException("missing required table [parameters]");
        }
        Map<?, ?> params = (Map<?, ?>) paramsValue;
        Map<ParameterKey, DistributionSampler> samplers = new EnumMap<>(ParameterKey.class);
        for (ParameterKey key : ParameterKey.values()) {
            Object descriptor = params.get(key.name());
            if (!(descriptor instanceof Map)) {
                throw new ConfigurationException("missing distribution for parameter " + key);
            }
            samplers.put(key, parseSampler(key, (Map<?, ?>) descriptor));
        }
        Set<String> unknown = new TreeSet<>();
        for (Object paramName : params.keySet()) {
            unknown.add(String.valueOf(paramName));
        }
        for (ParameterKey key : ParameterKey.values()) {
            unknown.remove(key.name());
        }
        if (!unknown.isEmpty()) {
            logger.warn("Ignoring unknown profile parameters {}", unknown);
        }

        return new WorkloadProfile(name, ((Number) pb).doubleValue(), appPool, samplers);
    }

    private static DistributionSampler parseSampler(ParameterKey key, Map<?, ?> descriptor)
            throws ConfigurationException {
        Object type = descriptor.get("type");
        Object params = descriptor.get("params");
        if (!(type instanceof String)) {
            throw new ConfigurationException(key + ": missing distribution type");
        }
        List<Number> numbers = new ArrayList<>();
        if (params != null) {
            if (!(params instanceof List)) {
                throw new ConfigurationException(key + ": params must be a list");
            }
            for (Object p : (List<?>) params) {
                if (!(p instanceof Number)) {
                    throw new ConfigurationException(key + ": non-numeric distribution parameter " + p);
                }
                numbers.add((Number) p);
            }
        }
        try {
            return new DistributionSampler((String) type, numbers);
        } catch (ConfigurationException e) {
            throw new ConfigurationException(key + ": " + e.getMessage(), e);
        }
    }

    public String getName() {
        return name;
    }

    public double getBatchProbability() {
        return batchProbability;
    }

    public List<String> getAppPool() {
        return appPool;
    }

    public DistributionSampler getSampler(ParameterKey key) {
        return samplers.get(key);
    }

    public DistributionSampler getSampler(ParameterKey.Quantity quantity, JobClass jobClass) {
        return samplers.get(ParameterKey.of(quantity, jobClass));
    }
}
