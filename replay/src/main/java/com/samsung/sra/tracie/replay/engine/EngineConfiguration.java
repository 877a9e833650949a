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

import com.moandjiezana.toml.Toml;
import com.samsung.sra.tracie.trace.ConfigurationException;

import java.io.File;
import java.nio.file.Paths;

/**
 * Engine settings backed by an optional Toml file. Every key has a default:
 *
 * <pre>
 * [engine]
 * executable = "hadoop"
 * jar = "/opt/hadoop/share/hadoop/mapreduce/hadoop-mapreduce-examples-3.4.1.jar"
 * </pre>
 */
public class EngineConfiguration {
    public static final String DEFAULT_EXECUTABLE = "hadoop";
    static final String EXAMPLES_JAR = "share/hadoop/mapreduce/hadoop-mapreduce-examples-3.4.1.jar";

    private final String executable;
    private final String examplesJar;

    public EngineConfiguration(String executable, String examplesJar) {
        this.executable = executable;
        this.examplesJar = examplesJar;
    }

    /** Hadoop on the PATH, examples jar under $HADOOP_HOME if it is set */
    public static EngineConfiguration defaults() {
        String hadoopHome = System.getenv("HADOOP_HOME");
        String jar = hadoopHome != null ? Paths.get(hadoopHome, EXAMPLES_JAR).toString() : EXAMPLES_JAR;
        return new EngineConfiguration(DEFAULT_EXECUTABLE, jar);
    }

    public static EngineConfiguration load(File file) throws ConfigurationException {
        if (file == null || !file.isFile()) {
            throw new ConfigurationException("invalid or non-existent engine config file " + file);
        }
        Toml toml;
        try {
            toml = new Toml().read(file);
        } catch (RuntimeException e) {
            throw new ConfigurationException("could not parse engine config " + file, e);
        }
        EngineConfiguration defaults = defaults();
        Toml conf = toml.getTable("engine");
        if (conf == null) {
            return defaults;
        }
        try {
            return new EngineConfiguration(
                    conf.getString("executable", defaults.executable),
                    conf.getString("jar", defaults.examplesJar));
        } catch (ClassCastException e) {
            throw new ConfigurationException("engine.executable and engine.jar must be strings in " + file, e);
        }
    }

    public EngineConfiguration withExamplesJar(String jar) {
        return new EngineConfiguration(executable, jar);
    }

    public String getExecutable() {
        return executable;
    }

    public String getExamplesJar() {
        return examplesJar;
    }
}
