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

import com.samsung.sra.tracie.trace.ConfigurationException;
import org.junit.Test;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class EngineConfigurationTest {
    private static File writeToml(String contents) throws IOException {
        File file = File.createTempFile("test-engine", ".toml");
        file.deleteOnExit();
        try (BufferedWriter writer = Files.newBufferedWriter(file.toPath())) {
            writer.write(contents);
        }
        return file;
    }

    @Test
    public void load() throws Exception {
        EngineConfiguration conf = EngineConfiguration.load(writeToml(
                "[engine]\nexecutable = \"/usr/local/hadoop/bin/hadoop\"\njar = \"/srv/examples.jar\"\n"));
        assertEquals("/usr/local/hadoop/bin/hadoop", conf.getExecutable());
        assertEquals("/srv/examples.jar", conf.getExamplesJar());
        assertEquals("/tmp/other.jar", conf.withExamplesJar("/tmp/other.jar").getExamplesJar());
    }

    @Test
    public void missingKeysFallBackToDefaults() throws Exception {
        EngineConfiguration conf = EngineConfiguration.load(writeToml("[engine]\njar = \"/srv/examples.jar\"\n"));
        assertEquals(EngineConfiguration.DEFAULT_EXECUTABLE, conf.getExecutable());
        EngineConfiguration empty = EngineConfiguration.load(writeToml("# nothing here\n"));
        assertEquals(EngineConfiguration.DEFAULT_EXECUTABLE, empty.getExecutable());
        assertTrue(empty.getExamplesJar().endsWith(EngineConfiguration.EXAMPLES_JAR));
    }

    @Test(expected = ConfigurationException.class)
    public void missingFile() throws Exception {
        EngineConfiguration.load(new File("/nonexistent/engine.toml"));
    }

    @Test(expected = ConfigurationException.class)
    public void nonStringValue() throws Exception {
        EngineConfiguration.load(writeToml("[engine]\nexecutable = 12\n"));
    }
}
