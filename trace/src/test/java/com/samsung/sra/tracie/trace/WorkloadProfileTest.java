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

import org.junit.Test;

import java.io.File;
import java.util.Arrays;

import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class WorkloadProfileTest {
    @Test
    public void load() throws Exception {
        WorkloadProfile profile = WorkloadProfile.load(Profiles.writeToml(Profiles.MIXED));
        assertEquals("mixed", profile.getName());
        assertEquals(0.4, profile.getBatchProbability(), 0);
        assertEquals(Arrays.asList("pi", "wordcount", "nginx"), profile.getAppPool());
        for (ParameterKey key : ParameterKey.values()) {
            assertNotNull(key.toString(), profile.getSampler(key));
        }
        assertEquals(DistributionFamily.WEIBULL_MIN,
                profile.getSampler(ParameterKey.Quantity.JOB_INTERARRIVAL, JobClass.INTERACTIVE).getFamily());
    }

    @Test
    public void integerProbability() throws Exception {
        WorkloadProfile profile = WorkloadProfile.load(Profiles.writeToml(Profiles.MIXED.replace("P_B = 0.4", "P_B = 1")));
        assertEquals(1, profile.getBatchProbability(), 0);
    }

    @Test
    public void integerParamsAreWidened() throws Exception {
        WorkloadProfile profile = WorkloadProfile.load(Profiles.writeToml(Profiles.MIXED));
        assertArrayEquals(new double[]{0, 10}, profile.getSampler(ParameterKey.J_D_UF).getParams(), 0);
    }

    @Test
    public void jsonProfile() throws Exception {
        WorkloadProfile profile = WorkloadProfile.load(Profiles.writeJson(Profiles.MIXED_JSON));
        assertEquals("Google 2011", profile.getName());
        assertEquals(0.3, profile.getBatchProbability(), 0);
        assertEquals(Arrays.asList("pi", "wordcount", "rodinia_kmeans"), profile.getAppPool());
        DistributionSampler jobDuration = profile.getSampler(ParameterKey.J_D_B);
        assertEquals(DistributionFamily.LOGNORM, jobDuration.getFamily());
        // integers and floats mixed in one array
        assertArrayEquals(new double[]{1.2, 0, 300}, jobDuration.getParams(), 0);
        assertArrayEquals(new double[]{2, 0, 2.5}, profile.getSampler(ParameterKey.T_D_B).getParams(), 0);
    }

    @Test
    public void jsonAndTomlProfilesGenerateAlike() throws Exception {
        String toml = "name = \"Google 2011\"\n"
                + "P_B = 0.3\n"
                + "app_pool = [\"pi\", \"wordcount\", \"rodinia_kmeans\"]\n"
                + "[parameters]\n"
                + "J_D_B = {type = \"lognorm\", params = [1.2, 0.0, 300.0]}\n"
                + "J_D_UF = {type = \"expon\", params = [0, 10]}\n"
                + "T_D_B = {type = \"gamma\", params = [2.0, 0.0, 2.5]}\n"
                + "T_D_UF = {type = \"expon\", params = [0.1, 0.5]}\n"
                + "J_AT_B = {type = \"expon\", params = [0, 3]}\n"
                + "J_AT_UF = {type = \"weibull_min\", params = [1.5, 0.0, 2.0]}\n"
                + "T_AT_B = {type = \"uniform\", params = [0.0, 0.2]}\n"
                + "T_AT_UF = {type = \"norm\", params = [0.05, 0.02]}\n";
        WorkloadProfile fromToml = WorkloadProfile.load(Profiles.writeToml(toml));
        WorkloadProfile fromJson = WorkloadProfile.load(Profiles.writeJson(Profiles.MIXED_JSON));
        assertEquals(TraceGenerator.generate(fromToml, 50, 1, 1, 5).getEntries(),
                TraceGenerator.generate(fromJson, 50, 1, 1, 5).getEntries());
    }

    @Test
    public void jsonProfileIsValidated() throws Exception {
        assertJsonRejected(Profiles.MIXED_JSON.replace("\"P_B\": 0.3", "\"P_B\": 1.5"), "P_B");
        assertJsonRejected(Profiles.MIXED_JSON.replace("\"gamma\"", "\"poisson\""), "T_D_B");
        assertJsonRejected(Profiles.MIXED_JSON.replace("\"app_pool\"", "\"apps\""), "app_pool");
        assertJsonRejected(Profiles.MIXED_JSON.replace("\"parameters\": {", "\"parameters\": ["), "could not parse");
        assertJsonRejected("", "empty profile");
    }

    @Test
    public void bundledProfilesLoad() throws Exception {
        for (String resource : new String[]{"/profiles/example.toml", "/profiles/example.json"}) {
            File file = new File(WorkloadProfileTest.class.getResource(resource).toURI());
            WorkloadProfile profile = WorkloadProfile.load(file);
            assertEquals(0.3, profile.getBatchProbability(), 0);
            assertEquals(7, profile.getAppPool().size());
        }
    }

    @Test
    public void missingParameter() throws Exception {
        assertRejected(Profiles.MIXED.replaceAll("(?m)^T_AT_UF.*$", ""), "T_AT_UF");
    }

    @Test
    public void emptyAppPool() throws Exception {
        assertRejected(Profiles.MIXED.replace("app_pool = [\"pi\", \"wordcount\", \"nginx\"]", "app_pool = []"),
                "app_pool");
    }

    @Test
    public void probabilityOutOfRange() throws Exception {
        assertRejected(Profiles.MIXED.replace("P_B = 0.4", "P_B = 1.5"), "P_B");
    }

    @Test
    public void missingProbability() throws Exception {
        assertRejected(Profiles.MIXED.replace("P_B = 0.4\n", ""), "P_B");
    }

    @Test
    public void badDistribution() throws Exception {
        assertRejected(Profiles.MIXED.replace("\"gamma\"", "\"gammma\""), "T_D_B");
    }

    @Test
    public void invalidDistributionParameters() throws Exception {
        assertRejected(Profiles.MIXED.replace("params = [0, 10]", "params = [0, -10]"), "J_D_UF");
    }

    @Test
    public void missingFile() {
        try {
            WorkloadProfile.load(new File("/nonexistent/profile.toml"));
            fail("expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertThat(e.getMessage(), containsString("non-existent"));
        }
    }

    private static void assertJsonRejected(String json, String expectedInMessage) throws Exception {
        File file = Profiles.writeJson(json);
        try {
            WorkloadProfile.load(file);
            fail("expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertThat(e.getMessage(), containsString(expectedInMessage));
        }
    }

    private static void assertRejected(String toml, String expectedInMessage) throws Exception {
        File file = Profiles.writeToml(toml);
        try {
            WorkloadProfile.load(file);
            fail("expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertThat(e.getMessage(), containsString(expectedInMessage));
        }
    }
}
