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

import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.distribution.ConstantRealDistribution;
import org.apache.commons.math3.distribution.ExponentialDistribution;
import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.distribution.LogNormalDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.ParetoDistribution;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.distribution.UniformRealDistribution;
import org.apache.commons.math3.distribution.WeibullDistribution;

import java.util.function.Function;

/**
 * Catalog of supported distribution families. Names and parameter order follow scipy.stats: the family's shape
 * parameters first, then an optional location (default 0) and an optional scale (default 1). Each family is built in
 * its standard form (loc = 0, scale = 1); {@link DistributionSampler} applies location and scale.
 */
public enum DistributionFamily {
    EXPON("expon", 0, s -> new ExponentialDistribution(1)),
    NORM("norm", 0, s -> new NormalDistribution(0, 1)),
    UNIFORM("uniform", 0, s -> new UniformRealDistribution(0, 1)),
    LOGNORM("lognorm", 1, s -> new LogNormalDistribution(0, s[0])),
    GAMMA("gamma", 1, s -> new GammaDistribution(s[0], 1)),
    WEIBULL_MIN("weibull_min", 1, s -> new WeibullDistribution(s[0], 1)),
    PARETO("pareto", 1, s -> new ParetoDistribution(1, s[0])),
    BETA("beta", 2, s -> new BetaDistribution(s[0], s[1])),
    /** Degenerate distribution, always returns loc */
    CONSTANT("constant", 0, s -> new ConstantRealDistribution(0));

    private final String familyName;
    private final int numShapes;
    private final Function<double[], RealDistribution> standardForm;

    DistributionFamily(String familyName, int numShapes, Function<double[], RealDistribution> standardForm) {
        this.familyName = familyName;
        this.numShapes = numShapes;
        this.standardForm = standardForm;
    }

    public String getFamilyName() {
        return familyName;
    }

    public int getNumShapes() {
        return numShapes;
    }

    /** May throw a Commons Math MathIllegalArgumentException if the shapes are out of range */
    RealDistribution standardForm(double[] shapes) {
        assert shapes.length == numShapes;
        return standardForm.apply(shapes);
    }

    public static DistributionFamily forName(String name) throws ConfigurationException {
        for (DistributionFamily family : values()) {
            if (family.familyName.equals(name)) {
                return family;
            }
        }
        throw new ConfigurationException("unsupported distribution type '" + name + "'");
    }
}
