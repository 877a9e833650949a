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

import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;

import java.util.Arrays;
import java.util.List;
import java.util.SplittableRandom;

/**
 * One parametrized distribution. Immutable: all randomness comes from the {@link SplittableRandom} passed to
 * {@link #sample}, so two samplers driven by identically seeded generators produce identical draws.
 */
public class DistributionSampler {
    private final DistributionFamily family;
    private final double[] params;
    private final RealDistribution standard;
    private final double loc, scale;

    public DistributionSampler(String familyName, List<? extends Number> params) throws ConfigurationException {
        this(DistributionFamily.forName(familyName), toArray(params));
    }

    public DistributionSampler(DistributionFamily family, double... params) throws ConfigurationException {
        this.family = family;
        this.params = params.clone();
        int nShapes = family.getNumShapes();
        if (params.length < nShapes || params.length > nShapes + 2) {
            throw new ConfigurationException(String.format("%s expects %d to %d parameters, got %s",
                    family.getFamilyName(), nShapes, nShapes + 2, Arrays.toString(params)));
        }
        for (double p : params) {
            if (!Double.isFinite(p)) {
                throw new ConfigurationException(
                        "non-finite parameter in " + family.getFamilyName() + Arrays.toString(params));
            }
        }
        for (int i = 0; i < nShapes; ++i) {
            if (params[i] <= 0) {
                throw new ConfigurationException(
                        "shape parameters must be positive in " + family.getFamilyName() + Arrays.toString(params));
            }
        }
        this.loc = params.length > nShapes ? params[nShapes] : 0;
        this.scale = params.length > nShapes + 1 ? params[nShapes + 1] : 1;
        if (scale <= 0) {
            throw new ConfigurationException(
                    "scale must be positive in " + family.getFamilyName() + Arrays.toString(params));
        }
        try {
            this.standard = family.standardForm(Arrays.copyOf(params, nShapes));
        } catch (MathIllegalArgumentException e) {
            throw new ConfigurationException(
                    "invalid parameters for " + family.getFamilyName() + Arrays.toString(params), e);
        }
    }

    /** Draw one value by inversion, clamped to be non-negative */
    public double sample(SplittableRandom random) {
        double x = loc + scale * standard.inverseCumulativeProbability(random.nextDouble());
        return x > 0 ? x : 0; // also maps NaN to 0
    }

    public DistributionFamily getFamily() {
        return family;
    }

    public double[] getParams() {
        return params.clone();
    }

    @Override
    public String toString() {
        return family.getFamilyName() + Arrays.toString(params);
    }

    private static double[] toArray(List<? extends Number> params) throws ConfigurationException {
        if (params == null) {
            throw new ConfigurationException("missing distribution parameter list");
        }
        double[] array = new double[params.size()];
        for (int i = 0; i < array.length; ++i) {
            Number p = params.get(i);
            if (p == null) {
                throw new ConfigurationException("null distribution parameter at position " + i);
            }
            array[i] = p.doubleValue();
        }
        return array;
    }
}
