package com.safepocket.anomaly.detector.ml;

/**
 * One-class SVM (nu formulation) with an RBF kernel over one-dimensional samples.
 *
 * <p>Solves {@code min 1/2 a'Qa} subject to {@code 0 <= a_i <= 1} and {@code sum(a) = nu * l}
 * with a second-order SMO working-set selection. Kernel values are computed on demand, so
 * memory stays linear in the sample size.
 */
public final class OneClassSvm {

    private static final double UPPER_BOUND = 1d;
    private static final double TAU = 1e-12d;

    private final double[] samples;
    private final double[] alpha;
    private final double gamma;
    private final double rho;
    private final int iterations;
    private final boolean converged;

    private OneClassSvm(double[] samples, double[] alpha, double gamma, double rho, int iterations, boolean converged) {
        this.samples = samples;
        this.alpha = alpha;
        this.gamma = gamma;
        this.rho = rho;
        this.iterations = iterations;
        this.converged = converged;
    }

    /**
     * @param nu            upper bound on the fraction of outliers, in (0, 1]
     * @param gamma         RBF kernel coefficient
     * @param tolerance     stopping tolerance on the maximal KKT violation
     * @param maxIterations hard cap on SMO iterations
     */
    public static OneClassSvm fit(double[] data, double nu, double gamma, double tolerance, int maxIterations) {
        int l = data.length;
        if (l == 0) {
            throw new IllegalArgumentException("cannot fit a one-class SVM on an empty sample");
        }
        if (!(nu > 0 && nu <= 1)) {
            throw new IllegalArgumentException("nu must be in (0, 1], got " + nu);
        }
        double[] x = data.clone();
        double[] alpha = new double[l];
        double total = nu * l;
        int full = (int) total;
        for (int i = 0; i < full && i < l; i++) {
            alpha[i] = UPPER_BOUND;
        }
        if (full < l) {
            alpha[full] = total - full;
        }

        double[] gradient = new double[l];
        for (int j = 0; j < l; j++) {
            if (alpha[j] == 0) {
                continue;
            }
            for (int k = 0; k < l; k++) {
                gradient[k] += alpha[j] * kernel(x[k], x[j], gamma);
            }
        }

        int iteration = 0;
        boolean converged = false;
        while (iteration < maxIterations) {
            int i = -1;
            double gMax = Double.NEGATIVE_INFINITY;
            for (int t = 0; t < l; t++) {
                if (alpha[t] < UPPER_BOUND && -gradient[t] >= gMax) {
                    gMax = -gradient[t];
                    i = t;
                }
            }
            int j = -1;
            double gMax2 = Double.NEGATIVE_INFINITY;
            double objectiveMin = Double.POSITIVE_INFINITY;
            for (int t = 0; t < l; t++) {
                if (alpha[t] <= 0) {
                    continue;
                }
                if (gradient[t] >= gMax2) {
                    gMax2 = gradient[t];
                }
                double gradientDiff = gMax + gradient[t];
                if (i >= 0 && gradientDiff > 0) {
                    double quad = 2d - 2d * kernel(x[i], x[t], gamma);
                    if (quad <= 0) {
                        quad = TAU;
                    }
                    double objective = -(gradientDiff * gradientDiff) / quad;
                    if (objective <= objectiveMin) {
                        objectiveMin = objective;
                        j = t;
                    }
                }
            }
            if (i < 0 || j < 0 || gMax + gMax2 < tolerance) {
                converged = true;
                break;
            }
            iteration++;

            double oldAlphaI = alpha[i];
            double oldAlphaJ = alpha[j];
            double quad = 2d - 2d * kernel(x[i], x[j], gamma);
            if (quad <= 0) {
                quad = TAU;
            }
            double delta = (gradient[i] - gradient[j]) / quad;
            double sum = oldAlphaI + oldAlphaJ;
            double newAlphaI = oldAlphaI - delta;
            double newAlphaJ = oldAlphaJ + delta;
            if (sum > UPPER_BOUND) {
                if (newAlphaI > UPPER_BOUND) {
                    newAlphaI = UPPER_BOUND;
                    newAlphaJ = sum - UPPER_BOUND;
                }
            } else if (newAlphaJ < 0) {
                newAlphaJ = 0;
                newAlphaI = sum;
            }
            if (sum > UPPER_BOUND) {
                if (newAlphaJ > UPPER_BOUND) {
                    newAlphaJ = UPPER_BOUND;
                    newAlphaI = sum - UPPER_BOUND;
                }
            } else if (newAlphaI < 0) {
                newAlphaI = 0;
                newAlphaJ = sum;
            }
            alpha[i] = newAlphaI;
            alpha[j] = newAlphaJ;

            double deltaI = newAlphaI - oldAlphaI;
            double deltaJ = newAlphaJ - oldAlphaJ;
            for (int k = 0; k < l; k++) {
                gradient[k] += kernel(x[k], x[i], gamma) * deltaI + kernel(x[k], x[j], gamma) * deltaJ;
            }
        }
        return new OneClassSvm(x, alpha, gamma, computeRho(alpha, gradient), iteration, converged);
    }

    /**
     * Signed distance to the learned boundary: positive inside, negative outside.
     */
    public double decision(double value) {
        double sum = 0d;
        for (int i = 0; i < samples.length; i++) {
            if (alpha[i] != 0) {
                sum += alpha[i] * kernel(samples[i], value, gamma);
            }
        }
        return sum - rho;
    }

    public double rho() {
        return rho;
    }

    public int iterations() {
        return iterations;
    }

    public boolean converged() {
        return converged;
    }

    public int supportVectorCount() {
        int count = 0;
        for (double a : alpha) {
            if (a > 0) {
                count++;
            }
        }
        return count;
    }

    static double kernel(double a, double b, double gamma) {
        double diff = a - b;
        return Math.exp(-gamma * diff * diff);
    }

    private static double computeRho(double[] alpha, double[] gradient) {
        double upper = Double.POSITIVE_INFINITY;
        double lower = Double.NEGATIVE_INFINITY;
        double freeSum = 0d;
        int freeCount = 0;
        for (int i = 0; i < alpha.length; i++) {
            if (alpha[i] >= UPPER_BOUND) {
                lower = Math.max(lower, gradient[i]);
            } else if (alpha[i] <= 0) {
                upper = Math.min(upper, gradient[i]);
            } else {
                freeCount++;
                freeSum += gradient[i];
            }
        }
        if (freeCount > 0) {
            return freeSum / freeCount;
        }
        return (upper + lower) / 2;
    }
}
