package com.leadgen.instrument.model;

import java.util.Arrays;

/**
 * CPU使用率快照。不支持负载均值的平台上 loadAverage 为三个0。
 */
public record CpuSnapshot(
        double percentTotal,
        double[] percentPerCore,
        double[] loadAverage
) {

    public CpuSnapshot {
        percentPerCore = percentPerCore.clone();
        loadAverage = loadAverage.clone();
    }

    @Override
    public double[] percentPerCore() {
        return percentPerCore.clone();
    }

    @Override
    public double[] loadAverage() {
        return loadAverage.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CpuSnapshot other)) return false;
        return Double.compare(percentTotal, other.percentTotal) == 0
                && Arrays.equals(percentPerCore, other.percentPerCore)
                && Arrays.equals(loadAverage, other.loadAverage);
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(percentTotal);
        result = 31 * result + Arrays.hashCode(percentPerCore);
        return 31 * result + Arrays.hashCode(loadAverage);
    }

    @Override
    public String toString() {
        return "CpuSnapshot{total=" + percentTotal
                + ", perCore=" + Arrays.toString(percentPerCore)
                + ", loadAvg=" + Arrays.toString(loadAverage) + "}";
    }
}
