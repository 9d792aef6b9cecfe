package com.ensemble.anomaly.stats;

import lombok.Value;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.SecondMoment;

import java.util.Arrays;
import java.util.Optional;

/**
 * Mean and population standard deviation of a group with one member left out, for every member.
 * NaN entries are missing values: they are not part of any peer set and get no statistics.
 * Group moments come from commons-math; removing one member is an O(1) downdate of them.
 */
public final class PeerStatistics {

    private final double[] values;
    private final int count;
    private final double mean;
    private final double m2;

    private PeerStatistics(double[] values, int count, double mean, double m2) {
        this.values = values;
        this.count = count;
        this.mean = mean;
        this.m2 = m2;
    }

    public static PeerStatistics of(double[] values) {
        double[] present = Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
        if (present.length == 0) {
            return new PeerStatistics(values, 0, Double.NaN, 0.0);
        }
        double mean = new Mean().evaluate(present);
        double m2 = new SecondMoment().evaluate(present);
        return new PeerStatistics(values, present.length, mean, m2);
    }

    /**
     * Statistics of every other non-missing member. Empty when the member's own value is missing
     * or fewer than two peers remain.
     */
    public Optional<Moments> excluding(int position) {
        double x = values[position];
        if (Double.isNaN(x) || count - 1 < 2) {
            return Optional.empty();
        }
        int peers = count - 1;
        double peerMean = (count * mean - x) / peers;
        double peerM2 = Math.max(0.0, m2 - (x - mean) * (x - peerMean));
        return Optional.of(new Moments(peerMean, Math.sqrt(peerM2 / peers)));
    }

    public double valueAt(int position) {
        return values[position];
    }

    @Value
    public static class Moments {
        double mean;
        double std;
    }
}
