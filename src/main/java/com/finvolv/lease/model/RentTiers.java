package com.finvolv.lease.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base rent figures keyed by lease-year index (1-based). An absent figure is kept
 * distinct from zero; both contribute nothing to proration.
 */
@EqualsAndHashCode
@ToString
public final class RentTiers {

    private final List<Double> amounts;

    private RentTiers(List<Double> amounts) {
        this.amounts = Collections.unmodifiableList(amounts);
    }

    public static RentTiers of(Double... amounts) {
        List<Double> values = new ArrayList<>(amounts.length);
        Collections.addAll(values, amounts);
        return new RentTiers(values);
    }

    public static RentTiers of(List<Double> amounts) {
        return new RentTiers(new ArrayList<>(amounts));
    }

    public int size() {
        return amounts.size();
    }

    /**
     * @param leaseYear 1-based lease-year index
     * @return the declared figure, or null when absent or out of range
     */
    public Double amountForYear(int leaseYear) {
        if (leaseYear < 1 || leaseYear > amounts.size()) {
            return null;
        }
        return amounts.get(leaseYear - 1);
    }

    public double amountOrZero(int leaseYear) {
        Double amount = amountForYear(leaseYear);
        return amount == null ? 0.0 : amount;
    }

    public boolean isPresent(int leaseYear) {
        Double amount = amountForYear(leaseYear);
        return amount != null && amount != 0.0;
    }

    /** Number of tiers holding a present, non-zero figure. */
    public int presentCount() {
        int count = 0;
        for (int year = 1; year <= amounts.size(); year++) {
            if (isPresent(year)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Pads with absent entries up to {@code tierCount}. Never truncates.
     */
    public RentTiers padTo(int tierCount) {
        if (amounts.size() >= tierCount) {
            return this;
        }
        List<Double> padded = new ArrayList<>(amounts);
        while (padded.size() < tierCount) {
            padded.add(null);
        }
        return new RentTiers(padded);
    }

    public List<Double> asList() {
        return amounts;
    }
}
