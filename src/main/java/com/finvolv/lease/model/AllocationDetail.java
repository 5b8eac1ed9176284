package com.finvolv.lease.model;

import lombok.Builder;
import lombok.Value;

/**
 * Intermediate values behind one month's receivable. Advisory only.
 */
@Value
@Builder
public class AllocationDetail {

    long freeDays;
    long effectiveDays;
    long payableDays;
    int daysInMonth;

    boolean splitYear;
    /** Lease year of a non-split month. */
    Integer leaseYear;
    Double tierAmount;
    Double dailyRent;

    /** Earlier of the two lease years of a split month. */
    Integer splitLeaseYear;
    Long firstPartDays;
    Long secondPartDays;
    Double firstTierAmount;
    Double secondTierAmount;

    String formula;

    public static AllocationDetail empty(String formula) {
        return AllocationDetail.builder().formula(formula).build();
    }

    public String leaseYearLabel() {
        if (splitYear) {
            return splitLeaseYear + "/" + (splitLeaseYear + 1);
        }
        return leaseYear == null ? "-" : String.valueOf(leaseYear);
    }

    public String tierAmountLabel() {
        if (splitYear) {
            return String.format("%.2f/%.2f", firstTierAmount, secondTierAmount);
        }
        return tierAmount == null ? "-" : String.format("%.2f", tierAmount);
    }

    public String dailyRentLabel() {
        if (splitYear) {
            int divisor = daysInMonth == 0 ? 1 : daysInMonth;
            return String.format("%.2f/%.2f", firstTierAmount / divisor, secondTierAmount / divisor);
        }
        return dailyRent == null ? "-" : String.format("%.2f", dailyRent);
    }
}
