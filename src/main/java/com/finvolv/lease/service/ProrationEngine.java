package com.finvolv.lease.service;

import com.finvolv.lease.model.AllocationDetail;
import com.finvolv.lease.model.CalculationTrace;
import com.finvolv.lease.model.Contract;
import com.finvolv.lease.model.DateSpan;
import com.finvolv.lease.model.MonthlyAllocation;
import com.finvolv.lease.model.RentTiers;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Allocates a contract's tiered rent figures to calendar months.
 *
 * <p>A month's receivable is {@code tier / daysInMonth × payableDays}, where payable days are
 * the days of the month inside [delivery date, lease end] minus free-rent days. A month that
 * contains a lease-year boundary (delivery date + 12·i months − 1 day) is split at that day and
 * each part is priced with its own tier. A fully paid month inside one lease year therefore
 * yields the tier figure itself.
 */
@Service
public class ProrationEngine {

    public double monthlyRent(Contract contract, int monthOffset) {
        return allocate(contract, monthOffset, CalculationTrace.disabled()).getAmount();
    }

    /**
     * @param monthOffset calendar months after the delivery month (0 = delivery month)
     */
    public MonthlyAllocation allocate(Contract contract, int monthOffset, CalculationTrace trace) {
        LocalDate deliveryDate = contract.getDeliveryDate();
        if (deliveryDate == null) {
            return result(contract, null, 0.0, AllocationDetail.empty("No delivery date, rent is 0"));
        }

        YearMonth targetMonth = YearMonth.from(deliveryDate).plusMonths(monthOffset);
        DateSpan monthSpan = DateSpan.ofMonth(targetMonth);
        LocalDate monthStart = monthSpan.start();
        LocalDate monthEnd = monthSpan.end();
        trace.record("  Month {} ({} to {})", targetMonth, monthStart, monthEnd);

        int freeRentDays = contract.freeRentDaysOrZero();
        DateSpan freeSpan = DateSpan.of(deliveryDate, deliveryDate.plusDays(freeRentDays - 1L));
        long freeDays = freeSpan.overlapDays(monthSpan);
        if (freeDays > 0) {
            trace.record("    Free rent {} to {}, {} free day(s) this month", freeSpan.start(), freeSpan.end(), freeDays);
        }

        DateSpan effectiveSpan = DateSpan.of(deliveryDate, contract.getLeaseEndDate()).intersect(monthSpan);
        if (effectiveSpan.isEmpty()) {
            trace.record("    Outside the lease term, rent is 0");
            return result(contract, targetMonth, 0.0, AllocationDetail.builder()
                .freeDays(freeDays)
                .formula("Outside the lease term, rent is 0")
                .build());
        }
        long effectiveDays = effectiveSpan.days();
        long payableDays = Math.max(0, effectiveDays - freeDays);
        trace.record("    Effective days {}, payable days {}", effectiveDays, payableDays);

        if (payableDays == 0) {
            trace.record("    No payable days, rent is 0");
            return result(contract, targetMonth, 0.0, AllocationDetail.builder()
                .freeDays(freeDays)
                .effectiveDays(effectiveDays)
                .formula("No payable days, rent is 0")
                .build());
        }

        RentTiers tiers = contract.getRentTiers() == null ? RentTiers.of() : contract.getRentTiers();
        int tierCount = Math.max(1, tiers.size());
        int daysInMonth = targetMonth.lengthOfMonth();
        List<LocalDate> yearEnds = leaseYearEnds(deliveryDate, tierCount);

        // the last lease year has no following boundary to straddle
        int splitYear = 0;
        for (int i = 1; i < tierCount; i++) {
            LocalDate yearEnd = yearEnds.get(i - 1);
            if (!yearEnd.isBefore(monthStart) && !yearEnd.isAfter(monthEnd)) {
                splitYear = i;
                break;
            }
        }

        AllocationDetail.AllocationDetailBuilder detail = AllocationDetail.builder()
            .freeDays(freeDays)
            .effectiveDays(effectiveDays)
            .payableDays(payableDays)
            .daysInMonth(daysInMonth);

        if (splitYear == 0) {
            int leaseYear = leaseYearOf(deliveryDate, monthStart, tierCount);
            Double tierAmount = tiers.amountForYear(leaseYear);
            detail.leaseYear(leaseYear);
            if (tierAmount == null || tierAmount == 0.0) {
                trace.record("    Lease year {} has no rent, rent is 0", leaseYear);
                return result(contract, targetMonth, 0.0, detail.formula("No rent for lease year " + leaseYear + ", rent is 0").build());
            }
            double dailyRent = tierAmount / daysInMonth;
            double amount = dailyRent * payableDays;
            String formula = String.format("%.2f / %d × %d = %.2f", tierAmount, daysInMonth, payableDays, amount);
            trace.record("    Lease year {}, tier {}, {} days in month, daily {}", leaseYear, fmt(tierAmount), daysInMonth, fmt(dailyRent));
            trace.record("    [formula] {}", formula);
            return result(contract, targetMonth, amount, detail
                .tierAmount(tierAmount)
                .dailyRent(dailyRent)
                .formula(formula)
                .build());
        }

        LocalDate splitDate = yearEnds.get(splitYear - 1);
        long firstPartDays = DateSpan.of(monthStart, splitDate).days();
        long secondPartDays = DateSpan.of(splitDate.plusDays(1), monthEnd).days();
        double firstTier = tiers.amountOrZero(splitYear);
        double secondTier = tiers.amountOrZero(splitYear + 1);
        double firstPart = firstTier / daysInMonth * firstPartDays;
        double secondPart = secondTier / daysInMonth * secondPartDays;
        double amount = firstPart + secondPart;
        String formula = String.format("(%.2f/%d×%d) + (%.2f/%d×%d) = %.2f + %.2f = %.2f",
            firstTier, daysInMonth, firstPartDays, secondTier, daysInMonth, secondPartDays,
            firstPart, secondPart, amount);
        trace.record("    Crosses lease years {}/{} at {}", splitYear, splitYear + 1, splitDate);
        trace.record("    [formula] {}", formula);

        return result(contract, targetMonth, amount, detail
            .splitYear(true)
            .splitLeaseYear(splitYear)
            .firstPartDays(firstPartDays)
            .secondPartDays(secondPartDays)
            .firstTierAmount(firstTier)
            .secondTierAmount(secondTier)
            .formula(formula)
            .build());
    }

    /**
     * Last day of each lease year: delivery date advanced by 12·i months, minus one day.
     */
    static List<LocalDate> leaseYearEnds(LocalDate deliveryDate, int tierCount) {
        List<LocalDate> ends = new ArrayList<>(tierCount);
        for (int i = 1; i <= tierCount; i++) {
            ends.add(deliveryDate.plusMonths(12L * i).minusDays(1));
        }
        return ends;
    }

    /**
     * Lease year containing {@code monthStart}; the anniversary falls on the delivery day,
     * not on the first of the month. Clamped to [1, tierCount].
     */
    static int leaseYearOf(LocalDate deliveryDate, LocalDate monthStart, int tierCount) {
        int monthsSinceDelivery = (monthStart.getYear() - deliveryDate.getYear()) * 12
            + (monthStart.getMonthValue() - deliveryDate.getMonthValue());
        if (monthStart.getDayOfMonth() < deliveryDate.getDayOfMonth()) {
            monthsSinceDelivery--;
        }
        int leaseYear = monthsSinceDelivery / 12 + 1;
        return Math.max(1, Math.min(leaseYear, tierCount));
    }

    static int monthOffset(LocalDate deliveryDate, YearMonth month) {
        return (month.getYear() - deliveryDate.getYear()) * 12 + (month.getMonthValue() - deliveryDate.getMonthValue());
    }

    private static MonthlyAllocation result(Contract contract, YearMonth month, double amount, AllocationDetail detail) {
        return MonthlyAllocation.builder()
            .contract(contract)
            .month(month)
            .amount(amount)
            .detail(detail)
            .build();
    }

    private static String fmt(double value) {
        return String.format("%.2f", value);
    }
}
