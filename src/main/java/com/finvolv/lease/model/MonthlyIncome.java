package com.finvolv.lease.model;

import lombok.Builder;
import lombok.Value;

import java.time.YearMonth;

@Value
@Builder
public class MonthlyIncome {

    Contract contract;
    YearMonth month;
    double amount;
    double dailyIncomeRate;
    long contractDaysInMonth;

    public String formula() {
        return String.format("%.4f × %d = %.2f", dailyIncomeRate, contractDaysInMonth, amount);
    }
}
