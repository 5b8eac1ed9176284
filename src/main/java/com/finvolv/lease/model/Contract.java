package com.finvolv.lease.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder(toBuilder = true)
public class Contract {

    String customerName;
    String merchantId;
    LocalDate deliveryDate;
    LocalDate leaseEndDate;
    Integer freeRentDays;
    RentTiers rentTiers;

    public int freeRentDaysOrZero() {
        return freeRentDays == null ? 0 : freeRentDays;
    }

    public boolean hasDeliveryDate() {
        return deliveryDate != null;
    }

    public String displayName() {
        return customerName + " (" + merchantId + ")";
    }
}
