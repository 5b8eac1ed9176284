package com.finvolv.lease.model;

import lombok.Getter;

import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loaded contract, bank and invoice records. Every contract's rent tiers are padded
 * to the registry-wide tier count.
 */
@Getter
public class ContractRegistry {

    private final List<Contract> contracts;
    private final List<BankTransaction> bankTransactions;
    private final List<Invoice> invoices;
    private final int tierCount;

    public ContractRegistry(List<Contract> contracts,
                            List<BankTransaction> bankTransactions,
                            List<Invoice> invoices,
                            int tierCount) {
        int resolvedTierCount = Math.max(1, tierCount);
        for (Contract contract : contracts) {
            if (contract.getRentTiers() != null) {
                resolvedTierCount = Math.max(resolvedTierCount, contract.getRentTiers().size());
            }
        }
        this.tierCount = resolvedTierCount;
        this.contracts = contracts.stream()
            .map(contract -> contract.toBuilder()
                .rentTiers(contract.getRentTiers() == null
                    ? RentTiers.of().padTo(this.tierCount)
                    : contract.getRentTiers().padTo(this.tierCount))
                .build())
            .toList();
        this.bankTransactions = List.copyOf(bankTransactions);
        this.invoices = List.copyOf(invoices);
    }

    /**
     * Highest lease-year index named by any header that starts with a match of {@code tierPattern}
     * (group 1 is the year number); 1 when none match.
     */
    public static int detectTierCount(Collection<String> headers, Pattern tierPattern) {
        int maxYear = 1;
        for (String header : headers) {
            if (header == null) {
                continue;
            }
            Matcher matcher = tierPattern.matcher(header);
            if (matcher.lookingAt()) {
                maxYear = Math.max(maxYear, Integer.parseInt(matcher.group(1)));
            }
        }
        return maxYear;
    }

    public int size() {
        return contracts.size();
    }
}
