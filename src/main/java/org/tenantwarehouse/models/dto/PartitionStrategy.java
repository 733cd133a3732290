package org.tenantwarehouse.models.dto;

import org.tenantwarehouse.models.enums.PartitionType;

import java.time.LocalDate;
import java.time.Period;

/**
 * Range strategies need {@code interval}, {@code start} and {@code periods}; hash strategies need
 * {@code partitionCount}.
 */
public record PartitionStrategy(PartitionType type,
                                String column,
                                Period interval,
                                LocalDate start,
                                Integer periods,
                                Integer partitionCount) {

    public static PartitionStrategy monthlyRange(String column, LocalDate start, int months) {
        return new PartitionStrategy(PartitionType.RANGE, column, Period.ofMonths(1), start, months, null);
    }

    public static PartitionStrategy hash(String column, int partitionCount) {
        return new PartitionStrategy(PartitionType.HASH, column, null, null, null, partitionCount);
    }
}
