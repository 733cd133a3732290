package org.tenantwarehouse.models.dto;

import org.tenantwarehouse.models.enums.PartitionType;

import java.time.LocalDate;

/**
 * One child partition. Range partitions own {@code [lowerBound, upperBound)}; hash partitions own
 * the keys with {@code key mod modulus == remainder}.
 */
public record PartitionSpec(String name,
                            PartitionType type,
                            LocalDate lowerBound,
                            LocalDate upperBound,
                            Integer modulus,
                            Integer remainder) {

    public static PartitionSpec range(String name, LocalDate lowerBound, LocalDate upperBound) {
        return new PartitionSpec(name, PartitionType.RANGE, lowerBound, upperBound, null, null);
    }

    public static PartitionSpec hash(String name, int modulus, int remainder) {
        return new PartitionSpec(name, PartitionType.HASH, null, null, modulus, remainder);
    }

    public boolean contains(LocalDate date) {
        return type == PartitionType.RANGE && !date.isBefore(lowerBound) && date.isBefore(upperBound);
    }

    public boolean owns(long key) {
        return type == PartitionType.HASH && Math.floorMod(key, modulus) == remainder;
    }
}
