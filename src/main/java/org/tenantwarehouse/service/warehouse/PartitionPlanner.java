package org.tenantwarehouse.service.warehouse;

import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.models.dto.PartitionSpec;
import org.tenantwarehouse.models.dto.PartitionStrategy;
import org.tenantwarehouse.models.enums.PartitionType;
import org.tenantwarehouse.utils.SqlIdentifiers;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.Period;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a partition strategy into the concrete child partitions of a table. Pure: no database access.
 */
@Component
public class PartitionPlanner {

    private static final DateTimeFormatter MONTH_SUFFIX = DateTimeFormatter.ofPattern("yyyy_MM");
    private static final DateTimeFormatter DAY_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd");

    public List<PartitionSpec> plan(String table, PartitionStrategy strategy) {
        SqlIdentifiers.requireSafe(table);
        if (strategy == null || strategy.type() == null) {
            throw new ConfigurationException("Partition strategy type is required for table " + table);
        }
        if (strategy.type() == PartitionType.RANGE) {
            return planRange(table, strategy);
        }
        return planHash(table, strategy);
    }

    /**
     * Monthly partitions from the month holding {@code today - retentionDays} up to
     * {@code monthsAhead} months past the current one.
     */
    public PartitionStrategy retentionWindow(String column, LocalDate today, int retentionDays, int monthsAhead) {
        LocalDate start = today.minusDays(retentionDays).withDayOfMonth(1);
        LocalDate end = today.withDayOfMonth(1).plusMonths(Math.max(monthsAhead, 0) + 1L);
        int months = (int) ChronoUnit.MONTHS.between(start, end);
        return PartitionStrategy.monthlyRange(column, start, months);
    }

    private List<PartitionSpec> planRange(String table, PartitionStrategy strategy) {
        Period interval = strategy.interval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new ConfigurationException("Range partitioning of " + table + " needs a positive interval");
        }
        if (strategy.start() == null) {
            throw new ConfigurationException("Range partitioning of " + table + " needs a start date");
        }
        if (strategy.periods() == null || strategy.periods() <= 0) {
            throw new ConfigurationException("Range partitioning of " + table + " needs a positive number of periods");
        }
        boolean monthly = interval.equals(Period.ofMonths(1)) && strategy.start().getDayOfMonth() == 1;
        List<PartitionSpec> partitions = new ArrayList<>(strategy.periods());
        for (int i = 0; i < strategy.periods(); i++) {
            // Bounds derive from the start date, not from the previous upper bound, so month-end
            // starts do not drift.
            LocalDate lower = strategy.start().plus(interval.multipliedBy(i));
            LocalDate upper = strategy.start().plus(interval.multipliedBy(i + 1));
            String suffix = monthly ? lower.format(MONTH_SUFFIX) : lower.format(DAY_SUFFIX);
            partitions.add(PartitionSpec.range(partitionName(table, suffix), lower, upper));
        }
        return partitions;
    }

    private List<PartitionSpec> planHash(String table, PartitionStrategy strategy) {
        Integer count = strategy.partitionCount();
        if (count == null || count <= 0) {
            throw new ConfigurationException("Hash partitioning of " + table + " needs a positive partition count");
        }
        List<PartitionSpec> partitions = new ArrayList<>(count);
        for (int remainder = 0; remainder < count; remainder++) {
            partitions.add(PartitionSpec.hash(partitionName(table, "hash_" + remainder), count, remainder));
        }
        return partitions;
    }

    private String partitionName(String table, String suffix) {
        String name = table + "_" + suffix;
        if (name.length() > TenantSchemaNaming.MAX_IDENTIFIER_LENGTH) {
            throw new ConfigurationException("Partition name too long: " + name);
        }
        return name;
    }
}
