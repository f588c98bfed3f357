package com.nudge.condition.impl;

import com.nudge.condition.Condition;
import com.nudge.condition.ConditionResult;
import com.nudge.condition.ConditionType;
import com.nudge.config.ConditionConfig;
import com.nudge.entity.EntityAdapter;
import com.nudge.entity.Timestamps;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Matches dates that have expired or are about to.
 * <p>
 * Settings: {@code field}, {@code days_until}, {@code days_warning} (default 30),
 * {@code days_exclude_under}.
 * <ul>
 *   <li>Expired mode, selected by a negative {@code days_until}: matches once the date
 *       has passed; {@code days_until_expiry} is the number of days overdue.</li>
 *   <li>Expiring mode: matches when the date is 0 to {@code days_warning} days away,
 *       except within the first {@code days_exclude_under} days, which a tighter
 *       rule is expected to cover.</li>
 * </ul>
 * Days until expiry are rounded up. Date-only values expire at local midnight.
 */
public class DateExpiringCondition implements Condition {

    public static final DateExpiringCondition INSTANCE = new DateExpiringCondition();

    private static final DateTimeFormatter EXPIRY_FORMAT = DateTimeFormatter.ofPattern("MMM d", Locale.US);

    private static final double DEFAULT_WARNING_DAYS = 30;

    private DateExpiringCondition() {
    }

    @Override
    public <E> ConditionResult evaluate(E entity, ConditionConfig config, EntityAdapter<E> adapter) {
        Optional<String> field = config.getString("field");
        if (field.isEmpty()) {
            return ConditionResult.noMatch();
        }

        ZoneId zone = adapter.clock().getZone();
        Optional<Long> expiry = adapter.dateField(entity, field.get())
                .flatMap(value -> Timestamps.toEpochMillis(value, zone));
        if (expiry.isEmpty()) {
            return ConditionResult.noMatch();
        }

        long daysUntil = Timestamps.daysUntil(expiry.get(), adapter.clock());
        String expiryDate = EXPIRY_FORMAT.format(Instant.ofEpochMilli(expiry.get()).atZone(zone));

        Optional<Double> configuredDaysUntil = config.getNumber("days_until");
        if (configuredDaysUntil.isPresent() && configuredDaysUntil.get() < 0) {
            if (daysUntil >= 0) {
                return ConditionResult.noMatch();
            }
            return ConditionResult.matched(Map.of(
                    "days_until_expiry", Math.abs(daysUntil),
                    "expiry_date", expiryDate));
        }

        double warningDays = config.getNumber("days_warning", DEFAULT_WARNING_DAYS);
        double excludeUnder = config.getNumber("days_exclude_under", 0);

        if (daysUntil < 0 || daysUntil > warningDays) {
            return ConditionResult.noMatch();
        }
        if (excludeUnder > 0 && daysUntil <= excludeUnder) {
            return ConditionResult.noMatch();
        }

        return ConditionResult.matched(Map.of(
                "days_until_expiry", daysUntil,
                "expiry_date", expiryDate));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.DATE_EXPIRING;
    }

    @Override
    public String toString() {
        return "DATE_EXPIRING";
    }
}
