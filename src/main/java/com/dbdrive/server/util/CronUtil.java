package com.dbdrive.server.util;

import com.dbdrive.server.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.scheduling.support.CronExpression;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Cron expressions are six whitespace separated fields:
 * seconds, minutes, hours, day-of-month, month, day-of-week.
 * Macros such as {@code @daily} are accepted as well.
 */
public class CronUtil {

    private static final int FIELD_COUNT = 6;

    public static final int MAX_RUN_TIMES = 100;

    public static CronExpression parse(String cronExpression) throws ValidationException {
        if (StringUtils.isBlank(cronExpression)) {
            throw new ValidationException("parse cron failed. cronExpression is blank");
        }
        String trimmed = cronExpression.trim();
        if (!trimmed.startsWith("@") && StringUtils.split(trimmed).length != FIELD_COUNT) {
            throw new ValidationException("parse cron failed. expect %d fields. cronExpression is %s"
                    .formatted(FIELD_COUNT, cronExpression));
        }
        try {
            return CronExpression.parse(trimmed);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("parse cron failed. cronExpression is %s".formatted(cronExpression), e);
        }
    }

    public static void validate(String cronExpression) throws ValidationException {
        parse(cronExpression);
    }

    public static List<LocalDateTime> nextRunTimes(String cronExpression, int count) throws ValidationException {
        if (count <= 0 || count > MAX_RUN_TIMES) {
            throw new ValidationException("nextRunTimes failed. count should be in [1, %d]. count is %d"
                    .formatted(MAX_RUN_TIMES, count));
        }
        CronExpression expression = parse(cronExpression);
        List<LocalDateTime> result = new ArrayList<>(count);
        LocalDateTime cursor = LocalDateTime.now();
        for (int i = 0; i < count; i++) {
            cursor = expression.next(cursor);
            if (cursor == null) {
                break;
            }
            result.add(cursor);
        }
        return result;
    }
}
