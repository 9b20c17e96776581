package com.dbdrive.server.util;

import com.dbdrive.server.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CronUtilTest {

    @Test
    void ShouldAcceptSixFieldsWhenValidate() {
        assertDoesNotThrow(() -> CronUtil.validate("0 0 2 * * *"));
        assertDoesNotThrow(() -> CronUtil.validate("0 */15 9-17 * * MON-FRI"));
        assertDoesNotThrow(() -> CronUtil.validate("@daily"));
    }

    @Test
    void ShouldThrowValidationExceptionWhenMalformed() {
        assertThrows(ValidationException.class, () -> CronUtil.validate(null));
        assertThrows(ValidationException.class, () -> CronUtil.validate("  "));
        // five field unix cron is not accepted
        assertThrows(ValidationException.class, () -> CronUtil.validate("0 2 * * *"));
        assertThrows(ValidationException.class, () -> CronUtil.validate("0 0 25 * * *"));
        assertThrows(ValidationException.class, () -> CronUtil.validate("not a cron at all"));
    }

    @Test
    void ShouldReturnAscendingTimesWhenNextRunTimes() {
        List<LocalDateTime> nextRunTimes = CronUtil.nextRunTimes("0 0 2 * * *", 5);

        assertEquals(5, nextRunTimes.size());
        assertTrue(nextRunTimes.get(0).isAfter(LocalDateTime.now()));
        for (int i = 0; i < nextRunTimes.size(); i++) {
            assertEquals(2, nextRunTimes.get(i).getHour());
            assertEquals(0, nextRunTimes.get(i).getMinute());
            if (i > 0) {
                assertEquals(nextRunTimes.get(i - 1).plusDays(1), nextRunTimes.get(i));
            }
        }
    }

    @Test
    void ShouldThrowWhenCountNotPositive() {
        assertThrows(ValidationException.class, () -> CronUtil.nextRunTimes("0 0 2 * * *", 0));
    }

    @Test
    void ShouldThrowWhenCountAboveCap() {
        assertThrows(ValidationException.class, () -> CronUtil.nextRunTimes("0 0 2 * * *", Integer.MAX_VALUE));
        assertThrows(ValidationException.class,
                () -> CronUtil.nextRunTimes("0 0 2 * * *", CronUtil.MAX_RUN_TIMES + 1));
        assertEquals(CronUtil.MAX_RUN_TIMES, CronUtil.nextRunTimes("0 0 2 * * *", CronUtil.MAX_RUN_TIMES).size());
    }
}
