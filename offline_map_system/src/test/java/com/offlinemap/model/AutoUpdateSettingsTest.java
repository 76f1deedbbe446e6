package com.offlinemap.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AutoUpdateSettingsTest {

    @Test
    void defaults() {
        AutoUpdateSettings settings = new AutoUpdateSettings();

        assertFalse(settings.isEnabled());
        assertTrue(settings.isWifiOnly());
        assertEquals(UpdateInterval.WEEKLY, settings.getUpdateInterval());
        assertEquals("02:00", settings.getTimeOfDay());
        assertEquals(120, settings.targetMinuteOfDay());
        assertEquals(0, settings.getLastAutoCheck());
    }

    @Test
    void rejectsMalformedTimeOfDay() {
        AutoUpdateSettings settings = new AutoUpdateSettings();

        assertThrows(IllegalArgumentException.class, () -> settings.setTimeOfDay("25:00"));
        assertThrows(IllegalArgumentException.class, () -> settings.setTimeOfDay("2am"));
        assertThrows(IllegalArgumentException.class, () -> settings.setTimeOfDay(null));
        assertEquals("02:00", settings.getTimeOfDay());

        settings.setTimeOfDay("23:45");
        assertEquals(23 * 60 + 45, settings.targetMinuteOfDay());
    }

    @Test
    void singleDigitHourIsAccepted() {
        AutoUpdateSettings settings = new AutoUpdateSettings();

        settings.setTimeOfDay("2:00");

        assertEquals(120, settings.targetMinuteOfDay());
        assertThrows(IllegalArgumentException.class, () -> settings.setTimeOfDay("2:0"));
    }

    @Test
    void copyIsIndependent() {
        AutoUpdateSettings settings = new AutoUpdateSettings();
        AutoUpdateSettings copy = settings.copy();
        copy.setEnabled(true);
        copy.setLastAutoCheck(42);

        assertFalse(settings.isEnabled());
        assertEquals(0, settings.getLastAutoCheck());
    }

    @Test
    void neverHasNoPeriod() {
        assertEquals(Optional.empty(), UpdateInterval.NEVER.getPeriod());
        assertEquals(Optional.of(Duration.ofDays(1)), UpdateInterval.DAILY.getPeriod());
        assertEquals(Optional.of(Duration.ofDays(30)), UpdateInterval.MONTHLY.getPeriod());
    }
}
