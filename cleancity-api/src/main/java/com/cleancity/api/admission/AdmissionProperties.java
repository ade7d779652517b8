package com.cleancity.api.admission;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Quotas and freshness rules for report submission.
 */
@Configuration
@ConfigurationProperties(prefix = "cleancity.admission")
public class AdmissionProperties {

    private int maxReportsPerDay = 10;
    private Duration cooldown = Duration.ofMinutes(5);
    private Duration maxPhotoAge = Duration.ofMinutes(5);
    private double duplicateRadiusMeters = 50;
    private Duration duplicateWindow = Duration.ofHours(24);
    private int maxDescriptionLength = 50;
    private int minDeviceIdLength = 16;
    private int maxDeviceIdLength = 128;
    private ZoneId calendarZone = ZoneId.of("UTC");

    public int getMaxReportsPerDay() { return maxReportsPerDay; }
    public void setMaxReportsPerDay(int maxReportsPerDay) { this.maxReportsPerDay = maxReportsPerDay; }
    public Duration getCooldown() { return cooldown; }
    public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }
    public Duration getMaxPhotoAge() { return maxPhotoAge; }
    public void setMaxPhotoAge(Duration maxPhotoAge) { this.maxPhotoAge = maxPhotoAge; }
    public double getDuplicateRadiusMeters() { return duplicateRadiusMeters; }
    public void setDuplicateRadiusMeters(double meters) { this.duplicateRadiusMeters = meters; }
    public Duration getDuplicateWindow() { return duplicateWindow; }
    public void setDuplicateWindow(Duration duplicateWindow) { this.duplicateWindow = duplicateWindow; }
    public int getMaxDescriptionLength() { return maxDescriptionLength; }
    public void setMaxDescriptionLength(int length) { this.maxDescriptionLength = length; }
    public int getMinDeviceIdLength() { return minDeviceIdLength; }
    public void setMinDeviceIdLength(int length) { this.minDeviceIdLength = length; }
    public int getMaxDeviceIdLength() { return maxDeviceIdLength; }
    public void setMaxDeviceIdLength(int length) { this.maxDeviceIdLength = length; }
    public ZoneId getCalendarZone() { return calendarZone; }
    public void setCalendarZone(ZoneId calendarZone) { this.calendarZone = calendarZone; }
}
