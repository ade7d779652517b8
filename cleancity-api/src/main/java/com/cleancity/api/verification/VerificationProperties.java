package com.cleancity.api.verification;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "cleancity.verification")
public class VerificationProperties {

    private double maxDistanceMeters = VerificationRules.DEFAULT_MAX_DISTANCE_METERS;
    private int minMinutes = VerificationRules.DEFAULT_MIN_MINUTES;
    private int maxMinutes = VerificationRules.DEFAULT_MAX_MINUTES;

    public double getMaxDistanceMeters() { return maxDistanceMeters; }
    public void setMaxDistanceMeters(double maxDistanceMeters) { this.maxDistanceMeters = maxDistanceMeters; }
    public int getMinMinutes() { return minMinutes; }
    public void setMinMinutes(int minMinutes) { this.minMinutes = minMinutes; }
    public int getMaxMinutes() { return maxMinutes; }
    public void setMaxMinutes(int maxMinutes) { this.maxMinutes = maxMinutes; }
}
