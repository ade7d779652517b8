package com.cleancity.api.points;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "cleancity.points")
public class PointsProperties {

    private int basePoints = 10;
    private int highSeverityBonus = 5;
    private int mediumSeverityBonus = 2;
    private int lowSeverityBonus = 0;
    private int pioneerBonus = 20;
    private double pioneerRadiusMeters = 500;
    private int streakBonusPerDay = 5;
    private Reconciliation reconciliation = new Reconciliation();

    public int getBasePoints() { return basePoints; }
    public void setBasePoints(int basePoints) { this.basePoints = basePoints; }
    public int getHighSeverityBonus() { return highSeverityBonus; }
    public void setHighSeverityBonus(int bonus) { this.highSeverityBonus = bonus; }
    public int getMediumSeverityBonus() { return mediumSeverityBonus; }
    public void setMediumSeverityBonus(int bonus) { this.mediumSeverityBonus = bonus; }
    public int getLowSeverityBonus() { return lowSeverityBonus; }
    public void setLowSeverityBonus(int bonus) { this.lowSeverityBonus = bonus; }
    public int getPioneerBonus() { return pioneerBonus; }
    public void setPioneerBonus(int pioneerBonus) { this.pioneerBonus = pioneerBonus; }
    public double getPioneerRadiusMeters() { return pioneerRadiusMeters; }
    public void setPioneerRadiusMeters(double meters) { this.pioneerRadiusMeters = meters; }
    public int getStreakBonusPerDay() { return streakBonusPerDay; }
    public void setStreakBonusPerDay(int bonus) { this.streakBonusPerDay = bonus; }
    public Reconciliation getReconciliation() { return reconciliation; }
    public void setReconciliation(Reconciliation reconciliation) { this.reconciliation = reconciliation; }

    public static class Reconciliation {
        private int maxAttempts = 5;
        private Duration retryDelay = Duration.ofMinutes(1);
        private int batchSize = 50;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getRetryDelay() { return retryDelay; }
        public void setRetryDelay(Duration retryDelay) { this.retryDelay = retryDelay; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    }
}
