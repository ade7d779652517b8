package com.cleancity.api.points;

import com.cleancity.core.domain.Severity;
import org.springframework.stereotype.Component;

/**
 * Points for one approved report: base, severity bonus, pioneer bonus and streak bonus.
 */
@Component
public class PointsCalculator {

    private final PointsProperties properties;

    public PointsCalculator(PointsProperties properties) {
        this.properties = properties;
    }

    public PointsBreakdown calculate(Severity severity, boolean pioneer, int streakDays) {
        return new PointsBreakdown(
                properties.getBasePoints(),
                severityBonus(severity),
                pioneer ? properties.getPioneerBonus() : 0,
                Math.max(streakDays, 0) * properties.getStreakBonusPerDay());
    }

    public int severityBonus(Severity severity) {
        return switch (Severity.orDefault(severity)) {
            case HIGH -> properties.getHighSeverityBonus();
            case MEDIUM -> properties.getMediumSeverityBonus();
            case LOW -> properties.getLowSeverityBonus();
        };
    }

    public record PointsBreakdown(int basePoints, int severityBonus, int pioneerBonus, int streakBonus) {
        public int total() {
            return basePoints + severityBonus + pioneerBonus + streakBonus;
        }
    }
}
