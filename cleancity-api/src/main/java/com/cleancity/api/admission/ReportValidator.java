package com.cleancity.api.admission;

import com.cleancity.api.error.ValidationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Field-level checks for a submission. Each method throws {@link ValidationException}
 * naming the offending field.
 */
@Component
public class ReportValidator {

    private static final Pattern DEVICE_ID = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final int MAX_AREA_LENGTH = 100;
    private static final int MAX_WASTE_TYPE_LENGTH = 50;
    private static final int MAX_PHOTO_URL_LENGTH = 2048;

    private final AdmissionProperties properties;

    public ReportValidator(AdmissionProperties properties) {
        this.properties = properties;
    }

    public void validateDeviceId(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new ValidationException("deviceId", "Device ID is required");
        }
        if (deviceId.length() < properties.getMinDeviceIdLength()
                || deviceId.length() > properties.getMaxDeviceIdLength()) {
            throw new ValidationException("deviceId", "Device ID must be between "
                    + properties.getMinDeviceIdLength() + " and " + properties.getMaxDeviceIdLength()
                    + " characters");
        }
        if (!DEVICE_ID.matcher(deviceId).matches()) {
            throw new ValidationException("deviceId", "Device ID contains invalid characters");
        }
    }

    public void requireCapturedAt(Instant capturedAt, Instant now) {
        if (capturedAt == null) {
            throw new ValidationException("timestamp", "Photo timestamp is required");
        }
        if (capturedAt.isAfter(now)) {
            throw new ValidationException("timestamp", "Photo timestamp is in the future");
        }
    }

    public boolean hasValidCoordinates(Double latitude, Double longitude) {
        return latitude != null && longitude != null
                && Double.isFinite(latitude) && latitude >= -90 && latitude <= 90
                && Double.isFinite(longitude) && longitude >= -180 && longitude <= 180;
    }

    public void validateFields(ReportSubmission submission) {
        if (submission.latitude() == null || !Double.isFinite(submission.latitude())
                || submission.latitude() < -90 || submission.latitude() > 90) {
            throw new ValidationException("latitude", "Latitude must be between -90 and 90");
        }
        if (submission.longitude() == null || !Double.isFinite(submission.longitude())
                || submission.longitude() < -180 || submission.longitude() > 180) {
            throw new ValidationException("longitude", "Longitude must be between -180 and 180");
        }
        if (submission.accuracy() != null
                && (!Double.isFinite(submission.accuracy()) || submission.accuracy() < 0)) {
            throw new ValidationException("accuracy", "Accuracy must be a non-negative number");
        }
        if (submission.photoUrl() == null || submission.photoUrl().isBlank()) {
            throw new ValidationException("photoUrl", "Photo is required");
        }
        if (submission.photoUrl().length() > MAX_PHOTO_URL_LENGTH) {
            throw new ValidationException("photoUrl", "Photo URL is too long");
        }
        String description = normalizeDescription(submission.description());
        if (description != null && description.length() > properties.getMaxDescriptionLength()) {
            throw new ValidationException("description",
                    "Description must be at most " + properties.getMaxDescriptionLength() + " characters");
        }
        if (submission.area() != null && submission.area().trim().length() > MAX_AREA_LENGTH) {
            throw new ValidationException("area", "Area must be at most " + MAX_AREA_LENGTH + " characters");
        }
        if (submission.wasteTypes() != null) {
            for (String type : submission.wasteTypes()) {
                if (type == null || type.isBlank() || type.length() > MAX_WASTE_TYPE_LENGTH) {
                    throw new ValidationException("wasteTypes", "Invalid waste type");
                }
            }
        }
    }

    /**
     * Trimmed description, or null when absent or blank.
     */
    public static String normalizeDescription(String description) {
        if (description == null) {
            return null;
        }
        String trimmed = description.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
