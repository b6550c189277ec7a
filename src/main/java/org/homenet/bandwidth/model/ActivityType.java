package org.homenet.bandwidth.model;

/**
 * What a device is currently doing on the network.
 * Each activity carries a display name and the multiplier the allocator
 * applies to the device's priority when ranking it.
 */
public enum ActivityType {
    STREAMING("Streaming", 1.2),
    GAMING("Gaming", 1.3),
    WEB_BROWSING("Web Browsing", 0.8),
    VIDEO_CALL("Video Call", 1.5),
    DOWNLOAD("Download", 1.0),
    UPLOAD("Upload", 1.0),
    IOT_COMMUNICATION("IoT Communication", 0.5);

    /** Multiplier used when a device reports no known activity. */
    public static final double DEFAULT_MULTIPLIER = 1.0;

    private final String displayName;
    private final double multiplier;

    ActivityType(String displayName, double multiplier) {
        this.displayName = displayName;
        this.multiplier = multiplier;
    }

    public String getDisplayName() {
        return displayName;
    }

    public double getMultiplier() {
        return multiplier;
    }

    /**
     * Multiplier for a possibly unknown activity.
     */
    public static double multiplierOf(ActivityType activity) {
        return activity != null ? activity.multiplier : DEFAULT_MULTIPLIER;
    }

    /**
     * Resolve an activity from its display name ("Video Call") or constant
     * name ("VIDEO_CALL"), ignoring case and surrounding whitespace.
     *
     * @return the activity, or null when the name is not recognised
     */
    public static ActivityType fromName(String name) {
        if (name == null) return null;
        String trimmed = name.trim();
        for (ActivityType type : values()) {
            if (type.displayName.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
