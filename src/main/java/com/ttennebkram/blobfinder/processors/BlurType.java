package com.ttennebkram.blobfinder.processors;

/**
 * The closed set of smoothing kernels supported by {@link BlurProcessor}.
 */
public enum BlurType {
    BOX("Box Blur"),
    GAUSSIAN("Gaussian Blur"),
    MEDIAN("Median Filter"),
    BILATERAL("Bilateral Filter");

    private final String displayName;

    BlurType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Look up a blur type by display name ("Gaussian Blur") or constant name ("GAUSSIAN").
     *
     * @throws IllegalArgumentException if the name matches no blur type
     */
    public static BlurType fromName(String name) {
        if (name != null) {
            for (BlurType type : values()) {
                if (type.displayName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown blur type: " + name);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
