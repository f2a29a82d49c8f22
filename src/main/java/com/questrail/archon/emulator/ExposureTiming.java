package com.questrail.archon.emulator;

/**
 * Exposure time as set through the {@code exptime} and {@code longexposure} parameters.
 *
 * @param exposureTime  value of {@code exptime}
 * @param longExposure  {@code true} when {@code exptime} counts seconds, otherwise milliseconds
 */
public record ExposureTiming(long exposureTime, boolean longExposure)
{
    public static final ExposureTiming NONE = new ExposureTiming(0, false);

    public ExposureTiming {
        if (exposureTime < 0) {
            throw new IllegalArgumentException("exposureTime must be >= 0: " + exposureTime);
        }
    }

    public ExposureTiming withExposureTime(long exposureTime) {
        return new ExposureTiming(exposureTime, longExposure);
    }

    public ExposureTiming withLongExposure(boolean longExposure) {
        return new ExposureTiming(exposureTime, longExposure);
    }

    public long exposureMillis() {
        return longExposure ? exposureTime * 1000L : exposureTime;
    }

    public String unit() {
        return longExposure ? "sec" : "msec";
    }
}
