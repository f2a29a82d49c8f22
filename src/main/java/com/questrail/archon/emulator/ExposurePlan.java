package com.questrail.archon.emulator;

/**
 * Everything one run of the {@link ExposureSequencer} needs, fixed when the run starts.
 *
 * @param exposures         number of exposures requested through the expose parameter
 * @param framesPerExposure frames read out per exposure
 * @param exposureMillis    wait before each readout
 * @param readoutMillis     nominal readout time; rows take 90 % of it in total
 * @param width             pixels per line reported for each frame
 * @param height            lines per frame
 */
public record ExposurePlan(
        int exposures,
        int framesPerExposure,
        long exposureMillis,
        long readoutMillis,
        int width,
        int height
) {
    public ExposurePlan {
        if (exposures <= 0) {
            throw new IllegalArgumentException("exposures must be > 0: " + exposures);
        }
        if (framesPerExposure <= 0) {
            throw new IllegalArgumentException("framesPerExposure must be > 0: " + framesPerExposure);
        }
        if (exposureMillis < 0 || readoutMillis < 0) {
            throw new IllegalArgumentException("times must be >= 0");
        }
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("image size must be >= 0");
        }
    }

    /**
     * Time per row: 90 % of the readout time spread over the lines.
     */
    public long rowNanos() {
        if (height == 0) {
            return 0L;
        }
        return (long) (readoutMillis * 1_000_000L * 0.9 / height);
    }
}
