package com.proveground.matchengine.exception;

/**
 * Schedule input rejected at the write boundary: overlapping blocks,
 * inverted time or date ranges, out-of-range hours.
 */
public class ScheduleValidationException extends BadRequestException {

    public ScheduleValidationException(String message) {
        super(message);
    }
}
