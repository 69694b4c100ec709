package com.ukdataalerts.coronavirus.model;

/**
 * How far back from the newest published date the comparison windows end.
 *
 * Recent days are revised upwards for a while after first publication, so
 * VERIFIED mode ignores the last {@link #VERIFIED_LAG_DAYS} days.
 */
public enum VerificationMode {
    VERIFIED,
    UNVERIFIED;

    public static final int VERIFIED_LAG_DAYS = 4;

    public int lagDays() {
        return this == VERIFIED ? VERIFIED_LAG_DAYS : 0;
    }
}
