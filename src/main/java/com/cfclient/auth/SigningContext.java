package com.cfclient.auth;

/**
 * Credentials and time pinning for signed requests. Immutable; owned by a client for its lifetime.
 *
 * @param enabled   when false requests go out unsigned
 * @param key       API key issued by Codeforces
 * @param secret    API secret; never logged
 * @param fixedTime Unix seconds to sign with instead of the clock, or null
 */
public record SigningContext(boolean enabled, String key, String secret, Long fixedTime) {

    private static final SigningContext DISABLED = new SigningContext(false, null, null, null);

    public static SigningContext disabled() {
        return DISABLED;
    }

    public static SigningContext of(String key, String secret) {
        return new SigningContext(true, key, secret, null);
    }

    public SigningContext withFixedTime(Long fixedTime) {
        return new SigningContext(enabled, key, secret, fixedTime);
    }

    @Override
    public String toString() {
        return "SigningContext[enabled=" + enabled + ", key=" + key + ", secret=***, fixedTime=" + fixedTime + "]";
    }
}
