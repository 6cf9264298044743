package com.cfclient.auth;

import com.cfclient.endpoint.ApiMethod;
import com.cfclient.endpoint.QueryStrings;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntSupplier;
import java.util.regex.Pattern;

/**
 * Adds apiKey, time and apiSig to a built URL.
 * <p>
 * Parameters are re-sorted by key and re-encoded canonically, then
 * {@code sha512("{rand6}/{method}?apiKey={key}&{query}&time={time}#{secret}")} is appended as
 * {@code apiSig={rand6}{hex}}. Clock and nonce are injectable so signatures are reproducible in tests.
 */
public final class RequestSigner {

    static final int NONCE_MIN = 111111;
    static final int NONCE_MAX = 999999;

    private static final Pattern API_SIG = Pattern.compile("apiSig=[^&]*");

    private final String apiRoot;
    private final SigningContext context;
    private final Clock clock;
    private final IntSupplier nonceSource;

    public RequestSigner(String apiRoot, SigningContext context) {
        this(apiRoot, context, Clock.systemUTC(), randomNonce());
    }

    public RequestSigner(String apiRoot, SigningContext context, Clock clock, IntSupplier nonceSource) {
        this.apiRoot = apiRoot;
        this.context = context == null ? SigningContext.disabled() : context;
        this.clock = clock;
        this.nonceSource = nonceSource;
        if (this.context.enabled() && (isBlank(this.context.key()) || isBlank(this.context.secret()))) {
            throw new IllegalStateException("Request signing is enabled but API key or secret is missing");
        }
    }

    /**
     * Uniform nonce in [111111, 999999].
     */
    public static IntSupplier randomNonce() {
        return () -> ThreadLocalRandom.current().nextInt(NONCE_MIN, NONCE_MAX + 1);
    }

    public boolean isEnabled() {
        return context.enabled();
    }

    /**
     * Returns the url unchanged when signing is disabled, otherwise the signed url.
     *
     * @throws IllegalArgumentException when the url does not belong to the given method under this api root
     */
    public String sign(String url, ApiMethod method) {
        if (!context.enabled()) {
            return url;
        }
        long time = context.fixedTime() != null ? context.fixedTime() : clock.instant().getEpochSecond();
        return sign(url, method, time, nonceSource.getAsInt());
    }

    String sign(String url, ApiMethod method, long time, int nonce) {
        String query = canonicalQuery(stripPrefix(url, method));
        String methodName = method.wireName();
        String signingInput = nonce + "/" + methodName + "?"
                + withCredentials(query, time)
                + "#" + context.secret();
        String digest = sha512Hex(signingInput);
        String head = query.isEmpty() ? "" : query + "&";
        return apiRoot + "/" + methodName + "?" + head
                + "apiKey=" + QueryStrings.encode(context.key())
                + "&time=" + time
                + "&apiSig=" + nonce + digest;
    }

    private String withCredentials(String query, long time) {
        String middle = query.isEmpty() ? "" : query + "&";
        return "apiKey=" + context.key() + "&" + middle + "time=" + time;
    }

    private String stripPrefix(String url, ApiMethod method) {
        String path = apiRoot + "/" + method.wireName();
        if (!url.startsWith(path)) {
            throw new IllegalArgumentException("URL is not a " + method.wireName() + " endpoint under " + apiRoot);
        }
        String rest = url.substring(path.length());
        if (rest.isEmpty()) {
            return "";
        }
        if (rest.charAt(0) != '?') {
            throw new IllegalArgumentException("URL is not a " + method.wireName() + " endpoint under " + apiRoot);
        }
        return rest.substring(1);
    }

    static String canonicalQuery(String rawQuery) {
        Map<String, String> sorted = new TreeMap<>(QueryStrings.parse(rawQuery));
        return QueryStrings.join(sorted);
    }

    static String sha512Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-512");
            byte[] raw = md.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(raw.length * 2);
            for (byte b : raw) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 not available", e);
        }
    }

    /**
     * Masks the apiSig value so signed urls can be logged.
     */
    public static String redact(String url) {
        return API_SIG.matcher(url).replaceAll("apiSig=***");
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
