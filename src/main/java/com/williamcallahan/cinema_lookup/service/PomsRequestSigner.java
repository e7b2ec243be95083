package com.williamcallahan.cinema_lookup.service;

import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.model.Credentials;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the NPO HMAC authentication headers for POMS API requests.
 *
 * The signed message is {@code origin:{origin},x-npo-date:{date},uri:/v1/api/{path}} followed by
 * {@code ,{name}:{value}} for every query parameter in name order, except {@code iecomp}.
 */
@Component
public class PomsRequestSigner {

    static final DateTimeFormatter NPO_DATE_FORMAT =
        DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String UNSIGNED_PARAMETER = "iecomp";

    private final String origin;

    @Autowired
    public PomsRequestSigner(AppConfigurationProperties properties) {
        this(properties.getPrimary().getOrigin());
    }

    PomsRequestSigner(String origin) {
        this.origin = origin;
    }

    /**
     * Headers for one signed request, in the order the API documents them
     *
     * @param credentials key pair to sign with
     * @param path API path relative to /v1/api/, e.g. "pages/"
     * @param params query parameters that will be sent with the request
     * @param now request timestamp
     */
    public Map<String, String> headers(Credentials credentials, String path, Map<String, String> params, Instant now) {
        String npoDate = NPO_DATE_FORMAT.format(now);
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        headers.put(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        headers.put(HttpHeaders.ORIGIN, origin);
        headers.put("x-npo-date", npoDate);
        headers.put(HttpHeaders.AUTHORIZATION,
            "NPO " + credentials.apiKey() + ":" + signature(credentials.apiSecret(), npoDate, path, params));
        return headers;
    }

    String signature(String secret, String npoDate, String path, Map<String, String> params) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(message(npoDate, path, params).getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    String message(String npoDate, String path, Map<String, String> params) {
        String cleanPath = path.contains("?") ? path.substring(0, path.indexOf('?')) : path;
        StringBuilder message = new StringBuilder()
            .append("origin:").append(origin)
            .append(",x-npo-date:").append(npoDate)
            .append(",uri:/v1/api/").append(cleanPath);
        if (params != null) {
            new TreeMap<>(params).forEach((name, value) -> {
                if (!UNSIGNED_PARAMETER.equals(name)) {
                    message.append(',').append(name).append(':').append(value);
                }
            });
        }
        return message.toString();
    }
}
