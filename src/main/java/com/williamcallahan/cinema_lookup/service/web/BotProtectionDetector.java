package com.williamcallahan.cinema_lookup.service.web;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Recognizes bot challenge pages by their DOM structure.
 *
 * Only challenge widgets, challenge forms and challenge scripts count; a results page that merely
 * mentions "captcha" or "robot" in its text is not flagged.
 */
@Component
public class BotProtectionDetector {

    private static final Map<String, String> SIGNATURES = new LinkedHashMap<>();

    static {
        SIGNATURES.put("cloudflare-challenge-form", "form#challenge-form, form[action*=__cf_chl]");
        SIGNATURES.put("cloudflare-challenge-page", "#cf-challenge-running, #challenge-running, #cf-wrapper #cf-error-details");
        SIGNATURES.put("cloudflare-turnstile", "div.cf-turnstile, script[src*=challenges.cloudflare.com]");
        SIGNATURES.put("recaptcha", "div.g-recaptcha, iframe[src*=recaptcha/api], script[src*=recaptcha/api.js]");
        SIGNATURES.put("hcaptcha", "div.h-captcha, iframe[src*=hcaptcha.com], script[src*=hcaptcha.com]");
        SIGNATURES.put("startpage-captcha", "form[action*=/sp/captcha], form[action*=captcha] input[name=captcha]");
        SIGNATURES.put("duckduckgo-anomaly", "div.anomaly-modal__modal, form[action*=/anomaly.js], #challenge-form.anomaly");
    }

    /**
     * @return the name of the first matching challenge signature, empty for a normal page
     */
    public Optional<String> detect(Document document) {
        for (Map.Entry<String, String> signature : SIGNATURES.entrySet()) {
            if (!document.select(signature.getValue()).isEmpty()) {
                return Optional.of(signature.getKey());
            }
        }
        return Optional.empty();
    }

    public Optional<String> detect(String html) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        return detect(Jsoup.parse(html));
    }
}
