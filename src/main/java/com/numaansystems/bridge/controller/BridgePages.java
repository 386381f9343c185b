package com.numaansystems.bridge.controller;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Static HTML pages shown in the user's browser.
 *
 * <p>Templates are loaded once from {@code classpath:pages/}. Every substituted
 * value is HTML-escaped.</p>
 */
@Component
public class BridgePages {

    static final String CONFIRMATION_TEMPLATE = "pages/bridge-confirmation.html";
    static final String ERROR_TEMPLATE = "pages/bridge-error.html";

    private final String confirmationPage;
    private final String errorTemplate;

    public BridgePages() {
        this.confirmationPage = load(CONFIRMATION_TEMPLATE);
        this.errorTemplate = load(ERROR_TEMPLATE);
    }

    /**
     * @return the page telling the user to return to the launcher
     */
    public String confirmation() {
        return confirmationPage;
    }

    /**
     * @param title short heading
     * @param message explanation shown under the heading
     * @return the error page
     */
    public String error(String title, String message) {
        return errorTemplate
                .replace("{{title}}", HtmlUtils.htmlEscape(title))
                .replace("{{message}}", HtmlUtils.htmlEscape(message));
    }

    private static String load(String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load page template " + path, e);
        }
    }
}
