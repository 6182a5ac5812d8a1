package com.phillippitts.duplexvoice.service.response;

import com.phillippitts.duplexvoice.domain.Intent;

/**
 * Produces the short phrase the assistant speaks in reply to an intent.
 *
 * <p>Implementations must be deterministic for identical inputs.
 */
@FunctionalInterface
public interface ResponseGenerator {

    /**
     * @param intent          analyzed intent
     * @param defaultLanguage language to use when the intent carries none
     * @return reply text, never null
     */
    String generate(Intent intent, String defaultLanguage);
}
