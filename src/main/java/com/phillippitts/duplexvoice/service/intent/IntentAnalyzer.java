package com.phillippitts.duplexvoice.service.intent;

import com.phillippitts.duplexvoice.domain.Intent;

/**
 * Converts finalized user text into a structured {@link Intent} (external collaborator).
 */
public interface IntentAnalyzer {

    /**
     * @param text    final transcription text
     * @param context conversation context set on the controller, may be null
     * @return extracted intent; {@code ActionType.UNKNOWN} when nothing matched
     */
    Intent analyze(String text, String context);
}
