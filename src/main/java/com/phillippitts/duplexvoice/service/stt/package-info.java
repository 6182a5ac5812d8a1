/**
 * Speech-to-Text boundary. Recognition itself is out of scope for this project; embedding
 * applications supply a {@link com.phillippitts.duplexvoice.service.stt.SpeechRecognizer}.
 */
package com.phillippitts.duplexvoice.service.stt;
