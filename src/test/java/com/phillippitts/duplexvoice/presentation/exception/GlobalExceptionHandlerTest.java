package com.phillippitts.duplexvoice.presentation.exception;

import com.phillippitts.duplexvoice.exception.ControllerConfigurationException;
import com.phillippitts.duplexvoice.exception.DuplexVoiceException;
import com.phillippitts.duplexvoice.exception.SynthesisException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void configurationErrorsMapToConflict() {
        ResponseEntity<GlobalExceptionHandler.ApiError> res =
                handler.handleConfiguration(new ControllerConfigurationException("No duplex session is running"));

        assertThat(res.getStatusCode().value()).isEqualTo(409);
        assertThat(res.getBody()).isNotNull();
        assertThat(res.getBody().errorCode()).isEqualTo("ControllerConfigurationException");
        assertThat(res.getBody().details()).isEqualTo("No duplex session is running");
        assertThat(res.getBody().timestamp()).isNotNull();
    }

    @Test
    void duplexFailuresMapToServiceUnavailable() {
        ResponseEntity<GlobalExceptionHandler.ApiError> res =
                handler.handleDuplexFailure(new DuplexVoiceException("Too many event stream clients"));

        assertThat(res.getStatusCode().value()).isEqualTo(503);
        assertThat(res.getBody().toString()).contains("DuplexVoiceException");
        assertThat(res.getBody().details()).contains("retry");
    }

    @Test
    void subclassNameIsReportedAsErrorCode() {
        ResponseEntity<GlobalExceptionHandler.ApiError> res =
                handler.handleDuplexFailure(new SynthesisException("engine crashed"));

        assertThat(res.getBody().errorCode()).isEqualTo("SynthesisException");
        assertThat(res.getBody().toString()).doesNotContain("engine crashed");
    }

    @Test
    void unexpectedErrorsMapToInternalServerError() {
        ResponseEntity<GlobalExceptionHandler.ApiError> res =
                handler.handleUnexpected(new IllegalStateException("secret internals"));

        assertThat(res.getStatusCode().value()).isEqualTo(500);
        assertThat(res.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(res.getBody().toString()).doesNotContain("secret internals");
    }
}
