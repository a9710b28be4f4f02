package com.jotter.common.exception;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void businessExceptionUsesErrorCodeStatus() {
        ResponseEntity<Map<String, Object>> response = handler.handleBusiness(new BusinessException(ErrorCode.DUPLICATE_IDENTITY));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody())
                .containsEntry("code", "DUPLICATE_IDENTITY")
                .containsEntry("message", "User already exists");
    }

    @Test
    void operationalFailuresMapToGatewayAndUnavailable() {
        assertThat(handler.handleBusiness(new BusinessException(ErrorCode.DELIVERY_FAILED, new IllegalStateException("smtp")))
                .getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(handler.handleBusiness(new BusinessException(ErrorCode.STORE_UNAVAILABLE, new IllegalStateException("db")))
                .getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(handler.handleBusiness(new BusinessException(ErrorCode.STORE_UNAVAILABLE)).getBody())
                .containsEntry("message", "Storage temporarily unavailable, please retry later");
        assertThat(handler.handleBusiness(new BusinessException(ErrorCode.VALIDATION_FAILED)).getBody())
                .containsEntry("message", "Invalid request");
    }

    @Test
    void customMessageIsReturned() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleBusiness(new BusinessException(ErrorCode.VALIDATION_FAILED, "email: must not be blank"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("message", "email: must not be blank");
    }

    @Test
    void unsupportedContentTypeIsValidationFailure() {
        ResponseEntity<Map<String, Object>> response = handler.handleMediaType(
                new HttpMediaTypeNotSupportedException(MediaType.TEXT_PLAIN, List.of(MediaType.APPLICATION_JSON)));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("code", "VALIDATION_FAILED");
    }

    @Test
    void unsupportedMethodIsMethodNotAllowed() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleMethod(new HttpRequestMethodNotSupportedException("PUT"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
        assertThat(response.getBody()).containsEntry("code", "METHOD_NOT_ALLOWED");
    }

    @Test
    void unknownPathIsNotFound() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleNoResource(new NoResourceFoundException(HttpMethod.GET, "api/unknown"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).containsEntry("code", "RESOURCE_NOT_FOUND");
    }

    @Test
    void unexpectedExceptionIsInternalError() {
        ResponseEntity<Map<String, Object>> response = handler.handleGeneric(new IllegalStateException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("code", "INTERNAL_ERROR");
    }
}
