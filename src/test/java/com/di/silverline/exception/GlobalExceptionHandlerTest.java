package com.di.silverline.exception;

import com.di.silverline.util.MdcPropagation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Invalid strategy should be a 400 listing problems per table")
    void testInvalidStrategy() {
        InvalidStrategyException e = new InvalidStrategyException(Map.of("piezas_1", List.of("upsert_scd1 requires key_columns")));

        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response = handler.handleInvalidStrategy(e);

        assertEquals(400, response.getStatusCode().value());
        GlobalExceptionHandler.ErrorResponse body = response.getBody();
        assertNotNull(body);
        assertEquals("INVALID_STRATEGY", body.getErrorKind());
        assertEquals(e.getProblemsByTable(), body.getDetails().get("problemsByTable"));
    }

    @Test
    @DisplayName("Bad input should be a 400")
    void testBadRequest() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
                handler.handleBadRequest(new IllegalArgumentException("bad date"));

        assertEquals(400, response.getStatusCode().value());
        assertEquals("bad date", response.getBody().getMessage());
        assertEquals("Bad Request", response.getBody().getError());
    }

    @Test
    @DisplayName("Unexpected errors should be a 500 carrying the kind and run id")
    void testUnexpected() {
        MDC.put(MdcPropagation.RUN_ID, "run-7");

        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
                handler.handleUnexpected(new WarehouseException("dataset not found"));

        assertEquals(500, response.getStatusCode().value());
        assertEquals("WAREHOUSE_ERROR", response.getBody().getErrorKind());
        assertEquals("run-7", response.getBody().getRunId());
        assertEquals(WarehouseException.class.getName(), response.getBody().getDetails().get("exceptionType"));
    }
}
