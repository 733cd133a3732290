package org.tenantwarehouse.controllers;

import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.exceptions.PipelineExecutionException;
import org.tenantwarehouse.exceptions.PipelineNotFoundException;
import org.tenantwarehouse.exceptions.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;

final class ErrorResponses {

    private ErrorResponses() {
    }

    static ResponseEntity<Map<String, Object>> from(Exception e) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("success", false);
        errorResponse.put("error", e.getMessage());
        if (e instanceof PipelineExecutionException failed) {
            errorResponse.put("result", failed.getJobResult());
        }
        return ResponseEntity.status(statusFor(e)).body(errorResponse);
    }

    static HttpStatus statusFor(Exception e) {
        if (e instanceof ConfigurationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof PipelineNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof QueryTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
