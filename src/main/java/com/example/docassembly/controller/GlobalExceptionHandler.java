package com.example.docassembly.controller;

import com.example.docassembly.exception.AssemblyException;
import com.example.docassembly.exception.ConflictingBlockException;
import com.example.docassembly.exception.EmptyLineGeometryException;
import com.example.docassembly.exception.InvalidGeometryException;
import com.example.docassembly.exception.InvalidRegionException;
import com.example.docassembly.exception.NonTextLineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AssemblyException.class)
    public ResponseEntity<Map<String, Object>> handleAssembly(AssemblyException ex) {
        logger.warn("Assembly rejected ({}): {}", ex.getErrorCode(), ex.getMessage());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.getErrorCode());
        body.put("message", ex.getMessage());
        body.put("pageIndex", ex.getPageIndex());

        if (ex instanceof EmptyLineGeometryException) {
            body.put("lineIndex", ((EmptyLineGeometryException) ex).getLineIndex());
        } else if (ex instanceof InvalidGeometryException) {
            InvalidGeometryException geometry = (InvalidGeometryException) ex;
            if (geometry.getLineIndex() != null) {
                body.put("lineIndex", geometry.getLineIndex());
            }
            if (geometry.getRegionId() != null) {
                body.put("regionId", geometry.getRegionId());
            }
        } else if (ex instanceof ConflictingBlockException) {
            body.put("regionId", ((ConflictingBlockException) ex).getRegionId());
        } else if (ex instanceof NonTextLineException) {
            body.put("regionId", ((NonTextLineException) ex).getRegionId());
        } else if (ex instanceof InvalidRegionException) {
            body.put("regionIndex", ((InvalidRegionException) ex).getRegionIndex());
        }

        return new ResponseEntity<>(body, HttpStatus.UNPROCESSABLE_ENTITY);
    }
}
