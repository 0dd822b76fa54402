package com.cumulo.controller.rest;

import java.time.Instant;

/**
 * JSON body of every error response. {@code type} is the simple name of the exception behind it, so clients can
 * tell a duplicate fact from a replay conflict without parsing {@code message}.
 */
public record ErrorPayload(Instant timestamp, int status, String error, String type, String message, String path) {}
