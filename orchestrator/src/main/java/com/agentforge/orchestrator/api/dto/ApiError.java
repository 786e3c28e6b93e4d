package com.agentforge.orchestrator.api.dto;

/** JSON error body: HTTP status code, its reason phrase, and what went wrong. */
public record ApiError(int status, String error, String message) {}
