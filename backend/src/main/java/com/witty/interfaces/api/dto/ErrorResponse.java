package com.witty.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
