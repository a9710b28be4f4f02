package com.jotter.common.api;

public record MessageResponse(String message) {
}
