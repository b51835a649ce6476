package com.entrainment.validation.dto;

public record DefaultProfileRequest(String name, String experienceLevel) {}
