package com.pricelens.backend.model;

/**
 * Model-side facts copied onto every evidence record.
 */
public record ModelMetadata(
        String modelVersion,
        double confidenceScore
) {}
