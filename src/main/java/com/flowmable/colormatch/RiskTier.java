package com.flowmable.colormatch;

/**
 * Environmental capture risk supplied by metadata collaborators (e.g. low sun altitude).
 */
public enum RiskTier {
    LOW,
    MEDIUM,
    HIGH
}
