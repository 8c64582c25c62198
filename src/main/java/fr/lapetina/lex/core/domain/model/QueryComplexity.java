package fr.lapetina.lex.core.domain.model;

/**
 * Complexity classes a prompt is scored against, from least to most demanding.
 */
public enum QueryComplexity {
    SIMPLE,
    MODERATE,
    COMPLEX,
    CREATIVE
}
