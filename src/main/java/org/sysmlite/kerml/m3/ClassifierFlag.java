package org.sysmlite.kerml.m3;

/**
 * Classifier families a type (or the types of a feature) belong to. Used by
 * implicit supertype selection and by specialization validation.
 */
public enum ClassifierFlag {
    DATA_TYPE,
    CLASS,
    STRUCTURE,
    ASSOCIATION
}
