package com.repstack.model.enums;

/**
 * Where an exercise pool entry came from. The builder normalizes each source through its own adapter.
 */
public enum PoolSource {
    CATALOG,
    REPOSITORY,
    MODEL
}
