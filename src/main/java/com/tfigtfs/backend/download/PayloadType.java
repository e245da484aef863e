package com.tfigtfs.backend.download;

/**
 * Shape of the payload handed to a registered callback.
 */
public enum PayloadType {
    NONE,
    BYTES,
    TEXT,
    JSON
}
