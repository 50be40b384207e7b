package com.themis.refinery.core.version;

public enum VersionBump {
    MAJOR,
    MINOR,
    PATCH
}
