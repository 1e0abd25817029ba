package com.libragraph.depot.core.version;

public record CountResult(long count) {
}
