package org.brown.coderunner.docker;

public enum FilesystemPolicy {
    READONLY,
    READWRITE
}
