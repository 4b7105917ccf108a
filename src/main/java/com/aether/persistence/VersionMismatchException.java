package com.aether.persistence;

import java.math.BigInteger;

/**
 * Thrown when a document was written by a newer format version than this build reads.
 */
public class VersionMismatchException extends DocumentFormatException {
    
    private final BigInteger foundVersion;
    private final int supportedVersion;
    
    public VersionMismatchException(BigInteger foundVersion, int supportedVersion) {
        super(String.format("Document schema version %s is newer than the supported version %d",
            foundVersion, supportedVersion));
        this.foundVersion = foundVersion;
        this.supportedVersion = supportedVersion;
    }
    
    public BigInteger getFoundVersion() {
        return foundVersion;
    }
    
    public int getSupportedVersion() {
        return supportedVersion;
    }
}
