package io.linkmesh.upgrade;

public enum ErrorKind {
    FETCH,
    MALFORMED_TRUST_ANCHORS,
    MALFORMED_ISSUER_CREDENTIAL,
    INVALID_ISSUER_CREDENTIAL,
    GENERATION,
    FLAGS,
    RENDER
}
