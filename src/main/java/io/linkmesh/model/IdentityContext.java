package io.linkmesh.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.linkmesh.util.ProtoDurationJson;

import java.time.Duration;

public record IdentityContext(
        String trustDomain,
        String trustAnchorsPem,
        @JsonSerialize(using = ProtoDurationJson.Serializer.class)
        @JsonDeserialize(using = ProtoDurationJson.Deserializer.class)
        Duration issuanceLifetime,
        @JsonSerialize(using = ProtoDurationJson.Serializer.class)
        @JsonDeserialize(using = ProtoDurationJson.Deserializer.class)
        Duration clockSkewAllowance
) {
    public IdentityContext {
        trustDomain = trustDomain == null ? "" : trustDomain;
        trustAnchorsPem = trustAnchorsPem == null ? "" : trustAnchorsPem;
        issuanceLifetime = issuanceLifetime == null ? Duration.ZERO : issuanceLifetime;
        clockSkewAllowance = clockSkewAllowance == null ? Duration.ZERO : clockSkewAllowance;
    }
}
