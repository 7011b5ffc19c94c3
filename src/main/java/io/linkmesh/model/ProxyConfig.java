package io.linkmesh.model;

import java.util.List;

public record ProxyConfig(
        Image proxyImage,
        Image proxyInitImage,
        Port controlPort,
        Port inboundPort,
        Port adminPort,
        Port outboundPort,
        List<Port> ignoreInboundPorts,
        List<Port> ignoreOutboundPorts,
        long proxyUid,
        LogLevel logLevel,
        boolean disableExternalProfiles,
        String proxyVersion
) {
    public ProxyConfig {
        ignoreInboundPorts = ignoreInboundPorts == null ? List.of() : List.copyOf(ignoreInboundPorts);
        ignoreOutboundPorts = ignoreOutboundPorts == null ? List.of() : List.copyOf(ignoreOutboundPorts);
        proxyVersion = proxyVersion == null ? "" : proxyVersion;
    }

    public ProxyConfig withOverrides(String pullPolicy, String newLogLevel, long newProxyUid, String newProxyVersion) {
        return new ProxyConfig(
                proxyImage == null ? null : proxyImage.withPullPolicy(pullPolicy),
                proxyInitImage == null ? null : proxyInitImage.withPullPolicy(pullPolicy),
                controlPort,
                inboundPort,
                adminPort,
                outboundPort,
                ignoreInboundPorts,
                ignoreOutboundPorts,
                newProxyUid,
                new LogLevel(newLogLevel),
                disableExternalProfiles,
                newProxyVersion
        );
    }

    public record Image(String imageName, String pullPolicy) {
        public Image withPullPolicy(String value) {
            return new Image(imageName, value);
        }
    }

    public record Port(int port) {
    }

    public record LogLevel(String level) {
    }
}
