/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.proxyplan.api.policy.ClientCertAuthPolicy;
import io.proxyplan.api.policy.ProxySslPolicy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A virtual host: a primary host name, its aliases, its TLS identity and its ordered locations.
 */
public class Server {

    private final String hostname;
    private List<String> aliases = new ArrayList<>();
    private final List<Location> locations = new ArrayList<>();
    private @Nullable SSLCert sslCert;
    private boolean sslPassthrough;
    private @Nullable String sslCiphers;
    private @Nullable String sslPreferServerCiphers;
    private @Nullable String serverSnippet;
    private boolean redirectFromToWWW;
    private ClientCertAuthPolicy certificateAuth = ClientCertAuthPolicy.NONE;
    private @Nullable String authTlsError;
    private ProxySslPolicy proxySsl = ProxySslPolicy.NONE;

    public Server(String hostname) {
        this.hostname = Objects.requireNonNull(hostname);
    }

    public String getHostname() {
        return hostname;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public void setAliases(List<String> aliases) {
        this.aliases = new ArrayList<>(aliases);
    }

    public List<Location> getLocations() {
        return locations;
    }

    /**
     * @return the first location whose path is the root path, if any
     */
    public Optional<Location> rootLocation() {
        return locations.stream().filter(location -> Names.ROOT_LOCATION.equals(location.getPath())).findFirst();
    }

    public @Nullable SSLCert getSslCert() {
        return sslCert;
    }

    public void setSslCert(@Nullable SSLCert sslCert) {
        this.sslCert = sslCert;
    }

    public boolean isSslPassthrough() {
        return sslPassthrough;
    }

    public void setSslPassthrough(boolean sslPassthrough) {
        this.sslPassthrough = sslPassthrough;
    }

    public @Nullable String getSslCiphers() {
        return sslCiphers;
    }

    public void setSslCiphers(@Nullable String sslCiphers) {
        this.sslCiphers = sslCiphers;
    }

    public @Nullable String getSslPreferServerCiphers() {
        return sslPreferServerCiphers;
    }

    public void setSslPreferServerCiphers(@Nullable String sslPreferServerCiphers) {
        this.sslPreferServerCiphers = sslPreferServerCiphers;
    }

    public @Nullable String getServerSnippet() {
        return serverSnippet;
    }

    public void setServerSnippet(@Nullable String serverSnippet) {
        this.serverSnippet = serverSnippet;
    }

    public boolean isRedirectFromToWWW() {
        return redirectFromToWWW;
    }

    public void setRedirectFromToWWW(boolean redirectFromToWWW) {
        this.redirectFromToWWW = redirectFromToWWW;
    }

    public ClientCertAuthPolicy getCertificateAuth() {
        return certificateAuth;
    }

    public void setCertificateAuth(ClientCertAuthPolicy certificateAuth) {
        this.certificateAuth = Objects.requireNonNull(certificateAuth);
    }

    public @Nullable String getAuthTlsError() {
        return authTlsError;
    }

    public void setAuthTlsError(@Nullable String authTlsError) {
        this.authTlsError = authTlsError;
    }

    public ProxySslPolicy getProxySsl() {
        return proxySsl;
    }

    public void setProxySsl(ProxySslPolicy proxySsl) {
        this.proxySsl = Objects.requireNonNull(proxySsl);
    }

    @Override
    public String toString() {
        return "Server[hostname=" + hostname + ", aliases=" + aliases + ", locations=" + locations + "]";
    }
}
