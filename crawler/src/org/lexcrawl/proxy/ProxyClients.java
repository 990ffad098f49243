package org.lexcrawl.proxy;

import org.jetbrains.annotations.Nullable;

import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * One {@link HttpClient} per proxy endpoint, routed through that proxy and authenticated with the credentials
 * its {@code credentialsRef} names.
 */
public class ProxyClients {
    private final Map<Long, HttpClient> clients = new ConcurrentHashMap<>();
    private final Function<String, String> env;
    private final Duration connectTimeout;

    public ProxyClients(Function<String, String> env, Duration connectTimeout) {
        this.env = env;
        this.connectTimeout = connectTimeout;
    }

    public HttpClient get(ProxyEndpoint endpoint) {
        return clients.computeIfAbsent(endpoint.id(), id -> build(endpoint));
    }

    HttpClient build(ProxyEndpoint endpoint) {
        var builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (!endpoint.isDirect()) {
            builder.proxy(ProxySelector.of(new InetSocketAddress(endpoint.address(), endpoint.port())));
            PasswordAuthentication credentials = credentials(endpoint.credentialsRef());
            if (credentials != null) {
                builder.authenticator(new Authenticator() {
                    @Override
                    protected PasswordAuthentication getPasswordAuthentication() {
                        return getRequestorType() == RequestorType.PROXY ? credentials : null;
                    }
                });
            }
        }
        return builder.build();
    }

    /**
     * Reads {@code user:password} from the environment variable named by {@code credentialsRef}.
     *
     * @throws IllegalStateException if the variable is unset or malformed
     */
    @Nullable PasswordAuthentication credentials(@Nullable String credentialsRef) {
        if (credentialsRef == null || credentialsRef.isBlank()) return null;
        String value = env.apply(credentialsRef);
        if (value == null) throw new IllegalStateException("Environment variable " + credentialsRef + " is not set");
        int colon = value.indexOf(':');
        if (colon < 0) throw new IllegalStateException("Environment variable " + credentialsRef
                                                       + " must have the form user:password");
        return new PasswordAuthentication(value.substring(0, colon), value.substring(colon + 1).toCharArray());
    }
}
