package com.clinicsync.client.http;

import com.clinicsync.client.queue.CommandExecutor;
import com.clinicsync.client.session.CredentialProvider;
import com.clinicsync.core.error.AuthException;
import com.clinicsync.core.error.TransientNetworkException;
import com.clinicsync.core.model.MutationCommand;
import com.clinicsync.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

/**
 * Generic executor submitting a command as {@code POST {apiBaseUrl}/{commandType}} with the
 * command arguments as JSON body.
 * <p>
 * 2xx completes; 401/403 fails with {@link AuthException}; anything else fails with
 * {@link TransientNetworkException}. The queue treats every failure the same way.
 * </p>
 */
public class HttpCommandExecutor implements CommandExecutor {
    private static final Logger log = LoggerFactory.getLogger(HttpCommandExecutor.class);

    static final String CLIENT_TYPE_HEADER = "X-Client-Type";
    static final String CLIENT_TYPE = "offline-sync";

    private final HttpClient httpClient;
    private final String apiBaseUrl;
    private final CredentialProvider credentials;

    public HttpCommandExecutor(HttpClient httpClient, String apiBaseUrl, CredentialProvider credentials) {
        this.httpClient = httpClient;
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.credentials = credentials;
    }

    @Override
    public Mono<Void> execute(MutationCommand command) {
        String uri = apiBaseUrl + "/" + command.getCommandType();
        String body = JsonUtils.writeValueAsString(command.getArguments());

        return credentials.currentToken()
            .defaultIfEmpty("")
            .flatMap(token -> httpClient
                .headers(headers -> {
                    headers.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
                    headers.set(CLIENT_TYPE_HEADER, CLIENT_TYPE);
                    if (!token.isEmpty()) {
                        headers.set(HttpHeaderNames.AUTHORIZATION, "Bearer " + token);
                    }
                })
                .post()
                .uri(uri)
                .send(ByteBufFlux.fromString(Mono.just(body)))
                .responseSingle((response, content) -> content.asString()
                    .defaultIfEmpty("")
                    .map(text -> new Reply(response.status().code(), text))))
            .<Void>flatMap(reply -> {
                int status = reply.status;
                if (status >= 200 && status < 300) {
                    log.debug("{} -> {}", uri, status);
                    return Mono.empty();
                }
                if (status == 401 || status == 403) {
                    return Mono.error(new AuthException("Submission to " + uri + " rejected with " + status, status));
                }
                return Mono.error(new TransientNetworkException(
                    "Submission to " + uri + " failed with " + status + ": " + abbreviate(reply.body)));
            })
            .onErrorMap(err -> !(err instanceof AuthException) && !(err instanceof TransientNetworkException),
                err -> new TransientNetworkException("Submission to " + uri + " failed: " + err.getMessage(), err));
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }

    private record Reply(int status, String body) {
    }
}
