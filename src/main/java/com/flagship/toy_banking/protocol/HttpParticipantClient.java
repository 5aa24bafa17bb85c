package com.flagship.toy_banking.protocol;

import com.flagship.toy_banking.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * WebClient-based ParticipantClient posting to {@code {baseUrl}/protocol/messages}.
 *
 * Not a Spring @Component; registered in {@link com.flagship.toy_banking.config.ClientConfig}.
 */
@Slf4j
public class HttpParticipantClient implements ParticipantClient {

    static final String PATH = "/protocol/messages";

    private final WebClient webClient;
    private final Duration requestTimeout;

    public HttpParticipantClient(WebClient webClient, Duration requestTimeout) {
        this.webClient = webClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public ProtocolMessage send(String baseUrl, ProtocolMessage request) {
        log.debug("Sending {}: transferId={}, nonce={}, to={}",
                request.getType(), request.getTransferId(), request.getNonce(), baseUrl);

        ProtocolMessage reply;
        try {
            reply = webClient.post()
                    .uri(baseUrl + PATH)
                    .header(CorrelationContext.CORRELATION_ID_HEADER, CorrelationContext.getCorrelationId())
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(ProtocolMessage.class)
                    .timeout(requestTimeout)
                    .block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().is4xxClientError()) {
                throw new MessageRejectedException(e.getStatusCode().value(),
                        request.getType() + " rejected by " + baseUrl + ": " + e.getResponseBodyAsString());
            }
            throw new RemoteUnreachableException(
                    request.getType() + " failed at " + baseUrl + ": " + e.getStatusCode(), e);
        } catch (RuntimeException e) {
            throw new RemoteUnreachableException(
                    request.getType() + " to " + baseUrl + " did not complete: " + e.getMessage(), e);
        }

        if (reply == null) {
            throw new RemoteUnreachableException(request.getType() + " to " + baseUrl + " returned no reply");
        }
        return reply;
    }
}
