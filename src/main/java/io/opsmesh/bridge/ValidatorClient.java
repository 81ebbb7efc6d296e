package io.opsmesh.bridge;

import io.opsmesh.model.Message;

import java.time.Duration;
import java.util.Optional;

/**
 * Transport to the external validation process.
 */
public interface ValidatorClient {
    /**
     * Sends one message. The validator may answer with a message of its own, typically a
     * {@code deployment_notification}.
     *
     * @throws ValidatorException when the call fails; {@link ValidatorException#transientFailure()}
     *                            decides whether the bridge retries
     */
    Optional<Message> send(Message message, Duration timeout) throws ValidatorException;
}
