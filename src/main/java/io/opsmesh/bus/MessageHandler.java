package io.opsmesh.bus;

import io.opsmesh.model.Message;

@FunctionalInterface
public interface MessageHandler {
    void onMessage(Message message) throws Exception;
}
