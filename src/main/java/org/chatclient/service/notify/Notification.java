package org.chatclient.service.notify;

import lombok.Value;

import java.time.Instant;

@Value
public class Notification {
    public enum Level { SUCCESS, INFO, ERROR }

    long id;
    Level level;
    String message;
    Instant createdAt;
}
