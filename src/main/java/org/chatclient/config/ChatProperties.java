package org.chatclient.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Getter
@Component
public class ChatProperties {

    @Value("${chat.mark-read.delay-ms:250}")
    private long markReadDelayMs;

    @Value("${chat.fresh.delay-ms:600}")
    private long freshDelayMs;

    @Value("${chat.sound.min-interval-ms:100}")
    private long soundMinIntervalMs;

    @Value("${chat.mobile.breakpoint-px:768}")
    private int mobileBreakpointPx;

    @Value("${chat.search.max-results:30}")
    private int searchMaxResults;
}
