package org.chatclient.service.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.GraphicsEnvironment;
import java.awt.Toolkit;

@Slf4j
@Component
public class BeepSoundPlayer implements SoundPlayer {

    @Override
    public void play() {
        if (GraphicsEnvironment.isHeadless()) {
            log.info("[son] nouveau message");
            return;
        }
        try {
            Toolkit.getDefaultToolkit().beep();
        } catch (RuntimeException e) {
            log.debug("Lecture du son impossible", e);
        }
    }
}
