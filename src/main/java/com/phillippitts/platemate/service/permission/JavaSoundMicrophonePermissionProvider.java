package com.phillippitts.platemate.service.permission;

import com.phillippitts.platemate.service.speech.audio.AudioFormat;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.TargetDataLine;

/**
 * Microphone permission derived from Java Sound: authorized when a capture line in the required
 * format is supported, restricted otherwise (no device, or the OS refuses access).
 */
@Component
@Qualifier("microphonePermission")
public class JavaSoundMicrophonePermissionProvider extends AbstractPermissionProvider {

    @Override
    protected PermissionStatus decide() {
        try {
            DataLine.Info info = new DataLine.Info(TargetDataLine.class, AudioFormat.REQUIRED_FORMAT);
            return AudioSystem.isLineSupported(info)
                    ? PermissionStatus.AUTHORIZED_WHEN_IN_USE
                    : PermissionStatus.RESTRICTED;
        } catch (SecurityException | IllegalArgumentException e) {
            return PermissionStatus.DENIED;
        }
    }

    @Override
    protected String resourceName() {
        return "microphone";
    }
}
