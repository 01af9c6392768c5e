package com.phillippitts.peervoice;

import com.phillippitts.peervoice.config.audio.AudioCaptureProperties;
import com.phillippitts.peervoice.config.audio.SegmentationProperties;
import com.phillippitts.peervoice.config.batching.BatchingProperties;
import com.phillippitts.peervoice.config.interaction.InteractionProperties;
import com.phillippitts.peervoice.config.properties.ThreadPoolProperties;
import com.phillippitts.peervoice.config.recognizer.WhisperProperties;
import com.phillippitts.peervoice.config.synthesis.SynthesizerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        AudioCaptureProperties.class,
        SegmentationProperties.class,
        BatchingProperties.class,
        InteractionProperties.class,
        WhisperProperties.class,
        SynthesizerProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class PeerVoiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PeerVoiceApplication.class, args);
    }
}
