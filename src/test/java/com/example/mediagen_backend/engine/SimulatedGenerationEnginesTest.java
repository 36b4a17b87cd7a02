package com.example.mediagen_backend.engine;

import com.example.mediagen_backend.engine.Interfaces.ImageGenerationEngine;
import com.example.mediagen_backend.engine.Interfaces.VideoGenerationEngine;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulatedGenerationEnginesTest {

    @Test
    void sameImageRequestMapsToSameUrl() throws Exception {
        SimulatedImageGenerationEngine engine = new SimulatedImageGenerationEngine();
        ImageGenerationEngine.Request request = new ImageGenerationEngine.Request("p", "s", "a fox", "dall-e-3",
                null, null, null);

        assertThat(engine.generate(request).url()).isEqualTo(engine.generate(request).url()).startsWith("sim://");
    }

    @Test
    void blankInputsArePermanentFailures() {
        assertThatThrownBy(() -> new SimulatedImageGenerationEngine().generate(
                new ImageGenerationEngine.Request("p", "s", "", "m", null, null, null)))
                .isInstanceOf(PermanentGenerationException.class);
        assertThatThrownBy(() -> new SimulatedVideoGenerationEngine().generate(
                new VideoGenerationEngine.Request("p", "s", null, "pan", 5, null, 50), () -> false))
                .isInstanceOf(PermanentGenerationException.class);
    }
}
