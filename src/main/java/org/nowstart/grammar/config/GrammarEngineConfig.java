package org.nowstart.grammar.config;

import java.time.Clock;
import org.nowstart.grammar.data.property.GrammarProperties;
import org.nowstart.grammar.data.property.LockedDoctrine;
import org.nowstart.grammar.engine.certify.FastRetestCorroboration;
import org.nowstart.grammar.engine.certify.TransitionCorroboration;
import org.nowstart.grammar.engine.pipeline.InstrumentPipelineFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GrammarEngineConfig {

    @Bean
    public LockedDoctrine lockedDoctrine() {
        return LockedDoctrine.V7_4;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TransitionCorroboration transitionCorroboration(LockedDoctrine lockedDoctrine) {
        return new FastRetestCorroboration(lockedDoctrine);
    }

    @Bean
    public InstrumentPipelineFactory instrumentPipelineFactory(
            GrammarProperties grammarProperties,
            LockedDoctrine lockedDoctrine,
            TransitionCorroboration transitionCorroboration,
            Clock clock
    ) {
        return new InstrumentPipelineFactory(grammarProperties, lockedDoctrine, transitionCorroboration, clock);
    }
}
