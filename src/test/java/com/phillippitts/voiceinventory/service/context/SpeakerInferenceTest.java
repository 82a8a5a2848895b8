package com.phillippitts.voiceinventory.service.context;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SpeakerInferenceTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "I replaced the compressor filter this morning",
            "We have checked the defibrillator",
            "I'm from Medika, we finished the repair"
    })
    void firstPersonNarrationSuggestsPerformer(String transcript) {
        assertThat(SpeakerInference.infer(transcript)).isEqualTo(SpeakerHint.LIKELY_PERFORMER);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "The technician replaced the pump on bed 4",
            "Someone from Siemens came yesterday, they fixed the monitor",
            "He said the battery was dead"
    })
    void thirdPersonNarrationSuggestsOperator(String transcript) {
        assertThat(SpeakerInference.infer(transcript)).isEqualTo(SpeakerHint.LIKELY_OPERATOR);
    }

    @Test
    void neutralOrBlankTextIsUnknown() {
        assertThat(SpeakerInference.infer("Oxygen concentrator, ward B, serial 1234")).isEqualTo(SpeakerHint.UNKNOWN);
        assertThat(SpeakerInference.infer("   ")).isEqualTo(SpeakerHint.UNKNOWN);
        assertThat(SpeakerInference.infer(null)).isEqualTo(SpeakerHint.UNKNOWN);
    }

    @Test
    void balancedEvidenceIsUnknown() {
        assertThat(SpeakerInference.infer("I checked it and the technician replaced it"))
                .isEqualTo(SpeakerHint.UNKNOWN);
    }
}
