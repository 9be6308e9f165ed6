package de.anton.xrf.analyser.xrf_analyzer.model;

import de.anton.xrf.analyser.xrf_analyzer.algorithms.LinearCalibration;
import de.anton.xrf.analyser.xrf_analyzer.service.DatasetDefaults;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElementDefinitionTest {

    private final CalibrationModel canonical = LinearCalibration.fit(DatasetDefaults.CALIBRATION_POINTS);

    @Test
    void pinnedChannelOverridesCalibration() {
        ElementDefinition fe = new ElementDefinition("Fe", "Iron", "Kα", 6.400, 10, 219);

        assertThat(fe.centerChannel(new CalibrationModel(1.0, 0.0, 1.0, 2))).isEqualTo(219);
        assertThat(fe.getPinnedChannel()).hasValue(219);
    }

    @Test
    void unpinnedLineUsesInverseCalibration() {
        ElementDefinition ca = new ElementDefinition("Ca", "Calcium", "Kα", 3.692, 15);

        assertThat(ca.getPinnedChannel()).isEmpty();
        assertThat(ca.centerChannel(canonical)).isEqualTo(canonical.toChannel(3.692));
    }

    @Test
    void referenceElementsFitTheDetectorRange() {
        for (ElementDefinition element : DatasetDefaults.ELEMENTS) {
            assertThatCode(() -> element.validateAgainst(canonical, DatasetDefaults.MAX_CHANNEL)).doesNotThrowAnyException();
        }
    }

    @Test
    void rejectsInvalidDefinitions() {
        assertThatThrownBy(() -> new ElementDefinition("Fe", "Iron", "Kα", 6.4, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ElementDefinition("Fe", "Iron", "Kα", -1.0, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ElementDefinition(" ", "Iron", "Kα", 6.4, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ElementDefinition("Fe", "Iron", "Kα", 6.4, 5, -3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lineBelowChannelZeroIsOutOfRange() {
        ElementDefinition low = new ElementDefinition("B", "Boron", "Kα", 0.001, 2);
        CalibrationModel shifted = new CalibrationModel(0.01, 1.0, 1.0, 2);

        assertThatThrownBy(() -> low.validateAgainst(shifted, 2048)).isInstanceOf(IllegalArgumentException.class);
    }
}
