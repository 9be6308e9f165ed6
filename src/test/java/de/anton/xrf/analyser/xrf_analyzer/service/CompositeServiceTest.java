package de.anton.xrf.analyser.xrf_analyzer.service;

import de.anton.xrf.analyser.xrf_analyzer.model.ElementMap;
import de.anton.xrf.analyser.xrf_analyzer.model.RgbImage;
import de.anton.xrf.analyser.xrf_analyzer.model.ScanGrid;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CompositeServiceTest {

    private final CompositeService service = new CompositeService();

    /** Map that is zero everywhere except one hot cell. */
    private static ElementMap spot(String id, int row, int column) {
        ElementMap map = ElementMap.zeros(id, new ScanGrid(5, 5));
        map.set(row, column, 100.0);
        return map.seal();
    }

    private static Map<String, ElementMap> referenceMaps() {
        Map<String, ElementMap> maps = new LinkedHashMap<>();
        maps.put("Fe", spot("Fe", 0, 0));
        maps.put("Cu", spot("Cu", 1, 1));
        maps.put("Pb_La", spot("Pb_La", 2, 2));
        maps.put("Pb_Lb", spot("Pb_Lb", 2, 2));
        return maps;
    }

    @Test
    void additiveCompositeColoursEachElementSpot() {
        RgbImage image = service.additive(referenceMaps());

        // Fe is (1, 0.2, 0) with gain 1.3
        assertThat(image.get(0, 0, 0)).isEqualTo(1.0);
        assertThat(image.get(0, 0, 1)).isCloseTo(0.26, within(1e-9));
        assertThat(image.get(0, 0, 2)).isZero();
        assertThat(image.get(4, 4, 0)).isZero();
    }

    @Test
    void rgbTripletUsesTheNamedMaps() {
        RgbImage image = service.rgbTriplet(referenceMaps(), List.of("Fe", "Cu", "Pb_La"));

        assertThat(image.get(0, 0, 0)).isEqualTo(1.0);
        assertThat(image.get(1, 1, 1)).isEqualTo(1.0);
        assertThat(image.get(2, 2, 2)).isEqualTo(1.0);
        assertThatThrownBy(() -> service.rgbTriplet(referenceMaps(), List.of("Fe", "Sn", "Cu")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pigmentReconstructionGivesPigmentColourWhereOneElementDominates() {
        RgbImage image = service.pigmentReconstruction(referenceMaps());

        // Only Cu present at (1,1): azurite blue
        assertThat(image.get(1, 1, 0)).isCloseTo(0.09, within(1e-9));
        assertThat(image.get(1, 1, 1)).isCloseTo(0.27, within(1e-9));
        assertThat(image.get(1, 1, 2)).isCloseTo(0.70, within(1e-9));
        assertThat(image.get(3, 3, 0)).isZero();
    }
}
