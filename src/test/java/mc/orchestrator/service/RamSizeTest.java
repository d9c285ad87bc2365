package mc.orchestrator.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RamSizeTest {

    @ParameterizedTest
    @CsvSource({"2G,2048", "1536M,1536", "512,512", "4gb,4096", "2097152K,2048"})
    void parsesSizesIntoMegabytes(String value, int expectedMb) {
        assertThat(RamSize.parseMb(value)).isEqualTo(expectedMb);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "lots", "-1G", "0M", "2T"})
    void rejectsInvalidSizes(String value) {
        assertThatThrownBy(() -> RamSize.parseMb(value)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formatsWholeGigabytesWithGSuffix() {
        assertThat(RamSize.format(2048)).isEqualTo("2G");
        assertThat(RamSize.format(1536)).isEqualTo("1536M");
    }
}
