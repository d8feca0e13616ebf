package de.mirkosertic.sheetwatch.baseline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BaselineCodec Tests")
class BaselineCodecTest {

    @Test
    @DisplayName("Codec is recognised from the artifact name")
    void recognisesArtifactNames() {
        assertThat(BaselineCodec.forArtifactName("a.xlsx.baseline.json.gz")).isEqualTo(BaselineCodec.GZIP);
        assertThat(BaselineCodec.forArtifactName("a.xlsx.baseline.json.deflate")).isEqualTo(BaselineCodec.DEFLATE);
        assertThat(BaselineCodec.forArtifactName("a.xlsx.baseline.json")).isEqualTo(BaselineCodec.PLAIN);
        assertThat(BaselineCodec.forArtifactName("a.xlsx.baseline.json.gz.backup")).isNull();
        assertThat(BaselineCodec.forArtifactName("notes.txt")).isNull();
    }

    @Test
    @DisplayName("Codec names are case-insensitive")
    void byName() {
        assertThat(BaselineCodec.byName(" GZip ")).isEqualTo(BaselineCodec.GZIP);
        assertThatThrownBy(() -> BaselineCodec.byName("lz4")).isInstanceOf(IllegalArgumentException.class);
    }
}
