package net.sentiflow.core.model;

import net.sentiflow.core.error.MalformedArtifactNameException;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@TestMethodOrder(MethodOrderer.MethodName.class)
class ArtifactNameTest {

    @Test
    void t1_parses_date_and_time_from_second_segment() {
        ArtifactName n = ArtifactName.parse("S2_20210615T103021_B04");

        assertEquals("2021-06-15", n.date());
        assertEquals("10:30:21", n.time());
        assertEquals("S2_20210615T103021", n.sceneId());
        assertEquals("B04", n.token());
        assertEquals(LocalDateTime.of(2021, 6, 15, 10, 30, 21), n.acquiredAt());
    }

    @Test
    void t2_keeps_trailing_segments() {
        ArtifactName n = ArtifactName.parse("T32UNE_20210615T103021_B8A_10m");
        assertThat(n.tail()).containsExactly("10m");
        assertEquals("2021-06-15 10:30:21", n.timestamp());
    }

    @Test
    void t3_rejects_malformed_names() {
        assertThatThrownBy(() -> ArtifactName.parse("S2_B04"))
                .isInstanceOf(MalformedArtifactNameException.class)
                .hasMessageContaining("S2_B04");
        assertThatThrownBy(() -> ArtifactName.parse("S2_2021061T103021_B04"))
                .isInstanceOf(MalformedArtifactNameException.class);
        assertThatThrownBy(() -> ArtifactName.parse("S2_20210615X103021_B04"))
                .isInstanceOf(MalformedArtifactNameException.class);
        assertThatThrownBy(() -> ArtifactName.parse("S2_20211315T103021_B04"))
                .isInstanceOf(MalformedArtifactNameException.class)
                .hasMessageContaining("invalid date/time");
        assertThatThrownBy(() -> ArtifactName.parse(""))
                .isInstanceOf(MalformedArtifactNameException.class);
    }

    @Test
    void t4_malformed_exception_carries_the_name() {
        try {
            ArtifactName.parse("clouds_patched");
        } catch (MalformedArtifactNameException e) {
            assertEquals("clouds_patched", e.artifactName());
            return;
        }
        throw new AssertionError("expected MalformedArtifactNameException");
    }
}
