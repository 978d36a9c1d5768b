package com.studyflow.cli;

import com.studyflow.core.model.Endpoint;
import com.studyflow.core.model.EndpointType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GenerateCommand#parseEndpoints(List)}.
 */
class GenerateCommandTest {

    @Test
    void parseEndpoints_withoutPrefix_firstIsPrimary() {
        List<Endpoint> endpoints = GenerateCommand.parseEndpoints(List.of("HbA1c change", "Body weight"));

        assertThat(endpoints).extracting(Endpoint::id).containsExactly("ep_0", "ep_1");
        assertThat(endpoints).extracting(Endpoint::type)
            .containsExactly(EndpointType.PRIMARY, EndpointType.SECONDARY);
    }

    @Test
    void parseEndpoints_withPrefix_usesPrefixedType() {
        List<Endpoint> endpoints = GenerateCommand.parseEndpoints(List.of(
            "secondary: Quality of life", "PRIMARY:HbA1c change", "exploratory:Biomarkers"));

        assertThat(endpoints).extracting(Endpoint::name)
            .containsExactly("Quality of life", "HbA1c change", "Biomarkers");
        assertThat(endpoints).extracting(Endpoint::type)
            .containsExactly(EndpointType.SECONDARY, EndpointType.PRIMARY, EndpointType.EXPLORATORY);
    }

    @Test
    void parseEndpoints_unknownPrefix_keepsWholeText() {
        List<Endpoint> endpoints = GenerateCommand.parseEndpoints(List.of("Ratio: LDL/HDL"));

        assertThat(endpoints.get(0).name()).isEqualTo("Ratio: LDL/HDL");
        assertThat(endpoints.get(0).type()).isEqualTo(EndpointType.PRIMARY);
    }

    @Test
    void parseEndpoints_blankName_throws() {
        assertThatThrownBy(() -> GenerateCommand.parseEndpoints(List.of("primary:  ")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must not be blank");
    }
}
