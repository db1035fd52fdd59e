package com.picfactory.orchestrator.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceInputTest {

    @Test
    void resolvedFileName_prefersExplicitName() {
        assertThat(new ReferenceInput("/a/b/cat.png", " Kitty ").resolvedFileName()).isEqualTo("Kitty");
    }

    @Test
    void resolvedFileName_derivesLastSegmentOnAnySeparator() {
        assertThat(new ReferenceInput("/a/b/cat.png", null).resolvedFileName()).isEqualTo("cat.png");
        assertThat(new ReferenceInput("C:\\refs\\dog.jpg", "").resolvedFileName()).isEqualTo("dog.jpg");
    }

    @Test
    void resolvedFileName_fallsBackToImage() {
        assertThat(new ReferenceInput("///", null).resolvedFileName()).isEqualTo("image");
        assertThat(new ReferenceInput(null, null).resolvedFileName()).isEqualTo("image");
    }
}
