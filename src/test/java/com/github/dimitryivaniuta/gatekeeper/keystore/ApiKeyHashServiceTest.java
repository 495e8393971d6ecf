package com.github.dimitryivaniuta.gatekeeper.keystore;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApiKeyHashServiceTest {

    @Test
    void withoutPepperShouldBePlainSha256Hex() {
        // sha256("abc")
        assertThat(new ApiKeyHashService("").hash("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void pepperShouldChangeTheHash() {
        String plain = new ApiKeyHashService((String) null).hash("abc");
        String peppered = new ApiKeyHashService("s3cret").hash("abc");

        assertThat(peppered).hasSize(64).isNotEqualTo(plain);
        assertThat(new ApiKeyHashService("s3cret").hash("abc")).isEqualTo(peppered);
    }

    @Test
    void blankKeyShouldBeRejected() {
        assertThatThrownBy(() -> new ApiKeyHashService("").hash(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
