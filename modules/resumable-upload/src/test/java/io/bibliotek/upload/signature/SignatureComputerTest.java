package io.bibliotek.upload.signature;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignatureComputerTest {

    @Test
    void compute_shouldMatchBrowserClientValue() {
        assertThat(SignatureComputer.compute("book.pdf", 52_428_800L, 1_700_000_000_000L))
                .isEqualTo("24a7d564de30e1fd");
    }

    @Test
    void compute_shouldHashNameAsUtf8() {
        assertThat(SignatureComputer.compute("résumé.pdf", 1L, 0L)).isEqualTo("439c88f77184d2e4");
    }

    @Test
    void compute_shouldChangeWhenAnyInputChanges() {
        String base = SignatureComputer.compute("book.pdf", 100L, 1L);

        assertThat(SignatureComputer.compute("book.pdf", 100L, 1L)).isEqualTo(base);
        assertThat(SignatureComputer.compute("book2.pdf", 100L, 1L)).isNotEqualTo(base);
        assertThat(SignatureComputer.compute("book.pdf", 101L, 1L)).isNotEqualTo(base);
        assertThat(SignatureComputer.compute("book.pdf", 100L, 2L)).isNotEqualTo(base);
    }

    @Test
    void compute_shouldAlwaysProduceAValidSignature() {
        assertThat(SignatureComputer.compute("", 0L, 0L))
                .hasSize(SignatureComputer.SIGNATURE_LENGTH)
                .matches(SignatureComputer::isValid);
    }

    @Test
    void compute_shouldRejectMissingName() {
        assertThatThrownBy(() -> SignatureComputer.compute(null, 1L, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isValid_shouldOnlyAcceptSixteenLowercaseHexCharacters() {
        assertThat(SignatureComputer.isValid("0123456789abcdef")).isTrue();
        assertThat(SignatureComputer.isValid("0123456789ABCDEF")).isFalse();
        assertThat(SignatureComputer.isValid("0123456789abcde")).isFalse();
        assertThat(SignatureComputer.isValid("0123456789abcdefa")).isFalse();
        assertThat(SignatureComputer.isValid("0123456789abcdeg")).isFalse();
        assertThat(SignatureComputer.isValid(null)).isFalse();
    }
}
