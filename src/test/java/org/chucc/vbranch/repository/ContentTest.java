package org.chucc.vbranch.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.chucc.vbranch.exception.ContentConversionException;
import org.junit.jupiter.api.Test;

class ContentTest {

  @Test
  void textConvertsToTypedValues() {
    assertThat(Content.of("hello").asText()).isEqualTo("hello");
    assertThat(Content.of("true").asBoolean()).isTrue();
    assertThat(Content.of("false").asBoolean()).isFalse();
    assertThat(Content.of("42").asUnsignedInt()).isEqualTo(42);
    assertThat(Content.of("1700000000000").asUnsignedLong()).isEqualTo(1_700_000_000_000L);
  }

  @Test
  void encodesPrimitivesAsText() {
    assertThat(Content.of(7L)).isEqualTo(new Content.Utf8("7"));
    assertThat(Content.of(true)).isEqualTo(new Content.Utf8("true"));
    assertThatThrownBy(() -> Content.of(-1L)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void binaryFailsEveryTextConversion() {
    Content binary = new Content.Binary(new byte[] {1, 2, 3});

    assertThatThrownBy(binary::asText)
        .isInstanceOf(ContentConversionException.class)
        .hasMessageContaining("binary");
    assertThatThrownBy(binary::asBoolean).isInstanceOf(ContentConversionException.class);
    assertThatThrownBy(binary::asUnsignedLong).isInstanceOf(ContentConversionException.class);
  }

  @Test
  void rejectsMalformedNumbersAndBooleans() {
    assertThatThrownBy(() -> Content.of("yes").asBoolean())
        .isInstanceOf(ContentConversionException.class);
    assertThatThrownBy(() -> Content.of("TRUE").asBoolean())
        .isInstanceOf(ContentConversionException.class);
    assertThatThrownBy(() -> Content.of("-3").asUnsignedInt())
        .isInstanceOf(ContentConversionException.class);
    assertThatThrownBy(() -> Content.of("").asUnsignedInt())
        .isInstanceOf(ContentConversionException.class);
    assertThatThrownBy(() -> Content.of(" 3").asUnsignedInt())
        .isInstanceOf(ContentConversionException.class);
    assertThatThrownBy(() -> Content.of("99999999999").asUnsignedInt())
        .isInstanceOf(ContentConversionException.class);
    assertThatThrownBy(() -> Content.of("99999999999999999999").asUnsignedLong())
        .isInstanceOf(ContentConversionException.class);
  }

  @Test
  void binaryComparesByBytes() {
    assertThat(new Content.Binary(new byte[] {1, 2}))
        .isEqualTo(new Content.Binary(new byte[] {1, 2}))
        .hasSameHashCodeAs(new Content.Binary(new byte[] {1, 2}))
        .isNotEqualTo(new Content.Binary(new byte[] {2, 1}));
  }
}
