package com.polaris.sentiment.codec;

import com.polaris.sentiment.api.model.Sentence;
import com.polaris.sentiment.api.model.SentimentResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonResultCodecTest {

    private final JsonResultCodec codec = new JsonResultCodec();

    private static byte[] json(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should preserve sentence order, text and score")
    void shouldPreserveResult() {
        SentimentResult result = new SentimentResult(List.of(
                new Sentence("Great food.", 0.8f),
                new Sentence("Slow service.", -0.4f),
                new Sentence("Great food.", 0.8f)));

        SentimentResult decoded = codec.decode(codec.encode(result));

        assertThat(decoded).isEqualTo(result);
    }

    @Test
    @DisplayName("Should encode an empty result")
    void shouldEncodeEmptyResult() {
        SentimentResult decoded = codec.decode(codec.encode(SentimentResult.empty()));

        assertThat(decoded.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should write a versioned document")
    void shouldWriteVersionedDocument() {
        String encoded = new String(codec.encode(new SentimentResult(List.of(new Sentence("Hi.", 0.5f)))),
                StandardCharsets.UTF_8);

        assertThat(encoded)
                .contains("\"v\":1")
                .contains("\"text\":\"Hi.\"")
                .contains("\"score\":0.5");
    }

    @Test
    @DisplayName("Should decode a stored document")
    void shouldDecodeStoredDocument() {
        SentimentResult decoded = codec.decode(
                json("{\"v\":1,\"sentences\":[{\"text\":\"word1\",\"score\":0.8},{\"text\":\"word4\",\"score\":-0.8}]}"));

        assertThat(decoded.sentences()).containsExactly(
                new Sentence("word1", 0.8f), new Sentence("word4", -0.8f));
    }

    @Test
    @DisplayName("Should treat missing sentences as empty")
    void shouldTreatMissingSentencesAsEmpty() {
        assertThat(codec.decode(json("{\"v\":1}")).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should reject null input on encode")
    void shouldRejectNullOnEncode() {
        assertThatThrownBy(() -> codec.encode(null)).isInstanceOf(EncodeException.class);
    }

    @Test
    @DisplayName("Should reject empty, truncated and malformed payloads")
    void shouldRejectMalformedPayloads() {
        byte[] valid = codec.encode(new SentimentResult(List.of(new Sentence("Fine.", 0.1f))));

        assertThatThrownBy(() -> codec.decode(null)).isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> codec.decode(new byte[0])).isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> codec.decode(Arrays.copyOf(valid, valid.length - 3)))
                .isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> codec.decode(json("not json"))).isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> codec.decode(json("null"))).isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> codec.decode(json("{\"v\":1} trailing"))).isInstanceOf(DecodeException.class);
    }

    @Test
    @DisplayName("Should reject an unknown format version")
    void shouldRejectUnknownVersion() {
        assertThatThrownBy(() -> codec.decode(json("{\"v\":2,\"sentences\":[]}")))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("version");
    }

    @Test
    @DisplayName("Should reject incomplete sentences")
    void shouldRejectIncompleteSentences() {
        assertThatThrownBy(() -> codec.decode(json("{\"v\":1,\"sentences\":[{\"score\":0.3}]}")))
                .isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> codec.decode(json("{\"v\":1,\"sentences\":[null]}")))
                .isInstanceOf(DecodeException.class);
    }
}
