package com.example.dococr.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HangulUtilsTest {

    @Test
    void shouldRecognizeSyllablesOnly() {
        assertThat(HangulUtils.isHangul('가')).isTrue();
        assertThat(HangulUtils.isHangul('힣')).isTrue();
        assertThat(HangulUtils.isHangul('ㄱ')).isFalse();
        assertThat(HangulUtils.isHangul('A')).isFalse();

        assertThat(HangulUtils.containsHangul("HOA 천안")).isTrue();
        assertThat(HangulUtils.containsHangul("HOA-123")).isFalse();
    }

    @Test
    void shouldDecomposeAndCompose() {
        int[] jamo = HangulUtils.decompose('한');

        assertThat(jamo).containsExactly(18, 0, 4);
        assertThat(HangulUtils.compose(18, 0, 4)).isEqualTo('한');
        assertThat(HangulUtils.decompose('A')).isNull();
    }

    @Test
    void shouldDecomposeStringKeepingOtherCharacters() {
        assertThat(HangulUtils.decomposeString("한a가")).isEqualTo("ㅎㅏㄴaㄱㅏ");
    }

    @Test
    void shouldRejectInvalidJamoIndices() {
        assertThatThrownBy(() -> HangulUtils.compose(19, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldScoreJamoSimilarity() {
        // 등 / 듬: 初声、中声相同，终声不同
        assertThat(HangulUtils.jamoSimilarity('등', '듬')).isCloseTo(0.8, within(1e-9));
        assertThat(HangulUtils.jamoSimilarity('지', '자')).isCloseTo(0.6, within(1e-9));
        assertThat(HangulUtils.jamoSimilarity('가', '가')).isCloseTo(1.0, within(1e-9));
        assertThat(HangulUtils.jamoSimilarity('가', 'a')).isZero();
    }
}
