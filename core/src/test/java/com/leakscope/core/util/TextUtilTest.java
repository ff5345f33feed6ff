package com.leakscope.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TextUtilTest {

    @Test
    void entropy_ofUniformAlphabet_isLog2OfSize() {
        assertThat(TextUtil.shannonEntropy("abcdabcd")).isCloseTo(2.0, within(1e-9));
        assertThat(TextUtil.shannonEntropy("aaaa")).isEqualTo(0.0);
        assertThat(TextUtil.shannonEntropy("")).isEqualTo(0.0);
        assertThat(TextUtil.shannonEntropy(null)).isEqualTo(0.0);
    }

    @Test
    void entropy_ofSecretKeyLiteral_isBetweenThresholds() {
        // e 3회 + 나머지 7글자 1회씩
        assertThat(TextUtil.shannonEntropy("secret_key")).isBetween(2.8, 2.9);
    }

    @Test
    void normalizeValue_trimsAndLowercases() {
        assertThat(TextUtil.normalizeValue("  AbC ")).isEqualTo("abc");
        assertThat(TextUtil.normalizeValue(null)).isEmpty();
    }
}
