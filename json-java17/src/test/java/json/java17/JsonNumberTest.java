package json.java17;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonNumberTest {

    private static final Logger LOG = Logger.getLogger(JsonNumberTest.class.getName());

    @Test
    void testKeepsLexicalForm() {
        LOG.info(() -> "TEST: testKeepsLexicalForm");
        assertThat(JsonNumber.of("1.50").toString()).isEqualTo("1.50");
        assertThat(JsonNumber.of(42L).toString()).isEqualTo("42");
        assertThat(JsonNumber.of(1.5).toString()).isEqualTo("1.5");
        assertThat(JsonNumber.of(new BigDecimal("1E+3")).toString()).isEqualTo("1E+3");
        assertThat(JsonNumber.of(new BigInteger("123456789012345678901234567890")).toString())
                .isEqualTo("123456789012345678901234567890");
    }

    @Test
    void testEqualityIgnoresCaseOfExponent() {
        LOG.info(() -> "TEST: testEqualityIgnoresCaseOfExponent");
        assertThat(JsonNumber.of("1e5")).isEqualTo(JsonNumber.of("1E5"));
        assertThat(JsonNumber.of("1e5").hashCode()).isEqualTo(JsonNumber.of("1E5").hashCode());
        assertThat(JsonNumber.of("1.0")).isNotEqualTo(JsonNumber.of("1"));
    }

    @Test
    void testRejectsNonNumbers() {
        LOG.info(() -> "TEST: testRejectsNonNumbers");
        assertThatThrownBy(() -> JsonNumber.of("abc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("abc");
    }

    @Test
    void testIntegralAndConversions() {
        LOG.info(() -> "TEST: testIntegralAndConversions");
        assertThat(JsonNumber.of("-12").isIntegral()).isTrue();
        assertThat(JsonNumber.of("1.0").isIntegral()).isFalse();
        assertThat(JsonNumber.of("1e3").isIntegral()).isFalse();
        assertThat(JsonNumber.of("1e3").toLong()).isEqualTo(1000L);
        assertThat(JsonNumber.of("-12").toNumber()).isEqualTo(-12L);
        assertThat(JsonNumber.of("123456789012345678901234567890").toNumber())
                .isEqualTo(new BigInteger("123456789012345678901234567890"));
        assertThat(JsonNumber.of("2.5").toNumber()).isEqualTo(2.5);
    }

    @Test
    void testToLongFailsForFractions() {
        LOG.info(() -> "TEST: testToLongFailsForFractions");
        assertThatThrownBy(() -> JsonNumber.of("2.5").toLong())
                .isInstanceOf(JsonAssertionException.class);
    }

    @Test
    void testNonFiniteDoubles() {
        LOG.info(() -> "TEST: testNonFiniteDoubles");
        final JsonNumber nan = JsonNumber.of(Double.NaN);
        final JsonNumber inf = JsonNumber.of(Double.NEGATIVE_INFINITY);
        assertThat(nan.isFinite()).isFalse();
        assertThat(inf.isFinite()).isFalse();
        assertThat(nan.toDouble()).isNaN();
        assertThat(inf.toDouble()).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(JsonNumber.of(0.25).isFinite()).isTrue();
        assertThatThrownBy(nan::toLong).isInstanceOf(JsonAssertionException.class);
    }
}
