package com.dcabot.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class NumericParserTest {

	@Test
	void parsesPlainDecimals() {
		assertThat(NumericParser.parse(" 0.012 ", "size")).isEqualByComparingTo("0.012");
	}

	@Test
	void rejectsPlaceholders() {
		for (String raw : new String[] { "", "   ", "null", "undefined", "NaN", "abc" }) {
			assertThatThrownBy(() -> NumericParser.parse(raw, "avgPrice"))
					.isInstanceOf(NumberFormatException.class)
					.hasMessageContaining("avgPrice");
		}
		assertThat(NumericParser.parseOrNull("NaN")).isNull();
		assertThat(NumericParser.parseOrZero(null)).isZero();
	}
}
